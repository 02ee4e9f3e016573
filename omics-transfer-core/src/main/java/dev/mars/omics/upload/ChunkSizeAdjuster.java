/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.omics.upload;

/**
 * Picks the part size for an upload: the configured target, doubled until the
 * source fits within the service's maximum part count.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ChunkSizeAdjuster {

    private ChunkSizeAdjuster() {
    }

    /**
     * @param targetSize configured part size
     * @param sourceSize size of the source, or a negative value when unknown
     * @param maxParts   largest part count the service accepts
     * @return a part size no smaller than {@code targetSize}
     */
    public static long adjust(long targetSize, long sourceSize, int maxParts) {
        if (targetSize <= 0) {
            throw new IllegalArgumentException("Target part size must be positive: " + targetSize);
        }
        long chunkSize = targetSize;
        if (sourceSize < 0) {
            return chunkSize;
        }
        while (partCount(sourceSize, chunkSize) > maxParts) {
            chunkSize *= 2;
        }
        return chunkSize;
    }

    static long partCount(long sourceSize, long chunkSize) {
        return Math.max(1, (sourceSize + chunkSize - 1) / chunkSize);
    }
}
