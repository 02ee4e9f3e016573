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

package dev.mars.omics.core;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One fixed-size slice of a remote file. Parts are numbered from 1; the last part
 * may be shorter than the others.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class PartDescriptor {

    private final int partNumber;
    private final long offset;
    private final long size;
    private final AtomicInteger attempts = new AtomicInteger();

    public PartDescriptor(int partNumber, long offset, long size) {
        if (partNumber < 1) {
            throw new IllegalArgumentException("Part numbers start at 1: " + partNumber);
        }
        this.partNumber = partNumber;
        this.offset = offset;
        this.size = size;
    }

    /**
     * Lays out part {@code partNumber} of a file described by {@code metadata}.
     */
    public static PartDescriptor of(int partNumber, FileMetadata metadata) {
        long offset = (partNumber - 1) * metadata.getPartSize();
        long size = Math.max(0, Math.min(metadata.getPartSize(), metadata.getContentLength() - offset));
        return new PartDescriptor(partNumber, offset, size);
    }

    public int getPartNumber() {
        return partNumber;
    }

    public long getOffset() {
        return offset;
    }

    public long getSize() {
        return size;
    }

    public int recordAttempt() {
        return attempts.incrementAndGet();
    }

    public int getAttempts() {
        return attempts.get();
    }

    @Override
    public String toString() {
        return "Part{" + partNumber + ", offset=" + offset + ", size=" + size + '}';
    }
}
