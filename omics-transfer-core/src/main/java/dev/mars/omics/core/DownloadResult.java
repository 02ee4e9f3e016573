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

import java.nio.file.Path;
import java.util.Optional;

/**
 * Result of a finished download.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class DownloadResult {

    private final long transferId;
    private final Path path;
    private final long bytesWritten;
    private final boolean compressed;

    public DownloadResult(long transferId, Path path, long bytesWritten, boolean compressed) {
        this.transferId = transferId;
        this.path = path;
        this.bytesWritten = bytesWritten;
        this.compressed = compressed;
    }

    public long getTransferId() {
        return transferId;
    }

    /**
     * Final location on disk, empty when the destination was a stream or channel.
     * A gzip payload downloaded to a path gets a {@code .gz} suffix.
     */
    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    public boolean isCompressed() {
        return compressed;
    }

    @Override
    public String toString() {
        return "DownloadResult{transferId=" + transferId + ", path=" + path
                + ", bytesWritten=" + bytesWritten + ", compressed=" + compressed + '}';
    }
}
