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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Size and part layout of a remote file, as reported by the metadata lookup.
 *
 * <p>The part layout is fixed by the service: every part except the last is
 * {@code partSize} bytes long. When the service reports no part count it is
 * derived from the content length. A zero-byte file still has exactly one part.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FileMetadata {

    private final long contentLength;
    private final long partSize;
    private final int totalParts;

    @JsonCreator
    public FileMetadata(@JsonProperty("contentLength") long contentLength,
                        @JsonProperty("partSize") long partSize,
                        @JsonProperty("totalParts") int totalParts) {
        if (contentLength < 0) {
            throw new IllegalArgumentException("Content length cannot be negative: " + contentLength);
        }
        if (partSize <= 0 && contentLength > 0) {
            throw new IllegalArgumentException("Part size must be positive for a non-empty file: " + partSize);
        }
        this.contentLength = contentLength;
        this.partSize = partSize;
        this.totalParts = totalParts;
    }

    public long getContentLength() {
        return contentLength;
    }

    public long getPartSize() {
        return partSize;
    }

    public int getTotalParts() {
        return totalParts;
    }

    /**
     * Number of parts to fetch. Falls back to {@code ceil(contentLength / partSize)}
     * when the service did not report a count, and never returns less than one.
     */
    public int getPartCount() {
        if (totalParts > 0) {
            return totalParts;
        }
        if (contentLength == 0) {
            return 1;
        }
        return (int) Math.max(1, (contentLength + partSize - 1) / partSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileMetadata that = (FileMetadata) o;
        return contentLength == that.contentLength && partSize == that.partSize && totalParts == that.totalParts;
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentLength, partSize, totalParts);
    }

    @Override
    public String toString() {
        return "FileMetadata{contentLength=" + contentLength + ", partSize=" + partSize
                + ", totalParts=" + totalParts + '}';
    }
}
