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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Acknowledgement of one uploaded part, echoed back to the service when the
 * multipart upload is completed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class UploadPartResult {

    private final int partNumber;
    private final ReadSetFileName partSource;
    private final String checksum;

    @JsonCreator
    public UploadPartResult(@JsonProperty("partNumber") int partNumber,
                            @JsonProperty("partSource") ReadSetFileName partSource,
                            @JsonProperty("checksum") String checksum) {
        this.partNumber = partNumber;
        this.partSource = Objects.requireNonNull(partSource, "Part source cannot be null");
        this.checksum = checksum;
    }

    public int getPartNumber() {
        return partNumber;
    }

    public ReadSetFileName getPartSource() {
        return partSource;
    }

    public String getChecksum() {
        return checksum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UploadPartResult that = (UploadPartResult) o;
        return partNumber == that.partNumber && partSource == that.partSource
                && Objects.equals(checksum, that.checksum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partNumber, partSource, checksum);
    }

    @Override
    public String toString() {
        return partSource + "#" + partNumber + "(" + checksum + ")";
    }
}
