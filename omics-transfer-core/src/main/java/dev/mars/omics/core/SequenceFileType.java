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

/**
 * Format of the sequence data in an uploaded read set.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum SequenceFileType {
    FASTQ(false),
    BAM(true),
    CRAM(true),
    UBAM(false);

    private final boolean requiresReference;

    SequenceFileType(boolean requiresReference) {
        this.requiresReference = requiresReference;
    }

    /**
     * Aligned formats must name the reference they were aligned against.
     */
    public boolean requiresReference() {
        return requiresReference;
    }
}
