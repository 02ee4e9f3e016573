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

import dev.mars.omics.core.ReadSetFileName;
import dev.mars.omics.transfer.executor.TaskTag;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * Splits one upload source into numbered part bodies.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public abstract class UploadInputManager {

    protected final ReadSetFileName partSource;
    private int nextPartNumber = 1;

    protected UploadInputManager(ReadSetFileName partSource) {
        this.partSource = partSource;
    }

    /**
     * Size of the source when it can be known before reading it.
     */
    public abstract OptionalLong getSize() throws IOException;

    /**
     * Next part of at most {@code chunkSize} bytes, or null when the source is
     * exhausted. The first call always returns a part, empty for an empty source.
     */
    public abstract UploadPartBody nextPart(long chunkSize) throws IOException;

    /**
     * Tag under which part tasks for this source are submitted, or null.
     */
    public TaskTag getTaskTag() {
        return null;
    }

    public ReadSetFileName getPartSource() {
        return partSource;
    }

    protected int takePartNumber() {
        return nextPartNumber++;
    }

    protected boolean isFirstPart() {
        return nextPartNumber == 1;
    }
}
