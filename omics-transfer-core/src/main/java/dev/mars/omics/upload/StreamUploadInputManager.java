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
import org.apache.commons.io.IOUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.OptionalLong;

/**
 * Upload source backed by a caller-owned stream. Parts are read sequentially
 * into memory, so their tasks run under {@link TaskTag#IN_MEMORY_UPLOAD} to cap
 * how many buffers exist at once. The stream is not closed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class StreamUploadInputManager extends UploadInputManager {

    private final InputStream stream;
    private boolean exhausted;

    public StreamUploadInputManager(InputStream stream, ReadSetFileName partSource) {
        super(partSource);
        this.stream = stream;
    }

    @Override
    public OptionalLong getSize() {
        return OptionalLong.empty();
    }

    @Override
    public UploadPartBody nextPart(long chunkSize) throws IOException {
        if (exhausted) {
            return null;
        }
        byte[] buffer = new byte[(int) Math.min(chunkSize, Integer.MAX_VALUE - 8)];
        int read = IOUtils.read(stream, buffer);
        if (read < buffer.length) {
            exhausted = true;
        }
        if (read == 0 && !isFirstPart()) {
            return null;
        }
        byte[] payload = read == buffer.length ? buffer : Arrays.copyOf(buffer, read);
        return new UploadPartBody(partSource, takePartNumber(), payload.length, () -> new ByteArrayInputStream(payload));
    }

    @Override
    public TaskTag getTaskTag() {
        return TaskTag.IN_MEMORY_UPLOAD;
    }
}
