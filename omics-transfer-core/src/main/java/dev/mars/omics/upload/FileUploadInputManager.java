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
import dev.mars.omics.storage.FileManager;
import org.apache.commons.io.input.BoundedInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalLong;

/**
 * Upload source backed by a file. Each part reads its own byte range.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FileUploadInputManager extends UploadInputManager {

    private final Path path;
    private long size = -1;
    private long nextOffset;

    public FileUploadInputManager(Path path, ReadSetFileName partSource) {
        super(partSource);
        this.path = path;
    }

    @Override
    public OptionalLong getSize() throws IOException {
        if (size < 0) {
            size = FileManager.getFileSize(path);
        }
        return OptionalLong.of(size);
    }

    @Override
    public UploadPartBody nextPart(long chunkSize) throws IOException {
        long total = getSize().getAsLong();
        if (nextOffset >= total && !isFirstPart()) {
            return null;
        }
        long offset = nextOffset;
        long length = Math.min(chunkSize, total - offset);
        nextOffset += length;
        return new UploadPartBody(partSource, takePartNumber(), length, () -> openRange(offset, length));
    }

    private InputStream openRange(long offset, long length) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            channel.position(offset);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return new BoundedInputStream(Channels.newInputStream(channel), length);
    }
}
