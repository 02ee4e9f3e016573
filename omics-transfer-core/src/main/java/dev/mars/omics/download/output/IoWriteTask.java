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

package dev.mars.omics.download.output;

import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.TransferTask;

import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Writes one chunk at its absolute offset of a seekable channel.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
class IoWriteTask extends TransferTask<Void> {

    private final SeekableByteChannel channel;
    private final byte[] data;
    private final long offset;
    private final OutputManager.WriteListener onWritten;

    IoWriteTask(TransferCoordinator coordinator, SeekableByteChannel channel, byte[] data, long offset,
                OutputManager.WriteListener onWritten) {
        super(coordinator);
        this.channel = channel;
        this.data = data;
        this.offset = offset;
        this.onWritten = onWritten;
    }

    @Override
    protected Void execute() throws Exception {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        channel.position(offset);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        onWritten.written(offset, data.length);
        return null;
    }

    @Override
    public String toString() {
        return "IoWriteTask(transferId=" + getTransferId() + ", offset=" + offset + ", length=" + data.length + ")";
    }
}
