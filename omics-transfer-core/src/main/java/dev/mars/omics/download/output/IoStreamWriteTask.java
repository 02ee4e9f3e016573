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
import java.nio.channels.WritableByteChannel;
import java.util.function.IntConsumer;

/**
 * Appends one chunk to a non-seekable channel. Callers guarantee offset order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
class IoStreamWriteTask extends TransferTask<Void> {

    private final WritableByteChannel channel;
    private final byte[] data;
    private final IntConsumer onWritten;

    IoStreamWriteTask(TransferCoordinator coordinator, WritableByteChannel channel, byte[] data,
                      IntConsumer onWritten) {
        super(coordinator);
        this.channel = channel;
        this.data = data;
        this.onWritten = onWritten;
    }

    @Override
    protected Void execute() throws Exception {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        onWritten.accept(data.length);
        return null;
    }
}
