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

import dev.mars.omics.core.DownloadResult;
import dev.mars.omics.core.exceptions.TransferException;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.executor.BoundedExecutor;

import java.nio.channels.SeekableByteChannel;

/**
 * Downloads into a caller-owned seekable channel, writing each chunk at its
 * absolute offset. The channel is left open.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class SeekableOutputManager extends OutputManager {

    private final SeekableByteChannel channel;

    public SeekableOutputManager(SeekableByteChannel channel, TransferCoordinator coordinator,
                                 BoundedExecutor ioExecutor) {
        super(coordinator, ioExecutor);
        this.channel = channel;
    }

    @Override
    public void open() {
    }

    @Override
    public void queueWrite(byte[] data, long offset) throws InterruptedException {
        coordinator.submit(ioExecutor, new IoWriteTask(coordinator, channel, data, offset, this::recordWritten), null);
    }

    @Override
    protected DownloadResult complete(long expectedLength) throws TransferException {
        verifyBytesWritten(expectedLength);
        return new DownloadResult(coordinator.getTransferId(), null, getBytesWritten(), false);
    }
}
