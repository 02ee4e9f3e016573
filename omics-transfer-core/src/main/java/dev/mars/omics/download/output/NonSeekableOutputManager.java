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

import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Downloads into a caller-owned stream that can only be appended to. Chunks
 * are released in strict offset order by a {@link DeferQueue}; the queue request
 * and the io submission happen under one lock so writes reach the io pool in
 * order. The stream is flushed but left open.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class NonSeekableOutputManager extends OutputManager {

    private final WritableByteChannel channel;
    private final Flushable flushable;
    private final DeferQueue deferQueue = new DeferQueue();
    private final ReentrantLock ioSubmitLock = new ReentrantLock();
    // advanced on the io thread only
    private long streamPosition;

    public NonSeekableOutputManager(Object destination, TransferCoordinator coordinator, BoundedExecutor ioExecutor) {
        super(coordinator, ioExecutor);
        if (destination instanceof OutputStream) {
            this.channel = Channels.newChannel((OutputStream) destination);
        } else if (destination instanceof WritableByteChannel) {
            this.channel = (WritableByteChannel) destination;
        } else {
            throw new IllegalArgumentException("Not a writable stream: " + destination);
        }
        this.flushable = destination instanceof Flushable ? (Flushable) destination : null;
    }

    @Override
    public void open() {
    }

    @Override
    public void queueWrite(byte[] data, long offset) throws InterruptedException {
        ioSubmitLock.lock();
        try {
            for (byte[] write : deferQueue.requestWrites(offset, data)) {
                coordinator.submit(ioExecutor, new IoStreamWriteTask(coordinator, channel, write, this::recordAppended), null);
            }
        } finally {
            ioSubmitLock.unlock();
        }
    }

    private void recordAppended(int count) {
        recordWritten(streamPosition, count);
        streamPosition += count;
    }

    @Override
    protected DownloadResult complete(long expectedLength) throws IOException, TransferException {
        if (flushable != null) {
            flushable.flush();
        }
        verifyBytesWritten(expectedLength);
        return new DownloadResult(coordinator.getTransferId(), null, getBytesWritten(), false);
    }
}
