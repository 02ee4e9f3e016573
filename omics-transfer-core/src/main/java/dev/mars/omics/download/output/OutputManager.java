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
import dev.mars.omics.transfer.TransferTask;
import dev.mars.omics.transfer.executor.BoundedExecutor;
import dev.mars.omics.transfer.executor.TaskTag;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes downloaded chunks to one destination.
 *
 * <p>Part tasks hand every chunk to {@link #queueWrite(byte[], long)}, which
 * schedules the actual write on the single-threaded io pool so that no two
 * writes to a destination ever interleave. Once every part is done the
 * finalization unit calls {@link #complete(long)}.</p>
 *
 * <p>Written bytes are tracked as ranges of the file rather than a running sum.
 * A retried part rewrites its leading bytes at the same offsets and those
 * bytes are counted once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public abstract class OutputManager {

    protected final TransferCoordinator coordinator;
    protected final BoundedExecutor ioExecutor;
    // start offset -> end offset (exclusive), non-overlapping and non-adjacent
    private final TreeMap<Long, Long> writtenRanges = new TreeMap<>();
    private long bytesWritten;

    protected OutputManager(TransferCoordinator coordinator, BoundedExecutor ioExecutor) {
        this.coordinator = coordinator;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Prepares the destination for writes. Called once by the submission task
     * before any part is fetched.
     */
    public abstract void open() throws IOException;

    /**
     * Schedules {@code data} to be written at {@code offset} of the file.
     */
    public abstract void queueWrite(byte[] data, long offset) throws InterruptedException;

    /**
     * Finishes the destination once all writes have run.
     */
    protected abstract DownloadResult complete(long expectedLength) throws IOException, TransferException;

    /**
     * Tag used when submitting part tasks for this destination, or null for none.
     */
    public TaskTag getDownloadTaskTag() {
        return null;
    }

    /**
     * The single unit that finalizes the download and records its result.
     */
    public TransferTask<DownloadResult> getFinalIoTask(long expectedLength) {
        return new FinalizeDownloadTask(coordinator, this, expectedLength);
    }

    /**
     * Distinct bytes of the file written so far.
     */
    public synchronized long getBytesWritten() {
        return bytesWritten;
    }

    /**
     * Marks {@code [offset, offset + count)} as written.
     */
    protected synchronized void recordWritten(long offset, int count) {
        if (count <= 0) {
            return;
        }
        long start = offset;
        long end = offset + count;
        Map.Entry<Long, Long> before = writtenRanges.floorEntry(start);
        if (before != null && before.getValue() >= start) {
            start = before.getKey();
            end = Math.max(end, before.getValue());
            writtenRanges.remove(before.getKey());
            bytesWritten -= before.getValue() - before.getKey();
        }
        Map.Entry<Long, Long> next = writtenRanges.ceilingEntry(start);
        while (next != null && next.getKey() <= end) {
            end = Math.max(end, next.getValue());
            writtenRanges.remove(next.getKey());
            bytesWritten -= next.getValue() - next.getKey();
            next = writtenRanges.ceilingEntry(start);
        }
        writtenRanges.put(start, end);
        bytesWritten += end - start;
    }

    protected void verifyBytesWritten(long expectedLength) throws TransferException {
        long written = getBytesWritten();
        if (written != expectedLength) {
            throw new TransferException(coordinator.getTransferId(),
                    String.format("Wrote %d bytes but expected %d", written, expectedLength));
        }
    }

    /**
     * Notified by io units after a chunk reached the destination.
     */
    @FunctionalInterface
    interface WriteListener {
        void written(long offset, int length);
    }

    static final class FinalizeDownloadTask extends TransferTask<DownloadResult> {
        private final OutputManager outputManager;
        private final long expectedLength;

        FinalizeDownloadTask(TransferCoordinator coordinator, OutputManager outputManager, long expectedLength) {
            super(coordinator, List.of(), true);
            this.outputManager = outputManager;
            this.expectedLength = expectedLength;
        }

        @Override
        protected DownloadResult execute() throws IOException, TransferException {
            return outputManager.complete(expectedLength);
        }
    }
}
