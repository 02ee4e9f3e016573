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

package dev.mars.omics.download;

import dev.mars.omics.client.OmicsStorageClient;
import dev.mars.omics.core.PartDescriptor;
import dev.mars.omics.core.TransferRequest;
import dev.mars.omics.core.exceptions.IncompleteReadException;
import dev.mars.omics.core.exceptions.RetriesExceededException;
import dev.mars.omics.download.output.OutputManager;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.TransferTask;
import dev.mars.omics.transfer.TransientErrorKind;
import dev.mars.omics.transfer.observability.TransferTelemetryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.function.LongConsumer;

/**
 * Fetches one part and queues its bytes for writing.
 *
 * <p>The body is read in chunks of {@code ioChunkSize}. Before queuing a chunk
 * the task checks the coordinator and stops quietly if the transfer already
 * finished; progress counts only queued chunks. Timeouts, connection resets
 * and truncated bodies restart the part from its first byte, retracting the
 * progress of the failed attempt. Any other error fails the transfer at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class GetPartTask extends TransferTask<Void> {
    private static final Logger logger = LoggerFactory.getLogger(GetPartTask.class);

    private final OmicsStorageClient client;
    private final TransferRequest request;
    private final PartDescriptor part;
    private final OutputManager outputManager;
    private final int maxAttempts;
    private final int ioChunkSize;
    private final LongConsumer progress;

    public GetPartTask(TransferCoordinator coordinator, OmicsStorageClient client, TransferRequest request,
                       PartDescriptor part, OutputManager outputManager, int maxAttempts, int ioChunkSize,
                       LongConsumer progress, List<Runnable> doneCallbacks) {
        super(coordinator, doneCallbacks, false);
        this.client = client;
        this.request = request;
        this.part = part;
        this.outputManager = outputManager;
        this.maxAttempts = maxAttempts;
        this.ioChunkSize = ioChunkSize;
        this.progress = progress;
    }

    @Override
    protected Void execute() throws Exception {
        IOException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (coordinator.isDone()) {
                return null;
            }
            part.recordAttempt();
            long currentOffset = part.getOffset();
            try (InputStream body = client.getPart(request.getFileType(), request.getStoreId(),
                    request.getResourceId(), request.getFileName(), part.getPartNumber())) {
                while (true) {
                    byte[] chunk = body.readNBytes(ioChunkSize);
                    if (chunk.length == 0) {
                        break;
                    }
                    if (coordinator.isDone()) {
                        return null;
                    }
                    outputManager.queueWrite(chunk, currentOffset);
                    currentOffset += chunk.length;
                    progress.accept(chunk.length);
                }
                long received = currentOffset - part.getOffset();
                if (received < part.getSize()) {
                    throw new IncompleteReadException(part.getPartNumber(), received, part.getSize());
                }
                return null;
            } catch (IOException e) {
                Optional<TransientErrorKind> kind = TransientErrorKind.classify(e);
                if (kind.isEmpty()) {
                    throw e;
                }
                lastException = e;
                logger.debug("Retrying part {} of transfer {} after {} ({}/{}): {}", part.getPartNumber(),
                        getTransferId(), kind.get(), attempt, maxAttempts, e.getMessage());
                TransferTelemetryMetrics.getInstance().recordRetryAttempt(request.getFileType().name(), kind.get().name());
                progress.accept(part.getOffset() - currentOffset);
            }
        }
        throw new RetriesExceededException(getTransferId(), maxAttempts, lastException);
    }

    public PartDescriptor getPart() {
        return part;
    }

    @Override
    public String toString() {
        return "GetPartTask(transferId=" + getTransferId() + ", part=" + part.getPartNumber() + ")";
    }
}
