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
import dev.mars.omics.config.TransferConfig;
import dev.mars.omics.core.FileMetadata;
import dev.mars.omics.core.PartDescriptor;
import dev.mars.omics.core.TransferRequest;
import dev.mars.omics.core.exceptions.RemoteApiException;
import dev.mars.omics.core.exceptions.RemoteErrorCode;
import dev.mars.omics.download.output.OutputManager;
import dev.mars.omics.transfer.CompletionCounter;
import dev.mars.omics.transfer.SubmissionTask;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.TransferMeta;
import dev.mars.omics.transfer.executor.BoundedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongConsumer;

/**
 * Fans a download out into one {@link GetPartTask} per part and arranges for
 * the finalization unit to run on the io pool once every part is done.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class DownloadSubmissionTask extends SubmissionTask {
    private static final Logger logger = LoggerFactory.getLogger(DownloadSubmissionTask.class);

    private final OmicsStorageClient client;
    private final TransferConfig config;
    private final TransferRequest request;
    private final BoundedExecutor requestExecutor;
    private final BoundedExecutor ioExecutor;
    private final OutputManager outputManager;
    private final LongConsumer progress;

    public DownloadSubmissionTask(TransferCoordinator coordinator, TransferMeta meta, OmicsStorageClient client,
                                  TransferConfig config, TransferRequest request, BoundedExecutor requestExecutor,
                                  BoundedExecutor ioExecutor, OutputManager outputManager, LongConsumer progress) {
        super(coordinator, meta);
        this.client = client;
        this.config = config;
        this.request = request;
        this.requestExecutor = requestExecutor;
        this.ioExecutor = ioExecutor;
        this.outputManager = outputManager;
        this.progress = progress;
    }

    @Override
    protected void submit() throws Exception {
        FileMetadata metadata = request.getFileMetadata().isPresent()
                ? request.getFileMetadata().get()
                : lookupMetadata();
        meta.provideTransferSize(metadata.getContentLength());
        outputManager.open();

        int partCount = metadata.getPartCount();
        logger.debug("Transfer {} downloading {} bytes in {} parts", coordinator.getTransferId(),
                metadata.getContentLength(), partCount);

        CompletionCounter counter = new CompletionCounter(() -> submitFinalTask(metadata.getContentLength()));
        for (int partNumber = 1; partNumber <= partCount; partNumber++) {
            PartDescriptor part = PartDescriptor.of(partNumber, metadata);
            counter.increment();
            GetPartTask task = new GetPartTask(coordinator, client, request, part, outputManager,
                    config.getDownloadMaxAttempts(), config.getIoChunkSize(), progress, List.of(counter::decrement));
            coordinator.submit(requestExecutor, task, outputManager.getDownloadTaskTag());
        }
        counter.finalizeCount();
    }

    private FileMetadata lookupMetadata() throws RemoteApiException, IOException {
        Map<String, FileMetadata> files = client.getFileMetadata(request.getFileType(), request.getStoreId(),
                request.getResourceId());
        for (Map.Entry<String, FileMetadata> entry : files.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(request.getFileName())) {
                return entry.getValue();
            }
        }
        throw new RemoteApiException(RemoteErrorCode.NOT_FOUND, "getFileMetadata",
                String.format("File %s not found for %s %s in store %s", request.getFileName(),
                        request.getFileType(), request.getResourceId(), request.getStoreId()));
    }

    private void submitFinalTask(long contentLength) {
        try {
            coordinator.submit(ioExecutor, outputManager.getFinalIoTask(contentLength), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failWithoutFinalTask(e);
        } catch (RejectedExecutionException e) {
            failWithoutFinalTask(e);
        }
    }

    // The final unit is the one that announces, so without it the transfer must be announced here.
    private void failWithoutFinalTask(Exception e) {
        logger.warn("Could not submit final task of transfer {}: {}", coordinator.getTransferId(), e.toString());
        coordinator.setException(e);
        coordinator.announceDone();
    }
}
