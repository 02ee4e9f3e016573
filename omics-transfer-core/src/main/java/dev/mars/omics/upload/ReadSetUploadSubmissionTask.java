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

import dev.mars.omics.client.OmicsStorageClient;
import dev.mars.omics.config.TransferConfig;
import dev.mars.omics.core.ReadSetFileName;
import dev.mars.omics.core.ReadSetUploadRequest;
import dev.mars.omics.core.UploadPartResult;
import dev.mars.omics.transfer.SubmissionTask;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.TransferMeta;
import dev.mars.omics.transfer.executor.BoundedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongConsumer;

/**
 * Fans a read set upload out into create, part and complete units.
 *
 * <p>Parts of the primary source are uploaded as {@code SOURCE1} and parts of
 * the paired source as {@code SOURCE2}, each numbered from 1.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ReadSetUploadSubmissionTask extends SubmissionTask {
    private static final Logger logger = LoggerFactory.getLogger(ReadSetUploadSubmissionTask.class);

    private final OmicsStorageClient client;
    private final TransferConfig config;
    private final ReadSetUploadRequest request;
    private final BoundedExecutor requestExecutor;
    private final LongConsumer progress;

    public ReadSetUploadSubmissionTask(TransferCoordinator coordinator, TransferMeta meta, OmicsStorageClient client,
                                       TransferConfig config, ReadSetUploadRequest request,
                                       BoundedExecutor requestExecutor, LongConsumer progress) {
        super(coordinator, meta);
        this.client = client;
        this.config = config;
        this.request = request;
        this.requestExecutor = requestExecutor;
        this.progress = progress;
    }

    @Override
    protected void submit() throws Exception {
        List<UploadInputManager> inputs = new ArrayList<>();
        inputs.add(UploadSourceKind.resolve(request.getSource())
                .createInputManager(request.getSource(), ReadSetFileName.SOURCE1));
        if (request.getPairedSource().isPresent()) {
            Object paired = request.getPairedSource().get();
            inputs.add(UploadSourceKind.resolve(paired).createInputManager(paired, ReadSetFileName.SOURCE2));
        }
        provideSize(inputs);

        CompletableFuture<String> uploadId = coordinator.submit(requestExecutor,
                new CreateMultipartUploadTask(coordinator, client, request), null);

        List<CompletableFuture<UploadPartResult>> partFutures = new ArrayList<>();
        for (UploadInputManager input : inputs) {
            long chunkSize = ChunkSizeAdjuster.adjust(config.getUploadPartSize(),
                    input.getSize().orElse(-1), config.getUploadMaxParts());
            UploadPartBody body;
            while ((body = input.nextPart(chunkSize)) != null) {
                UploadPartTask task = new UploadPartTask(coordinator, client, request.getStoreId(), uploadId,
                        body, progress);
                partFutures.add(coordinator.submit(requestExecutor, task, input.getTaskTag()));
            }
            logger.debug("Transfer {} submitted {} parts of {}", coordinator.getTransferId(),
                    partFutures.size(), input.getPartSource());
        }

        coordinator.submit(requestExecutor,
                new CompleteMultipartUploadTask(coordinator, client, request.getStoreId(), uploadId, partFutures),
                null);
    }

    private void provideSize(List<UploadInputManager> inputs) throws IOException {
        long total = 0;
        for (UploadInputManager input : inputs) {
            OptionalLong size = input.getSize();
            if (size.isEmpty()) {
                return;
            }
            total += size.getAsLong();
        }
        meta.provideTransferSize(total);
    }
}
