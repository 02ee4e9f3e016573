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
import dev.mars.omics.core.ReadSetUploadRequest;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.TransferTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the multipart upload session and registers its abort as a failure
 * cleanup, so a transfer that ends badly never leaves a session behind.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class CreateMultipartUploadTask extends TransferTask<String> {
    private static final Logger logger = LoggerFactory.getLogger(CreateMultipartUploadTask.class);

    private final OmicsStorageClient client;
    private final ReadSetUploadRequest request;

    public CreateMultipartUploadTask(TransferCoordinator coordinator, OmicsStorageClient client,
                                     ReadSetUploadRequest request) {
        super(coordinator);
        this.client = client;
        this.request = request;
    }

    @Override
    protected String execute() throws Exception {
        String uploadId = client.createMultipartReadSetUpload(request);
        logger.debug("Transfer {} created upload {}", getTransferId(), uploadId);
        coordinator.addFailureCleanup(() -> {
            logger.debug("Aborting upload {} of transfer {}", uploadId, getTransferId());
            client.abortMultipartReadSetUpload(request.getStoreId(), uploadId);
        });
        return uploadId;
    }
}
