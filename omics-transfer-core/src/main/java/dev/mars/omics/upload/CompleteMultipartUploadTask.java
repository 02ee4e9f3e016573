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
import dev.mars.omics.core.UploadPartResult;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.TransferTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

/**
 * Final unit of an upload. Waits for the session and every part, then
 * completes the upload with the parts in submission order and records the new
 * read set id as the transfer result.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class CompleteMultipartUploadTask extends TransferTask<String> {
    private static final Logger logger = LoggerFactory.getLogger(CompleteMultipartUploadTask.class);

    private final OmicsStorageClient client;
    private final String storeId;
    private final Future<String> uploadIdFuture;
    private final List<? extends Future<UploadPartResult>> partFutures;
    private String uploadId;
    private final List<UploadPartResult> parts = new ArrayList<>();

    public CompleteMultipartUploadTask(TransferCoordinator coordinator, OmicsStorageClient client, String storeId,
                                       Future<String> uploadIdFuture,
                                       List<? extends Future<UploadPartResult>> partFutures) {
        super(coordinator, List.of(), true);
        this.client = client;
        this.storeId = storeId;
        this.uploadIdFuture = uploadIdFuture;
        this.partFutures = List.copyOf(partFutures);
    }

    @Override
    protected void awaitDependencies() throws InterruptedException {
        uploadId = awaitValue(uploadIdFuture);
        for (Future<UploadPartResult> partFuture : partFutures) {
            parts.add(awaitValue(partFuture));
        }
    }

    @Override
    protected String execute() throws Exception {
        String readSetId = client.completeMultipartReadSetUpload(storeId, uploadId, parts);
        logger.debug("Transfer {} completed upload {} as read set {}", getTransferId(), uploadId, readSetId);
        return readSetId;
    }
}
