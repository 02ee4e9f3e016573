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

import java.io.InputStream;
import java.util.concurrent.Future;
import java.util.function.LongConsumer;

/**
 * Uploads one part once the upload session exists.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class UploadPartTask extends TransferTask<UploadPartResult> {

    private final OmicsStorageClient client;
    private final String storeId;
    private final Future<String> uploadIdFuture;
    private final UploadPartBody body;
    private final LongConsumer progress;
    private String uploadId;

    public UploadPartTask(TransferCoordinator coordinator, OmicsStorageClient client, String storeId,
                          Future<String> uploadIdFuture, UploadPartBody body, LongConsumer progress) {
        super(coordinator);
        this.client = client;
        this.storeId = storeId;
        this.uploadIdFuture = uploadIdFuture;
        this.body = body;
        this.progress = progress;
    }

    @Override
    protected void awaitDependencies() throws InterruptedException {
        uploadId = awaitValue(uploadIdFuture);
    }

    @Override
    protected UploadPartResult execute() throws Exception {
        String checksum;
        try (InputStream payload = body.open()) {
            checksum = client.uploadReadSetPart(storeId, uploadId, body.getPartSource(), body.getPartNumber(),
                    payload, body.getLength());
        }
        progress.accept(body.getLength());
        return new UploadPartResult(body.getPartNumber(), body.getPartSource(), checksum);
    }

    @Override
    public String toString() {
        return "UploadPartTask(transferId=" + getTransferId() + ", " + body.getPartSource()
                + "#" + body.getPartNumber() + ")";
    }
}
