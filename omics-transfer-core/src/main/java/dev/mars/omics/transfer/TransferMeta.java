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

package dev.mars.omics.transfer;

import dev.mars.omics.core.TransferDescriptor;

import java.util.OptionalLong;

/**
 * Descriptive data of a transfer: its id, the request that started it, its size
 * once known, and its progress.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferMeta {

    private final long transferId;
    private final TransferDescriptor request;
    private final ProgressTracker progress;
    private volatile long size = -1;

    public TransferMeta(long transferId, TransferDescriptor request) {
        this.transferId = transferId;
        this.request = request;
        this.progress = new ProgressTracker(transferId);
    }

    public long getTransferId() {
        return transferId;
    }

    public TransferDescriptor getRequest() {
        return request;
    }

    public ProgressTracker getProgress() {
        return progress;
    }

    public void provideTransferSize(long transferSize) {
        this.size = transferSize;
        progress.setTotalBytes(transferSize);
    }

    public OptionalLong getSize() {
        long current = size;
        return current < 0 ? OptionalLong.empty() : OptionalLong.of(current);
    }
}
