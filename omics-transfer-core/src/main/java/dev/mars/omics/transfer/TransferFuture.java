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

import dev.mars.omics.core.exceptions.CancellationKind;
import dev.mars.omics.core.exceptions.OmicsException;

import java.util.concurrent.TimeUnit;

/**
 * Handle returned to the caller for one transfer.
 *
 * @param <T> result type: {@link dev.mars.omics.core.DownloadResult} for downloads,
 *            the new read set id for uploads
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferFuture<T> {

    private final TransferMeta meta;
    private final TransferCoordinator coordinator;
    private final Class<T> resultType;

    public TransferFuture(TransferMeta meta, TransferCoordinator coordinator, Class<T> resultType) {
        this.meta = meta;
        this.coordinator = coordinator;
        this.resultType = resultType;
    }

    public TransferMeta getMeta() {
        return meta;
    }

    public long getTransferId() {
        return meta.getTransferId();
    }

    public TransferCoordinator getCoordinator() {
        return coordinator;
    }

    public CoordinatorStatus getStatus() {
        return coordinator.getStatus();
    }

    public boolean isDone() {
        return coordinator.isDone();
    }

    /**
     * Blocks until the transfer has finished and returns its result, or throws
     * the failure that ended it.
     */
    public T result() throws OmicsException, InterruptedException {
        return resultType.cast(coordinator.result());
    }

    /**
     * Waits up to {@code timeout} for the transfer to finish.
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return coordinator.awaitDone(timeout, unit);
    }

    public void cancel() {
        coordinator.cancel();
    }

    public void cancel(String message) {
        coordinator.cancel(message, CancellationKind.USER_REQUESTED);
    }

    @Override
    public String toString() {
        return "TransferFuture(transferId=" + getTransferId() + ", status=" + getStatus() + ")";
    }
}
