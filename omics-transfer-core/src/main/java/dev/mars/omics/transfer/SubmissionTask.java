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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Entry point of a transfer on the submission pool. Marks the transfer queued,
 * notifies subscribers, marks it running and fans out the units that do the
 * actual work.
 *
 * <p>If fan-out fails part way the failure is recorded, the task waits for
 * every unit already submitted to finish, and announces the transfer done
 * itself since no final unit was submitted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public abstract class SubmissionTask extends TransferTask<Void> {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionTask.class);

    protected final TransferMeta meta;

    protected SubmissionTask(TransferCoordinator coordinator, TransferMeta meta) {
        super(coordinator);
        this.meta = meta;
    }

    @Override
    protected final Void execute() {
        try {
            coordinator.setStatusToQueued();
            TransferSubscribers.notifyQueued(meta);
            meta.getProgress().start();
            coordinator.setStatusToRunning();
            submit();
        } catch (Exception e) {
            logger.debug("Submission of transfer {} failed: {}", coordinator.getTransferId(), e.toString());
            coordinator.setException(e);
            waitForSubmittedUnits();
            coordinator.announceDone();
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
        }
        return null;
    }

    /**
     * Submits every unit of the transfer, including the one that finalizes it.
     */
    protected abstract void submit() throws Exception;

    private void waitForSubmittedUnits() {
        while (true) {
            List<CompletableFuture<?>> pending = coordinator.getAssociatedFutures().stream()
                    .filter(f -> !f.isDone())
                    .collect(Collectors.toList());
            if (pending.isEmpty()) {
                return;
            }
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .exceptionally(error -> null)
                    .join();
        }
    }
}
