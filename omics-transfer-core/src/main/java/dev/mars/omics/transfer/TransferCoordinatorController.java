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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of in-flight transfers owned by one manager. Coordinators are added
 * when a transfer is submitted and removed by a done callback.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferCoordinatorController {
    private static final Logger logger = LoggerFactory.getLogger(TransferCoordinatorController.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, TransferCoordinator> trackedCoordinators = new LinkedHashMap<>();

    public void add(TransferCoordinator coordinator) {
        lock.lock();
        try {
            trackedCoordinators.put(coordinator.getTransferId(), coordinator);
        } finally {
            lock.unlock();
        }
    }

    public void remove(TransferCoordinator coordinator) {
        lock.lock();
        try {
            trackedCoordinators.remove(coordinator.getTransferId(), coordinator);
        } finally {
            lock.unlock();
        }
    }

    public Optional<TransferCoordinator> get(long transferId) {
        lock.lock();
        try {
            return Optional.ofNullable(trackedCoordinators.get(transferId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the tracked coordinators in submission order.
     */
    public List<TransferCoordinator> getTrackedCoordinators() {
        lock.lock();
        try {
            return List.copyOf(trackedCoordinators.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return trackedCoordinators.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels every tracked transfer with the same message and kind.
     */
    public void cancel(String message, CancellationKind kind) {
        List<TransferCoordinator> snapshot = getTrackedCoordinators();
        if (!snapshot.isEmpty()) {
            logger.info("Cancelling {} transfers ({})", snapshot.size(), kind);
        }
        for (TransferCoordinator coordinator : snapshot) {
            coordinator.cancel(message, kind);
        }
    }

    /**
     * Blocks until every transfer tracked at the time of the call is done.
     */
    public void waitForAll() throws InterruptedException {
        for (TransferCoordinator coordinator : getTrackedCoordinators()) {
            coordinator.awaitDone();
        }
    }
}
