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

package dev.mars.omics.transfer.executor;

import dev.mars.omics.core.exceptions.NoResourcesAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;

/**
 * Counting admission limiter for a pool. A permit is held from submission until
 * the unit finishes running, so the number of queued plus running units never
 * exceeds the capacity.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TaskSemaphore {
    private static final Logger logger = LoggerFactory.getLogger(TaskSemaphore.class);

    private final Semaphore semaphore;
    private final int capacity;

    public TaskSemaphore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity);
    }

    /**
     * Takes a permit for {@code taskName}.
     *
     * @param blocking wait for a permit when none is free, otherwise fail fast
     * @throws NoResourcesAvailableException if non-blocking and no permit is free
     */
    public void acquire(String taskName, boolean blocking) throws InterruptedException {
        logger.trace("Acquiring permit for {}", taskName);
        if (!blocking) {
            if (!semaphore.tryAcquire()) {
                throw new NoResourcesAvailableException("Cannot acquire permit for " + taskName);
            }
            return;
        }
        semaphore.acquire();
    }

    public void release(String taskName) {
        logger.trace("Releasing permit for {}", taskName);
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int getCapacity() {
        return capacity;
    }
}
