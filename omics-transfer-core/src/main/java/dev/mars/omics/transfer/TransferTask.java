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
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Unit of work belonging to one transfer.
 *
 * <p>Running a unit waits for its dependencies, then executes its body unless
 * the transfer already finished. A failure in the body is recorded on the
 * coordinator instead of being thrown. Done callbacks always run, whether the
 * body ran, failed or was skipped, so completion counting stays exact. A final
 * unit records its return value as the transfer result and then announces the
 * transfer done.</p>
 *
 * @param <T> value produced by the body
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public abstract class TransferTask<T> implements Callable<T> {
    private static final Logger logger = LoggerFactory.getLogger(TransferTask.class);

    protected final TransferCoordinator coordinator;
    private final List<Runnable> doneCallbacks;
    private final boolean isFinal;

    protected TransferTask(TransferCoordinator coordinator) {
        this(coordinator, List.of(), false);
    }

    protected TransferTask(TransferCoordinator coordinator, List<Runnable> doneCallbacks, boolean isFinal) {
        this.coordinator = coordinator;
        this.doneCallbacks = List.copyOf(doneCallbacks);
        this.isFinal = isFinal;
    }

    @Override
    public final T call() {
        try {
            awaitDependencies();
            if (!coordinator.isDone()) {
                T value = execute();
                if (isFinal) {
                    coordinator.setResult(value);
                }
                return value;
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.debug("{} failed for transfer {}: {}", this, coordinator.getTransferId(), e.toString());
            coordinator.setException(e);
        } finally {
            for (Runnable callback : doneCallbacks) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    logger.warn("Done callback of {} raised: {}", this, e.getMessage(), e);
                }
            }
            if (isFinal) {
                coordinator.announceDone();
            }
        }
        return null;
    }

    /**
     * Blocks until the units this one depends on have finished.
     */
    protected void awaitDependencies() throws InterruptedException {
    }

    /**
     * The body of the unit.
     */
    protected abstract T execute() throws Exception;

    public long getTransferId() {
        return coordinator.getTransferId();
    }

    public boolean isFinal() {
        return isFinal;
    }

    /**
     * Waits for a dependency and returns its value. Units never complete
     * exceptionally since their failures go to the coordinator, so a failed
     * dependency yields null and the caller finds the coordinator done.
     */
    protected static <V> V awaitValue(Future<V> dependency) throws InterruptedException {
        try {
            return dependency.get();
        } catch (ExecutionException e) {
            logger.debug("Dependency failed: {}", e.getCause() != null ? e.getCause().toString() : e.toString());
            return null;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(transferId=" + coordinator.getTransferId() + ")";
    }
}
