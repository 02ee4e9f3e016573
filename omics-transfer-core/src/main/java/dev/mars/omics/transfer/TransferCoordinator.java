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
import dev.mars.omics.core.exceptions.TransferCancelledException;
import dev.mars.omics.core.exceptions.TransferException;
import dev.mars.omics.transfer.executor.BoundedExecutor;
import dev.mars.omics.transfer.executor.TaskTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared state machine of one transfer.
 *
 * <p>Every unit of work belonging to a transfer (submission task, part tasks,
 * io writes, finalization) holds the same coordinator. Units record failures on
 * it, check it before doing work, and the final unit records the result. The
 * first recorded failure wins; later ones are ignored.</p>
 *
 * <h3>Completion:</h3>
 * <p>A transfer is finished once {@link #announceDone()} has run. Announcing
 * runs the failure cleanups (once, and only when the transfer did not succeed),
 * then the done callbacks, then releases every thread waiting in
 * {@link #result()}. Announcing more than once has no further effect.</p>
 *
 * <h3>Thread Safety:</h3>
 * <p>All state transitions are guarded by a single lock. Callbacks and cleanups
 * run outside the lock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(TransferCoordinator.class);

    private final long transferId;
    private final ReentrantLock lock = new ReentrantLock();
    private final CountDownLatch doneLatch = new CountDownLatch(1);
    private final List<Runnable> doneCallbacks = new ArrayList<>();
    private final List<FailureCleanup> failureCleanups = new ArrayList<>();
    private final Set<CompletableFuture<?>> associatedFutures = ConcurrentHashMap.newKeySet();

    private volatile CoordinatorStatus status = CoordinatorStatus.NOT_STARTED;
    private volatile Throwable exception;
    private volatile Object result;
    private boolean announced;

    public TransferCoordinator(long transferId) {
        this.transferId = transferId;
    }

    public long getTransferId() {
        return transferId;
    }

    public CoordinatorStatus getStatus() {
        return status;
    }

    /**
     * True once the status is terminal. Units check this before doing work.
     */
    public boolean isDone() {
        return status.isTerminal();
    }

    public Throwable getException() {
        return exception;
    }

    public void setStatusToQueued() {
        transitionIfActive(CoordinatorStatus.QUEUED);
    }

    public void setStatusToRunning() {
        transitionIfActive(CoordinatorStatus.RUNNING);
    }

    private void transitionIfActive(CoordinatorStatus next) {
        lock.lock();
        try {
            if (!status.isTerminal()) {
                status = next;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the successful result. Ignored if the transfer already finished.
     *
     * @return true if the result was recorded
     */
    public boolean setResult(Object value) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            result = value;
            exception = null;
            status = CoordinatorStatus.SUCCEEDED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a failure. Only the first failure of an unfinished transfer is kept.
     *
     * @return true if the failure was recorded
     */
    public boolean setException(Throwable failure) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            exception = failure;
            status = CoordinatorStatus.FAILED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void cancel() {
        cancel("", CancellationKind.USER_REQUESTED);
    }

    /**
     * Cancels the transfer unless it already finished. A transfer that never
     * started is announced immediately since no unit will ever do it.
     */
    public void cancel(String message, CancellationKind kind) {
        boolean announceNow;
        lock.lock();
        try {
            if (status.isTerminal()) {
                return;
            }
            announceNow = status == CoordinatorStatus.NOT_STARTED;
            exception = new TransferCancelledException(transferId, message, kind);
            status = CoordinatorStatus.CANCELLED;
        } finally {
            lock.unlock();
        }
        logger.debug("Transfer {} cancelled ({}): {}", transferId, kind, message);
        if (announceNow) {
            announceDone();
        }
    }

    /**
     * Waits for the transfer to finish and returns its result.
     *
     * @throws OmicsException the recorded failure; checked errors that are not
     *                        omics errors are wrapped in {@link TransferException}
     */
    public Object result() throws OmicsException, InterruptedException {
        doneLatch.await();
        return resultOrThrow();
    }

    /**
     * Waits up to {@code timeout} for the transfer to finish.
     *
     * @return true if the transfer finished in time
     */
    public boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
        return doneLatch.await(timeout, unit);
    }

    public void awaitDone() throws InterruptedException {
        doneLatch.await();
    }

    private Object resultOrThrow() throws OmicsException {
        Throwable failure = exception;
        if (failure == null) {
            return result;
        }
        if (failure instanceof OmicsException) {
            throw (OmicsException) failure;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new TransferException(transferId, failure.getMessage(), failure);
    }

    /**
     * Submits a unit of this transfer and tracks its future until it completes.
     */
    public <T> CompletableFuture<T> submit(BoundedExecutor executor, TransferTask<T> task, TaskTag tag)
            throws InterruptedException {
        logger.trace("Submitting {} to {} executor", task, executor.getName());
        CompletableFuture<T> future = executor.submit(task, tag);
        associatedFutures.add(future);
        future.whenComplete((value, error) -> associatedFutures.remove(future));
        return future;
    }

    /**
     * Futures of units submitted through this coordinator that have not yet been
     * observed as completed.
     */
    public Set<CompletableFuture<?>> getAssociatedFutures() {
        return Set.copyOf(associatedFutures);
    }

    /**
     * Registers a callback run when the transfer is announced done. Runs at once
     * if that already happened.
     */
    public void addDoneCallback(Runnable callback) {
        lock.lock();
        try {
            if (!announced) {
                doneCallbacks.add(callback);
                return;
            }
        } finally {
            lock.unlock();
        }
        runDoneCallback(callback);
    }

    /**
     * Registers a compensating action for an unsuccessful outcome. Runs at once
     * if the transfer was already announced as unsuccessful.
     */
    public void addFailureCleanup(FailureCleanup cleanup) {
        lock.lock();
        try {
            if (!announced) {
                failureCleanups.add(cleanup);
                return;
            }
            if (status == CoordinatorStatus.SUCCEEDED) {
                return;
            }
        } finally {
            lock.unlock();
        }
        runFailureCleanup(cleanup);
    }

    /**
     * Marks the transfer as finished. Failure cleanups run first (only when the
     * transfer did not succeed), then done callbacks, then waiters are released.
     */
    public void announceDone() {
        List<FailureCleanup> cleanups;
        List<Runnable> callbacks;
        lock.lock();
        try {
            if (announced) {
                return;
            }
            announced = true;
            cleanups = status == CoordinatorStatus.SUCCEEDED ? List.of() : List.copyOf(failureCleanups);
            callbacks = List.copyOf(doneCallbacks);
            failureCleanups.clear();
            doneCallbacks.clear();
        } finally {
            lock.unlock();
        }
        try {
            cleanups.forEach(this::runFailureCleanup);
            callbacks.forEach(this::runDoneCallback);
        } finally {
            doneLatch.countDown();
        }
    }

    public boolean isAnnounced() {
        lock.lock();
        try {
            return announced;
        } finally {
            lock.unlock();
        }
    }

    private void runFailureCleanup(FailureCleanup cleanup) {
        try {
            cleanup.run();
        } catch (Exception e) {
            logger.warn("Failure cleanup for transfer {} raised: {}", transferId, e.getMessage(), e);
        }
    }

    private void runDoneCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Done callback for transfer {} raised: {}", transferId, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "TransferCoordinator(transferId=" + transferId + ", status=" + status + ")";
    }
}
