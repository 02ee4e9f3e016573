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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool whose backlog is bounded by admission permits.
 *
 * <p>Submitting a unit first takes a permit from the pool's default
 * {@link TaskSemaphore}, or from the limiter registered for the unit's
 * {@link TaskTag}. A blocking submit waits for a permit, which pushes back on
 * producers. A non-blocking submit fails with
 * {@link dev.mars.omics.core.exceptions.NoResourcesAvailableException}. The
 * permit is released when the unit finishes.</p>
 *
 * <p>Created without threads, the executor runs every unit inline on the
 * submitting thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class BoundedExecutor {
    private static final Logger logger = LoggerFactory.getLogger(BoundedExecutor.class);

    private final String name;
    private final ExecutorService executor;
    private final TaskSemaphore defaultSemaphore;
    private final Map<TaskTag, TaskSemaphore> tagSemaphores;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * @param name            pool name used for thread names and logs
     * @param maxSize         admission capacity (queued plus running units)
     * @param maxThreads      worker threads
     * @param tagSemaphores   limiters that replace the default one for tagged units
     * @param useThreads      false to run units inline
     */
    public BoundedExecutor(String name, int maxSize, int maxThreads,
                           Map<TaskTag, TaskSemaphore> tagSemaphores, boolean useThreads) {
        this.name = name;
        this.defaultSemaphore = new TaskSemaphore(maxSize);
        this.tagSemaphores = Map.copyOf(tagSemaphores);
        this.executor = useThreads ? newPool(name, maxThreads) : null;
    }

    public BoundedExecutor(String name, int maxSize, int maxThreads) {
        this(name, maxSize, maxThreads, Map.of(), true);
    }

    private static ExecutorService newPool(String name, int maxThreads) {
        AtomicInteger threadCount = new AtomicInteger();
        return new ThreadPoolExecutor(
                maxThreads,
                maxThreads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "omics-" + name + "-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
    }

    /**
     * Submits a unit, waiting for an admission permit if none is free.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task, TaskTag tag) throws InterruptedException {
        return submit(task, tag, true);
    }

    /**
     * Submits a unit.
     *
     * @param task     the unit to run
     * @param tag      optional tag selecting a dedicated limiter, may be null
     * @param blocking wait for a permit, or fail fast when none is free
     * @return future completed with the unit's return value
     * @throws RejectedExecutionException if the pool is shut down or, for a
     *                                    non-blocking submit, full
     */
    public <T> CompletableFuture<T> submit(Callable<T> task, TaskTag tag, boolean blocking)
            throws InterruptedException {
        if (shutdown.get()) {
            throw new RejectedExecutionException("Executor " + name + " is shut down");
        }
        TaskSemaphore semaphore = tag != null ? tagSemaphores.getOrDefault(tag, defaultSemaphore) : defaultSemaphore;
        String taskName = task.toString();
        semaphore.acquire(taskName, blocking);

        CompletableFuture<T> future = new CompletableFuture<>();
        Runnable runnable = () -> {
            try {
                future.complete(task.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
                if (t instanceof Error) {
                    throw (Error) t;
                }
            } finally {
                semaphore.release(taskName);
            }
        };

        if (executor == null) {
            runnable.run();
            return future;
        }
        try {
            executor.execute(runnable);
        } catch (RejectedExecutionException e) {
            semaphore.release(taskName);
            throw e;
        }
        return future;
    }

    /**
     * Stops accepting units. When {@code wait} is true, blocks until queued units
     * have run.
     */
    public void shutdown(boolean wait) {
        if (shutdown.getAndSet(true) || executor == null) {
            return;
        }
        logger.debug("Shutting down {} executor", name);
        executor.shutdown();
        if (!wait) {
            return;
        }
        try {
            while (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("Still waiting for {} executor to terminate", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public String getName() {
        return name;
    }

    public int availablePermits() {
        return defaultSemaphore.availablePermits();
    }
}
