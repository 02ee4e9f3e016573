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

import dev.mars.omics.client.OmicsStorageClient;
import dev.mars.omics.config.TransferConfig;
import dev.mars.omics.core.DownloadResult;
import dev.mars.omics.core.FileMetadata;
import dev.mars.omics.core.OmicsFileType;
import dev.mars.omics.core.ReadSetFileName;
import dev.mars.omics.core.ReadSetUploadRequest;
import dev.mars.omics.core.ReferenceFileName;
import dev.mars.omics.core.TransferDescriptor;
import dev.mars.omics.core.TransferRequest;
import dev.mars.omics.core.TransferSubscriber;
import dev.mars.omics.core.exceptions.CancellationKind;
import dev.mars.omics.core.exceptions.FatalTransferException;
import dev.mars.omics.core.exceptions.OmicsException;
import dev.mars.omics.core.exceptions.TransferConfigurationException;
import dev.mars.omics.download.DownloadSubmissionTask;
import dev.mars.omics.download.output.DestinationKind;
import dev.mars.omics.download.output.OutputManager;
import dev.mars.omics.storage.FileManager;
import dev.mars.omics.transfer.executor.BoundedExecutor;
import dev.mars.omics.transfer.executor.TaskSemaphore;
import dev.mars.omics.transfer.executor.TaskTag;
import dev.mars.omics.transfer.observability.TransferTelemetryMetrics;
import dev.mars.omics.upload.ReadSetUploadSubmissionTask;
import dev.mars.omics.upload.UploadSourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

/**
 * Entry point for downloading and uploading omics files.
 *
 * <p>The manager owns three bounded pools: a submission pool that runs one
 * fan-out task per transfer, a request pool that runs part fetches and upload
 * calls, and a single-threaded io pool that performs every destination write.
 * Each transfer is tracked by a {@link TransferCoordinator} until it is done.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * try (OmicsTransferManager manager = new OmicsTransferManager(client)) {
 *     TransferFuture<DownloadResult> future = manager.downloadReadSetFile(
 *         "1234567890", "9876543210", ReadSetFileName.SOURCE1, Paths.get("sample.fastq"));
 *     DownloadResult result = future.result();
 * }
 * }</pre>
 *
 * <h3>Shutdown:</h3>
 * <p>{@link #shutdown(boolean, String)} optionally cancels every in-flight
 * transfer, waits for all of them to finish, then stops the submission,
 * request and io pools in that order. {@link #execute(TransferWork)} wraps a
 * block of caller code so that an unexpected error cancels every transfer
 * before shutting down.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class OmicsTransferManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(OmicsTransferManager.class);

    private final OmicsStorageClient client;
    private final TransferConfig config;
    private final TransferCoordinatorController coordinatorController = new TransferCoordinatorController();
    private final AtomicLong nextTransferId = new AtomicLong(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final BoundedExecutor submissionExecutor;
    private final BoundedExecutor requestExecutor;
    private final BoundedExecutor ioExecutor;
    private final TransferTelemetryMetrics metrics;

    public OmicsTransferManager(OmicsStorageClient client) {
        this(client, new TransferConfig());
    }

    public OmicsTransferManager(OmicsStorageClient client, TransferConfig config) {
        this.client = client;
        this.config = config;
        this.metrics = TransferTelemetryMetrics.getInstance();
        boolean useThreads = config.isUseThreads();
        this.submissionExecutor = new BoundedExecutor("submission", config.getMaxSubmissionQueueSize(),
                config.getMaxSubmissionConcurrency(), Map.of(), useThreads);
        this.requestExecutor = new BoundedExecutor("request", config.getMaxRequestQueueSize(),
                config.getMaxRequestConcurrency(),
                Map.of(TaskTag.IN_MEMORY_UPLOAD, new TaskSemaphore(config.getUploadMaxInMemoryChunks())),
                useThreads);
        this.ioExecutor = new BoundedExecutor("io", config.getMaxIoQueueSize(), 1, Map.of(), useThreads);
        logger.info("OmicsTransferManager initialized: {}", config);
    }

    // Downloads

    /**
     * Starts a download. The destination type decides how bytes are written; see
     * {@link TransferRequest}.
     *
     * @throws TransferConfigurationException if the file name or destination is not supported
     */
    public TransferFuture<DownloadResult> download(TransferRequest request) throws TransferConfigurationException {
        ensureRunning();
        if (!request.getFileType().isValidFileName(request.getFileName())) {
            throw new TransferConfigurationException(String.format("Invalid file name %s for %s, expected one of %s",
                    request.getFileName(), request.getFileType(), request.getFileType().getAllowedFileNames()));
        }
        TransferRequest resolved = request.getDestination().isPresent()
                ? request
                : request.withDestination(defaultDestination(request));
        Object destination = resolved.getDestination().get();
        DestinationKind kind = DestinationKind.resolve(destination);

        TransferMeta meta = new TransferMeta(nextTransferId.getAndIncrement(), resolved);
        TransferCoordinator coordinator = newCoordinator(meta);
        TransferFuture<DownloadResult> future = new TransferFuture<>(meta, coordinator, DownloadResult.class);
        OutputManager outputManager = kind.createOutputManager(destination, coordinator, ioExecutor);

        coordinatorController.add(coordinator);
        LongConsumer progress = TransferSubscribers.progressCallback(meta);
        submit(coordinator, new DownloadSubmissionTask(coordinator, meta, client, config, resolved,
                requestExecutor, ioExecutor, outputManager, progress));
        return future;
    }

    public TransferFuture<DownloadResult> downloadReadSetFile(String storeId, String readSetId, ReadSetFileName fileName,
                                                              Object destination, TransferSubscriber... subscribers)
            throws TransferConfigurationException {
        return download(TransferRequest.builder()
                .storeId(storeId)
                .resourceId(readSetId)
                .fileName(fileName)
                .destination(destination)
                .subscribers(Arrays.asList(subscribers))
                .build());
    }

    public TransferFuture<DownloadResult> downloadReferenceFile(String storeId, String referenceId,
                                                                ReferenceFileName fileName, Object destination,
                                                                TransferSubscriber... subscribers)
            throws TransferConfigurationException {
        return download(TransferRequest.builder()
                .storeId(storeId)
                .resourceId(referenceId)
                .fileName(fileName)
                .destination(destination)
                .subscribers(Arrays.asList(subscribers))
                .build());
    }

    /**
     * Downloads every file of a read set into {@code directory}, or the configured
     * directory when null. Files are named {@code <store>_<readSet>_<file>}.
     */
    public List<TransferFuture<DownloadResult>> downloadReadSet(String storeId, String readSetId, Path directory,
                                                                TransferSubscriber... subscribers)
            throws OmicsException, IOException {
        return downloadAll(OmicsFileType.READ_SET, storeId, readSetId, directory, subscribers);
    }

    /**
     * Downloads every file of a reference into {@code directory}, or the configured
     * directory when null. Files are named {@code <store>_<reference>_<file>}.
     */
    public List<TransferFuture<DownloadResult>> downloadReference(String storeId, String referenceId, Path directory,
                                                                  TransferSubscriber... subscribers)
            throws OmicsException, IOException {
        return downloadAll(OmicsFileType.REFERENCE, storeId, referenceId, directory, subscribers);
    }

    private List<TransferFuture<DownloadResult>> downloadAll(OmicsFileType fileType, String storeId, String resourceId,
                                                             Path directory, TransferSubscriber... subscribers)
            throws OmicsException, IOException {
        ensureRunning();
        Path target = directory != null ? directory : config.getDirectory();
        FileManager.validateDirectory(target);
        Map<String, FileMetadata> files = client.getFileMetadata(fileType, storeId, resourceId);

        List<TransferFuture<DownloadResult>> futures = new ArrayList<>();
        for (Map.Entry<String, FileMetadata> file : files.entrySet()) {
            String fileName = file.getKey().toUpperCase(Locale.ROOT);
            futures.add(download(TransferRequest.builder()
                    .storeId(storeId)
                    .resourceId(resourceId)
                    .fileType(fileType)
                    .fileName(fileName)
                    .fileMetadata(file.getValue())
                    .destination(target.resolve(defaultFileName(storeId, resourceId, fileName)))
                    .subscribers(Arrays.asList(subscribers))
                    .build()));
        }
        return futures;
    }

    // Uploads

    /**
     * Starts a multipart read set upload. The future's result is the new read set id.
     *
     * @throws TransferConfigurationException if a source is not supported, or an
     *                                        aligned format has no reference ARN
     */
    public TransferFuture<String> uploadReadSet(ReadSetUploadRequest request) throws TransferConfigurationException {
        ensureRunning();
        if (request.getSourceFileType().requiresReference() && request.getReferenceArn().isEmpty()) {
            throw new TransferConfigurationException("A reference ARN is required for source file type "
                    + request.getSourceFileType());
        }
        UploadSourceKind.resolve(request.getSource());
        if (request.getPairedSource().isPresent()) {
            UploadSourceKind.resolve(request.getPairedSource().get());
        }

        TransferMeta meta = new TransferMeta(nextTransferId.getAndIncrement(), request);
        TransferCoordinator coordinator = newCoordinator(meta);
        TransferFuture<String> future = new TransferFuture<>(meta, coordinator, String.class);

        coordinatorController.add(coordinator);
        submit(coordinator, new ReadSetUploadSubmissionTask(coordinator, meta, client, config, request,
                requestExecutor, TransferSubscribers.progressCallback(meta)));
        return future;
    }

    // Control

    /**
     * Cancels one in-flight transfer.
     *
     * @return false if no transfer with that id is in flight
     */
    public boolean cancelTransfer(long transferId) {
        return coordinatorController.get(transferId)
                .map(coordinator -> {
                    coordinator.cancel("Cancelled by request", CancellationKind.USER_REQUESTED);
                    return true;
                })
                .orElse(false);
    }

    public void cancelAll(String message) {
        coordinatorController.cancel(message, CancellationKind.USER_REQUESTED);
    }

    public int getActiveTransferCount() {
        return coordinatorController.size();
    }

    public TransferConfig getConfig() {
        return config;
    }

    /**
     * Runs {@code work} and then shuts the manager down, waiting for every
     * transfer. An unexpected error cancels all in-flight transfers first.
     *
     * @throws FatalTransferException wrapping the error raised by {@code work}
     * @throws InterruptedException   if interrupted; in-flight transfers are cancelled
     */
    public <T> T execute(TransferWork<T> work) throws FatalTransferException, InterruptedException {
        T value;
        try {
            value = work.run(this);
        } catch (InterruptedException e) {
            shutdownQuietly(true, "Interrupted", CancellationKind.INTERRUPTED);
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            shutdownQuietly(true, message, CancellationKind.FATAL_ERROR);
            throw new FatalTransferException("Transfer work failed: " + message, e);
        }
        shutdown(false, null);
        return value;
    }

    /**
     * Shuts the manager down.
     *
     * @param cancel  cancel every in-flight transfer before waiting
     * @param message cancellation message
     * @throws InterruptedException if interrupted while waiting; in-flight
     *                              transfers are cancelled before it is rethrown
     */
    public void shutdown(boolean cancel, String message) throws InterruptedException {
        shutdown(cancel, message, CancellationKind.SHUTDOWN);
    }

    private void shutdown(boolean cancel, String message, CancellationKind kind) throws InterruptedException {
        shutdown.set(true);
        if (cancel) {
            coordinatorController.cancel(message, kind);
        }
        try {
            coordinatorController.waitForAll();
        } catch (InterruptedException e) {
            coordinatorController.cancel("Interrupted during shutdown", CancellationKind.INTERRUPTED);
            throw e;
        } finally {
            submissionExecutor.shutdown(true);
            requestExecutor.shutdown(true);
            ioExecutor.shutdown(true);
            logger.info("OmicsTransferManager shut down");
        }
    }

    private void shutdownQuietly(boolean cancel, String message, CancellationKind kind) {
        try {
            shutdown(cancel, message, kind);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits for every transfer and shuts down. Interruption is restored on the
     * calling thread after in-flight transfers are cancelled.
     */
    @Override
    public void close() {
        try {
            shutdown(false, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    // Internals

    private void ensureRunning() {
        if (shutdown.get()) {
            throw new IllegalStateException("OmicsTransferManager is shut down");
        }
    }

    private TransferCoordinator newCoordinator(TransferMeta meta) {
        TransferCoordinator coordinator = new TransferCoordinator(meta.getTransferId());
        TransferDescriptor request = meta.getRequest();
        String direction = request.getDirection().label();
        String fileType = request.getFileType().name();
        metrics.recordTransferStarted(direction, fileType);
        coordinator.addDoneCallback(() -> coordinatorController.remove(coordinator));
        coordinator.addDoneCallback(() -> recordOutcome(coordinator, meta, direction, fileType));
        coordinator.addDoneCallback(() -> TransferSubscribers.notifyDone(meta));
        return coordinator;
    }

    private void recordOutcome(TransferCoordinator coordinator, TransferMeta meta, String direction, String fileType) {
        switch (coordinator.getStatus()) {
            case SUCCEEDED:
                double seconds = meta.getProgress().getElapsed().toMillis() / 1000.0;
                metrics.recordTransferCompleted(direction, fileType, meta.getSize().orElse(0), seconds);
                logger.info("Transfer {} ({} {}) completed in {}s", coordinator.getTransferId(), direction,
                        fileType, seconds);
                break;
            case CANCELLED:
                metrics.recordTransferCancelled(direction, fileType);
                logger.info("Transfer {} ({} {}) cancelled", coordinator.getTransferId(), direction, fileType);
                break;
            default:
                Throwable failure = coordinator.getException();
                metrics.recordTransferFailed(direction, fileType,
                        failure != null ? failure.getClass().getSimpleName() : null);
                logger.info("Transfer {} ({} {}) failed: {}", coordinator.getTransferId(), direction, fileType,
                        failure != null ? failure.getMessage() : "unknown");
        }
    }

    private void submit(TransferCoordinator coordinator, SubmissionTask task) {
        try {
            submissionExecutor.submit(task, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinator.cancel("Interrupted while submitting", CancellationKind.INTERRUPTED);
        } catch (RejectedExecutionException e) {
            coordinator.setException(e);
            coordinator.announceDone();
        }
    }

    private Object defaultDestination(TransferRequest request) {
        return config.getDirectory().resolve(defaultFileName(request.getStoreId(), request.getResourceId(),
                request.getFileName()));
    }

    private static String defaultFileName(String storeId, String resourceId, String fileName) {
        return storeId + "_" + resourceId + "_" + fileName.toLowerCase(Locale.ROOT);
    }
}
