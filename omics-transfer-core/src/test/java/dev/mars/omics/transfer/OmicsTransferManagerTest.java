package dev.mars.omics.transfer;

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

import dev.mars.omics.config.TransferConfig;
import dev.mars.omics.core.DownloadResult;
import dev.mars.omics.core.OmicsFileType;
import dev.mars.omics.core.ReadSetFileName;
import dev.mars.omics.core.TransferRequest;
import dev.mars.omics.core.TransferSubscriber;
import dev.mars.omics.core.exceptions.CancellationKind;
import dev.mars.omics.core.exceptions.FatalTransferException;
import dev.mars.omics.core.exceptions.TransferCancelledException;
import dev.mars.omics.core.exceptions.TransferConfigurationException;
import dev.mars.omics.simulator.InMemoryOmicsStorageClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link OmicsTransferManager} lifecycle, validation and cancellation.
 */
class OmicsTransferManagerTest {

    private static final String STORE = "store-1";
    private static final String READ_SET = "rs-1";

    @TempDir
    Path tempDir;

    private InMemoryOmicsStorageClient client;
    private OmicsTransferManager manager;

    @BeforeEach
    void setUp() {
        byte[] content = new byte[1000];
        new Random(1).nextBytes(content);
        client = new InMemoryOmicsStorageClient()
                .putFile(OmicsFileType.READ_SET, STORE, READ_SET, "SOURCE1", content, 100);
        Properties properties = new Properties();
        properties.setProperty(TransferConfig.DIRECTORY, tempDir.toString());
        properties.setProperty(TransferConfig.IO_CHUNK_SIZE, "10");
        properties.setProperty(TransferConfig.MAX_REQUEST_CONCURRENCY, "2");
        manager = new OmicsTransferManager(client, new TransferConfig(properties));
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void testTransferIdsStartAtZero() throws Exception {
        TransferFuture<DownloadResult> first = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1,
                tempDir.resolve("a"));
        TransferFuture<DownloadResult> second = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1,
                tempDir.resolve("b"));

        assertEquals(0, first.getTransferId());
        assertEquals(1, second.getTransferId());
        assertEquals(0, first.result().getTransferId());
        second.result();
    }

    @Test
    void testInvalidFileNameRejected() {
        TransferRequest request = TransferRequest.builder()
                .storeId(STORE)
                .resourceId(READ_SET)
                .fileType(OmicsFileType.READ_SET)
                .fileName("SOURCE")
                .build();

        assertThrows(TransferConfigurationException.class, () -> manager.download(request));
        assertEquals(0, manager.getActiveTransferCount());
    }

    @Test
    void testUnsupportedDestinationRejected() {
        assertThrows(TransferConfigurationException.class,
                () -> manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1, 42));
    }

    @Test
    void testDirectoryDownloadRejectsFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        assertThrows(IOException.class, () -> manager.downloadReadSet(STORE, READ_SET, file));
    }

    @Test
    @DisplayName("Cancelling after the first chunk removes the partial file")
    void testCancelAfterFirstChunk() throws Exception {
        client.setPartDelay(part -> part == 1 ? 0L : 300L);
        CountDownLatch firstChunk = new CountDownLatch(1);
        TransferSubscriber subscriber = new TransferSubscriber() {
            @Override
            public void onProgress(long transferId, long bytes) {
                firstChunk.countDown();
            }
        };

        TransferFuture<DownloadResult> future = manager.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("reads.fastq"), subscriber);
        assertTrue(firstChunk.await(5, TimeUnit.SECONDS));
        assertTrue(manager.cancelTransfer(future.getTransferId()));

        TransferCancelledException thrown = assertThrows(TransferCancelledException.class, future::result);
        assertEquals(CancellationKind.USER_REQUESTED, thrown.getKind());
        assertEquals(CoordinatorStatus.CANCELLED, future.getStatus());
        assertEquals(0, manager.getActiveTransferCount());
        assertThat(listDir()).isEmpty();
    }

    @Test
    @DisplayName("No bytes are queued for parts fetched after the cancellation")
    void testCancelQueuesNothingForLaterParts() throws Exception {
        byte[] fourParts = new byte[400];
        new Random(4).nextBytes(fourParts);
        client.putFile(OmicsFileType.READ_SET, STORE, "rs-4", "SOURCE1", fourParts, 100);
        client.setPartDelay(part -> part == 1 ? 0L : 300L);
        Properties properties = new Properties();
        properties.setProperty(TransferConfig.DIRECTORY, tempDir.toString());
        properties.setProperty(TransferConfig.IO_CHUNK_SIZE, "100");
        properties.setProperty(TransferConfig.MAX_REQUEST_CONCURRENCY, "2");
        List<Long> queued = new CopyOnWriteArrayList<>();
        CountDownLatch firstChunk = new CountDownLatch(1);
        TransferSubscriber subscriber = new TransferSubscriber() {
            @Override
            public void onProgress(long transferId, long bytes) {
                queued.add(bytes);
                firstChunk.countDown();
            }
        };

        try (OmicsTransferManager fourPartManager = new OmicsTransferManager(client, new TransferConfig(properties))) {
            TransferFuture<DownloadResult> future = fourPartManager.downloadReadSetFile(STORE, "rs-4",
                    ReadSetFileName.SOURCE1, tempDir.resolve("four.fastq"), subscriber);
            assertTrue(firstChunk.await(5, TimeUnit.SECONDS));
            assertTrue(fourPartManager.cancelTransfer(future.getTransferId()));
            List<Long> queuedAtCancel = List.copyOf(queued);

            assertThrows(TransferCancelledException.class, future::result);

            assertEquals(List.of(100L), queuedAtCancel);
            assertEquals(queuedAtCancel, queued);
            assertEquals(100L, future.getMeta().getProgress().getTransferredBytes());
        }
        assertThat(listDir()).isEmpty();
    }

    @Test
    void testCancelUnknownTransfer() {
        assertFalse(manager.cancelTransfer(99));
    }

    @Test
    void testShutdownWithCancelStopsInFlightTransfers() throws Exception {
        client.setPartDelay(part -> 200L);
        TransferFuture<DownloadResult> future = manager.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("reads.fastq"));

        manager.shutdown(true, "stopping");

        TransferCancelledException thrown = assertThrows(TransferCancelledException.class, future::result);
        assertEquals(CancellationKind.SHUTDOWN, thrown.getKind());
        assertTrue(manager.isShutdown());
        assertThat(listDir()).isEmpty();
    }

    @Test
    void testShutdownWithoutCancelWaitsForTransfers() throws Exception {
        client.setPartDelay(part -> 20L);
        TransferFuture<DownloadResult> future = manager.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("reads.fastq"));

        manager.shutdown(false, null);

        assertEquals(CoordinatorStatus.SUCCEEDED, future.getStatus());
        assertEquals(1000, future.result().getBytesWritten());
    }

    @Test
    void testNewTransfersRejectedAfterShutdown() throws Exception {
        manager.shutdown(false, null);

        assertThrows(IllegalStateException.class,
                () -> manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1, tempDir.resolve("x")));
    }

    @Test
    void testCancelAll() throws Exception {
        client.setPartDelay(part -> 200L);
        TransferFuture<DownloadResult> first = manager.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("a"));
        TransferFuture<DownloadResult> second = manager.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("b"));

        manager.cancelAll("user abort");

        assertThrows(TransferCancelledException.class, first::result);
        assertThrows(TransferCancelledException.class, second::result);
        await().atMost(5, TimeUnit.SECONDS).until(() -> manager.getActiveTransferCount() == 0);
    }

    @Test
    void testExecuteShutsDownAfterWork() throws Exception {
        DownloadResult result = manager.execute(m -> m.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("reads.fastq")).result());

        assertEquals(1000, result.getBytesWritten());
        assertTrue(manager.isShutdown());
    }

    @Test
    void testExecuteWrapsFailure() {
        IOException failure = new IOException("disk gone");

        FatalTransferException thrown = assertThrows(FatalTransferException.class, () -> manager.execute(m -> {
            throw failure;
        }));

        assertSame(failure, thrown.getCause());
        assertTrue(manager.isShutdown());
    }

    @Test
    void testExecuteRethrowsInterrupt() {
        try {
            assertThrows(InterruptedException.class, () -> manager.execute(m -> {
                throw new InterruptedException("stop");
            }));
            assertTrue(Thread.currentThread().isInterrupted());
            assertTrue(manager.isShutdown());
        } finally {
            Thread.interrupted();
        }
    }

    private List<String> listDir() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
