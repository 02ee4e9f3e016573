package dev.mars.omics.download;

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
import dev.mars.omics.core.FileMetadata;
import dev.mars.omics.core.OmicsFileType;
import dev.mars.omics.core.ReadSetFileName;
import dev.mars.omics.core.ReferenceFileName;
import dev.mars.omics.core.TransferRequest;
import dev.mars.omics.core.TransferSubscriber;
import dev.mars.omics.core.exceptions.RemoteApiException;
import dev.mars.omics.core.exceptions.RemoteErrorCode;
import dev.mars.omics.core.exceptions.RetriesExceededException;
import dev.mars.omics.simulator.InMemoryOmicsStorageClient;
import dev.mars.omics.transfer.CoordinatorStatus;
import dev.mars.omics.transfer.OmicsTransferManager;
import dev.mars.omics.transfer.TransferFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end download tests running the full pipeline against the in-memory
 * storage service.
 */
class DownloadTest {

    private static final String STORE = "store-1";
    private static final String READ_SET = "rs-1";
    private static final int PART_SIZE = 100;

    @TempDir
    Path tempDir;

    private InMemoryOmicsStorageClient client;
    private OmicsTransferManager manager;
    private byte[] content;

    @BeforeEach
    void setUp() {
        content = randomBytes(1000, 42);
        client = new InMemoryOmicsStorageClient()
                .putFile(OmicsFileType.READ_SET, STORE, READ_SET, "SOURCE1", content, PART_SIZE);
        manager = new OmicsTransferManager(client, config());
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private TransferConfig config() {
        Properties properties = new Properties();
        properties.setProperty(TransferConfig.DIRECTORY, tempDir.toString());
        properties.setProperty(TransferConfig.IO_CHUNK_SIZE, "16");
        properties.setProperty(TransferConfig.DOWNLOAD_MAX_ATTEMPTS, "3");
        properties.setProperty(TransferConfig.MAX_REQUEST_CONCURRENCY, "4");
        return new TransferConfig(properties);
    }

    @Test
    @DisplayName("Parts completing in reverse order still produce the exact file")
    void testOutOfOrderPartsAssembleFile() throws Exception {
        client.setPartDelay(part -> (11 - part) * 5L);
        Path destination = tempDir.resolve("reads.fastq");

        DownloadResult result = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1, destination)
                .result();

        assertEquals(destination, result.getPath().orElseThrow());
        assertEquals(content.length, result.getBytesWritten());
        assertFalse(result.isCompressed());
        assertArrayEquals(content, Files.readAllBytes(destination));
        assertThat(listDir()).containsExactly("reads.fastq");
        assertEquals(1, client.getMetadataCalls());
        assertEquals(10, client.getPartCalls());
    }

    @Test
    void testDefaultDestinationUnderConfiguredDirectory() throws Exception {
        TransferRequest request = TransferRequest.builder()
                .storeId(STORE)
                .resourceId(READ_SET)
                .fileName("source1")
                .fileType(OmicsFileType.READ_SET)
                .build();

        DownloadResult result = manager.download(request).result();

        assertEquals(tempDir.resolve("store-1_rs-1_source1"), result.getPath().orElseThrow());
        assertArrayEquals(content, Files.readAllBytes(result.getPath().orElseThrow()));
    }

    @Test
    void testSuppliedMetadataSkipsLookup() throws Exception {
        TransferRequest request = TransferRequest.builder()
                .storeId(STORE)
                .resourceId(READ_SET)
                .fileName(ReadSetFileName.SOURCE1)
                .fileMetadata(new FileMetadata(content.length, PART_SIZE, 10))
                .destination(tempDir.resolve("out.bin"))
                .build();

        manager.download(request).result();

        assertEquals(0, client.getMetadataCalls());
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("out.bin")));
    }

    @Test
    void testZeroByteFile() throws Exception {
        client.putFile(OmicsFileType.REFERENCE, STORE, "ref-1", "INDEX", new byte[0], PART_SIZE);

        DownloadResult result = manager.downloadReferenceFile(STORE, "ref-1", ReferenceFileName.INDEX,
                tempDir.resolve("ref.fai")).result();

        assertEquals(0, result.getBytesWritten());
        assertTrue(Files.exists(tempDir.resolve("ref.fai")));
        assertEquals(0, Files.size(tempDir.resolve("ref.fai")));
        assertEquals(1, client.getPartCalls());
    }

    @Test
    void testMetadataFailureFailsTransfer() throws Exception {
        client.failMetadataWith(new RemoteApiException(RemoteErrorCode.THROTTLING, "getFileMetadata", "slow down"));

        TransferFuture<DownloadResult> future = assertDoesNotThrow(() -> manager.downloadReadSetFile(
                STORE, READ_SET, ReadSetFileName.SOURCE1, tempDir.resolve("reads.fastq")));

        RemoteApiException thrown = assertThrows(RemoteApiException.class, future::result);
        assertEquals(RemoteErrorCode.THROTTLING, thrown.getErrorCode());
        assertEquals(CoordinatorStatus.FAILED, future.getStatus());
        assertThat(listDir()).isEmpty();
    }

    @Test
    void testMissingFileReportedAsNotFound() throws Exception {
        TransferFuture<DownloadResult> future = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.INDEX,
                tempDir.resolve("reads.bai"));

        RemoteApiException thrown = assertThrows(RemoteApiException.class, future::result);
        assertEquals(RemoteErrorCode.NOT_FOUND, thrown.getErrorCode());
    }

    @Test
    void testTransientFailureRecovered() throws Exception {
        client.setPartResponder((part, attempt, bytes) -> part == 4 && attempt == 1
                ? InMemoryOmicsStorageClient.failingAfter(bytes, 40, new SocketException("Connection reset"))
                : new ByteArrayInputStream(bytes));
        AtomicLong progress = new AtomicLong();

        DownloadResult result = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1,
                tempDir.resolve("reads.fastq"), new TransferSubscriber() {
                    @Override
                    public void onProgress(long transferId, long bytes) {
                        progress.addAndGet(bytes);
                    }
                }).result();

        assertArrayEquals(content, Files.readAllBytes(result.getPath().orElseThrow()));
        assertEquals(2, client.getPartAttempts(4));
        assertEquals(content.length, progress.get());
        assertEquals(content.length, result.getBytesWritten());
    }

    @Test
    @DisplayName("Bytes rewritten by a retried part are counted once for a seekable channel")
    void testSeekableChannelRetriedPartCountedOnce() throws Exception {
        client.setPartResponder((part, attempt, bytes) -> part == 1 && attempt == 1
                ? InMemoryOmicsStorageClient.failingAfter(bytes, 20, new SocketException("Connection reset"))
                : new ByteArrayInputStream(bytes));
        Path target = tempDir.resolve("retried.bin");

        try (SeekableByteChannel channel = Files.newByteChannel(target,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            DownloadResult result = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1, channel)
                    .result();
            assertEquals(content.length, result.getBytesWritten());
        }

        assertEquals(2, client.getPartAttempts(1));
        assertArrayEquals(content, Files.readAllBytes(target));
    }

    @Test
    void testNonSeekableStreamRetriedPartWrittenOnce() throws Exception {
        client.setPartResponder((part, attempt, bytes) -> part == 1 && attempt == 1
                ? InMemoryOmicsStorageClient.failingAfter(bytes, 40, new SocketException("Connection reset"))
                : new ByteArrayInputStream(bytes));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        DownloadResult result = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1, out).result();

        assertEquals(content.length, result.getBytesWritten());
        assertArrayEquals(content, out.toByteArray());
    }

    @Test
    @DisplayName("Exhausted retries fail the transfer and remove the temporary file")
    void testRetriesExceededLeavesNoFiles() throws Exception {
        client.setPartResponder((part, attempt, bytes) -> part == 3
                ? InMemoryOmicsStorageClient.failingAfter(bytes, 5, new SocketException("Connection reset"))
                : new ByteArrayInputStream(bytes));

        TransferFuture<DownloadResult> future = manager.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("reads.fastq"));

        RetriesExceededException thrown = assertThrows(RetriesExceededException.class, future::result);
        assertInstanceOf(SocketException.class, thrown.getLastException());
        assertEquals(3, client.getPartAttempts(3));
        assertThat(listDir()).isEmpty();
        assertEquals(0, manager.getActiveTransferCount());
    }

    @Test
    void testGzipContentGetsExtension() throws Exception {
        byte[] gzip = gzip(randomBytes(5000, 7));
        client.putFile(OmicsFileType.READ_SET, STORE, "rs-gz", "SOURCE1", gzip, PART_SIZE);

        DownloadResult result = manager.downloadReadSetFile(STORE, "rs-gz", ReadSetFileName.SOURCE1,
                tempDir.resolve("reads.fastq")).result();

        assertTrue(result.isCompressed());
        assertEquals(tempDir.resolve("reads.fastq.gz"), result.getPath().orElseThrow());
        assertArrayEquals(gzip, Files.readAllBytes(tempDir.resolve("reads.fastq.gz")));
        assertThat(listDir()).containsExactly("reads.fastq.gz");
    }

    @Test
    void testNonSeekableStreamReceivesBytesInOrder() throws Exception {
        client.setPartDelay(part -> (11 - part) * 5L);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        DownloadResult result = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1, out).result();

        assertTrue(result.getPath().isEmpty());
        assertEquals(content.length, result.getBytesWritten());
        assertArrayEquals(content, out.toByteArray());
    }

    @Test
    void testSeekableChannelWrittenAtOffsets() throws Exception {
        client.setPartDelay(part -> part % 2 == 0 ? 20L : 0L);
        Path target = tempDir.resolve("channel.bin");

        try (SeekableByteChannel channel = Files.newByteChannel(target,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            DownloadResult result = manager.downloadReadSetFile(STORE, READ_SET, ReadSetFileName.SOURCE1, channel)
                    .result();
            assertEquals(content.length, result.getBytesWritten());
            assertTrue(channel.isOpen());
        }

        assertArrayEquals(content, Files.readAllBytes(target));
    }

    @Test
    void testSubscribersNotified() throws Exception {
        AtomicInteger queued = new AtomicInteger();
        AtomicInteger done = new AtomicInteger();
        AtomicLong bytes = new AtomicLong();
        TransferSubscriber subscriber = new TransferSubscriber() {
            @Override
            public void onQueued(long transferId) {
                queued.incrementAndGet();
            }

            @Override
            public void onProgress(long transferId, long delta) {
                bytes.addAndGet(delta);
            }

            @Override
            public void onDone(long transferId) {
                done.incrementAndGet();
            }
        };

        TransferFuture<DownloadResult> future = manager.downloadReadSetFile(STORE, READ_SET,
                ReadSetFileName.SOURCE1, tempDir.resolve("reads.fastq"), subscriber);
        future.result();

        assertEquals(1, queued.get());
        assertEquals(1, done.get());
        assertEquals(content.length, bytes.get());
        assertEquals(1.0, future.getMeta().getProgress().getProgressPercentage());
    }

    @Test
    void testDownloadWholeReadSet() throws Exception {
        byte[] index = randomBytes(150, 3);
        client.putFile(OmicsFileType.READ_SET, STORE, READ_SET, "INDEX", index, PART_SIZE);
        Path directory = tempDir.resolve("downloads");

        List<TransferFuture<DownloadResult>> futures = manager.downloadReadSet(STORE, READ_SET, directory);
        for (TransferFuture<DownloadResult> future : futures) {
            future.result();
        }

        assertEquals(2, futures.size());
        assertArrayEquals(content, Files.readAllBytes(directory.resolve("store-1_rs-1_source1")));
        assertArrayEquals(index, Files.readAllBytes(directory.resolve("store-1_rs-1_index")));
        assertEquals(1, client.getMetadataCalls());
    }

    private List<String> listDir() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private static byte[] randomBytes(int length, long seed) {
        byte[] bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }

    private static byte[] gzip(byte[] content) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(content);
        }
        return bytes.toByteArray();
    }
}
