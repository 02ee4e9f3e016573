package dev.mars.omics.download.output;

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

import dev.mars.omics.core.exceptions.TransferConfigurationException;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.executor.BoundedExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DestinationKindTest {

    @TempDir
    Path tempDir;

    @Test
    void testPathLikeDestinationsAreFiles() throws Exception {
        assertEquals(DestinationKind.FILE, DestinationKind.resolve(tempDir.resolve("a.bam")));
        assertEquals(DestinationKind.FILE, DestinationKind.resolve(new File("a.bam")));
        assertEquals(DestinationKind.FILE, DestinationKind.resolve("a.bam"));
    }

    @Test
    void testChannelsAndStreams() throws Exception {
        try (SeekableByteChannel channel = Files.newByteChannel(tempDir.resolve("out"),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            assertEquals(DestinationKind.SEEKABLE_STREAM, DestinationKind.resolve(channel));
        }
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        assertEquals(DestinationKind.NON_SEEKABLE_STREAM, DestinationKind.resolve(stream));
        assertEquals(DestinationKind.NON_SEEKABLE_STREAM, DestinationKind.resolve(Channels.newChannel(stream)));
    }

    @Test
    void testUnsupportedDestinationRejected() {
        assertThrows(TransferConfigurationException.class, () -> DestinationKind.resolve(42));
        assertThrows(TransferConfigurationException.class, () -> DestinationKind.resolve(null));
    }

    @Test
    void testCreatesMatchingOutputManager() throws Exception {
        TransferCoordinator coordinator = new TransferCoordinator(1);
        BoundedExecutor io = new BoundedExecutor("io", 4, 1, Map.of(), false);

        OutputManager fileManager = DestinationKind.FILE.createOutputManager(
                tempDir.resolve("reads.fastq").toString(), coordinator, io);
        OutputManager streamManager = DestinationKind.NON_SEEKABLE_STREAM.createOutputManager(
                new ByteArrayOutputStream(), coordinator, io);

        assertInstanceOf(FileOutputManager.class, fileManager);
        assertEquals(tempDir.resolve("reads.fastq"), ((FileOutputManager) fileManager).getFinalPath());
        assertInstanceOf(NonSeekableOutputManager.class, streamManager);
    }
}
