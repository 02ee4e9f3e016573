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

package dev.mars.omics.download.output;

import dev.mars.omics.core.DownloadResult;
import dev.mars.omics.core.exceptions.TransferException;
import dev.mars.omics.storage.FileManager;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.executor.BoundedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Downloads to a named file. Chunks are written at their offsets into a
 * temporary sibling file, which is moved into place once the download is
 * complete. A gzip payload gets a {@code .gz} suffix.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FileOutputManager extends OutputManager {
    private static final Logger logger = LoggerFactory.getLogger(FileOutputManager.class);

    private final Path finalPath;
    private Path tempPath;
    private FileChannel channel;

    public FileOutputManager(Path finalPath, TransferCoordinator coordinator, BoundedExecutor ioExecutor) {
        super(coordinator, ioExecutor);
        this.finalPath = finalPath;
    }

    @Override
    public void open() throws IOException {
        FileManager.ensureDirectoryExists(finalPath);
        tempPath = FileManager.tempSiblingFor(finalPath);
        channel = FileChannel.open(tempPath, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        Path temp = tempPath;
        coordinator.addFailureCleanup(this::closeChannel);
        coordinator.addFailureCleanup(() -> FileManager.deleteFile(temp));
        logger.debug("Transfer {} writing to temporary file {}", coordinator.getTransferId(), tempPath);
    }

    @Override
    public void queueWrite(byte[] data, long offset) throws InterruptedException {
        coordinator.submit(ioExecutor, new IoWriteTask(coordinator, channel, data, offset, this::recordWritten), null);
    }

    @Override
    protected DownloadResult complete(long expectedLength) throws IOException, TransferException {
        closeChannel();
        verifyBytesWritten(expectedLength);
        boolean compressed = FileManager.isGzipped(tempPath);
        Path target = compressed ? FileManager.withGzipExtension(finalPath) : finalPath;
        FileManager.moveFile(tempPath, target);
        logger.debug("Transfer {} moved {} to {}", coordinator.getTransferId(), tempPath, target);
        return new DownloadResult(coordinator.getTransferId(), target, getBytesWritten(), compressed);
    }

    private void closeChannel() throws IOException {
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
    }

    public Path getFinalPath() {
        return finalPath;
    }

    Path getTempPath() {
        return tempPath;
    }
}
