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

package dev.mars.omics.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

/**
 * File system helpers for download destinations and upload sources.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FileManager {
    private static final Logger logger = LoggerFactory.getLogger(FileManager.class);

    public static final String GZIP_EXTENSION = ".gz";

    private FileManager() {
    }

    /**
     * Converts a {@link Path}, {@link File} or path string to a path.
     */
    public static Path toPath(Object location) {
        if (location instanceof Path) {
            return (Path) location;
        }
        if (location instanceof File) {
            return ((File) location).toPath();
        }
        return Paths.get(location.toString());
    }

    public static void ensureDirectoryExists(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null && !Files.exists(parentDir)) {
            Files.createDirectories(parentDir);
            logger.info("Created directory: {}", parentDir);
        }
    }

    /**
     * Creates {@code directory} if needed.
     *
     * @throws IOException if the path exists but is not a directory
     */
    public static void validateDirectory(Path directory) throws IOException {
        if (Files.exists(directory) && !Files.isDirectory(directory)) {
            throw new IOException("Invalid directory, a file exists at: " + directory);
        }
        Files.createDirectories(directory);
    }

    /**
     * Name of the temporary file a download is written to before being moved
     * into place: the final name plus a random suffix, in the same directory.
     */
    public static Path tempSiblingFor(Path finalPath) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return finalPath.resolveSibling(finalPath.getFileName() + "." + suffix);
    }

    public static long getFileSize(Path filePath) throws IOException {
        return Files.size(filePath);
    }

    public static boolean deleteFile(Path filePath) {
        try {
            boolean deleted = Files.deleteIfExists(filePath);
            if (deleted) {
                logger.debug("Deleted file: {}", filePath);
            }
            return deleted;
        } catch (IOException e) {
            logger.warn("Failed to delete file: {} - {}", filePath, e.getMessage());
            return false;
        }
    }

    public static void moveFile(Path source, Path target) throws IOException {
        ensureDirectoryExists(target);
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Moved file from {} to {}", source, target);
    }

    /**
     * Checks whether the file starts with a valid gzip stream. Empty and
     * non-gzip files return false.
     */
    public static boolean isGzipped(Path filePath) throws IOException {
        try (InputStream raw = Files.newInputStream(filePath);
             InputStream in = new GZIPInputStream(raw)) {
            in.read();
            return true;
        } catch (ZipException | EOFException e) {
            return false;
        }
    }

    /**
     * Final location for a downloaded file, with {@value #GZIP_EXTENSION}
     * appended when the content is gzip and the name does not already end with it.
     */
    public static Path withGzipExtension(Path finalPath) {
        String name = finalPath.getFileName().toString();
        if (name.endsWith(GZIP_EXTENSION)) {
            return finalPath;
        }
        return finalPath.resolveSibling(name + GZIP_EXTENSION);
    }
}
