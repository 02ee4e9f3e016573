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

package dev.mars.omics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration for the omics transfer manager.
 *
 * <p>Values are resolved from built-in defaults, then the first readable
 * {@code omics-transfer.properties} found on disk or the classpath, then
 * {@code omics.transfer.*} system properties. Every numeric setting must be
 * positive.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferConfig {
    private static final Logger logger = LoggerFactory.getLogger(TransferConfig.class);

    public static final String PREFIX = "omics.transfer.";
    public static final String USE_THREADS = PREFIX + "use.threads";
    public static final String DIRECTORY = PREFIX + "directory";
    public static final String MAX_REQUEST_CONCURRENCY = PREFIX + "max.request.concurrency";
    public static final String MAX_SUBMISSION_CONCURRENCY = PREFIX + "max.submission.concurrency";
    public static final String MAX_REQUEST_QUEUE_SIZE = PREFIX + "max.request.queue.size";
    public static final String MAX_SUBMISSION_QUEUE_SIZE = PREFIX + "max.submission.queue.size";
    public static final String MAX_IO_QUEUE_SIZE = PREFIX + "max.io.queue.size";
    public static final String IO_CHUNK_SIZE = PREFIX + "io.chunk.size";
    public static final String DOWNLOAD_MAX_ATTEMPTS = PREFIX + "download.max.attempts";
    public static final String UPLOAD_PART_SIZE = PREFIX + "upload.part.size";
    public static final String UPLOAD_MAX_PARTS = PREFIX + "upload.max.parts";
    public static final String UPLOAD_MAX_IN_MEMORY_CHUNKS = PREFIX + "upload.max.in.memory.chunks";

    private static final int DEFAULT_MAX_REQUEST_CONCURRENCY = 10;
    private static final int DEFAULT_MAX_SUBMISSION_CONCURRENCY = 5;
    private static final int DEFAULT_MAX_QUEUE_SIZE = 1000;
    private static final int DEFAULT_IO_CHUNK_SIZE = 256 * 1024;
    private static final int DEFAULT_DOWNLOAD_MAX_ATTEMPTS = 5;
    private static final long DEFAULT_UPLOAD_PART_SIZE = 100L * 1024 * 1024; // 100 MiB
    private static final int DEFAULT_UPLOAD_MAX_PARTS = 10_000;
    private static final int DEFAULT_UPLOAD_MAX_IN_MEMORY_CHUNKS = 10;

    private static final String CONFIG_FILE = "omics-transfer.properties";

    private final Properties properties;

    public TransferConfig() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
        validate();
    }

    public TransferConfig(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
        validate();
    }

    // Pools
    public boolean isUseThreads() {
        return getBooleanProperty(USE_THREADS, true);
    }

    public int getMaxRequestConcurrency() {
        return getIntProperty(MAX_REQUEST_CONCURRENCY, DEFAULT_MAX_REQUEST_CONCURRENCY);
    }

    public int getMaxSubmissionConcurrency() {
        return getIntProperty(MAX_SUBMISSION_CONCURRENCY, DEFAULT_MAX_SUBMISSION_CONCURRENCY);
    }

    public int getMaxRequestQueueSize() {
        return getIntProperty(MAX_REQUEST_QUEUE_SIZE, DEFAULT_MAX_QUEUE_SIZE);
    }

    public int getMaxSubmissionQueueSize() {
        return getIntProperty(MAX_SUBMISSION_QUEUE_SIZE, DEFAULT_MAX_QUEUE_SIZE);
    }

    public int getMaxIoQueueSize() {
        return getIntProperty(MAX_IO_QUEUE_SIZE, DEFAULT_MAX_QUEUE_SIZE);
    }

    // Downloads
    public Path getDirectory() {
        return Paths.get(properties.getProperty(DIRECTORY, "."));
    }

    public int getIoChunkSize() {
        return getIntProperty(IO_CHUNK_SIZE, DEFAULT_IO_CHUNK_SIZE);
    }

    public int getDownloadMaxAttempts() {
        return getIntProperty(DOWNLOAD_MAX_ATTEMPTS, DEFAULT_DOWNLOAD_MAX_ATTEMPTS);
    }

    // Uploads
    public long getUploadPartSize() {
        return getLongProperty(UPLOAD_PART_SIZE, DEFAULT_UPLOAD_PART_SIZE);
    }

    public int getUploadMaxParts() {
        return getIntProperty(UPLOAD_MAX_PARTS, DEFAULT_UPLOAD_MAX_PARTS);
    }

    public int getUploadMaxInMemoryChunks() {
        return getIntProperty(UPLOAD_MAX_IN_MEMORY_CHUNKS, DEFAULT_UPLOAD_MAX_IN_MEMORY_CHUNKS);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void validate() {
        requirePositive(MAX_REQUEST_CONCURRENCY, getMaxRequestConcurrency());
        requirePositive(MAX_SUBMISSION_CONCURRENCY, getMaxSubmissionConcurrency());
        requirePositive(MAX_REQUEST_QUEUE_SIZE, getMaxRequestQueueSize());
        requirePositive(MAX_SUBMISSION_QUEUE_SIZE, getMaxSubmissionQueueSize());
        requirePositive(MAX_IO_QUEUE_SIZE, getMaxIoQueueSize());
        requirePositive(IO_CHUNK_SIZE, getIoChunkSize());
        requirePositive(DOWNLOAD_MAX_ATTEMPTS, getDownloadMaxAttempts());
        requirePositive(UPLOAD_PART_SIZE, getUploadPartSize());
        requirePositive(UPLOAD_MAX_PARTS, getUploadMaxParts());
        requirePositive(UPLOAD_MAX_IN_MEMORY_CHUNKS, getUploadMaxInMemoryChunks());
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be greater than 0 but was " + value);
        }
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(USE_THREADS, "true");
        properties.setProperty(DIRECTORY, ".");
        properties.setProperty(MAX_REQUEST_CONCURRENCY, String.valueOf(DEFAULT_MAX_REQUEST_CONCURRENCY));
        properties.setProperty(MAX_SUBMISSION_CONCURRENCY, String.valueOf(DEFAULT_MAX_SUBMISSION_CONCURRENCY));
        properties.setProperty(MAX_REQUEST_QUEUE_SIZE, String.valueOf(DEFAULT_MAX_QUEUE_SIZE));
        properties.setProperty(MAX_SUBMISSION_QUEUE_SIZE, String.valueOf(DEFAULT_MAX_QUEUE_SIZE));
        properties.setProperty(MAX_IO_QUEUE_SIZE, String.valueOf(DEFAULT_MAX_QUEUE_SIZE));
        properties.setProperty(IO_CHUNK_SIZE, String.valueOf(DEFAULT_IO_CHUNK_SIZE));
        properties.setProperty(DOWNLOAD_MAX_ATTEMPTS, String.valueOf(DEFAULT_DOWNLOAD_MAX_ATTEMPTS));
        properties.setProperty(UPLOAD_PART_SIZE, String.valueOf(DEFAULT_UPLOAD_PART_SIZE));
        properties.setProperty(UPLOAD_MAX_PARTS, String.valueOf(DEFAULT_UPLOAD_MAX_PARTS));
        properties.setProperty(UPLOAD_MAX_IN_MEMORY_CHUNKS, String.valueOf(DEFAULT_UPLOAD_MAX_IN_MEMORY_CHUNKS));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE,
                "config/" + CONFIG_FILE,
                System.getProperty("user.home") + "/.omics/" + CONFIG_FILE
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith(PREFIX))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.debug("Override from system property: {}={}", key, System.getProperty(key));
                });
    }

    @Override
    public String toString() {
        return "TransferConfig{" +
                "useThreads=" + isUseThreads() +
                ", maxRequestConcurrency=" + getMaxRequestConcurrency() +
                ", maxSubmissionConcurrency=" + getMaxSubmissionConcurrency() +
                ", ioChunkSize=" + getIoChunkSize() +
                ", downloadMaxAttempts=" + getDownloadMaxAttempts() +
                ", uploadPartSize=" + getUploadPartSize() +
                '}';
    }
}
