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

package dev.mars.omics.transfer.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for omics transfers:
 * - omics.transfer.active (gauge) - transfers submitted and not yet done
 * - omics.transfer.total (counter) - transfers submitted
 * - omics.transfer.completed / failed / cancelled (counters) - outcomes
 * - omics.transfer.bytes.total (counter) - bytes of completed transfers
 * - omics.transfer.duration.seconds (histogram) - duration of completed transfers
 * - omics.transfer.retries (counter) - part fetch retries by error kind
 *
 * Without an installed OpenTelemetry SDK every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(TransferTelemetryMetrics.class);
    private static final String METER_NAME = "omics-transfer-core";

    private static TransferTelemetryMetrics instance;

    // Counters
    private final LongCounter transfersTotal;
    private final LongCounter transfersCompleted;
    private final LongCounter transfersFailed;
    private final LongCounter transfersCancelled;
    private final LongCounter bytesTransferred;
    private final LongCounter retryAttempts;

    private final DoubleHistogram transferDuration;

    private final AtomicLong activeTransfers = new AtomicLong(0);

    private static final AttributeKey<String> DIRECTION_KEY = AttributeKey.stringKey("direction");
    private static final AttributeKey<String> FILE_TYPE_KEY = AttributeKey.stringKey("file.type");
    private static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");

    private TransferTelemetryMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        transfersTotal = meter.counterBuilder("omics.transfer.total")
                .setDescription("Total number of transfers submitted")
                .setUnit("1")
                .build();

        transfersCompleted = meter.counterBuilder("omics.transfer.completed")
                .setDescription("Number of successfully completed transfers")
                .setUnit("1")
                .build();

        transfersFailed = meter.counterBuilder("omics.transfer.failed")
                .setDescription("Number of failed transfers")
                .setUnit("1")
                .build();

        transfersCancelled = meter.counterBuilder("omics.transfer.cancelled")
                .setDescription("Number of cancelled transfers")
                .setUnit("1")
                .build();

        bytesTransferred = meter.counterBuilder("omics.transfer.bytes.total")
                .setDescription("Total bytes moved by completed transfers")
                .setUnit("By")
                .build();

        retryAttempts = meter.counterBuilder("omics.transfer.retries")
                .setDescription("Number of part retries after transient errors")
                .setUnit("1")
                .build();

        transferDuration = meter.histogramBuilder("omics.transfer.duration.seconds")
                .setDescription("Transfer duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("omics.transfer.active")
                .setDescription("Number of transfers not yet done")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeTransfers.get()));

        logger.debug("TransferTelemetryMetrics initialized");
    }

    public static synchronized TransferTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new TransferTelemetryMetrics();
        }
        return instance;
    }

    public void recordTransferStarted(String direction, String fileType) {
        transfersTotal.add(1, attributes(direction, fileType));
        activeTransfers.incrementAndGet();
    }

    public void recordTransferCompleted(String direction, String fileType, long bytes, double durationSeconds) {
        activeTransfers.decrementAndGet();
        Attributes attrs = attributes(direction, fileType);
        transfersCompleted.add(1, attrs);
        if (bytes > 0) {
            bytesTransferred.add(bytes, attrs);
        }
        transferDuration.record(durationSeconds, attrs);
    }

    public void recordTransferFailed(String direction, String fileType, String errorType) {
        activeTransfers.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(DIRECTION_KEY, direction)
                .put(FILE_TYPE_KEY, fileType)
                .put(ERROR_TYPE_KEY, errorType != null ? errorType : "unknown")
                .build();
        transfersFailed.add(1, attrs);
    }

    public void recordTransferCancelled(String direction, String fileType) {
        activeTransfers.decrementAndGet();
        transfersCancelled.add(1, attributes(direction, fileType));
    }

    /**
     * Record a part retry caused by a transient error of {@code errorKind}.
     */
    public void recordRetryAttempt(String fileType, String errorKind) {
        Attributes attrs = Attributes.builder()
                .put(FILE_TYPE_KEY, fileType)
                .put(ERROR_TYPE_KEY, errorKind)
                .build();
        retryAttempts.add(1, attrs);
    }

    public long getActiveTransfers() {
        return activeTransfers.get();
    }

    private static Attributes attributes(String direction, String fileType) {
        return Attributes.builder()
                .put(DIRECTION_KEY, direction)
                .put(FILE_TYPE_KEY, fileType)
                .build();
    }
}
