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

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running byte count of one transfer with a smoothed transfer rate.
 * Updates arrive from many part tasks at once and may be negative when a part
 * attempt is retried.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ProgressTracker {
    private static final long RATE_WINDOW_MS = 1000;

    private final long transferId;
    private final AtomicLong totalBytes = new AtomicLong(-1);
    private final AtomicLong transferredBytes = new AtomicLong();
    private final AtomicReference<Instant> startTime = new AtomicReference<>();
    private final AtomicReference<Instant> rateSampleTime = new AtomicReference<>();
    private final AtomicLong rateSampleBytes = new AtomicLong();
    private final AtomicReference<Double> smoothedRate = new AtomicReference<>(0.0);

    public ProgressTracker(long transferId) {
        this.transferId = transferId;
    }

    public long getTransferId() {
        return transferId;
    }

    /**
     * Marks the start of the transfer. Later calls keep the first start time.
     */
    public void start() {
        Instant now = Instant.now();
        if (startTime.compareAndSet(null, now)) {
            rateSampleTime.set(now);
        }
    }

    public void setTotalBytes(long total) {
        totalBytes.set(total);
    }

    /**
     * @return total bytes, or -1 while the size is unknown
     */
    public long getTotalBytes() {
        return totalBytes.get();
    }

    public long addBytesTransferred(long delta) {
        long current = transferredBytes.addAndGet(delta);
        sampleRate(current, Instant.now());
        return current;
    }

    public long getTransferredBytes() {
        return transferredBytes.get();
    }

    public double getProgressPercentage() {
        long total = totalBytes.get();
        if (total <= 0) {
            return total == 0 ? 1.0 : 0.0;
        }
        return Math.max(0.0, Math.min(1.0, (double) transferredBytes.get() / total));
    }

    public double getCurrentRateBytesPerSecond() {
        return smoothedRate.get();
    }

    public Duration getElapsed() {
        Instant start = startTime.get();
        return start == null ? Duration.ZERO : Duration.between(start, Instant.now());
    }

    public long getEstimatedRemainingSeconds() {
        long total = totalBytes.get();
        double rate = smoothedRate.get();
        if (total <= 0 || rate <= 0) {
            return -1;
        }
        return (long) (Math.max(0, total - transferredBytes.get()) / rate);
    }

    private void sampleRate(long currentBytes, Instant now) {
        Instant last = rateSampleTime.get();
        if (last == null) {
            return;
        }
        long elapsedMs = Duration.between(last, now).toMillis();
        if (elapsedMs < RATE_WINDOW_MS || !rateSampleTime.compareAndSet(last, now)) {
            return;
        }
        long bytes = currentBytes - rateSampleBytes.getAndSet(currentBytes);
        if (bytes > 0) {
            double instant = (double) bytes / elapsedMs * 1000.0;
            double previous = smoothedRate.get();
            // exponential moving average
            smoothedRate.set(previous == 0.0 ? instant : previous * 0.7 + instant * 0.3);
        }
    }

    @Override
    public String toString() {
        return String.format("ProgressTracker{transferId=%d, progress=%.1f%%, rate=%.2f MB/s}",
                transferId, getProgressPercentage() * 100, getCurrentRateBytesPerSecond() / (1024.0 * 1024.0));
    }
}
