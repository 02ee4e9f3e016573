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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    @Test
    void testUnknownSizeReportsNoProgress() {
        ProgressTracker tracker = new ProgressTracker(1);
        tracker.addBytesTransferred(100);

        assertEquals(-1, tracker.getTotalBytes());
        assertEquals(0.0, tracker.getProgressPercentage());
        assertEquals(-1, tracker.getEstimatedRemainingSeconds());
    }

    @Test
    void testEmptyTransferIsComplete() {
        ProgressTracker tracker = new ProgressTracker(1);
        tracker.setTotalBytes(0);
        assertEquals(1.0, tracker.getProgressPercentage());
    }

    @Test
    void testRetryCorrectionsAreApplied() {
        ProgressTracker tracker = new ProgressTracker(1);
        tracker.setTotalBytes(1000);

        tracker.addBytesTransferred(400);
        tracker.addBytesTransferred(-150);
        tracker.addBytesTransferred(250);

        assertEquals(500, tracker.getTransferredBytes());
        assertEquals(0.5, tracker.getProgressPercentage(), 0.0001);
    }

    @Test
    void testStartKeepsFirstTimestamp() throws Exception {
        ProgressTracker tracker = new ProgressTracker(1);
        assertEquals(Duration.ZERO, tracker.getElapsed());

        tracker.start();
        Thread.sleep(20);
        tracker.start();

        assertTrue(tracker.getElapsed().toMillis() >= 20);
    }

    @Test
    void testRateSampledAfterWindow() throws Exception {
        ProgressTracker tracker = new ProgressTracker(1);
        tracker.setTotalBytes(10_000_000);
        tracker.start();

        Thread.sleep(1100);
        tracker.addBytesTransferred(1_000_000);

        assertTrue(tracker.getCurrentRateBytesPerSecond() > 0);
        assertTrue(tracker.getEstimatedRemainingSeconds() >= 0);
    }
}
