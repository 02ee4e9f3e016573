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

import dev.mars.omics.core.exceptions.CancellationKind;
import dev.mars.omics.core.exceptions.RemoteApiException;
import dev.mars.omics.core.exceptions.RemoteErrorCode;
import dev.mars.omics.core.exceptions.TransferCancelledException;
import dev.mars.omics.core.exceptions.TransferException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TransferCoordinator} state transitions and completion.
 */
class TransferCoordinatorTest {

    private TransferCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new TransferCoordinator(7);
    }

    @Test
    void testInitialState() {
        assertEquals(CoordinatorStatus.NOT_STARTED, coordinator.getStatus());
        assertFalse(coordinator.isDone());
        assertFalse(coordinator.isAnnounced());
        assertNull(coordinator.getException());
    }

    @Test
    void testResultAfterSuccess() throws Exception {
        coordinator.setStatusToQueued();
        coordinator.setStatusToRunning();
        assertTrue(coordinator.setResult("done"));
        coordinator.announceDone();

        assertEquals(CoordinatorStatus.SUCCEEDED, coordinator.getStatus());
        assertEquals("done", coordinator.result());
    }

    @Test
    @DisplayName("First failure wins")
    void testFirstFailureWins() {
        IOException first = new IOException("first");
        assertTrue(coordinator.setException(first));
        assertFalse(coordinator.setException(new IOException("second")));
        assertFalse(coordinator.setResult("late"));

        assertSame(first, coordinator.getException());
        assertEquals(CoordinatorStatus.FAILED, coordinator.getStatus());
    }

    @Test
    void testFailureAfterSuccessIsIgnored() throws Exception {
        coordinator.setResult("value");

        assertFalse(coordinator.setException(new IllegalStateException("late")));

        assertNull(coordinator.getException());
        assertEquals(CoordinatorStatus.SUCCEEDED, coordinator.getStatus());
        coordinator.announceDone();
        assertEquals("value", coordinator.result());
    }

    @Test
    void testFailureAfterCancelKeepsCancellation() {
        coordinator.setStatusToQueued();
        coordinator.cancel("stop", CancellationKind.USER_REQUESTED);

        assertFalse(coordinator.setException(new IOException("late")));

        assertEquals(CoordinatorStatus.CANCELLED, coordinator.getStatus());
        assertInstanceOf(TransferCancelledException.class, coordinator.getException());
    }

    @Test
    void testStatusDoesNotLeaveTerminalState() {
        coordinator.setException(new IOException("boom"));
        coordinator.setStatusToRunning();
        assertEquals(CoordinatorStatus.FAILED, coordinator.getStatus());
    }

    @Test
    void testOmicsExceptionRethrownAsIs() {
        RemoteApiException failure = new RemoteApiException(RemoteErrorCode.ACCESS_DENIED, "getPart", "denied");
        coordinator.setException(failure);
        coordinator.announceDone();

        RemoteApiException thrown = assertThrows(RemoteApiException.class, () -> coordinator.result());
        assertSame(failure, thrown);
    }

    @Test
    void testCheckedExceptionWrapped() {
        IOException failure = new IOException("disk full");
        coordinator.setException(failure);
        coordinator.announceDone();

        TransferException thrown = assertThrows(TransferException.class, () -> coordinator.result());
        assertSame(failure, thrown.getCause());
        assertEquals(7, thrown.getTransferId());
    }

    @Test
    void testRuntimeExceptionRethrown() {
        coordinator.setException(new IllegalArgumentException("bad"));
        coordinator.announceDone();

        assertThrows(IllegalArgumentException.class, () -> coordinator.result());
    }

    @Test
    @DisplayName("Cancelling a transfer that never started announces it")
    void testCancelBeforeStartAnnounces() throws Exception {
        coordinator.cancel("stop", CancellationKind.USER_REQUESTED);

        assertTrue(coordinator.isAnnounced());
        assertTrue(coordinator.awaitDone(1, TimeUnit.SECONDS));
        TransferCancelledException thrown = assertThrows(TransferCancelledException.class,
                () -> coordinator.result());
        assertEquals(CancellationKind.USER_REQUESTED, thrown.getKind());
        assertEquals("stop", thrown.getReason());
    }

    @Test
    void testCancelWhileRunningWaitsForAnnounce() {
        coordinator.setStatusToRunning();
        coordinator.cancel("stop", CancellationKind.SHUTDOWN);

        assertEquals(CoordinatorStatus.CANCELLED, coordinator.getStatus());
        assertTrue(coordinator.isDone());
        assertFalse(coordinator.isAnnounced());
    }

    @Test
    void testCancelAfterSuccessIgnored() throws Exception {
        coordinator.setResult(42);
        coordinator.cancel();
        coordinator.announceDone();

        assertEquals(42, coordinator.result());
    }

    @Test
    void testCleanupsRunBeforeCallbacksOnFailure() {
        List<String> events = new ArrayList<>();
        coordinator.addDoneCallback(() -> events.add("callback"));
        coordinator.addFailureCleanup(() -> events.add("cleanup"));

        coordinator.setException(new IOException("boom"));
        coordinator.announceDone();

        assertEquals(List.of("cleanup", "callback"), events);
    }

    @Test
    void testCleanupsSkippedOnSuccess() {
        List<String> events = new ArrayList<>();
        coordinator.addFailureCleanup(() -> events.add("cleanup"));
        coordinator.addDoneCallback(() -> events.add("callback"));

        coordinator.setResult("ok");
        coordinator.announceDone();

        assertEquals(List.of("callback"), events);
    }

    @Test
    void testAnnounceIsIdempotent() {
        List<String> events = new ArrayList<>();
        coordinator.addDoneCallback(() -> events.add("callback"));
        coordinator.setException(new IOException("boom"));

        coordinator.announceDone();
        coordinator.announceDone();

        assertEquals(1, events.size());
    }

    @Test
    void testFailingCleanupDoesNotStopOthers() {
        List<String> events = new ArrayList<>();
        coordinator.addFailureCleanup(() -> {
            throw new IOException("cleanup failed");
        });
        coordinator.addFailureCleanup(() -> events.add("second"));
        coordinator.addDoneCallback(() -> {
            throw new IllegalStateException("callback failed");
        });
        coordinator.addDoneCallback(() -> events.add("callback"));

        coordinator.setException(new IOException("boom"));
        coordinator.announceDone();

        assertEquals(List.of("second", "callback"), events);
        assertTrue(coordinator.isAnnounced());
    }

    @Test
    void testLateRegistrationRunsImmediately() {
        List<String> events = new ArrayList<>();
        coordinator.setException(new IOException("boom"));
        coordinator.announceDone();

        coordinator.addDoneCallback(() -> events.add("callback"));
        coordinator.addFailureCleanup(() -> events.add("cleanup"));

        assertEquals(List.of("callback", "cleanup"), events);
    }

    @Test
    void testAwaitDoneTimesOut() throws Exception {
        assertFalse(coordinator.awaitDone(50, TimeUnit.MILLISECONDS));
    }
}
