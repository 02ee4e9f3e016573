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
import dev.mars.omics.core.exceptions.TransferCancelledException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TransferCoordinatorControllerTest {

    private final TransferCoordinatorController controller = new TransferCoordinatorController();

    @Test
    void testTracksInSubmissionOrder() {
        TransferCoordinator first = new TransferCoordinator(1);
        TransferCoordinator second = new TransferCoordinator(2);
        controller.add(first);
        controller.add(second);

        assertEquals(List.of(first, second), controller.getTrackedCoordinators());
        assertEquals(2, controller.size());
        assertSame(second, controller.get(2).orElseThrow());

        controller.remove(first);

        assertEquals(List.of(second), controller.getTrackedCoordinators());
        assertTrue(controller.get(1).isEmpty());
    }

    @Test
    void testCancelAppliesToEveryTransfer() {
        TransferCoordinator idle = new TransferCoordinator(1);
        TransferCoordinator running = new TransferCoordinator(2);
        running.setStatusToRunning();
        controller.add(idle);
        controller.add(running);

        controller.cancel("shutting down", CancellationKind.SHUTDOWN);

        assertEquals(CoordinatorStatus.CANCELLED, idle.getStatus());
        assertEquals(CoordinatorStatus.CANCELLED, running.getStatus());
        assertThat(running.getException())
                .isInstanceOf(TransferCancelledException.class)
                .hasMessageContaining("shutting down");
    }

    @Test
    void testWaitForAllBlocksUntilAnnounced() throws Exception {
        TransferCoordinator coordinator = new TransferCoordinator(1);
        coordinator.setStatusToRunning();
        controller.add(coordinator);
        coordinator.addDoneCallback(() -> controller.remove(coordinator));

        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try {
                controller.waitForAll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        Thread.sleep(50);
        assertFalse(waiter.isDone());

        coordinator.setResult("ok");
        coordinator.announceDone();

        waiter.get(5, TimeUnit.SECONDS);
        assertEquals(0, controller.size());
    }
}
