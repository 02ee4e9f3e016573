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

import dev.mars.omics.core.TransferSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Dispatches lifecycle and progress events to the subscribers of a transfer.
 * A failing subscriber is logged and skipped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class TransferSubscribers {
    private static final Logger logger = LoggerFactory.getLogger(TransferSubscribers.class);

    private TransferSubscribers() {
    }

    public static void notifyQueued(TransferMeta meta) {
        dispatch(meta, s -> s.onQueued(meta.getTransferId()));
    }

    public static void notifyDone(TransferMeta meta) {
        dispatch(meta, s -> s.onDone(meta.getTransferId()));
    }

    /**
     * Progress sink for part tasks: updates the tracker and fans out to subscribers.
     * Zero deltas are dropped.
     */
    public static LongConsumer progressCallback(TransferMeta meta) {
        return bytes -> {
            if (bytes == 0) {
                return;
            }
            meta.getProgress().addBytesTransferred(bytes);
            dispatch(meta, s -> s.onProgress(meta.getTransferId(), bytes));
        };
    }

    private static void dispatch(TransferMeta meta, Consumer<TransferSubscriber> event) {
        for (TransferSubscriber subscriber : meta.getRequest().getSubscribers()) {
            try {
                event.accept(subscriber);
            } catch (RuntimeException e) {
                logger.warn("Subscriber {} of transfer {} raised: {}", subscriber, meta.getTransferId(), e.getMessage(), e);
            }
        }
    }
}
