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

package dev.mars.omics.core;

/**
 * Observer of a single transfer. All methods are optional. Exceptions thrown by a
 * subscriber are logged and never change the outcome of the transfer.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface TransferSubscriber {

    /**
     * Called once the transfer has been accepted by the submission pool and is queued.
     */
    default void onQueued(long transferId) {
    }

    /**
     * Called for every chunk read or sent. Negative values retract progress reported
     * by a part attempt that was later retried.
     */
    default void onProgress(long transferId, long bytesTransferred) {
    }

    /**
     * Called once the transfer is finished, whatever its outcome.
     */
    default void onDone(long transferId) {
    }
}
