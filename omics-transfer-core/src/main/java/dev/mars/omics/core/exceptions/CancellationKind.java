package dev.mars.omics.core.exceptions;

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


/**
 * Why a transfer was cancelled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum CancellationKind {
    /** Caller asked for the transfer (or all transfers) to stop. */
    USER_REQUESTED,
    /** The controlling thread was interrupted while waiting. */
    INTERRUPTED,
    /** An unexpected error escaped a guarded block on the manager. */
    FATAL_ERROR,
    /** The manager was shut down with cancellation requested. */
    SHUTDOWN
}
