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
 * Raised when a part download keeps failing with transient errors until its
 * attempt budget is spent. The last transient error is kept as the cause.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class RetriesExceededException extends TransferException {

    private final int attempts;

    public RetriesExceededException(long transferId, int attempts, Throwable lastException) {
        super(transferId, String.format("Exceeded %d attempts, last error: %s", attempts,
                lastException != null ? lastException.getMessage() : "none"), lastException);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public Throwable getLastException() {
        return getCause();
    }
}
