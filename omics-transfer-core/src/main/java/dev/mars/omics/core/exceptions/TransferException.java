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
 * Exception raised when a single transfer fails.
 * Carries the numeric id of the transfer so callers holding many futures can tell
 * which one broke.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferException extends OmicsException {

    private final long transferId;

    public TransferException(long transferId, String message) {
        super(message);
        this.transferId = transferId;
    }

    public TransferException(long transferId, String message, Throwable cause) {
        super(message, cause);
        this.transferId = transferId;
    }

    public long getTransferId() {
        return transferId;
    }

    @Override
    public String getMessage() {
        return String.format("Transfer %d failed: %s", transferId, super.getMessage());
    }
}
