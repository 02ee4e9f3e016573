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
 * Failure recorded on a transfer when it is cancelled before it completes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TransferCancelledException extends TransferException {

    private final CancellationKind kind;
    private final String reason;

    public TransferCancelledException(long transferId, String reason, CancellationKind kind) {
        super(transferId, reason);
        this.kind = kind;
        this.reason = reason;
    }

    public CancellationKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return String.format("Transfer %d cancelled (%s)%s", getTransferId(), kind,
                reason == null || reason.isEmpty() ? "" : ": " + reason);
    }
}
