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

import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Optional;

/**
 * Network errors that are worth retrying when fetching a part.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum TransientErrorKind {
    TIMEOUT(List.of(SocketTimeoutException.class, HttpTimeoutException.class)),
    CONNECTION_RESET(List.of(SocketException.class)),
    TRUNCATED_READ(List.of(EOFException.class));

    private final List<Class<? extends Exception>> types;

    TransientErrorKind(List<Class<? extends Exception>> types) {
        this.types = types;
    }

    /**
     * @return the matching kind, or empty when the error must not be retried
     */
    public static Optional<TransientErrorKind> classify(Throwable error) {
        if (error == null) {
            return Optional.empty();
        }
        for (TransientErrorKind kind : values()) {
            for (Class<? extends Exception> type : kind.types) {
                if (type.isInstance(error)) {
                    return Optional.of(kind);
                }
            }
        }
        return Optional.empty();
    }
}
