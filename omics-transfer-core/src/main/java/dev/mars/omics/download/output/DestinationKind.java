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

package dev.mars.omics.download.output;

import dev.mars.omics.core.exceptions.TransferConfigurationException;
import dev.mars.omics.storage.FileManager;
import dev.mars.omics.transfer.TransferCoordinator;
import dev.mars.omics.transfer.executor.BoundedExecutor;

import java.io.File;
import java.io.OutputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Path;

/**
 * Kinds of download destination, probed in declaration order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum DestinationKind {
    FILE {
        @Override
        public boolean isCompatible(Object destination) {
            return destination instanceof Path || destination instanceof File || destination instanceof String;
        }

        @Override
        public OutputManager createOutputManager(Object destination, TransferCoordinator coordinator,
                                                 BoundedExecutor ioExecutor) {
            return new FileOutputManager(FileManager.toPath(destination), coordinator, ioExecutor);
        }
    },
    SEEKABLE_STREAM {
        @Override
        public boolean isCompatible(Object destination) {
            return destination instanceof SeekableByteChannel;
        }

        @Override
        public OutputManager createOutputManager(Object destination, TransferCoordinator coordinator,
                                                 BoundedExecutor ioExecutor) {
            return new SeekableOutputManager((SeekableByteChannel) destination, coordinator, ioExecutor);
        }
    },
    NON_SEEKABLE_STREAM {
        @Override
        public boolean isCompatible(Object destination) {
            return destination instanceof WritableByteChannel || destination instanceof OutputStream;
        }

        @Override
        public OutputManager createOutputManager(Object destination, TransferCoordinator coordinator,
                                                 BoundedExecutor ioExecutor) {
            return new NonSeekableOutputManager(destination, coordinator, ioExecutor);
        }
    };

    public abstract boolean isCompatible(Object destination);

    public abstract OutputManager createOutputManager(Object destination, TransferCoordinator coordinator,
                                                      BoundedExecutor ioExecutor);

    /**
     * Picks the first kind compatible with {@code destination}.
     *
     * @throws TransferConfigurationException if no kind accepts it
     */
    public static DestinationKind resolve(Object destination) throws TransferConfigurationException {
        for (DestinationKind kind : values()) {
            if (kind.isCompatible(destination)) {
                return kind;
            }
        }
        throw new TransferConfigurationException("Unsupported download destination: "
                + (destination == null ? "null" : destination.getClass().getName()));
    }
}
