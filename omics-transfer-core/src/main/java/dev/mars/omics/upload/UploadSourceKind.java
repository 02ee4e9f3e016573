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

package dev.mars.omics.upload;

import dev.mars.omics.core.ReadSetFileName;
import dev.mars.omics.core.exceptions.TransferConfigurationException;
import dev.mars.omics.storage.FileManager;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Kinds of upload source, probed in declaration order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum UploadSourceKind {
    FILE {
        @Override
        public boolean isCompatible(Object source) {
            return source instanceof Path || source instanceof File || source instanceof String;
        }

        @Override
        public UploadInputManager createInputManager(Object source, ReadSetFileName partSource) {
            return new FileUploadInputManager(FileManager.toPath(source), partSource);
        }
    },
    STREAM {
        @Override
        public boolean isCompatible(Object source) {
            return source instanceof InputStream;
        }

        @Override
        public UploadInputManager createInputManager(Object source, ReadSetFileName partSource) {
            return new StreamUploadInputManager((InputStream) source, partSource);
        }
    };

    public abstract boolean isCompatible(Object source);

    public abstract UploadInputManager createInputManager(Object source, ReadSetFileName partSource);

    public static UploadSourceKind resolve(Object source) throws TransferConfigurationException {
        for (UploadSourceKind kind : values()) {
            if (kind.isCompatible(source)) {
                return kind;
            }
        }
        throw new TransferConfigurationException("Unsupported upload source: "
                + (source == null ? "null" : source.getClass().getName()));
    }
}
