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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Kind of omics resource a file belongs to. Each kind exposes a fixed set of file
 * names that may be transferred.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum OmicsFileType {
    READ_SET(Arrays.stream(ReadSetFileName.values()).map(Enum::name).toList()),
    REFERENCE(Arrays.stream(ReferenceFileName.values()).map(Enum::name).toList());

    private final List<String> allowedFileNames;

    OmicsFileType(List<String> allowedFileNames) {
        this.allowedFileNames = allowedFileNames;
    }

    public List<String> getAllowedFileNames() {
        return allowedFileNames;
    }

    /**
     * Case-insensitive check of a file name against the names this kind allows.
     */
    public boolean isValidFileName(String fileName) {
        return fileName != null && allowedFileNames.contains(fileName.toUpperCase(Locale.ROOT));
    }
}
