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

import java.util.Locale;

/**
 * Files that make up a read set. {@code SOURCE2} is only present for paired reads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum ReadSetFileName {
    SOURCE1,
    SOURCE2,
    INDEX;

    public static ReadSetFileName fromValue(String value) {
        for (ReadSetFileName name : values()) {
            if (name.name().equalsIgnoreCase(value)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Read set file name must be one of SOURCE1, SOURCE2, INDEX but was: " + value);
    }

    public String lowerCaseName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
