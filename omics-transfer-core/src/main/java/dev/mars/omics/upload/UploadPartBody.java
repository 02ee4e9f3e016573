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

import java.io.IOException;
import java.io.InputStream;

/**
 * Payload of one upload part. The payload is opened by the part task when it
 * runs, so a file-backed part holds no open handle while queued.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class UploadPartBody {

    @FunctionalInterface
    public interface PayloadOpener {
        InputStream open() throws IOException;
    }

    private final ReadSetFileName partSource;
    private final int partNumber;
    private final long length;
    private final PayloadOpener opener;

    public UploadPartBody(ReadSetFileName partSource, int partNumber, long length, PayloadOpener opener) {
        this.partSource = partSource;
        this.partNumber = partNumber;
        this.length = length;
        this.opener = opener;
    }

    public ReadSetFileName getPartSource() {
        return partSource;
    }

    public int getPartNumber() {
        return partNumber;
    }

    public long getLength() {
        return length;
    }

    public InputStream open() throws IOException {
        return opener.open();
    }
}
