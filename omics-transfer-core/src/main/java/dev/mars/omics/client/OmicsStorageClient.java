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

package dev.mars.omics.client;

import dev.mars.omics.core.FileMetadata;
import dev.mars.omics.core.OmicsFileType;
import dev.mars.omics.core.ReadSetFileName;
import dev.mars.omics.core.ReadSetUploadRequest;
import dev.mars.omics.core.UploadPartResult;
import dev.mars.omics.core.exceptions.RemoteApiException;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Remote omics storage operations consumed by the transfer engine.
 *
 * <p>Implementations wrap a concrete service SDK or HTTP API. Service-side
 * failures are reported as {@link RemoteApiException}. Network failures are
 * reported as {@link IOException}; the engine retries timeouts, connection resets
 * and truncated reads when fetching parts.</p>
 *
 * <p>Implementations must be safe for concurrent use from the request pool.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface OmicsStorageClient {

    /**
     * Looks up the size and part layout of every file of a read set or reference.
     *
     * @return file name (for example {@code source1}, {@code index}) to metadata
     */
    Map<String, FileMetadata> getFileMetadata(OmicsFileType fileType, String storeId, String resourceId)
            throws RemoteApiException, IOException;

    /**
     * Opens the body of a single part. The caller closes the stream.
     */
    InputStream getPart(OmicsFileType fileType, String storeId, String resourceId,
                        String fileName, int partNumber) throws RemoteApiException, IOException;

    /**
     * Starts a multipart read set upload and returns the upload id.
     */
    String createMultipartReadSetUpload(ReadSetUploadRequest request) throws RemoteApiException, IOException;

    /**
     * Uploads one part and returns its checksum.
     */
    String uploadReadSetPart(String storeId, String uploadId, ReadSetFileName partSource, int partNumber,
                             InputStream payload, long contentLength) throws RemoteApiException, IOException;

    /**
     * Completes the upload with the ordered list of uploaded parts and returns the new read set id.
     */
    String completeMultipartReadSetUpload(String storeId, String uploadId, List<UploadPartResult> parts)
            throws RemoteApiException, IOException;

    void abortMultipartReadSetUpload(String storeId, String uploadId) throws RemoteApiException, IOException;
}
