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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable request to download one file of a read set or reference.
 *
 * <h3>Destination:</h3>
 * <p>The destination is deliberately loosely typed. It may be a {@link Path},
 * a {@link java.io.File} or a path string (written to a temporary sibling and
 * renamed into place), a {@link java.nio.channels.SeekableByteChannel} (written
 * at each chunk's offset), or a plain {@link java.io.OutputStream} or
 * {@link java.nio.channels.WritableByteChannel} (written strictly in order).
 * When no destination is given the manager derives a file name under its
 * configured directory.</p>
 *
 * <h3>Metadata:</h3>
 * <p>Callers that already know the file layout can supply it and skip the
 * remote metadata lookup.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * TransferRequest request = TransferRequest.builder()
 *     .storeId("1234567890")
 *     .resourceId("9876543210")
 *     .fileType(OmicsFileType.READ_SET)
 *     .fileName(ReadSetFileName.SOURCE1)
 *     .destination(Paths.get("/data/sample.fastq"))
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class TransferRequest implements TransferDescriptor {

    private final String storeId;
    private final String resourceId;
    private final OmicsFileType fileType;
    private final String fileName;
    private final Object destination;
    private final FileMetadata fileMetadata;
    private final List<TransferSubscriber> subscribers;

    private TransferRequest(Builder builder) {
        this.storeId = Objects.requireNonNull(builder.storeId, "Store id cannot be null");
        this.resourceId = Objects.requireNonNull(builder.resourceId, "Resource id cannot be null");
        this.fileType = Objects.requireNonNull(builder.fileType, "File type cannot be null");
        this.fileName = builder.fileName;
        this.destination = builder.destination;
        this.fileMetadata = builder.fileMetadata;
        this.subscribers = List.copyOf(builder.subscribers);
    }

    @Override
    public String getStoreId() { return storeId; }

    /**
     * Read set id or reference id, depending on the file type.
     */
    public String getResourceId() { return resourceId; }

    @Override
    public OmicsFileType getFileType() { return fileType; }

    public String getFileName() { return fileName; }

    public Optional<Object> getDestination() { return Optional.ofNullable(destination); }

    public Optional<FileMetadata> getFileMetadata() { return Optional.ofNullable(fileMetadata); }

    @Override
    public TransferDirection getDirection() { return TransferDirection.DOWNLOAD; }

    @Override
    public List<TransferSubscriber> getSubscribers() { return subscribers; }

    /**
     * Copy of this request with the destination replaced.
     */
    public TransferRequest withDestination(Object newDestination) {
        return toBuilder().destination(newDestination).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .storeId(storeId)
                .resourceId(resourceId)
                .fileType(fileType)
                .fileName(fileName)
                .destination(destination)
                .fileMetadata(fileMetadata);
        builder.subscribers.addAll(subscribers);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String storeId;
        private String resourceId;
        private OmicsFileType fileType;
        private String fileName;
        private Object destination;
        private FileMetadata fileMetadata;
        private final List<TransferSubscriber> subscribers = new ArrayList<>();

        public Builder storeId(String storeId) {
            this.storeId = storeId;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder fileType(OmicsFileType fileType) {
            this.fileType = fileType;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder fileName(ReadSetFileName fileName) {
            this.fileType = OmicsFileType.READ_SET;
            this.fileName = fileName.name();
            return this;
        }

        public Builder fileName(ReferenceFileName fileName) {
            this.fileType = OmicsFileType.REFERENCE;
            this.fileName = fileName.name();
            return this;
        }

        public Builder destination(Object destination) {
            this.destination = destination;
            return this;
        }

        public Builder fileMetadata(FileMetadata fileMetadata) {
            this.fileMetadata = fileMetadata;
            return this;
        }

        public Builder subscriber(TransferSubscriber subscriber) {
            this.subscribers.add(Objects.requireNonNull(subscriber, "Subscriber cannot be null"));
            return this;
        }

        public Builder subscribers(List<TransferSubscriber> subscribers) {
            subscribers.forEach(this::subscriber);
            return this;
        }

        public TransferRequest build() {
            return new TransferRequest(this);
        }
    }

    @Override
    public String toString() {
        return "TransferRequest{" +
                "storeId='" + storeId + '\'' +
                ", resourceId='" + resourceId + '\'' +
                ", fileType=" + fileType +
                ", fileName='" + fileName + '\'' +
                '}';
    }
}
