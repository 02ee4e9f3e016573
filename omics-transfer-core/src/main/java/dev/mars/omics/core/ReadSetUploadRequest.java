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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable request to upload a read set as a multipart upload.
 *
 * <p>The primary source becomes part source {@code SOURCE1}; an optional paired
 * source becomes {@code SOURCE2}. Each source is a {@link java.nio.file.Path},
 * {@link java.io.File} or path string (sent as byte ranges of the file), or an
 * {@link java.io.InputStream} (read into memory one part at a time).</p>
 *
 * <p>Aligned formats ({@link SequenceFileType#BAM}, {@link SequenceFileType#CRAM})
 * require a reference ARN.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ReadSetUploadRequest implements TransferDescriptor {

    private final String storeId;
    private final SequenceFileType sourceFileType;
    private final String subjectId;
    private final String sampleId;
    private final String name;
    private final String referenceArn;
    private final String generatedFrom;
    private final String description;
    private final Map<String, String> tags;
    private final Object source;
    private final Object pairedSource;
    private final List<TransferSubscriber> subscribers;

    private ReadSetUploadRequest(Builder builder) {
        this.storeId = Objects.requireNonNull(builder.storeId, "Store id cannot be null");
        this.sourceFileType = Objects.requireNonNull(builder.sourceFileType, "Source file type cannot be null");
        this.subjectId = Objects.requireNonNull(builder.subjectId, "Subject id cannot be null");
        this.sampleId = Objects.requireNonNull(builder.sampleId, "Sample id cannot be null");
        this.name = Objects.requireNonNull(builder.name, "Name cannot be null");
        this.source = Objects.requireNonNull(builder.source, "Source cannot be null");
        this.referenceArn = builder.referenceArn;
        this.generatedFrom = builder.generatedFrom;
        this.description = builder.description;
        this.tags = Map.copyOf(builder.tags);
        this.pairedSource = builder.pairedSource;
        this.subscribers = List.copyOf(builder.subscribers);
    }

    @Override
    public String getStoreId() { return storeId; }

    public SequenceFileType getSourceFileType() { return sourceFileType; }

    public String getSubjectId() { return subjectId; }

    public String getSampleId() { return sampleId; }

    public String getName() { return name; }

    public Optional<String> getReferenceArn() { return Optional.ofNullable(referenceArn); }

    public Optional<String> getGeneratedFrom() { return Optional.ofNullable(generatedFrom); }

    public Optional<String> getDescription() { return Optional.ofNullable(description); }

    public Map<String, String> getTags() { return tags; }

    public Object getSource() { return source; }

    public Optional<Object> getPairedSource() { return Optional.ofNullable(pairedSource); }

    @Override
    public OmicsFileType getFileType() { return OmicsFileType.READ_SET; }

    @Override
    public TransferDirection getDirection() { return TransferDirection.UPLOAD; }

    @Override
    public List<TransferSubscriber> getSubscribers() { return subscribers; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String storeId;
        private SequenceFileType sourceFileType;
        private String subjectId;
        private String sampleId;
        private String name;
        private String referenceArn;
        private String generatedFrom;
        private String description;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private Object source;
        private Object pairedSource;
        private final List<TransferSubscriber> subscribers = new ArrayList<>();

        public Builder storeId(String storeId) {
            this.storeId = storeId;
            return this;
        }

        public Builder sourceFileType(SequenceFileType sourceFileType) {
            this.sourceFileType = sourceFileType;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder sampleId(String sampleId) {
            this.sampleId = sampleId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder referenceArn(String referenceArn) {
            this.referenceArn = referenceArn;
            return this;
        }

        public Builder generatedFrom(String generatedFrom) {
            this.generatedFrom = generatedFrom;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags.putAll(tags);
            return this;
        }

        public Builder source(Object source) {
            this.source = source;
            return this;
        }

        public Builder pairedSource(Object pairedSource) {
            this.pairedSource = pairedSource;
            return this;
        }

        public Builder subscriber(TransferSubscriber subscriber) {
            this.subscribers.add(Objects.requireNonNull(subscriber, "Subscriber cannot be null"));
            return this;
        }

        public ReadSetUploadRequest build() {
            return new ReadSetUploadRequest(this);
        }
    }

    @Override
    public String toString() {
        return "ReadSetUploadRequest{" +
                "storeId='" + storeId + '\'' +
                ", sourceFileType=" + sourceFileType +
                ", name='" + name + '\'' +
                ", paired=" + (pairedSource != null) +
                '}';
    }
}
