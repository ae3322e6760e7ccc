/*
 * Copyright 2017 Christian Basler
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

package ch.dissem.sourcing.entity;

import ch.dissem.sourcing.entity.valueobject.DataLabel;
import ch.dissem.sourcing.entity.valueobject.DataSource;
import ch.dissem.sourcing.entity.valueobject.TimeBucket;

import java.io.Serializable;

/**
 * A single piece of scraped content, e.g. a post or a comment, as delivered by a miner. The URI identifies
 * the entity.
 */
public class DataEntity implements Serializable {
    private static final long serialVersionUID = -1753262734869107468L;

    private final String uri;
    /**
     * Unix time (seconds) the content was created
     */
    private final long timestamp;
    private final DataSource source;
    private final DataLabel label;
    private final byte[] content;
    /**
     * The size of the content as claimed by the miner
     */
    private final long contentSizeBytes;

    private DataEntity(Builder builder) {
        uri = builder.uri;
        timestamp = builder.timestamp;
        source = builder.source;
        label = builder.label;
        content = builder.content;
        contentSizeBytes = builder.contentSizeBytes;
    }

    public String getUri() {
        return uri;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public TimeBucket getTimeBucket() {
        return TimeBucket.fromUnixTime(timestamp);
    }

    public DataSource getSource() {
        return source;
    }

    public DataLabel getLabel() {
        return label;
    }

    /**
     * @return the raw content, never null (but possibly empty)
     */
    public byte[] getContent() {
        return content;
    }

    public long getContentSizeBytes() {
        return contentSizeBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataEntity)) return false;
        return uri.equals(((DataEntity) o).uri);
    }

    @Override
    public int hashCode() {
        return uri.hashCode();
    }

    @Override
    public String toString() {
        return "DataEntity{" + uri + ", " + source + "/" + label + " @" + timestamp + ", " + contentSizeBytes + " bytes}";
    }

    public static final class Builder {
        private String uri;
        private long timestamp;
        private DataSource source;
        private DataLabel label;
        private byte[] content;
        private Long contentSizeBytes;

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder source(DataSource source) {
            this.source = source;
            return this;
        }

        public Builder label(DataLabel label) {
            this.label = label;
            return this;
        }

        public Builder label(String label) {
            this.label = DataLabel.of(label);
            return this;
        }

        public Builder content(byte[] content) {
            this.content = content;
            return this;
        }

        /**
         * If not set, the actual length of the content is used.
         */
        public Builder contentSizeBytes(long contentSizeBytes) {
            this.contentSizeBytes = contentSizeBytes;
            return this;
        }

        public DataEntity build() {
            if (uri == null) {
                throw new IllegalStateException("URI must be set");
            }
            if (source == null) {
                throw new IllegalStateException("Source must be set");
            }
            if (content == null) {
                content = new byte[0];
            }
            if (contentSizeBytes == null) {
                contentSizeBytes = (long) content.length;
            }
            return new DataEntity(this);
        }
    }
}
