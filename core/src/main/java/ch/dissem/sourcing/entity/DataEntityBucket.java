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

import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;

import java.io.Serializable;
import java.util.Objects;

/**
 * A miner's claim to hold {@code sizeBytes} bytes of content in the given bucket.
 */
public class DataEntityBucket implements Serializable {
    private static final long serialVersionUID = 3398215670042216617L;

    private final DataEntityBucketId id;
    private final long sizeBytes;

    public DataEntityBucket(DataEntityBucketId id, long sizeBytes) {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Claimed size must not be negative: " + sizeBytes);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.sizeBytes = sizeBytes;
    }

    public DataEntityBucketId getId() {
        return id;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataEntityBucket)) return false;
        DataEntityBucket that = (DataEntityBucket) o;
        return sizeBytes == that.sizeBytes && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sizeBytes);
    }

    @Override
    public String toString() {
        return id + " (" + sizeBytes + " bytes)";
    }
}
