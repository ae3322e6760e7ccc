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
 * A claimed bucket together with the part of it that counts towards the miner's reward.
 */
public class ScorableDataEntityBucket implements Serializable {
    private static final long serialVersionUID = 7706025338541299017L;

    private final DataEntityBucketId id;
    private final long sizeBytes;
    private final long scorableBytes;

    public ScorableDataEntityBucket(DataEntityBucketId id, long sizeBytes, long scorableBytes) {
        if (scorableBytes < 0 || scorableBytes > sizeBytes) {
            throw new IllegalArgumentException("Scorable bytes must be within [0, " + sizeBytes + "]: " + scorableBytes);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.sizeBytes = sizeBytes;
        this.scorableBytes = scorableBytes;
    }

    public DataEntityBucketId getId() {
        return id;
    }

    /**
     * @return the size claimed by the miner
     */
    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getScorableBytes() {
        return scorableBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScorableDataEntityBucket)) return false;
        ScorableDataEntityBucket that = (ScorableDataEntityBucket) o;
        return sizeBytes == that.sizeBytes && scorableBytes == that.scorableBytes && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sizeBytes, scorableBytes);
    }

    @Override
    public String toString() {
        return id + " (" + scorableBytes + "/" + sizeBytes + " bytes)";
    }
}
