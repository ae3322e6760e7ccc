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
import java.util.*;

/**
 * Everything a miner claims to hold, as reported by the miner itself.
 */
public class MinerIndex implements Serializable {
    private static final long serialVersionUID = -6309415538412076420L;

    private final String hotkey;
    private final List<DataEntityBucket> buckets;

    /**
     * @throws IllegalArgumentException if the same bucket is claimed twice
     */
    public MinerIndex(String hotkey, Collection<DataEntityBucket> buckets) {
        this.hotkey = Objects.requireNonNull(hotkey, "hotkey");
        Set<DataEntityBucketId> ids = new HashSet<>();
        for (DataEntityBucket bucket : buckets) {
            if (!ids.add(bucket.getId())) {
                throw new IllegalArgumentException("Bucket " + bucket.getId() + " claimed twice by " + hotkey);
            }
        }
        List<DataEntityBucket> sorted = new ArrayList<>(buckets);
        sorted.sort(Comparator.comparing(DataEntityBucket::getId));
        this.buckets = Collections.unmodifiableList(sorted);
    }

    public String getHotkey() {
        return hotkey;
    }

    /**
     * @return the claimed buckets, ordered by their id
     */
    public List<DataEntityBucket> getBuckets() {
        return buckets;
    }

    public long getTotalSizeBytes() {
        long total = 0;
        for (DataEntityBucket bucket : buckets) {
            total += bucket.getSizeBytes();
        }
        return total;
    }

    @Override
    public String toString() {
        return "MinerIndex{" + hotkey + ", " + buckets.size() + " buckets}";
    }
}
