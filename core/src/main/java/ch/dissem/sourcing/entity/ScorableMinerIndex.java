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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The part of a miner's index that counts towards its reward, after claims of other credible miners
 * were taken into account.
 */
public class ScorableMinerIndex implements Serializable {
    private static final long serialVersionUID = 1585238761046287925L;

    private final String hotkey;
    private final List<ScorableDataEntityBucket> buckets;
    private final long lastUpdated;

    public ScorableMinerIndex(String hotkey, Collection<ScorableDataEntityBucket> buckets, long lastUpdated) {
        this.hotkey = Objects.requireNonNull(hotkey, "hotkey");
        List<ScorableDataEntityBucket> sorted = new ArrayList<>(buckets);
        sorted.sort(Comparator.comparing(ScorableDataEntityBucket::getId));
        this.buckets = Collections.unmodifiableList(sorted);
        this.lastUpdated = lastUpdated;
    }

    public String getHotkey() {
        return hotkey;
    }

    /**
     * @return the scorable buckets in a stable order (by bucket id)
     */
    public List<ScorableDataEntityBucket> getBuckets() {
        return buckets;
    }

    /**
     * @return Unix time of the last successful index update
     */
    public long getLastUpdated() {
        return lastUpdated;
    }

    public long getTotalSizeBytes() {
        long total = 0;
        for (ScorableDataEntityBucket bucket : buckets) {
            total += bucket.getSizeBytes();
        }
        return total;
    }

    public long getTotalScorableBytes() {
        long total = 0;
        for (ScorableDataEntityBucket bucket : buckets) {
            total += bucket.getScorableBytes();
        }
        return total;
    }

    public boolean isEmpty() {
        return getTotalScorableBytes() == 0;
    }

    @Override
    public String toString() {
        return "ScorableMinerIndex{" + hotkey + ", " + buckets.size() + " buckets, " + getTotalScorableBytes() + " bytes}";
    }
}
