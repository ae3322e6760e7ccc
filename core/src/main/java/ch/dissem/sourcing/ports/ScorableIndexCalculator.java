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

package ch.dissem.sourcing.ports;

import ch.dissem.sourcing.entity.DataEntityBucket;
import ch.dissem.sourcing.entity.MinerIndex;
import ch.dissem.sourcing.entity.ScorableDataEntityBucket;
import ch.dissem.sourcing.entity.ScorableMinerIndex;
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;

import java.util.*;

/**
 * Works out how much of a miner's claimed content counts towards its reward.
 * <p>
 * The same content may be claimed by several miners, but should only be rewarded once. For each bucket,
 * the claimants are all credible miners claiming it plus the miner in question. Credible miners are served
 * first, ordered by hotkey, a miner that isn't credible comes last. Each claimant gets whatever part of its
 * claim exceeds the largest claim served before it, so the bytes rewarded for a bucket never exceed the
 * largest single claim among credible miners. Claims of other miners that aren't credible are ignored.
 * </p>
 * <p>
 * Miners that aren't credible are each measured against the credible claims only, never against each
 * other. Two of them claiming the same bucket both get the part exceeding the largest credible claim.
 * Their reward is kept small by their credibility, which scales their score squared.
 * </p>
 */
public final class ScorableIndexCalculator {
    private ScorableIndexCalculator() {
    }

    /**
     * @param index    the index of the miner to score
     * @param claims   indexes of other miners, at least of all credible ones (others are ignored)
     * @param credible hotkeys of credible miners
     * @return bucket id to scorable bytes for every bucket of {@code index} with at least one scorable byte
     */
    public static Map<DataEntityBucketId, Long> scorableBytes(MinerIndex index, Collection<MinerIndex> claims,
                                                              Set<String> credible) {
        String hotkey = index.getHotkey();
        boolean isCredible = credible.contains(hotkey);
        Map<DataEntityBucketId, SortedMap<String, Long>> competing = competingClaims(hotkey, claims, credible);

        Map<DataEntityBucketId, Long> result = new TreeMap<>();
        for (DataEntityBucket bucket : index.getBuckets()) {
            SortedMap<String, Long> others = competing.get(bucket.getId());
            long largest = 0;
            if (others != null) {
                for (Map.Entry<String, Long> claim : others.entrySet()) {
                    if (isCredible && hotkey.compareTo(claim.getKey()) < 0) {
                        break;
                    }
                    largest = Math.max(largest, claim.getValue());
                }
            }
            long own = Math.max(0, bucket.getSizeBytes() - largest);
            if (own > 0) {
                result.put(bucket.getId(), own);
            }
        }
        return result;
    }

    /**
     * Calculates the scorable bytes for every credible miner in {@code claims}.
     */
    public static Map<String, Map<DataEntityBucketId, Long>> scorableBytes(Collection<MinerIndex> claims,
                                                                           Set<String> credible) {
        Map<String, Map<DataEntityBucketId, Long>> result = new TreeMap<>();
        for (MinerIndex index : claims) {
            if (credible.contains(index.getHotkey())) {
                result.put(index.getHotkey(), scorableBytes(index, claims, credible));
            }
        }
        return result;
    }

    public static ScorableMinerIndex calculate(MinerIndex index, Collection<MinerIndex> claims,
                                               Set<String> credible, long lastUpdated) {
        Map<DataEntityBucketId, Long> scorable = scorableBytes(index, claims, credible);
        List<ScorableDataEntityBucket> buckets = new ArrayList<>(scorable.size());
        for (DataEntityBucket bucket : index.getBuckets()) {
            Long bytes = scorable.get(bucket.getId());
            if (bytes != null) {
                buckets.add(new ScorableDataEntityBucket(bucket.getId(), bucket.getSizeBytes(), bytes));
            }
        }
        return new ScorableMinerIndex(index.getHotkey(), buckets, lastUpdated);
    }

    private static Map<DataEntityBucketId, SortedMap<String, Long>> competingClaims(
        String hotkey, Collection<MinerIndex> claims, Set<String> credible) {
        Map<DataEntityBucketId, SortedMap<String, Long>> result = new HashMap<>();
        for (MinerIndex other : claims) {
            if (other.getHotkey().equals(hotkey) || !credible.contains(other.getHotkey())) {
                continue;
            }
            for (DataEntityBucket bucket : other.getBuckets()) {
                SortedMap<String, Long> claimants = result.get(bucket.getId());
                if (claimants == null) {
                    claimants = new TreeMap<>();
                    result.put(bucket.getId(), claimants);
                }
                claimants.put(other.getHotkey(), bucket.getSizeBytes());
            }
        }
        return result;
    }
}
