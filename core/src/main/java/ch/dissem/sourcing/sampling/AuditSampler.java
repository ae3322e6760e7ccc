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

package ch.dissem.sourcing.sampling;

import ch.dissem.sourcing.entity.DataEntity;
import ch.dissem.sourcing.entity.ScorableDataEntityBucket;
import ch.dissem.sourcing.entity.ScorableMinerIndex;
import ch.dissem.sourcing.entity.ValidationResult;
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;
import ch.dissem.sourcing.entity.valueobject.TimeBucket;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Picks what to audit. Buckets and entities are chosen by picking a random byte of the claimed content, so
 * a miner's chance of being caught on a bucket is proportional to the size of its claim.
 */
public class AuditSampler {
    private final Random random;

    public AuditSampler() {
        this(new Random());
    }

    public AuditSampler(Random random) {
        this.random = random;
    }

    /**
     * @throws IllegalArgumentException if the index claims no content at all
     */
    public ScorableDataEntityBucket chooseBucket(ScorableMinerIndex index) {
        return chooseBucket(index, random.nextDouble() * totalSize(index));
    }

    /**
     * Returns the first bucket (in index order) with positive size whose cumulative size reaches {@code x}.
     *
     * @param x position of the chosen byte, {@code 0 <= x <= total size}
     */
    public ScorableDataEntityBucket chooseBucket(ScorableMinerIndex index, double x) {
        long total = totalSize(index);
        long cumulative = 0;
        for (ScorableDataEntityBucket bucket : index.getBuckets()) {
            if (bucket.getSizeBytes() == 0) {
                continue;
            }
            cumulative += bucket.getSizeBytes();
            if (cumulative >= x) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Byte " + x + " is beyond the claimed " + total + " bytes");
    }

    private static long totalSize(ScorableMinerIndex index) {
        long total = index.getTotalSizeBytes();
        if (total <= 0) {
            throw new IllegalArgumentException("Cannot choose a bucket from an index without content");
        }
        return total;
    }

    public DataEntity chooseEntity(List<DataEntity> entities) {
        if (entities.isEmpty()) {
            throw new IllegalArgumentException("No entities to choose from");
        }
        long total = 0;
        for (DataEntity entity : entities) {
            total += entity.getContentSizeBytes();
        }
        if (total == 0) {
            return entities.get(random.nextInt(entities.size()));
        }
        return chooseEntity(entities, random.nextDouble() * total);
    }

    /**
     * Same walk as {@link #chooseBucket(ScorableMinerIndex, double)}, over the claimed content sizes.
     */
    public DataEntity chooseEntity(List<DataEntity> entities, double x) {
        if (entities.isEmpty()) {
            throw new IllegalArgumentException("No entities to choose from");
        }
        long cumulative = 0;
        DataEntity last = null;
        for (DataEntity entity : entities) {
            if (entity.getContentSizeBytes() <= 0) {
                continue;
            }
            cumulative += entity.getContentSizeBytes();
            last = entity;
            if (cumulative >= x) {
                return entity;
            }
        }
        return last == null ? entities.get(0) : last;
    }

    /**
     * Chooses the entities to verify against the original source. Currently exactly one.
     */
    public List<DataEntity> chooseEntities(List<DataEntity> entities) {
        return Collections.singletonList(chooseEntity(entities));
    }

    public List<DataEntity> chooseEntities(List<DataEntity> entities, double x) {
        return Collections.singletonList(chooseEntity(entities, x));
    }

    /**
     * Checks that the delivered entities match the bucket they were requested for, and that their
     * content adds up to what was claimed.
     */
    public ValidationResult validateBatch(List<DataEntity> entities, ScorableDataEntityBucket bucket) {
        DataEntityBucketId id = bucket.getId();
        TimeBucket timeBucket = id.getTimeBucket();
        long actualSize = 0;
        long claimedSize = 0;
        for (DataEntity entity : entities) {
            actualSize += entity.getContent().length;
            claimedSize += entity.getContentSizeBytes();
            if (entity.getSource() != id.getSource()) {
                return ValidationResult.invalid("Entity source " + entity.getSource()
                    + " does not match chunk source " + id.getSource());
            }
            if (!Objects.equals(entity.getLabel(), id.getLabel())) {
                return ValidationResult.invalid("Entity label " + entity.getLabel()
                    + " does not match chunk label " + id.getLabel());
            }
            if (!timeBucket.contains(entity.getTimestamp())) {
                return ValidationResult.invalid("Entity datetime " + entity.getTimestamp()
                    + " is not in the expected range " + timeBucket.getRange());
            }
        }
        if (actualSize < claimedSize || actualSize < bucket.getSizeBytes()) {
            return ValidationResult.invalid("Size not as expected. Actual=" + actualSize
                + ". Claimed=" + claimedSize + ". Expected=" + bucket.getSizeBytes());
        }
        return ValidationResult.valid();
    }
}
