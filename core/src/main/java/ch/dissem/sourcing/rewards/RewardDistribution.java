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

package ch.dissem.sourcing.rewards;

import ch.dissem.sourcing.entity.ScorableDataEntityBucket;
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;
import ch.dissem.sourcing.entity.valueobject.TimeBucket;
import ch.dissem.sourcing.utils.UnixTime;

import java.io.Serializable;
import java.util.Objects;

/**
 * Calculates the value of scraped content. A bucket is worth
 * <p>
 * {@code weight(source) * labelFactor(source, label) * ageDecay(timeBucket) * bytes}
 * </p>
 * where the age decay falls linearly from 1 for current content to 0.5 for content of the maximum age, and
 * is 0 for anything older.
 */
public class RewardDistribution implements Serializable {
    private static final long serialVersionUID = -4650227431298718054L;

    private final RewardDistributionModel model;

    public RewardDistribution() {
        this(RewardDistributionModel.defaultModel());
    }

    public RewardDistribution(RewardDistributionModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    public RewardDistributionModel getModel() {
        return model;
    }

    public double getScore(ScorableDataEntityBucket bucket) {
        return getScore(bucket.getId(), bucket.getScorableBytes(), UnixTime.now());
    }

    public double getScore(ScorableDataEntityBucket bucket, long now) {
        return getScore(bucket.getId(), bucket.getScorableBytes(), now);
    }

    public double getScore(DataEntityBucketId bucketId, long bytes) {
        return getScore(bucketId, bytes, UnixTime.now());
    }

    public double getScore(DataEntityBucketId bucketId, long bytes, long now) {
        DataSourceReward reward = model.getReward(bucketId.getSource());
        return reward.getWeight()
            * reward.getScaleFactor(bucketId.getLabel())
            * getAgeFactor(bucketId.getTimeBucket(), now)
            * bytes;
    }

    double getAgeFactor(TimeBucket timeBucket, long now) {
        // content from the future is treated as current
        long ageInHours = Math.max(0, Math.floorDiv(now - timeBucket.getStart(), UnixTime.HOUR));
        int maxAge = model.getMaxAgeInHours();
        if (ageInHours > maxAge) {
            return 0;
        }
        return 1.0 - ageInHours / (2.0 * maxAge);
    }
}
