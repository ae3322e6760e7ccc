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

import ch.dissem.sourcing.entity.valueobject.DataLabel;
import ch.dissem.sourcing.entity.valueobject.DataSource;
import ch.dissem.sourcing.utils.UnixTime;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of how rewards are spread across data sources, labels and content age.
 */
public class RewardDistributionModel implements Serializable {
    private static final long serialVersionUID = 8530226931006014402L;

    public static final int DEFAULT_MAX_AGE_IN_HOURS = (int) (30 * UnixTime.DAY / UnixTime.HOUR);

    private final Map<DataSource, DataSourceReward> distribution;
    private final int maxAgeInHours;

    private RewardDistributionModel(Builder builder) {
        distribution = Collections.unmodifiableMap(new EnumMap<>(builder.distribution));
        maxAgeInHours = builder.maxAgeInHours;
    }

    public Map<DataSource, DataSourceReward> getDistribution() {
        return distribution;
    }

    /**
     * @throws IllegalArgumentException if the source isn't part of this model
     */
    public DataSourceReward getReward(DataSource source) {
        DataSourceReward reward = distribution.get(source);
        if (reward == null) {
            throw new IllegalArgumentException("No reward defined for " + source);
        }
        return reward;
    }

    public int getMaxAgeInHours() {
        return maxAgeInHours;
    }

    public static RewardDistributionModel defaultModel() {
        return new Builder()
            .source(DataSource.REDDIT, 0.55, 0.5)
            .label(DataSource.REDDIT, "r/bitcoin", 1.0)
            .label(DataSource.REDDIT, "r/bitcoincash", 1.0)
            .label(DataSource.REDDIT, "r/bittensor_", 1.0)
            .label(DataSource.REDDIT, "r/cryptocurrency", 1.0)
            .label(DataSource.REDDIT, "r/cryptomarkets", 1.0)
            .label(DataSource.REDDIT, "r/ethereum", 1.0)
            .label(DataSource.REDDIT, "r/machinelearning", 1.0)
            .label(DataSource.REDDIT, "r/artificial", 1.0)
            .source(DataSource.X, 0.35, 0.5)
            .label(DataSource.X, "#bitcoin", 1.0)
            .label(DataSource.X, "#bitcoincharts", 1.0)
            .label(DataSource.X, "#bittensor", 1.0)
            .label(DataSource.X, "#btc", 1.0)
            .label(DataSource.X, "#cryptocurrency", 1.0)
            .label(DataSource.X, "#crypto", 1.0)
            .label(DataSource.X, "#ai", 1.0)
            .source(DataSource.YOUTUBE, 0.10, 0.5)
            .maxAgeInHours(DEFAULT_MAX_AGE_IN_HOURS)
            .build();
    }

    @Override
    public String toString() {
        return "RewardDistributionModel{" + distribution + ", maxAgeInHours=" + maxAgeInHours + "}";
    }

    public static final class Builder {
        private final Map<DataSource, DataSourceReward> distribution = new EnumMap<>(DataSource.class);
        private final Map<DataSource, Map<DataLabel, Double>> labels = new EnumMap<>(DataSource.class);
        private final Map<DataSource, double[]> sources = new EnumMap<>(DataSource.class);
        private int maxAgeInHours = DEFAULT_MAX_AGE_IN_HOURS;

        public Builder source(DataSource source, double weight, double defaultScaleFactor) {
            sources.put(source, new double[]{weight, defaultScaleFactor});
            return this;
        }

        public Builder label(DataSource source, String label, double scaleFactor) {
            Map<DataLabel, Double> factors = labels.get(source);
            if (factors == null) {
                factors = new LinkedHashMap<>();
                labels.put(source, factors);
            }
            factors.put(new DataLabel(label), scaleFactor);
            return this;
        }

        public Builder maxAgeInHours(int maxAgeInHours) {
            this.maxAgeInHours = maxAgeInHours;
            return this;
        }

        public RewardDistributionModel build() {
            if (maxAgeInHours <= 0) {
                throw new IllegalStateException("Max age must be positive: " + maxAgeInHours);
            }
            for (DataSource source : labels.keySet()) {
                if (!sources.containsKey(source)) {
                    throw new IllegalStateException("Labels defined for unknown source " + source);
                }
            }
            for (Map.Entry<DataSource, double[]> entry : sources.entrySet()) {
                Map<DataLabel, Double> factors = labels.get(entry.getKey());
                distribution.put(entry.getKey(), new DataSourceReward(
                    entry.getValue()[0],
                    entry.getValue()[1],
                    factors == null ? Collections.<DataLabel, Double>emptyMap() : factors
                ));
            }
            return new RewardDistributionModel(this);
        }
    }
}
