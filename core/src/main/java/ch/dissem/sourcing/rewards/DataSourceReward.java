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

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How content of one data source is rewarded. Label factors may be negative for undesirable content.
 */
public class DataSourceReward implements Serializable {
    private static final long serialVersionUID = -5103487781220911873L;

    private final double weight;
    private final double defaultScaleFactor;
    private final Map<DataLabel, Double> labelScaleFactors;

    public DataSourceReward(double weight, double defaultScaleFactor, Map<DataLabel, Double> labelScaleFactors) {
        if (weight < 0) {
            throw new IllegalArgumentException("Weight must not be negative: " + weight);
        }
        this.weight = weight;
        this.defaultScaleFactor = defaultScaleFactor;
        this.labelScaleFactors = Collections.unmodifiableMap(new LinkedHashMap<>(labelScaleFactors));
    }

    public double getWeight() {
        return weight;
    }

    public double getDefaultScaleFactor() {
        return defaultScaleFactor;
    }

    public Map<DataLabel, Double> getLabelScaleFactors() {
        return labelScaleFactors;
    }

    /**
     * @param label may be null for unlabeled content
     * @return the factor configured for the label, or the default factor
     */
    public double getScaleFactor(DataLabel label) {
        if (label == null) {
            return defaultScaleFactor;
        }
        Double factor = labelScaleFactors.get(label);
        return factor == null ? defaultScaleFactor : factor;
    }

    @Override
    public String toString() {
        return "DataSourceReward{weight=" + weight + ", default=" + defaultScaleFactor
            + ", labels=" + labelScaleFactors + "}";
    }
}
