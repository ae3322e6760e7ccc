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

package ch.dissem.sourcing.ini;

import ch.dissem.sourcing.entity.valueobject.DataLabel;
import ch.dissem.sourcing.entity.valueobject.DataSource;
import ch.dissem.sourcing.exception.ApplicationException;
import ch.dissem.sourcing.rewards.DataSourceReward;
import ch.dissem.sourcing.rewards.RewardDistributionModel;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.*;
import java.util.Map;

import static ch.dissem.sourcing.ini.RewardModelImporter.*;

/**
 * Writes a reward distribution model in the format read by {@link RewardModelImporter}.
 */
public class RewardModelExporter {
    private final Ini ini;

    public RewardModelExporter(RewardDistributionModel model) {
        this.ini = new Ini();
        Profile.Section modelSection = ini.add(MODEL_SECTION);
        modelSection.add(MAX_AGE, model.getMaxAgeInHours());
        for (Map.Entry<DataSource, DataSourceReward> entry : model.getDistribution().entrySet()) {
            DataSourceReward reward = entry.getValue();
            Profile.Section section = ini.add(entry.getKey().name());
            section.add(WEIGHT, reward.getWeight());
            section.add(DEFAULT_FACTOR, reward.getDefaultScaleFactor());
            for (Map.Entry<DataLabel, Double> label : reward.getLabelScaleFactors().entrySet()) {
                section.add(LABEL_PREFIX + label.getKey().getValue(), label.getValue());
            }
        }
    }

    public void write(File file) throws IOException {
        try (FileOutputStream out = new FileOutputStream(file)) {
            write(out);
        }
    }

    public void write(OutputStream out) throws IOException {
        ini.store(out);
    }

    @Override
    public String toString() {
        StringWriter writer = new StringWriter();
        try {
            ini.store(writer);
        } catch (IOException e) {
            throw new ApplicationException(e);
        }
        return writer.toString();
    }
}
