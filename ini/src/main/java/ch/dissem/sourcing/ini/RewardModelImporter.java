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

import ch.dissem.sourcing.entity.valueobject.DataSource;
import ch.dissem.sourcing.rewards.RewardDistributionModel;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Map.Entry;

/**
 * Reads a reward distribution model from an INI file like this:
 * <pre>
 * [model]
 * max_age_in_hours = 720
 *
 * [REDDIT]
 * weight = 0.55
 * default = 0.5
 * label.r/bitcoin = 1.0
 * </pre>
 * Sections that aren't named after a data source are ignored.
 */
public class RewardModelImporter {
    static final String MODEL_SECTION = "model";
    static final String MAX_AGE = "max_age_in_hours";
    static final String WEIGHT = "weight";
    static final String DEFAULT_FACTOR = "default";
    static final String LABEL_PREFIX = "label.";

    private final RewardDistributionModel model;

    public RewardModelImporter(File file) throws IOException {
        this(new FileInputStream(file));
    }

    public RewardModelImporter(String data) throws IOException {
        this(new ByteArrayInputStream(data.getBytes(StandardCharsets.UTF_8)));
    }

    public RewardModelImporter(InputStream in) throws IOException {
        Ini ini = new Ini();
        try {
            ini.load(in);
        } finally {
            in.close();
        }

        RewardDistributionModel.Builder builder = new RewardDistributionModel.Builder();
        Profile.Section modelSection = ini.get(MODEL_SECTION);
        if (modelSection != null && modelSection.containsKey(MAX_AGE)) {
            builder.maxAgeInHours(modelSection.get(MAX_AGE, int.class));
        }
        for (Entry<String, Profile.Section> entry : ini.entrySet()) {
            DataSource source = source(entry.getKey());
            if (source == null)
                continue;

            Profile.Section section = entry.getValue();
            if (!section.containsKey(WEIGHT) || !section.containsKey(DEFAULT_FACTOR))
                throw new IOException("Section [" + entry.getKey() + "] needs both '" + WEIGHT + "' and '"
                    + DEFAULT_FACTOR + "'");
            builder.source(source, section.get(WEIGHT, double.class), section.get(DEFAULT_FACTOR, double.class));
            for (String key : section.keySet()) {
                if (key.startsWith(LABEL_PREFIX)) {
                    builder.label(source, key.substring(LABEL_PREFIX.length()), section.get(key, double.class));
                }
            }
        }
        try {
            model = builder.build();
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new IOException("Invalid reward model: " + e.getMessage(), e);
        }
    }

    private static DataSource source(String sectionName) {
        for (DataSource source : DataSource.values()) {
            if (source.name().equalsIgnoreCase(sectionName)) {
                return source;
            }
        }
        return null;
    }

    public RewardDistributionModel getModel() {
        return model;
    }
}
