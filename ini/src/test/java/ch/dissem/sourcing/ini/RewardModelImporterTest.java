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
import ch.dissem.sourcing.rewards.DataSourceReward;
import ch.dissem.sourcing.rewards.RewardDistributionModel;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RewardModelImporterTest {
    private static final double DELTA = 1e-9;

    @Test
    public void ensureModelIsImportedFromFile() throws Exception {
        RewardModelImporter importer = new RewardModelImporter(
            getClass().getClassLoader().getResourceAsStream("reward-model.ini"));
        RewardDistributionModel model = importer.getModel();

        assertEquals(168, model.getMaxAgeInHours());
        assertEquals(2, model.getDistribution().size());
        assertFalse(model.getDistribution().containsKey(DataSource.X));

        DataSourceReward reddit = model.getReward(DataSource.REDDIT);
        assertEquals(0.75, reddit.getWeight(), DELTA);
        assertEquals(0.5, reddit.getDefaultScaleFactor(), DELTA);
        assertEquals(1.0, reddit.getScaleFactor(new DataLabel("r/bitcoin")), DELTA);
        assertEquals(0.8, reddit.getScaleFactor(new DataLabel("r/ethereum")), DELTA);
        assertEquals(0.5, reddit.getScaleFactor(new DataLabel("r/other")), DELTA);

        DataSourceReward youtube = model.getReward(DataSource.YOUTUBE);
        assertEquals(0.25, youtube.getWeight(), DELTA);
        assertTrue(youtube.getLabelScaleFactors().isEmpty());
    }

    @Test
    public void ensureMaxAgeDefaultsWithoutModelSection() throws Exception {
        RewardModelImporter importer = new RewardModelImporter("[X]\n" +
            "weight = 1.0\n" +
            "default = 0.5\n" +
            "label.#bitcoin = 1.0\n");
        RewardDistributionModel model = importer.getModel();

        assertEquals(RewardDistributionModel.DEFAULT_MAX_AGE_IN_HOURS, model.getMaxAgeInHours());
        assertEquals(1.0, model.getReward(DataSource.X).getScaleFactor(new DataLabel("#bitcoin")), DELTA);
    }

    @Test
    public void ensureSectionNamesAreCaseInsensitive() throws Exception {
        RewardModelImporter importer = new RewardModelImporter("[youtube]\n" +
            "weight = 1.0\n" +
            "default = 1.0\n");
        assertEquals(1.0, importer.getModel().getReward(DataSource.YOUTUBE).getWeight(), DELTA);
    }

    @Test(expected = IOException.class)
    public void ensureSourceWithoutWeightIsRejected() throws Exception {
        new RewardModelImporter("[REDDIT]\n" +
            "default = 0.5\n");
    }

    @Test(expected = IOException.class)
    public void ensureNonPositiveMaxAgeIsRejected() throws Exception {
        new RewardModelImporter("[model]\n" +
            "max_age_in_hours = 0\n" +
            "[REDDIT]\n" +
            "weight = 1.0\n" +
            "default = 0.5\n");
    }
}
