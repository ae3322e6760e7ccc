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

import ch.dissem.sourcing.entity.MinerIndex;
import ch.dissem.sourcing.entity.ScorableMinerIndex;

import java.util.Set;

/**
 * Stores the latest index of every miner.
 */
public interface MinerIndexRepository {
    /**
     * Replaces whatever was stored for the index' miner, and sets its last update to now.
     */
    void store(MinerIndex index);

    /**
     * @param hotkey          the miner to get the index for
     * @param credibleHotkeys miners whose claims take precedence over those of untrusted miners
     * @return the part of the miner's index that should be rewarded, or null if the miner never supplied an index
     */
    ScorableMinerIndex getScorableIndex(String hotkey, Set<String> credibleHotkeys);

    MinerIndex getIndex(String hotkey);

    /**
     * @return Unix time of the last successful update of the miner's index, or null if there is none
     */
    Long getLastUpdated(String hotkey);

    void delete(String hotkey);
}
