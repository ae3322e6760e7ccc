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

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Derives the scorable index from stored raw indexes, leaving only storage to the implementation.
 */
public abstract class AbstractMinerIndexRepository implements MinerIndexRepository {

    @Override
    public ScorableMinerIndex getScorableIndex(String hotkey, Set<String> credibleHotkeys) {
        MinerIndex index = getIndex(hotkey);
        if (index == null) {
            return null;
        }
        Long lastUpdated = getLastUpdated(hotkey);
        Set<String> others = new HashSet<>(credibleHotkeys);
        others.remove(hotkey);
        return ScorableIndexCalculator.calculate(index, getIndexes(others), credibleHotkeys,
            lastUpdated == null ? 0 : lastUpdated);
    }

    /**
     * @return the stored indexes of all given miners that have one
     */
    protected abstract Collection<MinerIndex> getIndexes(Set<String> hotkeys);
}
