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
import ch.dissem.sourcing.utils.UnixTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps miner indexes in memory. They are lost on restart, so miners are treated as new until they
 * answer the next index request.
 */
public class MemoryMinerIndexRepository extends AbstractMinerIndexRepository {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryMinerIndexRepository.class);

    private final Map<String, Entry> indexes = new ConcurrentHashMap<>();

    @Override
    public void store(MinerIndex index) {
        indexes.put(index.getHotkey(), new Entry(index, UnixTime.now()));
        LOG.trace("Stored index of {} with {} buckets", index.getHotkey(), index.getBuckets().size());
    }

    @Override
    public MinerIndex getIndex(String hotkey) {
        Entry entry = indexes.get(hotkey);
        return entry == null ? null : entry.index;
    }

    @Override
    public Long getLastUpdated(String hotkey) {
        Entry entry = indexes.get(hotkey);
        return entry == null ? null : entry.lastUpdated;
    }

    @Override
    public void delete(String hotkey) {
        indexes.remove(hotkey);
    }

    @Override
    protected Collection<MinerIndex> getIndexes(Set<String> hotkeys) {
        List<MinerIndex> result = new ArrayList<>(hotkeys.size());
        for (String hotkey : hotkeys) {
            Entry entry = indexes.get(hotkey);
            if (entry != null) {
                result.add(entry.index);
            }
        }
        return result;
    }

    private static class Entry {
        private final MinerIndex index;
        private final long lastUpdated;

        private Entry(MinerIndex index, long lastUpdated) {
            this.index = index;
            this.lastUpdated = lastUpdated;
        }
    }
}
