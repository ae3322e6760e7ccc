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

import ch.dissem.sourcing.entity.MinerTrustState;
import ch.dissem.sourcing.exception.ApplicationException;
import ch.dissem.sourcing.utils.Encode;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Keeps the serialized state in memory, which is mostly useful for tests and short lived validators.
 */
public class MemoryScorerStateRepository implements ScorerStateRepository {
    private byte[] data;

    @Override
    public synchronized MinerTrustState load() {
        if (data == null) {
            return null;
        }
        try {
            return MinerTrustState.read(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new ApplicationException(e);
        }
    }

    @Override
    public synchronized void save(MinerTrustState state) {
        try {
            data = Encode.bytes(state);
        } catch (IOException e) {
            throw new ApplicationException(e);
        }
    }
}
