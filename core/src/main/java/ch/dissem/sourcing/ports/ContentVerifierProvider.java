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

import ch.dissem.sourcing.entity.valueobject.DataSource;

import java.util.EnumMap;
import java.util.Map;

/**
 * Knows which {@link ContentVerifier} is responsible for which data source.
 */
public class ContentVerifierProvider {
    private final Map<DataSource, ContentVerifier> verifiers = new EnumMap<>(DataSource.class);

    public ContentVerifierProvider register(DataSource source, ContentVerifier verifier) {
        verifiers.put(source, verifier);
        return this;
    }

    /**
     * @throws IllegalStateException if no verifier is registered for the source
     */
    public ContentVerifier get(DataSource source) {
        ContentVerifier verifier = verifiers.get(source);
        if (verifier == null) {
            throw new IllegalStateException("No content verifier registered for " + source);
        }
        return verifier;
    }

    public boolean supports(DataSource source) {
        return verifiers.containsKey(source);
    }
}
