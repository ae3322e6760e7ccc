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

import ch.dissem.sourcing.entity.DataEntity;
import ch.dissem.sourcing.entity.ValidationResult;
import ch.dissem.sourcing.exception.NodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Verifies entities by fetching the authoritative version and comparing them field by field. Subclasses only
 * need to know how to fetch content from their source.
 */
public abstract class AbstractContentVerifier implements ContentVerifier {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractContentVerifier.class);

    @Override
    public List<ValidationResult> validate(List<DataEntity> entities) {
        List<ValidationResult> results = new ArrayList<>(entities.size());
        for (DataEntity entity : entities) {
            results.add(validate(entity));
        }
        return results;
    }

    protected ValidationResult validate(DataEntity entity) {
        DataEntity original;
        try {
            original = fetch(entity.getUri());
        } catch (NodeException e) {
            LOG.debug("Could not fetch {}: {}", entity.getUri(), e.getMessage());
            return ValidationResult.invalid("Failed to retrieve " + entity.getUri() + ": " + e.getMessage());
        }
        if (original == null) {
            return ValidationResult.invalid("Content " + entity.getUri() + " does not exist");
        }
        if (original.getSource() != entity.getSource()) {
            return ValidationResult.invalid("Source does not match");
        }
        if (!Objects.equals(original.getLabel(), entity.getLabel())) {
            return ValidationResult.invalid("Label does not match");
        }
        if (original.getTimestamp() != entity.getTimestamp()) {
            return ValidationResult.invalid("Timestamp does not match");
        }
        if (!Arrays.equals(original.getContent(), entity.getContent())) {
            return ValidationResult.invalid("Content does not match");
        }
        return ValidationResult.valid();
    }

    /**
     * @return the entity as currently found at the source, or null if it doesn't exist (anymore)
     * @throws NodeException if the source couldn't be reached
     */
    protected abstract DataEntity fetch(String uri);
}
