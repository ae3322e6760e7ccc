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

import java.util.List;

/**
 * Checks content delivered by a miner against the original source.
 */
public interface ContentVerifier {
    /**
     * @return one result per entity, in the same order
     */
    List<ValidationResult> validate(List<DataEntity> entities);
}
