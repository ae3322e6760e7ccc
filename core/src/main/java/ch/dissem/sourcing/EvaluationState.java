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

package ch.dissem.sourcing;

/**
 * Steps of a single miner's evaluation. An evaluation ends in {@link #NO_DATA}, {@link #SCORED} or
 * {@link #ABORTED}.
 */
public enum EvaluationState {
    FETCH_INDEX,
    SELECT,
    FETCH_CONTENT,
    BASIC_CHECK,
    SAMPLE_VERIFY,
    SCORE,
    /**
     * The miner had nothing to evaluate, its score and credibility were reset.
     */
    NO_DATA,
    SCORED,
    /**
     * The evaluation was interrupted. Neither score nor credibility were touched.
     */
    ABORTED;

    public boolean isTerminal() {
        return this == NO_DATA || this == SCORED || this == ABORTED;
    }
}
