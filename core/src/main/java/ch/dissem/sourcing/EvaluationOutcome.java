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

import ch.dissem.sourcing.entity.ValidationResult;

import java.util.Collections;
import java.util.List;

/**
 * What happened when a miner was evaluated.
 */
public class EvaluationOutcome {
    private final int uid;
    private final String hotkey;
    private final EvaluationState state;
    private final EvaluationState decidedAt;
    private final List<ValidationResult> results;

    EvaluationOutcome(int uid, String hotkey, EvaluationState state, EvaluationState decidedAt,
                      List<ValidationResult> results) {
        this.uid = uid;
        this.hotkey = hotkey;
        this.state = state;
        this.decidedAt = decidedAt;
        this.results = Collections.unmodifiableList(results);
    }

    public int getUid() {
        return uid;
    }

    public String getHotkey() {
        return hotkey;
    }

    /**
     * @return the terminal state, {@link EvaluationState#NO_DATA}, {@link EvaluationState#SCORED} or
     * {@link EvaluationState#ABORTED}
     */
    public EvaluationState getState() {
        return state;
    }

    /**
     * @return the step that produced the results (e.g. {@link EvaluationState#BASIC_CHECK} if the delivered
     * content didn't match the bucket)
     */
    public EvaluationState getDecidedAt() {
        return decidedAt;
    }

    /**
     * @return the results passed to the scorer, empty unless {@link EvaluationState#SCORED}
     */
    public List<ValidationResult> getResults() {
        return results;
    }

    @Override
    public String toString() {
        return "EvaluationOutcome{" + uid + "/" + hotkey + ": " + state + " at " + decidedAt + ", " + results + "}";
    }
}
