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

package ch.dissem.sourcing.entity;

import java.io.Serializable;
import java.util.Objects;

/**
 * The outcome of checking (a batch of) content delivered by a miner.
 */
public class ValidationResult implements Serializable {
    private static final long serialVersionUID = -4218903316750427312L;

    private static final ValidationResult VALID = new ValidationResult(true, "");

    private final boolean valid;
    private final String reason;

    private ValidationResult(boolean valid, String reason) {
        this.valid = valid;
        this.reason = reason;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return why the content is invalid, or an empty string if it is valid
     */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult)) return false;
        ValidationResult that = (ValidationResult) o;
        return valid == that.valid && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, reason);
    }

    @Override
    public String toString() {
        return valid ? "valid" : "invalid: " + reason;
    }
}
