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

package ch.dissem.sourcing.entity.valueobject;

import java.io.Serializable;
import java.util.Locale;

/**
 * A topical tag like a hashtag, subreddit or keyword. Labels are normalized on creation (trimmed and lower case),
 * so two labels differing only in case are equal.
 */
public class DataLabel implements Serializable, Comparable<DataLabel> {
    private static final long serialVersionUID = 4127785382907719651L;

    public static final int MAX_LENGTH = 140;

    private final String value;

    public DataLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Label value must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Label must not be empty");
        }
        if (normalized.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Label must not be longer than " + MAX_LENGTH + " characters: " + value);
        }
        this.value = normalized;
    }

    /**
     * @return a label for the given value, or null if the value is null or blank (meaning "no label")
     */
    public static DataLabel of(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return new DataLabel(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(DataLabel other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataLabel)) return false;
        return value.equals(((DataLabel) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
