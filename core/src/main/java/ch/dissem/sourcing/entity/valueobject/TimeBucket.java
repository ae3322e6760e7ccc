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

import ch.dissem.sourcing.utils.UnixTime;

import java.io.Serializable;
import java.time.Instant;

import static ch.dissem.sourcing.utils.UnixTime.HOUR;

/**
 * One hour of UTC time. The id is the number of full hours since the epoch.
 */
public class TimeBucket implements Serializable, Comparable<TimeBucket> {
    private static final long serialVersionUID = -2841104785014725389L;

    private final long id;

    public TimeBucket(long id) {
        this.id = id;
    }

    public static TimeBucket fromUnixTime(long unixTime) {
        return new TimeBucket(UnixTime.hours(unixTime));
    }

    public long getId() {
        return id;
    }

    /**
     * @return the first second (Unix time) belonging to this bucket
     */
    public long getStart() {
        return id * HOUR;
    }

    /**
     * @return the first second (Unix time) <em>not</em> belonging to this bucket anymore
     */
    public long getEnd() {
        return getStart() + HOUR;
    }

    public boolean contains(long unixTime) {
        return unixTime >= getStart() && unixTime < getEnd();
    }

    /**
     * Human readable form of [start, end), used in validation messages.
     */
    public String getRange() {
        return "[" + Instant.ofEpochSecond(getStart()) + ", " + Instant.ofEpochSecond(getEnd()) + ")";
    }

    @Override
    public int compareTo(TimeBucket other) {
        return Long.compare(id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeBucket)) return false;
        return id == ((TimeBucket) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "TimeBucket(" + id + ")";
    }
}
