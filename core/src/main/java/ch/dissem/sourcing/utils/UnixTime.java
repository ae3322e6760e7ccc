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

package ch.dissem.sourcing.utils;

/**
 * A simple utility class that simplifies using second based Unix time, which is used for all timestamps
 * in this library.
 */
public class UnixTime {
    /**
     * Length of a minute in seconds, intended for use with {@link #now(long)}.
     */
    public static final long MINUTE = 60;
    /**
     * Length of an hour in seconds, intended for use with {@link #now(long)}.
     */
    public static final long HOUR = 60 * MINUTE;
    /**
     * Length of a day in seconds, intended for use with {@link #now(long)}.
     */
    public static final long DAY = 24 * HOUR;

    /**
     * Returns the time in second based Unix time ({@link System#currentTimeMillis()}/1000)
     */
    public static long now() {
        return System.currentTimeMillis() / 1000;
    }

    /**
     * Same as {@link #now()} + shiftSeconds, but might be more readable.
     */
    public static long now(long shiftSeconds) {
        return (System.currentTimeMillis() / 1000) + shiftSeconds;
    }

    /**
     * Returns the number of full hours since the epoch, rounded down (also for times before the epoch).
     */
    public static long hours(long unixTime) {
        return Math.floorDiv(unixTime, HOUR);
    }
}
