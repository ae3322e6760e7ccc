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

/**
 * The platforms content can be scraped from. The numbers are used on the wire and in the database and must
 * never change.
 */
public enum DataSource {
    REDDIT(1),
    X(2),
    YOUTUBE(3);

    private final int number;

    DataSource(int number) {
        this.number = number;
    }

    public static DataSource fromNumber(long number) {
        for (DataSource source : values()) {
            if (source.number == number) return source;
        }
        throw new IllegalArgumentException("Unknown data source " + number);
    }

    public int getNumber() {
        return number;
    }
}
