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
import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a bucket of content: one hour of data from one source with one label. The label may be null for
 * unlabeled content.
 */
public class DataEntityBucketId implements Serializable, Comparable<DataEntityBucketId> {
    private static final long serialVersionUID = 5873419205511827443L;

    private static final Comparator<DataEntityBucketId> ORDER = Comparator
        .comparing(DataEntityBucketId::getTimeBucket)
        .thenComparingInt(id -> id.getSource().getNumber())
        .thenComparing(DataEntityBucketId::getLabel, Comparator.nullsFirst(Comparator.<DataLabel>naturalOrder()));

    private final TimeBucket timeBucket;
    private final DataSource source;
    private final DataLabel label;

    public DataEntityBucketId(TimeBucket timeBucket, DataSource source, DataLabel label) {
        this.timeBucket = Objects.requireNonNull(timeBucket, "timeBucket");
        this.source = Objects.requireNonNull(source, "source");
        this.label = label;
    }

    public TimeBucket getTimeBucket() {
        return timeBucket;
    }

    public DataSource getSource() {
        return source;
    }

    public DataLabel getLabel() {
        return label;
    }

    @Override
    public int compareTo(DataEntityBucketId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataEntityBucketId)) return false;
        DataEntityBucketId that = (DataEntityBucketId) o;
        return timeBucket.equals(that.timeBucket)
            && source == that.source
            && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeBucket, source, label);
    }

    @Override
    public String toString() {
        return timeBucket.getId() + "/" + source + "/" + label;
    }
}
