/*
 *  Copyright 2023 The original authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package dev.morling.bigcsv;

import java.util.EnumSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Value-length statistics of one column, accumulated by a single owner.
 * <p>
 * Minimum and maximum are undefined until the first value was seen. Lengths are counted in
 * code points. All statistics are accumulated; the tracked set only decides which of them
 * are reported.
 */
public final class ColumnStats {

    private final Set<ColumnStatistic> tracked;
    private long valueCount;
    private long fillCount;
    private long sumLength;
    private int minLength;
    private int maxLength;

    public ColumnStats(Set<ColumnStatistic> tracked) {
        this.tracked = tracked.isEmpty() ? EnumSet.noneOf(ColumnStatistic.class) : EnumSet.copyOf(tracked);
    }

    public void accept(String value) {
        accept(value.codePointCount(0, value.length()));
    }

    public void accept(int length) {
        if (valueCount == 0) {
            minLength = length;
            maxLength = length;
        }
        else {
            minLength = Math.min(minLength, length);
            maxLength = Math.max(maxLength, length);
        }
        valueCount++;
        sumLength += length;
        if (length > 0) {
            fillCount++;
        }
    }

    /**
     * Adds the values accumulated by {@code other} to this instance.
     */
    public void merge(ColumnStats other) {
        if (!tracked.equals(other.tracked)) {
            throw new IllegalArgumentException("Can't merge statistics tracking " + other.tracked + " into " + tracked);
        }
        if (other.valueCount == 0) {
            return;
        }
        if (valueCount == 0) {
            minLength = other.minLength;
            maxLength = other.maxLength;
        }
        else {
            minLength = Math.min(minLength, other.minLength);
            maxLength = Math.max(maxLength, other.maxLength);
        }
        valueCount += other.valueCount;
        fillCount += other.fillCount;
        sumLength += other.sumLength;
    }

    public ColumnStats copy() {
        ColumnStats copy = new ColumnStats(tracked);
        copy.merge(this);
        return copy;
    }

    public Set<ColumnStatistic> tracked() {
        return tracked;
    }

    public long valueCount() {
        return valueCount;
    }

    public long fillCount() {
        return fillCount;
    }

    public long sumLength() {
        return sumLength;
    }

    public OptionalInt minLength() {
        return valueCount == 0 ? OptionalInt.empty() : OptionalInt.of(minLength);
    }

    public OptionalInt maxLength() {
        return valueCount == 0 ? OptionalInt.empty() : OptionalInt.of(maxLength);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnStats that)) {
            return false;
        }
        return valueCount == that.valueCount && fillCount == that.fillCount && sumLength == that.sumLength
                && minLength().equals(that.minLength()) && maxLength().equals(that.maxLength()) && tracked.equals(that.tracked);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tracked, valueCount, fillCount, sumLength, minLength(), maxLength());
    }

    @Override
    public String toString() {
        return "ColumnStats[values=" + valueCount + ", fill=" + fillCount + ", sum=" + sumLength
                + ", min=" + minLength() + ", max=" + maxLength() + "]";
    }
}
