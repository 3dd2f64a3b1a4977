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

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Number of rows seen per row width, malformed rows included.
 */
public final class RowLengthHistogram {

    private final TreeMap<Integer, Long> counts = new TreeMap<>();

    public void increment(int width) {
        add(width, 1);
    }

    public void add(int width, long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative count " + count + " for width " + width);
        }
        if (count > 0) {
            counts.merge(width, count, Long::sum);
        }
    }

    public void merge(RowLengthHistogram other) {
        other.counts.forEach(this::add);
    }

    public long count(int width) {
        return counts.getOrDefault(width, 0L);
    }

    public long total() {
        long total = 0;
        for (long count : counts.values()) {
            total += count;
        }
        return total;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public SortedMap<Integer, Long> asMap() {
        return Collections.unmodifiableSortedMap(counts);
    }

    public RowLengthHistogram copy() {
        RowLengthHistogram copy = new RowLengthHistogram();
        copy.merge(this);
        return copy;
    }

    public static RowLengthHistogram of(Map<Integer, Long> counts) {
        RowLengthHistogram histogram = new RowLengthHistogram();
        counts.forEach(histogram::add);
        return histogram;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RowLengthHistogram that && counts.equals(that.counts));
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
