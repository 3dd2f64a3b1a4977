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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Statistics accumulated by one worker. Owned exclusively by that worker until it hands the
 * instance over at the end of its run; afterwards it is only read.
 */
public final class PartialResult {

    private final RowLengthHistogram histogram;
    private final List<ColumnStats> columns;

    private PartialResult(RowLengthHistogram histogram, List<ColumnStats> columns) {
        this.histogram = histogram;
        this.columns = columns;
    }

    public static PartialResult empty(int width, Set<ColumnStatistic> statistics) {
        List<ColumnStats> columns = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            columns.add(new ColumnStats(statistics));
        }
        return new PartialResult(new RowLengthHistogram(), columns);
    }

    /**
     * Tallies one tokenized row. Rows whose width doesn't match the header only count
     * towards the histogram.
     *
     * @return whether the row was used for the column statistics
     */
    public boolean accept(String[] row) {
        histogram.increment(row.length);
        if (row.length != columns.size()) {
            return false;
        }
        for (int j = 0; j < row.length; j++) {
            columns.get(j).accept(row[j]);
        }
        return true;
    }

    PartialResult copy() {
        List<ColumnStats> copies = new ArrayList<>(columns.size());
        for (ColumnStats column : columns) {
            copies.add(column.copy());
        }
        return new PartialResult(histogram.copy(), copies);
    }

    void mergeFrom(PartialResult other) {
        if (other.columns.size() != columns.size()) {
            throw new IllegalArgumentException("Can't merge results of " + other.columns.size() + " columns into " + columns.size());
        }
        histogram.merge(other.histogram);
        for (int j = 0; j < columns.size(); j++) {
            columns.get(j).merge(other.columns.get(j));
        }
    }

    public RowLengthHistogram histogram() {
        return histogram;
    }

    public List<ColumnStats> columns() {
        return Collections.unmodifiableList(columns);
    }

    public int width() {
        return columns.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PartialResult that && histogram.equals(that.histogram) && columns.equals(that.columns));
    }

    @Override
    public int hashCode() {
        return 31 * histogram.hashCode() + columns.hashCode();
    }

    @Override
    public String toString() {
        return "PartialResult[histogram=" + histogram + ", columns=" + columns + "]";
    }
}
