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

import java.util.List;
import java.util.Set;

/**
 * Aggregate of all partial results of one profiling run.
 */
public record Profile(Header header, RowLengthHistogram histogram, List<ColumnProfile> columns, AverageBasis averageBasis,
                      Set<ColumnStatistic> statistics) {

    public Profile {
        histogram = histogram.copy();
        columns = List.copyOf(columns);
        statistics = Set.copyOf(statistics);
    }

    public boolean tracks(ColumnStatistic statistic) {
        return statistics.contains(statistic);
    }

    public long totalRows() {
        return histogram.total();
    }

    /**
     * Rows whose width matched the header, the only ones used for column statistics.
     */
    public long matchingRows() {
        return histogram.count(header.width());
    }

    public long malformedRows() {
        return totalRows() - matchingRows();
    }

    /**
     * Whether at least one row contributed to the column statistics. Without such a row,
     * averages are undefined rather than zero.
     */
    public boolean hasData() {
        return matchingRows() > 0;
    }

    public ColumnProfile column(int index) {
        return columns.get(index);
    }
}
