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
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Merges partial results into the final {@link Profile}.
 * <p>
 * Histograms, fill counts and length sums are added, minima and maxima combined. All of
 * these are associative and commutative, hence the result doesn't depend on how rows were
 * distributed among workers nor on the order partials arrive in.
 */
public final class Collator {

    private Collator() {
    }

    /**
     * Pure merge of two partials; neither argument is modified.
     */
    public static PartialResult merge(PartialResult left, PartialResult right) {
        PartialResult merged = left.copy();
        merged.mergeFrom(right);
        return merged;
    }

    public static Profile collate(Header header, Collection<PartialResult> partials, AverageBasis basis, Set<ColumnStatistic> statistics) {
        PartialResult total = PartialResult.empty(header.width(), statistics);
        for (PartialResult partial : partials) {
            total.mergeFrom(partial);
        }
        return toProfile(header, total, basis, statistics);
    }

    public static Profile collate(Header header, Collection<PartialResult> partials) {
        return collate(header, partials, AverageBasis.ALL_ROWS, ColumnStatistic.ALL);
    }

    static Profile toProfile(Header header, PartialResult total, AverageBasis basis, Set<ColumnStatistic> statistics) {
        RowLengthHistogram histogram = total.histogram();
        long matchingRows = histogram.count(header.width());
        long denominator = basis == AverageBasis.ALL_ROWS ? histogram.total() : matchingRows;

        List<ColumnProfile> columns = new ArrayList<>(header.width());
        for (int j = 0; j < header.width(); j++) {
            ColumnStats stats = total.columns().get(j);
            Set<ColumnStatistic> tracked = stats.tracked();
            columns.add(new ColumnProfile(
                    j,
                    header.name(j),
                    tracked.contains(ColumnStatistic.FILL_COUNT) ? OptionalLong.of(stats.fillCount()) : OptionalLong.empty(),
                    tracked.contains(ColumnStatistic.MIN_LENGTH) ? stats.minLength() : OptionalInt.empty(),
                    tracked.contains(ColumnStatistic.MAX_LENGTH) ? stats.maxLength() : OptionalInt.empty(),
                    tracked.contains(ColumnStatistic.AVG_LENGTH) && matchingRows > 0
                            ? OptionalDouble.of((double) stats.sumLength() / denominator)
                            : OptionalDouble.empty()));
        }
        return new Profile(header, histogram, columns, basis, statistics);
    }
}
