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
import java.util.Locale;
import java.util.Set;

/**
 * Per-column statistics a profiling run can track.
 */
public enum ColumnStatistic {

    FILL_COUNT("fill"),
    MIN_LENGTH("min"),
    MAX_LENGTH("max"),
    AVG_LENGTH("avg");

    public static final Set<ColumnStatistic> ALL = Set.copyOf(EnumSet.allOf(ColumnStatistic.class));

    private final String shortName;

    ColumnStatistic(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }

    /**
     * Parses a comma separated list of short names, e.g. {@code fill,max}.
     */
    public static Set<ColumnStatistic> parseList(String list) {
        EnumSet<ColumnStatistic> statistics = EnumSet.noneOf(ColumnStatistic.class);
        for (String token : list.split(",")) {
            String name = token.trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            statistics.add(fromShortName(name));
        }
        if (statistics.isEmpty()) {
            throw new IllegalArgumentException("No statistics selected in '" + list + "'");
        }
        return statistics;
    }

    private static ColumnStatistic fromShortName(String name) {
        for (ColumnStatistic statistic : values()) {
            if (statistic.shortName.equals(name)) {
                return statistic;
            }
        }
        throw new IllegalArgumentException("Unknown statistic '" + name + "', expected one of fill, min, max, avg");
    }
}
