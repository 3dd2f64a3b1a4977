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

import java.util.Locale;

/**
 * Row count the summed value lengths of a column are divided by.
 */
public enum AverageBasis {

    /**
     * Every row read, malformed ones included.
     */
    ALL_ROWS,

    /**
     * Only rows whose width matches the header, i.e. the rows that contributed values.
     */
    MATCHING_ROWS;

    public static AverageBasis parse(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all":
            case "all_rows":
                return ALL_ROWS;
            case "matching":
            case "matching_rows":
                return MATCHING_ROWS;
            default:
                throw new IllegalArgumentException("Unknown average basis '" + value + "', expected all or matching");
        }
    }
}
