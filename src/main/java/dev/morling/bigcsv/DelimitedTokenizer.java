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
import java.util.List;

/**
 * Naive single-character splitter. Quoted fields are not recognized, so a delimiter inside
 * a value always starts a new field. Trailing empty fields are kept: {@code "1|"} has two
 * fields, {@code ""} has one.
 */
public final class DelimitedTokenizer implements RowTokenizer {

    private final char delimiter;

    public DelimitedTokenizer(char delimiter) {
        if (delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Line terminator can't be used as delimiter");
        }
        this.delimiter = delimiter;
    }

    public char delimiter() {
        return delimiter;
    }

    @Override
    public String[] tokenize(String line) {
        int end = stripTerminator(line);
        List<String> fields = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < end; i++) {
            if (line.charAt(i) == delimiter) {
                fields.add(line.substring(start, i));
                start = i + 1;
            }
        }
        fields.add(line.substring(start, end));
        return fields.toArray(new String[0]);
    }

    private static int stripTerminator(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
            if (end > 0 && line.charAt(end - 1) == '\r') {
                end--;
            }
        }
        return end;
    }
}
