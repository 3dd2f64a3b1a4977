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
import java.util.Random;

final class Fixtures {

    static final String TOY = "a|b\n"
            + "1|\n"
            + "foobar|baz\n"
            + "x";

    private Fixtures() {
    }

    /**
     * Pipe delimited input with {@code width} columns; roughly one row in ten has a wrong
     * width, values are between 0 and 12 characters long.
     */
    static String randomInput(long seed, int width, int rows) {
        Random random = new Random(seed);
        StringBuilder input = new StringBuilder();
        for (int j = 0; j < width; j++) {
            input.append(j == 0 ? "" : "|").append("c").append(j);
        }
        input.append('\n');
        for (int i = 0; i < rows; i++) {
            int fields = random.nextInt(10) == 0 ? 1 + random.nextInt(width + 2) : width;
            for (int j = 0; j < fields; j++) {
                if (j > 0) {
                    input.append('|');
                }
                int length = random.nextInt(4) == 0 ? 0 : random.nextInt(13);
                for (int k = 0; k < length; k++) {
                    input.append((char) ('a' + random.nextInt(26)));
                }
            }
            input.append('\n');
        }
        return input.toString();
    }

    /**
     * Values of one column, taken from the rows of {@code input} that have the header's
     * width, in input order.
     */
    static List<String> columnValues(String input, int column) {
        DelimitedTokenizer tokenizer = new DelimitedTokenizer('|');
        String[] lines = input.split("\n", -1);
        int width = tokenizer.tokenize(lines[0]).length;
        List<String> values = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            if (i == lines.length - 1 && lines[i].isEmpty()) {
                break;
            }
            String[] row = tokenizer.tokenize(lines[i]);
            if (row.length == width) {
                values.add(row[column]);
            }
        }
        return values;
    }
}
