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

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Column names of one input, fixed for the lifetime of a run. The number of names is the
 * row width every other row is checked against.
 */
public record Header(List<String> names) {

    public Header {
        names = List.copyOf(names);
    }

    public static Header of(String... names) {
        return new Header(Arrays.asList(names));
    }

    /**
     * Reads the first line of the source as header.
     *
     * @throws EmptyInputException if the source has no line at all
     */
    public static Header read(LineSource source, RowTokenizer tokenizer) throws IOException {
        String line = source.readLine();
        if (line == null) {
            throw new EmptyInputException("Input has no header line");
        }
        return new Header(Arrays.asList(tokenizer.tokenize(line)));
    }

    public int width() {
        return names.size();
    }

    public String name(int column) {
        return names.get(column);
    }

    public boolean matches(String[] row) {
        return row.length == names.size();
    }
}
