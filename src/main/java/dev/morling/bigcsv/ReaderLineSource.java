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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ReaderLineSource implements LineSource {

    private static final int BUFFER_SIZE = 1024 * 1024;

    private final BufferedReader reader;
    private long linesRead;

    public ReaderLineSource(Reader reader) {
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader, BUFFER_SIZE);
    }

    public static ReaderLineSource of(Path file) throws IOException {
        return of(Files.newInputStream(file));
    }

    /**
     * Reads UTF-8; malformed bytes are replaced with U+FFFD rather than failing the run.
     */
    public static ReaderLineSource of(InputStream in) {
        return new ReaderLineSource(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), BUFFER_SIZE));
    }

    public static ReaderLineSource of(String text) {
        return new ReaderLineSource(new StringReader(text));
    }

    @Override
    public String readLine() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            linesRead++;
        }
        return line;
    }

    public long linesRead() {
        return linesRead;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
