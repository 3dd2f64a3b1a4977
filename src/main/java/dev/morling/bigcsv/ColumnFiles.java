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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes every column to its own file {@code col-<index>.txt} in one directory.
 */
public class ColumnFiles implements ColumnSinkFactory {

    private static final int BUFFER_SIZE = 256 * 1024;

    private final Path directory;
    private final Map<Integer, Path> opened = new TreeMap<>();

    public ColumnFiles(Path directory) {
        this.directory = directory;
    }

    public static String fileName(int column) {
        return "col-" + column + ".txt";
    }

    public Path path(int column) {
        return directory.resolve(fileName(column));
    }

    @Override
    public synchronized Writer open(int column, String name) throws IOException {
        Files.createDirectories(directory);
        Path path = path(column);
        opened.put(column, path);
        return new BufferedWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8), BUFFER_SIZE);
    }

    /**
     * Files opened so far, in column order.
     */
    public synchronized List<Path> paths() {
        return Collections.unmodifiableList(new ArrayList<>(opened.values()));
    }

    public Path directory() {
        return directory;
    }

    /**
     * Removes all files opened through this instance.
     */
    public synchronized void delete() throws IOException {
        for (Path path : opened.values()) {
            Files.deleteIfExists(path);
        }
        opened.clear();
    }
}
