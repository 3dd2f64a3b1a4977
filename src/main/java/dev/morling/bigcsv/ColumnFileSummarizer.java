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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarizes column files in parallel, one file per task. Every value of a column file
 * belongs to a row that matched the header, so averages are taken over the file's values.
 */
public class ColumnFileSummarizer {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnFileSummarizer.class);

    private final int workerCount;

    public ColumnFileSummarizer(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        this.workerCount = workerCount;
    }

    /**
     * @param paths column files, in column order
     * @return one summary per file, in the order of {@code paths}
     */
    public List<ColumnFileSummary> summarize(Header header, List<Path> paths) {
        if (paths.size() != header.width()) {
            throw new IllegalArgumentException("Expected " + header.width() + " column files but got " + paths.size());
        }
        CancellationSignal cancellation = CancellationSignal.create();
        ExecutorService executor = Workers.newPool(Math.min(workerCount, Math.max(paths.size(), 1)), "bigcsv-summary-");
        try {
            List<Future<ColumnFileSummary>> futures = new ArrayList<>(paths.size());
            for (int j = 0; j < paths.size(); j++) {
                int column = j;
                futures.add(executor.submit(() -> summarize(column, header.name(column), paths.get(column))));
            }
            return Workers.awaitAll(futures, cancellation, "Summarizing");
        }
        finally {
            executor.shutdownNow();
        }
    }

    public static ColumnFileSummary summarize(int index, String name, Path path) throws IOException {
        ColumnStats stats = new ColumnStats(ColumnStatistic.ALL);
        long runs = 0;
        String previous = null;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String value;
            while ((value = reader.readLine()) != null) {
                stats.accept(value);
                if (!Objects.equals(value, previous)) {
                    runs++;
                    previous = value;
                }
            }
        }
        LOG.debug("[SUMMARY] {} has {} values in {} runs", path, stats.valueCount(), runs);
        OptionalDouble avg = stats.valueCount() == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of((double) stats.sumLength() / stats.valueCount());
        return new ColumnFileSummary(index, name, path, stats.valueCount(), stats.fillCount(), stats.minLength(), stats.maxLength(), avg, runs);
    }
}
