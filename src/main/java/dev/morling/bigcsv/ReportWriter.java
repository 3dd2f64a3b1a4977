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
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Prints run results, either as line-delimited JSON (one record per line, keys sorted) or
 * as plain text. The histogram always comes first, followed by one record per column.
 * Undefined values are written as {@code null}, statistics the run didn't track are left
 * out.
 */
public class ReportWriter {

    public enum Format {
        JSON,
        TEXT;

        public static Format parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            }
            catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown format '" + value + "', expected json or text", e);
            }
        }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final PrintStream out;
    private final Format format;

    public ReportWriter(PrintStream out, Format format) {
        this.out = out;
        this.format = format;
    }

    public void writeProfile(Profile profile) throws IOException {
        writeHistogram(profile.histogram());
        for (ColumnProfile column : profile.columns()) {
            Map<String, Object> record = new TreeMap<>();
            record.put("index", column.index());
            record.put("name", column.name());
            if (profile.tracks(ColumnStatistic.FILL_COUNT)) {
                record.put("fill_count", value(column.fillCount()));
            }
            if (profile.tracks(ColumnStatistic.MIN_LENGTH)) {
                record.put("min_len", value(column.minLength()));
            }
            if (profile.tracks(ColumnStatistic.MAX_LENGTH)) {
                record.put("max_len", value(column.maxLength()));
            }
            if (profile.tracks(ColumnStatistic.AVG_LENGTH)) {
                record.put("avg_len", value(column.avgLength()));
            }
            writeRecord(column.name(), record);
        }
    }

    public void writeSplit(SplitResult result, ColumnFiles files) throws IOException {
        writeHistogram(result.histogram());
        for (int j = 0; j < result.header().width(); j++) {
            Map<String, Object> record = new TreeMap<>();
            record.put("index", j);
            record.put("name", result.header().name(j));
            record.put("values", result.valuesWritten().get(j));
            if (files != null) {
                record.put("path", files.path(j).toString());
            }
            writeRecord(result.header().name(j), record);
        }
    }

    public void writeSummaries(RowLengthHistogram histogram, List<ColumnFileSummary> summaries) throws IOException {
        writeHistogram(histogram);
        for (ColumnFileSummary summary : summaries) {
            Map<String, Object> record = new TreeMap<>();
            record.put("index", summary.index());
            record.put("name", summary.name());
            record.put("_path", summary.path().toString());
            record.put("values", summary.valueCount());
            record.put("fill_count", summary.fillCount());
            record.put("min_len", value(summary.minLength()));
            record.put("max_len", value(summary.maxLength()));
            record.put("avg_len", value(summary.avgLength()));
            record.put("runs", summary.runs());
            writeRecord(summary.name(), record);
        }
    }

    private void writeHistogram(RowLengthHistogram histogram) throws IOException {
        if (format == Format.JSON) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("histogram", histogram.asMap());
            out.println(MAPPER.writeValueAsString(record));
        }
        else {
            out.println(histogram.asMap());
        }
    }

    private void writeRecord(String name, Map<String, Object> record) throws IOException {
        if (format == Format.JSON) {
            out.println(MAPPER.writeValueAsString(record));
            return;
        }
        StringBuilder line = new StringBuilder(name).append(':');
        record.forEach((key, value) -> {
            if (!key.equals("name")) {
                line.append(' ').append(key).append('=').append(text(value));
            }
        });
        out.println(line);
    }

    private static String text(Object value) {
        if (value == null) {
            return "n/a";
        }
        if (value instanceof Double d) {
            return String.format(Locale.ROOT, "%.2f", d);
        }
        return value.toString();
    }

    private static Object value(OptionalLong value) {
        return value.isPresent() ? value.getAsLong() : null;
    }

    private static Object value(OptionalInt value) {
        return value.isPresent() ? value.getAsInt() : null;
    }

    private static Object value(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
