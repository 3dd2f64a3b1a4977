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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ColumnSplitterTest {

    @TempDir
    Path tempDir;

    private static SplitResult split(String input, ProfilerOptions options, ColumnSinkFactory sinks) throws IOException {
        try (LineSource source = ReaderLineSource.of(input)) {
            return new ColumnSplitter(options).split(source, sinks);
        }
    }

    private static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @ValueSource(booleans = { true, false })
    void toyExample(boolean sequential) throws IOException {
        ColumnFiles files = new ColumnFiles(tempDir.resolve("out"));

        SplitResult result = split(Fixtures.TOY, ProfilerOptions.builder().workerCount(2).sequentialSplit(sequential).build(), files);

        assertThat(files.paths()).containsExactly(files.path(0), files.path(1));
        assertThat(read(files.path(0))).isEqualTo("1\nfoobar\n");
        assertThat(read(files.path(1))).isEqualTo("\nbaz\n");
        assertThat(result.histogram().asMap()).isEqualTo(Map.of(1, 1L, 2, 2L));
        assertThat(result.valuesWritten()).containsExactly(2L, 2L);
        assertThat(result.totalRows()).isEqualTo(3);
        assertThat(result.matchingRows()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(booleans = { true, false })
    void valuesKeepInputOrder(boolean sequential) throws IOException {
        String input = Fixtures.randomInput(sequential ? 42 : 43, 6, 10_000);
        ColumnFiles files = new ColumnFiles(tempDir);
        ProfilerOptions options = ProfilerOptions.builder().workerCount(2).sequentialSplit(sequential).batchSize(7).queueCapacity(2).build();

        SplitResult result = split(input, options, files);

        for (int j = 0; j < 6; j++) {
            List<String> expected = Fixtures.columnValues(input, j);
            assertThat(result.valuesWritten().get(j)).isEqualTo((long) expected.size());
            assertThat(read(files.path(j))).isEqualTo(expected.isEmpty() ? "" : String.join("\n", expected) + "\n");
        }
    }

    @Test
    void replayingGivesIdenticalFiles() throws IOException {
        String input = Fixtures.randomInput(7, 4, 5_000);
        ColumnFiles first = new ColumnFiles(tempDir.resolve("first"));
        ColumnFiles second = new ColumnFiles(tempDir.resolve("second"));

        split(input, ProfilerOptions.builder().workerCount(4).batchSize(100).build(), first);
        split(input, ProfilerOptions.builder().workerCount(4).sequentialSplit(true).batchSize(33).build(), second);

        for (int j = 0; j < 4; j++) {
            assertThat(Files.readAllBytes(second.path(j))).isEqualTo(Files.readAllBytes(first.path(j)));
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = { true, false })
    void headerOnlyGivesEmptyFiles(boolean sequential) throws IOException {
        ColumnFiles files = new ColumnFiles(tempDir);

        SplitResult result = split("a|b|c\n", ProfilerOptions.builder().workerCount(2).sequentialSplit(sequential).build(), files);

        assertThat(result.histogram().isEmpty()).isTrue();
        assertThat(result.valuesWritten()).containsExactly(0L, 0L, 0L);
        for (Path path : files.paths()) {
            assertThat(path).exists().isEmptyFile();
        }
    }

    @Test
    void missingHeader() {
        assertThatThrownBy(() -> split("", ProfilerOptions.builder().workerCount(2).build(), new ColumnFiles(tempDir)))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void singleWorkerStillRunsOneWriterPerColumn() throws IOException {
        List<String> threads = new ArrayList<>();
        ColumnSinkFactory sinks = (column, name) -> new StringWriter() {
            @Override
            public void close() throws IOException {
                synchronized (threads) {
                    threads.add(Thread.currentThread().getName());
                }
                super.close();
            }
        };

        split(Fixtures.TOY, ProfilerOptions.builder().workerCount(1).build(), sinks);

        assertThat(threads).hasSize(2).allSatisfy(name -> assertThat(name).startsWith("bigcsv-writer-"));
    }

    @Test
    void partition() {
        RowLengthHistogram histogram = new RowLengthHistogram();
        List<String[]> rows = List.of(
                new String[]{ "1", "" },
                new String[]{ "x" },
                new String[]{ "foobar", "baz" },
                new String[]{ "p", "q", "r" });

        List<List<String>> columns = ColumnSplitter.partition(Header.of("a", "b"), rows, histogram);

        assertThat(columns).containsExactly(List.of("1", "foobar"), List.of("", "baz"));
        assertThat(histogram.asMap()).isEqualTo(Map.of(1, 1L, 2, 2L, 3, 1L));
    }

    @Test
    void partitionWithoutMatchingRows() {
        RowLengthHistogram histogram = new RowLengthHistogram();

        List<List<String>> columns = ColumnSplitter.partition(Header.of("a", "b"), List.<String[]> of(new String[]{ "x" }), histogram);

        assertThat(columns).containsExactly(List.of(), List.of());
        assertThat(histogram.total()).isEqualTo(1);
    }

    @Test
    void failingSinkAbortsParallelSplit() {
        List<Writer> opened = new ArrayList<>();
        ColumnSinkFactory sinks = (column, name) -> {
            Writer writer = column == 1 ? new FailingWriter() : new StringWriter();
            opened.add(writer);
            return writer;
        };
        String input = Fixtures.randomInput(3, 3, 20_000);
        ProfilerOptions options = ProfilerOptions.builder().workerCount(3).batchSize(50).queueCapacity(1).build();

        assertThatThrownBy(() -> split(input, options, sinks))
                .isInstanceOf(ProfilingException.class)
                .hasMessageContaining("no space left")
                .hasCauseInstanceOf(IOException.class);
        assertThat(opened).hasSize(3);
    }

    @Test
    void failingSinkAbortsInlineSplit() {
        ColumnSinkFactory sinks = (column, name) -> column == 0 ? new FailingWriter() : new StringWriter();

        assertThatThrownBy(() -> split(Fixtures.TOY, ProfilerOptions.builder().workerCount(2).sequentialSplit(true).build(), sinks))
                .isInstanceOf(IOException.class)
                .hasMessage("no space left");
    }

    @Test
    void sinkNamesFollowHeader() throws IOException {
        List<String> names = new ArrayList<>();
        ColumnSinkFactory sinks = (column, name) -> {
            names.add(column + "=" + name);
            return new StringWriter();
        };

        split("id|name|city\n1|2|3\n", ProfilerOptions.builder().workerCount(2).sequentialSplit(true).build(), sinks);

        assertThat(names).isEqualTo(Arrays.asList("0=id", "1=name", "2=city"));
    }

    private static class FailingWriter extends Writer {

        @Override
        public void write(char[] buffer, int offset, int length) throws IOException {
            throw new IOException("no space left");
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
