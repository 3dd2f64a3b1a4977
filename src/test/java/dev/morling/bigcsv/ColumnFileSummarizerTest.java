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
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ColumnFileSummarizerTest {

    @TempDir
    Path tempDir;

    private Path file(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void summarizesOneFile() throws IOException {
        Path path = file("col-0.txt", "a\na\nb\n\n\nc\n");

        ColumnFileSummary summary = ColumnFileSummarizer.summarize(0, "letters", path);

        assertThat(summary.index()).isZero();
        assertThat(summary.name()).isEqualTo("letters");
        assertThat(summary.path()).isEqualTo(path);
        assertThat(summary.valueCount()).isEqualTo(6);
        assertThat(summary.fillCount()).isEqualTo(4);
        assertThat(summary.minLength()).hasValue(0);
        assertThat(summary.maxLength()).hasValue(1);
        assertThat(summary.avgLength().getAsDouble()).isCloseTo(4 / 6.0, within(1e-12));
        assertThat(summary.runs()).isEqualTo(4);
    }

    @Test
    void emptyFile() throws IOException {
        ColumnFileSummary summary = ColumnFileSummarizer.summarize(1, "b", file("col-1.txt", ""));

        assertThat(summary.valueCount()).isZero();
        assertThat(summary.fillCount()).isZero();
        assertThat(summary.minLength()).isEmpty();
        assertThat(summary.maxLength()).isEmpty();
        assertThat(summary.avgLength()).isEmpty();
        assertThat(summary.runs()).isZero();
    }

    @Test
    void summarizesSplitOutputInColumnOrder() throws IOException {
        ColumnFiles files = new ColumnFiles(tempDir.resolve("split"));
        SplitResult result = new ColumnSplitter(ProfilerOptions.builder().workerCount(2).build())
                .split(ReaderLineSource.of(Fixtures.TOY), files);

        List<ColumnFileSummary> summaries = new ColumnFileSummarizer(2).summarize(result.header(), files.paths());

        assertThat(summaries).extracting(ColumnFileSummary::name).containsExactly("a", "b");
        assertThat(summaries.get(0).valueCount()).isEqualTo(2);
        assertThat(summaries.get(0).avgLength()).hasValue(3.5);
        assertThat(summaries.get(1).fillCount()).isEqualTo(1);
        assertThat(summaries.get(1).minLength()).hasValue(0);
        assertThat(summaries.get(1).runs()).isEqualTo(2);
    }

    @Test
    void missingFileFailsRun() {
        Header header = Header.of("a");
        List<Path> paths = List.of(tempDir.resolve("nope.txt"));

        assertThatThrownBy(() -> new ColumnFileSummarizer(1).summarize(header, paths))
                .isInstanceOf(ProfilingException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void fileCountMustMatchHeader() {
        assertThatThrownBy(() -> new ColumnFileSummarizer(1).summarize(Header.of("a", "b"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
