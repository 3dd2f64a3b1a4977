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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BigCsvTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String input, String... args) {
        return run(input.getBytes(StandardCharsets.UTF_8), args);
    }

    private int run(byte[] input, String... args) {
        return BigCsv.run(args, new ByteArrayInputStream(input),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private List<String> outLines() {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Test
    void profileFromStdin() {
        assertThat(run(Fixtures.TOY, "--workers=2")).isZero();

        assertThat(outLines()).containsExactly(
                "{\"histogram\":{\"1\":1,\"2\":2}}",
                "{\"avg_len\":2.3333333333333335,\"fill_count\":2,\"index\":0,\"max_len\":6,\"min_len\":1,\"name\":\"a\"}",
                "{\"avg_len\":1.0,\"fill_count\":1,\"index\":1,\"max_len\":3,\"min_len\":0,\"name\":\"b\"}");
    }

    @Test
    void profileFromFileWithOtherDelimiter() throws IOException {
        Path input = Files.writeString(tempDir.resolve("in.csv"), "a,b\n1,\nfoobar,baz\nx\n");

        assertThat(run("", "profile", "--workers=1", "--delimiter=,", "--average=matching", input.toString())).isZero();

        assertThat(outLines()).hasSize(3);
        assertThat(outLines().get(1)).startsWith("{\"avg_len\":3.5,");
    }

    @Test
    void split() throws IOException {
        Path dir = tempDir.resolve("columns");

        assertThat(run(Fixtures.TOY, "split", "--workers=4", "--output-dir=" + dir)).isZero();

        assertThat(Files.readString(dir.resolve("col-0.txt"))).isEqualTo("1\nfoobar\n");
        assertThat(Files.readString(dir.resolve("col-1.txt"))).isEqualTo("\nbaz\n");
        assertThat(outLines()).containsExactly(
                "{\"histogram\":{\"1\":1,\"2\":2}}",
                "{\"index\":0,\"name\":\"a\",\"path\":\"" + dir.resolve("col-0.txt") + "\",\"values\":2}",
                "{\"index\":1,\"name\":\"b\",\"path\":\"" + dir.resolve("col-1.txt") + "\",\"values\":2}");
    }

    @Test
    void summarizeRemovesColumnFiles() {
        Path dir = tempDir.resolve("work");

        assertThat(run(Fixtures.TOY, "summarize", "--workers=2", "--output-dir=" + dir)).isZero();

        assertThat(outLines()).hasSize(3);
        assertThat(outLines().get(1)).endsWith(
                "\"avg_len\":3.5,\"fill_count\":2,\"index\":0,\"max_len\":6,\"min_len\":1,\"name\":\"a\",\"runs\":2,\"values\":2}");
        assertThat(outLines().get(2)).endsWith(
                "\"avg_len\":1.5,\"fill_count\":1,\"index\":1,\"max_len\":3,\"min_len\":0,\"name\":\"b\",\"runs\":2,\"values\":2}");
        assertThat(dir.resolve("col-0.txt")).doesNotExist();
        assertThat(dir.resolve("col-1.txt")).doesNotExist();
    }

    @Test
    void summarizeKeepsColumnFiles() throws IOException {
        Path dir = tempDir.resolve("kept");

        assertThat(run(Fixtures.TOY, "summarize", "--workers=1", "--keep-files", "--output-dir=" + dir, "--format=text")).isZero();

        assertThat(Files.readString(dir.resolve("col-0.txt"))).isEqualTo("1\nfoobar\n");
        assertThat(outLines()).contains("a: _path=" + dir.resolve("col-0.txt")
                + " avg_len=3.50 fill_count=2 index=0 max_len=6 min_len=1 runs=2 values=2");
    }

    @Test
    void malformedUtf8IsReadTheSameFromFileAndStdin() throws IOException {
        byte[] latin1 = "a|b\ncaf\u00e9|x\n".getBytes(StandardCharsets.ISO_8859_1);
        Path input = Files.write(tempDir.resolve("latin1.txt"), latin1);

        assertThat(run(latin1, "--workers=2")).isZero();
        String fromStdin = out.toString(StandardCharsets.UTF_8);
        out.reset();
        assertThat(run(new byte[0], "--workers=2", input.toString())).isZero();
        String fromFile = out.toString(StandardCharsets.UTF_8);

        assertThat(err.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(fromFile).isEqualTo(fromStdin);
        assertThat(fromFile.lines().toList()).containsExactly(
                "{\"histogram\":{\"2\":1}}",
                "{\"avg_len\":4.0,\"fill_count\":1,\"index\":0,\"max_len\":4,\"min_len\":4,\"name\":\"a\"}",
                "{\"avg_len\":1.0,\"fill_count\":1,\"index\":1,\"max_len\":1,\"min_len\":1,\"name\":\"b\"}");
    }

    @Test
    void help() {
        assertThat(run("", "--help")).isZero();

        assertThat(out.toString(StandardCharsets.UTF_8)).startsWith("Usage: bigcsv");
    }

    @Test
    void invalidArguments() {
        assertThat(run("", "--bogus=1")).isEqualTo(2);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("bigcsv: Unknown option --bogus", "Usage: bigcsv");
    }

    @Test
    void emptyInput() {
        assertThat(run("", "--workers=2")).isEqualTo(1);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("bigcsv: Input has no header line");
    }

    @Test
    void missingFile() {
        assertThat(run("", "--workers=1", tempDir.resolve("missing.txt").toString())).isEqualTo(1);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(err.toString(StandardCharsets.UTF_8)).startsWith("bigcsv: ");
    }
}
