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
import java.io.Writer;
import java.util.List;

import org.junit.jupiter.api.Test;

class WriterTaskTest {

    @Test
    void writesOneValuePerLineAndClosesSink() throws Exception {
        InlineWorkQueue<List<String>> queue = new InlineWorkQueue<>();
        queue.push(List.of("foo", "bar"));
        queue.push(List.of("baz"));
        queue.close();
        RecordingWriter sink = new RecordingWriter();

        WriterTask task = new WriterTask(0, queue, sink, CancellationSignal.create());

        assertThat(task.call()).isEqualTo(3L);
        assertThat(sink.toString()).isEqualTo("foo\nbar\nbaz\n");
        assertThat(sink.closed).isTrue();
        assertThat(queue.size()).isZero();
    }

    @Test
    void emptyValuesBecomeEmptyLines() throws Exception {
        InlineWorkQueue<List<String>> queue = new InlineWorkQueue<>();
        queue.push(List.of("", "baz", ""));
        queue.close();
        RecordingWriter sink = new RecordingWriter();

        new WriterTask(1, queue, sink, CancellationSignal.create()).call();

        assertThat(sink.toString()).isEqualTo("\nbaz\n\n");
    }

    @Test
    void nothingQueued() throws Exception {
        InlineWorkQueue<List<String>> queue = new InlineWorkQueue<>();
        queue.close();
        RecordingWriter sink = new RecordingWriter();

        assertThat(new WriterTask(0, queue, sink, CancellationSignal.create()).call()).isZero();
        assertThat(sink.toString()).isEmpty();
        assertThat(sink.closed).isTrue();
    }

    @Test
    void sinkFailureCancelsRun() {
        InlineWorkQueue<List<String>> queue = new InlineWorkQueue<>();
        queue.push(List.of("foo"));
        queue.close();
        CancellationSignal cancellation = CancellationSignal.create();
        Writer failing = new RecordingWriter() {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk full");
            }
        };

        assertThatThrownBy(() -> new WriterTask(3, queue, failing, cancellation).call())
                .isInstanceOf(IOException.class)
                .hasMessage("disk full");
        assertThat(cancellation.isCancelled()).isTrue();
        assertThat(cancellation.reason()).contains("column 3");
        assertThat(((RecordingWriter) failing).closed).isTrue();
    }

    @Test
    void noWritesAfterEnd() throws Exception {
        InlineWorkQueue<List<String>> queue = new InlineWorkQueue<>();
        queue.close();
        WriterTask task = new WriterTask(0, queue, new RecordingWriter(), CancellationSignal.create());

        assertThat(task.writeNext()).isFalse();
        assertThatThrownBy(task::writeNext).isInstanceOf(QueueProtocolException.class);
    }

    private static class RecordingWriter extends Writer {

        private final StringBuilder written = new StringBuilder();
        boolean closed;

        @Override
        public void write(char[] buffer, int offset, int length) throws IOException {
            written.append(buffer, offset, length);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public String toString() {
            return written.toString();
        }
    }
}
