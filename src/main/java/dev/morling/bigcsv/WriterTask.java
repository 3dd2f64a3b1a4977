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
import java.io.Writer;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the queue of one column into that column's sink, one value per line. Batches are
 * written in the order they were queued, so the values keep their input order. The sink is
 * closed when the end marker arrives.
 */
public class WriterTask implements Callable<Long> {

    private static final Logger LOG = LoggerFactory.getLogger(WriterTask.class);

    private final int column;
    private final WorkQueue<List<String>> queue;
    private final Writer sink;
    private final CancellationSignal cancellation;

    private long written;
    private boolean finished;

    public WriterTask(int column, WorkQueue<List<String>> queue, Writer sink, CancellationSignal cancellation) {
        this.column = column;
        this.queue = queue;
        this.sink = sink;
        this.cancellation = cancellation;
    }

    @Override
    public Long call() throws IOException, InterruptedException {
        try {
            while (writeNext()) {
                // until the end marker
            }
            return written;
        }
        catch (IOException | RuntimeException e) {
            cancellation.cancel("writer of column " + column + " failed: " + e);
            closeAfterFailure(e);
            throw e;
        }
    }

    /**
     * Pops and writes one column-batch.
     *
     * @return {@code false} once the end marker was consumed and the sink closed
     */
    public boolean writeNext() throws IOException, InterruptedException {
        if (finished) {
            throw new QueueProtocolException("Writer of column " + column + " already consumed its end marker");
        }
        cancellation.throwIfCancelled();
        QueueItem<List<String>> item = queue.pop();
        try {
            if (item instanceof QueueItem.Data<List<String>> data) {
                for (String value : data.payload()) {
                    sink.write(value);
                    sink.write('\n');
                }
                written += data.payload().size();
                return true;
            }
            finished = true;
            sink.close();
            LOG.debug("[WRITER] column {} closed after {} values", column, written);
            return false;
        }
        finally {
            queue.taskDone();
        }
    }

    private void closeAfterFailure(Exception failure) {
        if (finished) {
            return;
        }
        try {
            sink.close();
        }
        catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    public long written() {
        return written;
    }

    public int column() {
        return column;
    }
}
