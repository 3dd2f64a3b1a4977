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

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer of the profiling queue. Tokenizes every line of the batches it pops and
 * accumulates them into a private {@link PartialResult}, which it hands out once it has seen
 * its end marker.
 */
public class ColumnWorker implements Callable<PartialResult> {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnWorker.class);

    private final int id;
    private final WorkQueue<List<String>> queue;
    private final RowTokenizer tokenizer;
    private final CancellationSignal cancellation;
    private final PartialResult result;

    private boolean finished;
    private long rows;
    private long malformed;

    public ColumnWorker(int id, WorkQueue<List<String>> queue, Header header, RowTokenizer tokenizer, Set<ColumnStatistic> statistics,
                        CancellationSignal cancellation) {
        this.id = id;
        this.queue = queue;
        this.tokenizer = tokenizer;
        this.cancellation = cancellation;
        this.result = PartialResult.empty(header.width(), statistics);
    }

    @Override
    public PartialResult call() throws InterruptedException {
        try {
            while (processNext()) {
                // keep pulling until the end marker
            }
        }
        catch (RuntimeException e) {
            cancellation.cancel("worker " + id + " failed: " + e);
            throw e;
        }
        return result();
    }

    /**
     * Pops and processes one item.
     *
     * @return {@code false} once the end marker was consumed
     */
    public boolean processNext() throws InterruptedException {
        if (finished) {
            throw new QueueProtocolException("Worker " + id + " already consumed its end marker");
        }
        cancellation.throwIfCancelled();
        QueueItem<List<String>> item = queue.pop();
        try {
            if (item instanceof QueueItem.Data<List<String>> data) {
                for (String line : data.payload()) {
                    rows++;
                    if (!result.accept(tokenizer.tokenize(line))) {
                        malformed++;
                    }
                }
                return true;
            }
            finished = true;
            LOG.debug("[PROFILE] worker {} done, {} rows, {} malformed", id, rows, malformed);
            return false;
        }
        finally {
            queue.taskDone();
        }
    }

    /**
     * The accumulated statistics, available once the end marker was consumed.
     */
    public PartialResult result() {
        if (!finished) {
            throw new QueueProtocolException("Worker " + id + " has not seen its end marker yet");
        }
        return result;
    }

    public long rows() {
        return rows;
    }
}
