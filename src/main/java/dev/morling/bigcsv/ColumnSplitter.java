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
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes every column of a delimited input into a sink of its own.
 * <p>
 * Rows are read in batches; each batch is partitioned into one column-batch per column and
 * every non-empty column-batch is queued for that column's {@link WriterTask}. Rows whose
 * width doesn't match the header are only counted. Batching amortizes the queue hand-off
 * over many rows; the batch size trades memory for throughput. One writer task runs per
 * column regardless of the worker count; with {@link ProfilerOptions#sequentialSplit()} all
 * columns are written on the calling thread instead.
 */
public class ColumnSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnSplitter.class);

    private static final long DRAIN_POLL_MS = 100;

    private final ProfilerOptions options;
    private final RowTokenizer tokenizer;

    public ColumnSplitter(ProfilerOptions options) {
        this(options, options.tokenizer());
    }

    public ColumnSplitter(ProfilerOptions options, RowTokenizer tokenizer) {
        this.options = options;
        this.tokenizer = tokenizer;
    }

    public SplitResult split(LineSource source, ColumnSinkFactory sinks) throws IOException {
        return split(source, sinks, options.newCancellationSignal());
    }

    /**
     * @throws EmptyInputException if the source has no header line
     * @throws ProfilingException if a writer failed or the run was cancelled
     */
    public SplitResult split(LineSource source, ColumnSinkFactory sinks, CancellationSignal cancellation) throws IOException {
        Header header = Header.read(source, tokenizer);
        long start = System.nanoTime();
        List<Writer> writers = open(header, sinks);

        SplitResult result;
        try {
            result = options.sequentialSplit()
                    ? splitInline(header, source, writers, cancellation)
                    : splitParallel(header, source, writers, cancellation);
        }
        catch (ProfilingException e) {
            LOG.error("[SPLIT] aborted: {}", e.getMessage());
            throw e;
        }

        LOG.info("[SPLIT] {} rows into {} columns, {} ms", result.totalRows(), header.width(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        if (result.matchingRows() < result.totalRows()) {
            LOG.warn("[SPLIT] skipped {} of {} rows not having {} fields", result.totalRows() - result.matchingRows(), result.totalRows(),
                    header.width());
        }
        return result;
    }

    /**
     * Splits one batch of rows into per-column value lists, counting every row in the
     * histogram. Rows of the wrong width contribute no values.
     */
    public static List<List<String>> partition(Header header, List<String[]> rows, RowLengthHistogram histogram) {
        int width = header.width();
        List<List<String>> columns = new ArrayList<>(width);
        for (int j = 0; j < width; j++) {
            columns.add(new ArrayList<>(rows.size()));
        }
        for (String[] row : rows) {
            histogram.increment(row.length);
            if (row.length != width) {
                continue;
            }
            for (int j = 0; j < width; j++) {
                columns.get(j).add(row[j]);
            }
        }
        return columns;
    }

    private SplitResult splitInline(Header header, LineSource source, List<Writer> writers, CancellationSignal cancellation) throws IOException {
        List<InlineWorkQueue<List<String>>> queues = new ArrayList<>(header.width());
        List<WriterTask> tasks = new ArrayList<>(header.width());
        for (int j = 0; j < header.width(); j++) {
            InlineWorkQueue<List<String>> queue = new InlineWorkQueue<>();
            queues.add(queue);
            tasks.add(new WriterTask(j, queue, writers.get(j), cancellation));
        }

        RowLengthHistogram histogram = new RowLengthHistogram();
        try {
            Batches<String[]> batches = rowBatches(source);
            while (batches.hasNext()) {
                List<List<String>> columns = partition(header, batches.next(), histogram);
                for (int j = 0; j < columns.size(); j++) {
                    if (!columns.get(j).isEmpty()) {
                        queues.get(j).push(columns.get(j));
                        tasks.get(j).writeNext();
                    }
                }
            }
            for (int j = 0; j < queues.size(); j++) {
                queues.get(j).close();
                tasks.get(j).writeNext();
                queues.get(j).awaitDrained(0, TimeUnit.MILLISECONDS);
            }
        }
        catch (UncheckedIOException e) {
            closeAll(writers, e.getCause());
            throw e.getCause();
        }
        catch (IOException | RuntimeException e) {
            closeAll(writers, e);
            if (e instanceof CancellationException) {
                throw new ProfilingException("Splitting cancelled: " + cancellation.reason(), e);
            }
            throw e;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProfilingException("Splitting interrupted", e);
        }

        List<Long> written = new ArrayList<>(tasks.size());
        for (WriterTask task : tasks) {
            written.add(task.written());
        }
        return new SplitResult(header, histogram, written);
    }

    private SplitResult splitParallel(Header header, LineSource source, List<Writer> writers, CancellationSignal cancellation) throws IOException {
        int width = header.width();
        List<BlockingWorkQueue<List<String>>> queues = new ArrayList<>(width);
        ExecutorService executor = Workers.newPool(width, "bigcsv-writer-");
        List<Future<Long>> futures = new ArrayList<>(width);
        try {
            for (int j = 0; j < width; j++) {
                BlockingWorkQueue<List<String>> queue = new BlockingWorkQueue<>(options.queueCapacity(), 1, cancellation);
                queues.add(queue);
                futures.add(executor.submit(new WriterTask(j, queue, writers.get(j), cancellation)));
            }

            RowLengthHistogram histogram = populate(header, source, queues, futures, cancellation);
            awaitDrained(queues, futures, cancellation);
            List<Long> written = Workers.awaitAll(futures, cancellation, "Splitting");
            return new SplitResult(header, histogram, written);
        }
        finally {
            executor.shutdownNow();
        }
    }

    private RowLengthHistogram populate(Header header, LineSource source, List<? extends WorkQueue<List<String>>> queues, List<Future<Long>> futures,
                                        CancellationSignal cancellation)
            throws IOException {
        RowLengthHistogram histogram = new RowLengthHistogram();
        try {
            Batches<String[]> batches = rowBatches(source);
            while (batches.hasNext()) {
                List<List<String>> columns = partition(header, batches.next(), histogram);
                for (int j = 0; j < columns.size(); j++) {
                    if (!columns.get(j).isEmpty()) {
                        queues.get(j).push(columns.get(j));
                    }
                }
            }
            for (WorkQueue<List<String>> queue : queues) {
                queue.close();
            }
            return histogram;
        }
        catch (UncheckedIOException e) {
            cancellation.cancel("input could not be read");
            throw e.getCause();
        }
        catch (CancellationException e) {
            throw Workers.failure(futures, cancellation, "Splitting");
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            throw new ProfilingException("Splitting interrupted", e);
        }
    }

    /**
     * Waits until every queue, not just the last one fed, has been fully acknowledged.
     */
    private static void awaitDrained(List<? extends WorkQueue<List<String>>> queues, List<Future<Long>> futures, CancellationSignal cancellation) {
        try {
            for (int j = 0; j < queues.size(); j++) {
                while (!queues.get(j).awaitDrained(DRAIN_POLL_MS, TimeUnit.MILLISECONDS)) {
                    if (futures.get(j).isDone() || cancellation.isCancelled()) {
                        cancellation.cancel("writer of column " + j + " stopped before draining its queue");
                        throw Workers.failure(futures, cancellation, "Splitting");
                    }
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            throw new ProfilingException("Splitting interrupted", e);
        }
    }

    private Batches<String[]> rowBatches(LineSource source) {
        return new Batches<>(Batches.map(Batches.lines(source), tokenizer::tokenize), options.batchSize());
    }

    private static List<Writer> open(Header header, ColumnSinkFactory sinks) throws IOException {
        List<Writer> writers = new ArrayList<>(header.width());
        try {
            for (int j = 0; j < header.width(); j++) {
                writers.add(sinks.open(j, header.name(j)));
            }
        }
        catch (IOException | RuntimeException e) {
            closeAll(writers, e);
            throw e;
        }
        return writers;
    }

    private static void closeAll(List<Writer> writers, Exception failure) {
        for (Writer writer : writers) {
            try {
                writer.close();
            }
            catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
