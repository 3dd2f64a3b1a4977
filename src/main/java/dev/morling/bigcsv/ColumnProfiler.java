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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the {@link Profile} of a delimited input.
 * <p>
 * The calling thread reads lines and pushes them in batches onto one shared bounded queue;
 * {@code workerCount} {@link ColumnWorker}s pop from it and accumulate private partial
 * results, which are collated once every worker has seen its end marker. With a single
 * worker everything runs on the calling thread, through an {@link InlineWorkQueue}.
 */
public class ColumnProfiler {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnProfiler.class);

    private static final int QUEUED_BATCHES_PER_WORKER = 4;

    private final ProfilerOptions options;
    private final RowTokenizer tokenizer;

    public ColumnProfiler(ProfilerOptions options) {
        this(options, options.tokenizer());
    }

    public ColumnProfiler(ProfilerOptions options, RowTokenizer tokenizer) {
        this.options = options;
        this.tokenizer = tokenizer;
    }

    public Profile profile(LineSource source) throws IOException {
        return profile(source, options.newCancellationSignal());
    }

    /**
     * @throws EmptyInputException if the source has no header line
     * @throws ProfilingException if a worker failed or the run was cancelled
     */
    public Profile profile(LineSource source, CancellationSignal cancellation) throws IOException {
        Header header = Header.read(source, tokenizer);
        long start = System.nanoTime();
        LOG.debug("[PROFILE] header has {} columns, {}", header.width(), options);

        Profile profile;
        try {
            profile = options.workerCount() == 1
                    ? profileInline(header, source, cancellation)
                    : profileParallel(header, source, cancellation);
        }
        catch (ProfilingException e) {
            LOG.error("[PROFILE] aborted: {}", e.getMessage());
            throw e;
        }

        LOG.info("[PROFILE] {} rows, {} columns, {} workers, {} ms", profile.totalRows(), header.width(), options.workerCount(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        if (profile.malformedRows() > 0) {
            LOG.warn("[PROFILE] {} of {} rows don't have {} fields", profile.malformedRows(), profile.totalRows(), header.width());
        }
        return profile;
    }

    private Profile profileInline(Header header, LineSource source, CancellationSignal cancellation) throws IOException {
        InlineWorkQueue<List<String>> queue = new InlineWorkQueue<>();
        ColumnWorker worker = new ColumnWorker(0, queue, header, tokenizer, options.statistics(), cancellation);
        try {
            Batches<String> batches = new Batches<>(Batches.lines(source), options.batchSize());
            while (batches.hasNext()) {
                queue.push(batches.next());
                worker.processNext();
            }
            queue.close();
            worker.processNext();
        }
        catch (UncheckedIOException e) {
            throw e.getCause();
        }
        catch (CancellationException e) {
            throw new ProfilingException("Profiling cancelled: " + cancellation.reason(), e);
        }
        catch (RuntimeException e) {
            cancellation.cancel("worker 0 failed: " + e);
            throw new ProfilingException("Profiling failed: " + e.getMessage(), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProfilingException("Profiling interrupted", e);
        }
        return Collator.collate(header, List.of(worker.result()), options.averageBasis(), options.statistics());
    }

    private Profile profileParallel(Header header, LineSource source, CancellationSignal cancellation) throws IOException {
        int workers = options.workerCount();
        BlockingWorkQueue<List<String>> queue = new BlockingWorkQueue<>(workers * QUEUED_BATCHES_PER_WORKER, workers, cancellation);
        ExecutorService executor = Workers.newPool(workers, "bigcsv-worker-");
        List<Future<PartialResult>> futures = new ArrayList<>(workers);
        try {
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(new ColumnWorker(i, queue, header, tokenizer, options.statistics(), cancellation)));
            }
            distribute(source, queue, futures, cancellation);
            List<PartialResult> partials = Workers.awaitAll(futures, cancellation, "Profiling");
            return Collator.collate(header, partials, options.averageBasis(), options.statistics());
        }
        finally {
            executor.shutdownNow();
        }
    }

    private void distribute(LineSource source, WorkQueue<List<String>> queue, List<Future<PartialResult>> futures, CancellationSignal cancellation)
            throws IOException {
        try {
            Batches<String> batches = new Batches<>(Batches.lines(source), options.batchSize());
            while (batches.hasNext()) {
                queue.push(batches.next());
            }
            queue.close();
        }
        catch (UncheckedIOException e) {
            cancellation.cancel("input could not be read");
            throw e.getCause();
        }
        catch (CancellationException e) {
            throw Workers.failure(futures, cancellation, "Profiling");
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            throw new ProfilingException("Profiling interrupted", e);
        }
    }
}
