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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pool and future handling shared by the pipelines.
 */
final class Workers {

    private static final Logger LOG = LoggerFactory.getLogger(Workers.class);

    private Workers() {
    }

    static ExecutorService newPool(int threads, String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r);
                    t.setDaemon(true);
                    t.setName(namePrefix + counter.getAndIncrement());
                    return t;
                });
    }

    /**
     * Waits for all futures, in order. If any of them failed the whole run is cancelled and
     * the first real failure is reported, in preference to the cancellations it caused.
     */
    static <T> List<T> awaitAll(List<Future<T>> futures, CancellationSignal cancellation, String what) {
        List<T> results = new ArrayList<>(futures.size());
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        }
        catch (ExecutionException e) {
            cancellation.cancel(what + " failed");
            throw failure(futures, cancellation, what);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            throw new ProfilingException(what + " interrupted", e);
        }
    }

    /**
     * Builds the exception reported for an aborted run, waiting briefly for the other units
     * so that the root cause can be told apart from the cancellations it triggered.
     */
    static ProfilingException failure(List<? extends Future<?>> futures, CancellationSignal cancellation, String what) {
        Throwable cause = null;
        for (Future<?> future : futures) {
            try {
                future.get(1, TimeUnit.SECONDS);
            }
            catch (ExecutionException e) {
                if (!(e.getCause() instanceof CancellationException) && cause == null) {
                    cause = e.getCause();
                }
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            catch (TimeoutException | CancellationException e) {
                LOG.debug("[{}] no outcome to report from {}: {}", what, future, e.toString());
            }
        }
        if (cause != null) {
            return new ProfilingException(what + " failed: " + cause.getMessage(), cause);
        }
        return new ProfilingException(what + " cancelled: " + cancellation.reason());
    }
}
