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

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link WorkQueue} shared between threads. Bounded when created with a positive capacity,
 * in which case {@link #push(Object)} blocks the producer until a consumer made room.
 * <p>
 * Blocking operations wake up periodically to check the run's {@link CancellationSignal},
 * so neither side can hang on a peer that died.
 */
public class BlockingWorkQueue<T> implements WorkQueue<T> {

    private static final long POLL_INTERVAL_MS = 50;

    private final BlockingQueue<QueueItem<T>> queue;
    private final int consumers;
    private final CancellationSignal cancellation;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private long unfinished;
    private volatile boolean closed;

    /**
     * @param capacity maximum number of queued items, {@code 0} for unbounded. End markers
     *            count against it too, so closing may wait for consumers to make room.
     */
    public BlockingWorkQueue(int capacity, int consumers, CancellationSignal cancellation) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        if (consumers < 1) {
            throw new IllegalArgumentException("At least one consumer is required: " + consumers);
        }
        this.queue = capacity == 0 ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(capacity);
        this.consumers = consumers;
        this.cancellation = cancellation;
    }

    public BlockingWorkQueue(int capacity, int consumers) {
        this(capacity, consumers, CancellationSignal.create());
    }

    @Override
    public void push(T payload) throws InterruptedException {
        if (closed) {
            throw new QueueProtocolException("Can't push to a closed queue");
        }
        enqueue(QueueItem.data(payload));
    }

    @Override
    public QueueItem<T> pop() throws InterruptedException {
        while (true) {
            cancellation.throwIfCancelled();
            QueueItem<T> item = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (item != null) {
                return item;
            }
        }
    }

    @Override
    public void close() throws InterruptedException {
        lock.lock();
        try {
            if (closed) {
                throw new QueueProtocolException("Queue closed twice");
            }
            closed = true;
        }
        finally {
            lock.unlock();
        }
        for (int i = 0; i < consumers; i++) {
            enqueue(QueueItem.end());
        }
    }

    private void enqueue(QueueItem<T> item) throws InterruptedException {
        lock.lock();
        try {
            unfinished++;
        }
        finally {
            lock.unlock();
        }
        boolean added = false;
        try {
            while (!added) {
                cancellation.throwIfCancelled();
                added = queue.offer(item, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            }
        }
        finally {
            if (!added) {
                release(1);
            }
        }
    }

    @Override
    public void taskDone() {
        release(1);
    }

    private void release(long count) {
        lock.lock();
        try {
            if (unfinished < count) {
                throw new QueueProtocolException("taskDone() called more often than items were queued");
            }
            unfinished -= count;
            if (unfinished == 0) {
                drained.signalAll();
            }
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (unfinished > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = drained.awaitNanos(remaining);
            }
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public int consumers() {
        return consumers;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }
}
