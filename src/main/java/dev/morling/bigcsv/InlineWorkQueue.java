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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * {@link WorkQueue} for producer and consumer running on the same thread, one after the
 * other. Since nobody else could ever fill or drain it, an operation that would have to
 * wait fails with {@link QueueProtocolException} instead.
 */
public class InlineWorkQueue<T> implements WorkQueue<T> {

    private final Deque<QueueItem<T>> items = new ArrayDeque<>();
    private final int consumers;
    private long unfinished;
    private boolean closed;

    public InlineWorkQueue() {
        this(1);
    }

    public InlineWorkQueue(int consumers) {
        if (consumers < 1) {
            throw new IllegalArgumentException("At least one consumer is required: " + consumers);
        }
        this.consumers = consumers;
    }

    @Override
    public void push(T payload) {
        if (closed) {
            throw new QueueProtocolException("Can't push to a closed queue");
        }
        items.addLast(QueueItem.data(payload));
        unfinished++;
    }

    @Override
    public QueueItem<T> pop() {
        QueueItem<T> item = items.pollFirst();
        if (item == null) {
            throw new QueueProtocolException(closed
                    ? "All end markers were already consumed"
                    : "Queue is empty and was never closed, pop would block forever");
        }
        return item;
    }

    @Override
    public void close() {
        if (closed) {
            throw new QueueProtocolException("Queue closed twice");
        }
        closed = true;
        for (int i = 0; i < consumers; i++) {
            items.addLast(QueueItem.end());
            unfinished++;
        }
    }

    @Override
    public void taskDone() {
        if (unfinished == 0) {
            throw new QueueProtocolException("taskDone() called more often than items were queued");
        }
        unfinished--;
    }

    @Override
    public boolean awaitDrained(long timeout, TimeUnit unit) {
        if (unfinished > 0) {
            throw new QueueProtocolException(unfinished + " items were never acknowledged");
        }
        return true;
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
        return items.size();
    }
}
