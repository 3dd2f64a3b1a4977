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

import java.util.concurrent.TimeUnit;

/**
 * FIFO channel between one producer and a fixed number of consumers.
 * <p>
 * Termination protocol: after the last payload the producer calls {@link #close()}, which
 * enqueues exactly one {@link QueueItem.End} per consumer. A consumer stops pulling as soon
 * as it sees its end marker, so every consumer observes exactly one, and none before all
 * payloads were enqueued. Consumers acknowledge every popped item (end markers included)
 * with {@link #taskDone()}, which lets the producer wait for a complete drain.
 */
public interface WorkQueue<T> {

    /**
     * Enqueues one payload, waiting for space if the queue is bounded.
     *
     * @throws QueueProtocolException if the queue was already closed
     */
    void push(T payload) throws InterruptedException;

    /**
     * Takes the next item, waiting while the queue is empty.
     */
    QueueItem<T> pop() throws InterruptedException;

    /**
     * Enqueues one end marker per consumer.
     *
     * @throws QueueProtocolException if the queue was already closed
     */
    void close() throws InterruptedException;

    /**
     * Acknowledges that a previously popped item has been fully processed.
     */
    void taskDone();

    /**
     * Waits until every enqueued item has been acknowledged.
     *
     * @return {@code false} if the timeout elapsed first
     */
    boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException;

    int consumers();

    boolean isClosed();
}
