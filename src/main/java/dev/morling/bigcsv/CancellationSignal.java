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

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation shared by the producer and all consumers of one run. Every unit
 * checks it between items; once cancelled (explicitly, or because the deadline passed), the
 * next check throws {@link CancellationException}.
 */
public final class CancellationSignal {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;
    private final Duration timeout;
    private volatile String reason;

    private CancellationSignal(Duration timeout) {
        this.timeout = timeout;
        this.deadlineNanos = timeout == null ? NO_DEADLINE : System.nanoTime() + timeout.toNanos();
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null);
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        if (timeout == null) {
            return create();
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        return new CancellationSignal(timeout);
    }

    /**
     * Cancels the run. Only the first reason is kept.
     */
    public void cancel(String reason) {
        synchronized (this) {
            if (this.reason == null) {
                this.reason = reason;
            }
        }
    }

    public boolean isCancelled() {
        if (reason != null) {
            return true;
        }
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos > 0) {
            cancel("timed out after " + timeout);
            return true;
        }
        return false;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason);
        }
    }
}
