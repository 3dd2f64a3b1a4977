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
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Tunables shared by the profiling and splitting pipelines.
 */
public final class ProfilerOptions {

    public static final String WORKERS_ENV_VARIABLE = "BIGCSV_WORKERS";

    public static final char DEFAULT_DELIMITER = '|';
    public static final int DEFAULT_BATCH_SIZE = 10_000;
    public static final int DEFAULT_QUEUE_CAPACITY = 16;

    private final char delimiter;
    private final int workerCount;
    private final int batchSize;
    private final int queueCapacity;
    private final AverageBasis averageBasis;
    private final Set<ColumnStatistic> statistics;
    private final Duration timeout;
    private final boolean sequentialSplit;

    private ProfilerOptions(Builder builder) {
        this.delimiter = builder.delimiter;
        this.workerCount = builder.workerCount;
        this.batchSize = builder.batchSize;
        this.queueCapacity = builder.queueCapacity;
        this.averageBasis = builder.averageBasis;
        this.statistics = Set.copyOf(builder.statistics);
        this.timeout = builder.timeout;
        this.sequentialSplit = builder.sequentialSplit;
    }

    public static ProfilerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Worker count used when none is configured: {@value #WORKERS_ENV_VARIABLE} if set,
     * the number of available processors otherwise.
     */
    public static int defaultWorkerCount() {
        String fromEnv = System.getenv(WORKERS_ENV_VARIABLE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            try {
                return Integer.parseInt(fromEnv.trim());
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException(WORKERS_ENV_VARIABLE + " is not a number: " + fromEnv, e);
            }
        }
        return Runtime.getRuntime().availableProcessors();
    }

    public char delimiter() {
        return delimiter;
    }

    public int workerCount() {
        return workerCount;
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Bound of each per-column queue of the splitter, {@code 0} for unbounded.
     */
    public int queueCapacity() {
        return queueCapacity;
    }

    public AverageBasis averageBasis() {
        return averageBasis;
    }

    public Set<ColumnStatistic> statistics() {
        return statistics;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Whether the splitter writes all columns on the calling thread rather than running one
     * writer task per column.
     */
    public boolean sequentialSplit() {
        return sequentialSplit;
    }

    public RowTokenizer tokenizer() {
        return new DelimitedTokenizer(delimiter);
    }

    public CancellationSignal newCancellationSignal() {
        return CancellationSignal.withTimeout(timeout);
    }

    public Builder toBuilder() {
        return new Builder()
                .delimiter(delimiter)
                .workerCount(workerCount)
                .batchSize(batchSize)
                .queueCapacity(queueCapacity)
                .averageBasis(averageBasis)
                .statistics(statistics)
                .timeout(timeout)
                .sequentialSplit(sequentialSplit);
    }

    @Override
    public String toString() {
        return "ProfilerOptions[delimiter='" + delimiter + "', workers=" + workerCount + ", batchSize=" + batchSize
                + ", queueCapacity=" + queueCapacity + ", average=" + averageBasis + ", statistics=" + statistics
                + ", timeout=" + timeout + ", sequentialSplit=" + sequentialSplit + "]";
    }

    public static final class Builder {

        private char delimiter = DEFAULT_DELIMITER;
        private int workerCount = -1;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private AverageBasis averageBasis = AverageBasis.ALL_ROWS;
        private Set<ColumnStatistic> statistics = EnumSet.allOf(ColumnStatistic.class);
        private Duration timeout;
        private boolean sequentialSplit;

        private Builder() {
        }

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder averageBasis(AverageBasis averageBasis) {
            this.averageBasis = averageBasis;
            return this;
        }

        public Builder statistics(Set<ColumnStatistic> statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder sequentialSplit(boolean sequentialSplit) {
            this.sequentialSplit = sequentialSplit;
            return this;
        }

        public ProfilerOptions build() {
            if (workerCount == -1) {
                workerCount = defaultWorkerCount();
            }
            if (workerCount < 1) {
                throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            }
            if (queueCapacity < 0) {
                throw new IllegalArgumentException("Queue capacity must not be negative: " + queueCapacity);
            }
            if (averageBasis == null) {
                throw new IllegalArgumentException("Average basis is required");
            }
            if (statistics == null || statistics.isEmpty()) {
                throw new IllegalArgumentException("At least one statistic must be tracked");
            }
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }
            if (delimiter == '\n' || delimiter == '\r') {
                throw new IllegalArgumentException("Line terminator can't be used as delimiter");
            }
            return new ProfilerOptions(this);
        }
    }
}
