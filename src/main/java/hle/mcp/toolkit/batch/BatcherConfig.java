package hle.mcp.toolkit.batch;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link CallBatcher}.
 */
public class BatcherConfig {

    private final int maxBatchSize;
    private final Duration maxWait;
    private final boolean executeOnFull;
    private final BatchListener listener;
    private final String threadNamePrefix;

    private BatcherConfig(Builder builder) {
        this.maxBatchSize = builder.maxBatchSize;
        this.maxWait = builder.maxWait;
        this.executeOnFull = builder.executeOnFull;
        this.listener = builder.listener;
        this.threadNamePrefix = builder.threadNamePrefix;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BatcherConfig defaultConfig() {
        return builder().build();
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public boolean isExecuteOnFull() {
        return executeOnFull;
    }

    public BatchListener getListener() {
        return listener;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public static class Builder {
        private int maxBatchSize = 10;
        private Duration maxWait = Duration.ofMillis(50);
        private boolean executeOnFull = true;
        private BatchListener listener = BatchListener.NO_OP;
        private String threadNamePrefix = "call-batcher";

        private Builder() {}

        /**
         * Sets the most calls handed to the executor at once.
         * Default: 10
         */
        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize < 1) {
                throw new IllegalArgumentException("maxBatchSize must be >= 1");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        /**
         * Sets the batch window, measured from the first call into an idle queue.
         * Default: 50 milliseconds
         */
        public Builder maxWait(Duration maxWait) {
            Objects.requireNonNull(maxWait, "maxWait cannot be null");
            if (maxWait.isNegative() || maxWait.isZero()) {
                throw new IllegalArgumentException("maxWait must be positive");
            }
            this.maxWait = maxWait;
            return this;
        }

        /**
         * Whether a full queue is flushed without waiting for the window to end.
         * Default: true
         */
        public Builder executeOnFull(boolean executeOnFull) {
            this.executeOnFull = executeOnFull;
            return this;
        }

        public Builder listener(BatchListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener cannot be null");
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
                throw new IllegalArgumentException("threadNamePrefix cannot be blank");
            }
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        public BatcherConfig build() {
            return new BatcherConfig(this);
        }
    }
}
