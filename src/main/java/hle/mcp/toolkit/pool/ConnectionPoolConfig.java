package hle.mcp.toolkit.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link ConnectionPool}.
 * Uses the builder pattern for flexible configuration.
 *
 * <p>{@code maxConnections} is the per-endpoint limit and
 * {@code maxTotalConnections} the limit across all endpoints.
 */
public class ConnectionPoolConfig {

    private final int minConnections;
    private final int maxConnections;
    private final int maxTotalConnections;
    private final Duration idleTimeout;
    private final Duration acquireTimeout;
    private final Duration healthCheckInterval;
    private final Duration maxConnectionAge;
    private final boolean validateOnAcquire;
    private final ConnectionPoolListener listener;

    private ConnectionPoolConfig(Builder builder) {
        this.minConnections = builder.minConnections;
        this.maxConnections = builder.maxConnections;
        this.maxTotalConnections = builder.maxTotalConnections;
        this.idleTimeout = builder.idleTimeout;
        this.acquireTimeout = builder.acquireTimeout;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.maxConnectionAge = builder.maxConnectionAge;
        this.validateOnAcquire = builder.validateOnAcquire;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration suitable for most use cases.
     */
    public static ConnectionPoolConfig defaultConfig() {
        return builder().build();
    }

    public int getMinConnections() {
        return minConnections;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public int getMaxTotalConnections() {
        return maxTotalConnections;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration getMaxConnectionAge() {
        return maxConnectionAge;
    }

    public boolean isValidateOnAcquire() {
        return validateOnAcquire;
    }

    public ConnectionPoolListener getListener() {
        return listener;
    }

    public static class Builder {
        private int minConnections = 0;
        private int maxConnections = 10;
        private int maxTotalConnections = 50;
        private Duration idleTimeout = Duration.ofSeconds(60);
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration maxConnectionAge = Duration.ofMinutes(5);
        private boolean validateOnAcquire = true;
        private ConnectionPoolListener listener = ConnectionPoolListener.NO_OP;

        private Builder() {}

        /**
         * Sets the number of idle connections to keep per endpoint.
         * Default: 0
         */
        public Builder minConnections(int minConnections) {
            if (minConnections < 0) {
                throw new IllegalArgumentException("minConnections must be >= 0");
            }
            this.minConnections = minConnections;
            return this;
        }

        /**
         * Sets the maximum number of connections (idle plus borrowed) per endpoint.
         * Default: 10
         */
        public Builder maxConnections(int maxConnections) {
            if (maxConnections < 1) {
                throw new IllegalArgumentException("maxConnections must be >= 1");
            }
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Sets the maximum number of connections across all endpoints.
         * Default: 50
         */
        public Builder maxTotalConnections(int maxTotalConnections) {
            if (maxTotalConnections < 1) {
                throw new IllegalArgumentException("maxTotalConnections must be >= 1");
            }
            this.maxTotalConnections = maxTotalConnections;
            return this;
        }

        /**
         * Sets how long a connection may stay idle before it is closed.
         * Default: 60 seconds
         */
        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = requirePositive(idleTimeout, "idleTimeout");
            return this;
        }

        /**
         * Sets how long {@code acquire} waits for a connection.
         * Default: 30 seconds
         */
        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = requirePositive(acquireTimeout, "acquireTimeout");
            return this;
        }

        /**
         * Sets how often idle connections are pinged, aged out and topped up.
         * Default: 30 seconds
         */
        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = requirePositive(healthCheckInterval, "healthCheckInterval");
            return this;
        }

        /**
         * Sets the age after which a connection is retired.
         * Default: 5 minutes
         */
        public Builder maxConnectionAge(Duration maxConnectionAge) {
            this.maxConnectionAge = requirePositive(maxConnectionAge, "maxConnectionAge");
            return this;
        }

        /**
         * Whether to ping a connection before handing it out.
         * Default: true
         */
        public Builder validateOnAcquire(boolean validateOnAcquire) {
            this.validateOnAcquire = validateOnAcquire;
            return this;
        }

        public Builder listener(ConnectionPoolListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener cannot be null");
            return this;
        }

        public ConnectionPoolConfig build() {
            if (minConnections > maxConnections) {
                throw new IllegalArgumentException("minConnections cannot be greater than maxConnections");
            }
            if (maxConnections > maxTotalConnections) {
                throw new IllegalArgumentException("maxConnections cannot be greater than maxTotalConnections");
            }
            return new ConnectionPoolConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " cannot be null");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
