package hle.mcp.toolkit.pool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of a {@link ConnectionPool}.
 */
public class PoolStats {

    private final int total;
    private final int active;
    private final int idle;
    private final int waiting;
    private final long totalCreated;
    private final long totalReused;
    private final long totalDestroyed;
    private final long acquireTimeouts;
    private final long healthCheckFailures;
    private final Map<String, EndpointStats> byEndpoint;

    PoolStats(int active, int idle, int waiting, long totalCreated, long totalReused,
              long totalDestroyed, long acquireTimeouts, long healthCheckFailures,
              Map<String, EndpointStats> byEndpoint) {
        this.total = active + idle;
        this.active = active;
        this.idle = idle;
        this.waiting = waiting;
        this.totalCreated = totalCreated;
        this.totalReused = totalReused;
        this.totalDestroyed = totalDestroyed;
        this.acquireTimeouts = acquireTimeouts;
        this.healthCheckFailures = healthCheckFailures;
        this.byEndpoint = Collections.unmodifiableMap(new LinkedHashMap<>(byEndpoint));
    }

    public int getTotal() {
        return total;
    }

    public int getActive() {
        return active;
    }

    public int getIdle() {
        return idle;
    }

    /**
     * Gets the number of callers blocked in {@code acquire}.
     */
    public int getWaiting() {
        return waiting;
    }

    public long getTotalCreated() {
        return totalCreated;
    }

    /**
     * Gets how many acquisitions were served by a connection that had been used before.
     */
    public long getTotalReused() {
        return totalReused;
    }

    public long getTotalDestroyed() {
        return totalDestroyed;
    }

    public long getAcquireTimeouts() {
        return acquireTimeouts;
    }

    public long getHealthCheckFailures() {
        return healthCheckFailures;
    }

    /**
     * Per-endpoint counts keyed by URL. Empty unless the snapshot came from
     * {@link ConnectionPool#getDetailedStats()}.
     */
    public Map<String, EndpointStats> getByEndpoint() {
        return byEndpoint;
    }

    @Override
    public String toString() {
        return String.format("ConnectionPool[total=%d, active=%d, idle=%d, waiting=%d, created=%d, reused=%d, destroyed=%d]",
                total, active, idle, waiting, totalCreated, totalReused, totalDestroyed);
    }

    public static class EndpointStats {
        private final int idle;
        private final int active;

        EndpointStats(int idle, int active) {
            this.idle = idle;
            this.active = active;
        }

        public int getIdle() {
            return idle;
        }

        public int getActive() {
            return active;
        }

        @Override
        public String toString() {
            return "{idle=" + idle + ", active=" + active + "}";
        }
    }
}
