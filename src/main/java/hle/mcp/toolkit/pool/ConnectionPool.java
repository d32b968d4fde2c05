package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Connection;
import hle.mcp.toolkit.client.ConnectionFactory;
import hle.mcp.toolkit.client.Endpoint;
import hle.mcp.toolkit.concurrent.ExecutorUtils;
import hle.mcp.toolkit.concurrent.NamedThreadFactory;
import org.apache.commons.pool2.impl.GenericKeyedObjectPool;
import org.apache.commons.pool2.impl.GenericKeyedObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A thread-safe pool of connections partitioned by endpoint.
 * This class provides a connection-oriented API over Apache Commons Pool2's
 * keyed pool.
 *
 * <p>Key features:
 * <ul>
 *   <li>Per-endpoint and global connection limits</li>
 *   <li>Fair, FIFO hand-off to callers blocked in {@link #acquire(Endpoint)}</li>
 *   <li>Validation on acquire, periodic health checks of idle connections</li>
 *   <li>Retirement of connections past their maximum age or idle timeout</li>
 *   <li>Background top-up of endpoints to their minimum idle count</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * ConnectionPool pool = new ConnectionPool(
 *     endpoint -> openConnection(endpoint.getUrl()),
 *     ConnectionPoolConfig.builder()
 *         .maxConnections(5)
 *         .build()
 * );
 *
 * List<ToolDefinition> tools = pool.withConnection(Endpoint.of("mcp://search"), Connection::listTools);
 *
 * pool.shutdown();
 * }</pre>
 *
 * <p>Idle expiry and max-age retirement run on the Commons Pool evictor
 * thread, at least every half {@code idleTimeout}. The same runs ping idle
 * connections once their last check is {@code healthCheckInterval} old.
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private final ConnectionPoolConfig config;
    private final PooledConnectionFactory lifecycle;
    private final GenericKeyedObjectPool<Endpoint, PooledConnection> internalPool;
    private final Set<PooledConnection> activeConnections = ConcurrentHashMap.newKeySet();
    private final Set<Endpoint> knownEndpoints = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService maintenance;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicLong totalReused = new AtomicLong(0);
    private final AtomicLong acquireTimeouts = new AtomicLong(0);

    /**
     * Creates a new connection pool with the given factory and configuration.
     *
     * @param connectionFactory opens new connections for an endpoint
     * @param config pool configuration
     */
    public ConnectionPool(ConnectionFactory connectionFactory, ConnectionPoolConfig config) {
        Objects.requireNonNull(connectionFactory, "connectionFactory cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.lifecycle = new PooledConnectionFactory(connectionFactory, this, config);
        this.internalPool = new GenericKeyedObjectPool<>(lifecycle, createPoolConfig(config));
        this.internalPool.setEvictionPolicy(new ConnectionEvictionPolicy(config));
        this.internalPool.setSwallowedExceptionListener(e -> {
            logger.warn("Background pool maintenance failed: {}", e.getMessage());
            lifecycle.reportError(e, null);
        });

        if (config.getMinConnections() > 0) {
            this.maintenance = Executors.newSingleThreadScheduledExecutor(
                    new NamedThreadFactory("connection-pool-topup"));
            long interval = config.getHealthCheckInterval().toMillis();
            maintenance.scheduleWithFixedDelay(this::topUp, interval, interval, TimeUnit.MILLISECONDS);
        } else {
            this.maintenance = null;
        }
    }

    /**
     * Creates a new connection pool with default configuration.
     */
    public ConnectionPool(ConnectionFactory connectionFactory) {
        this(connectionFactory, ConnectionPoolConfig.defaultConfig());
    }

    private static GenericKeyedObjectPoolConfig<PooledConnection> createPoolConfig(ConnectionPoolConfig config) {
        GenericKeyedObjectPoolConfig<PooledConnection> poolConfig = new GenericKeyedObjectPoolConfig<>();
        poolConfig.setMinIdlePerKey(config.getMinConnections());
        poolConfig.setMaxIdlePerKey(config.getMaxConnections());
        poolConfig.setMaxTotalPerKey(config.getMaxConnections());
        poolConfig.setMaxTotal(config.getMaxTotalConnections());
        poolConfig.setMaxWait(config.getAcquireTimeout());
        poolConfig.setBlockWhenExhausted(true);
        // Waiters are served in arrival order
        poolConfig.setFairness(true);
        poolConfig.setLifo(false);
        poolConfig.setTestOnBorrow(config.isValidateOnAcquire());
        poolConfig.setTestOnReturn(false);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setTimeBetweenEvictionRuns(evictionInterval(config));
        poolConfig.setMinEvictableIdleDuration(config.getIdleTimeout());
        // Negative means "every idle connection on each run"
        poolConfig.setNumTestsPerEvictionRun(-1);
        poolConfig.setJmxEnabled(true);
        poolConfig.setJmxNamePrefix("connection-pool");
        return poolConfig;
    }

    /**
     * The evictor runs often enough to retire idle connections within half an
     * idle timeout; idle pings still follow {@code healthCheckInterval}.
     */
    static Duration evictionInterval(ConnectionPoolConfig config) {
        Duration halfIdle = config.getIdleTimeout().dividedBy(2);
        if (halfIdle.isZero()) {
            halfIdle = Duration.ofMillis(1);
        }
        Duration health = config.getHealthCheckInterval();
        return health.compareTo(halfIdle) < 0 ? health : halfIdle;
    }

    /**
     * Borrows a connection for the endpoint, waiting up to the configured
     * acquire timeout.
     *
     * @throws AcquireTimeoutException if no connection became available in time
     * @throws PoolShutdownException if the pool is or becomes shut down
     * @throws ConnectionPoolException if a new connection could not be opened
     */
    public PooledConnection acquire(Endpoint endpoint) {
        return acquire(endpoint, config.getAcquireTimeout());
    }

    public PooledConnection acquire(String url) {
        return acquire(Endpoint.of(url));
    }

    /**
     * Borrows a connection for the endpoint with a custom timeout.
     */
    public PooledConnection acquire(Endpoint endpoint, Duration timeout) {
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        ensureOpen();
        knownEndpoints.add(endpoint);

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                throw timedOut(endpoint, timeout);
            }

            PooledConnection connection;
            try {
                connection = internalPool.borrowObject(endpoint, remainingMillis);
            } catch (NoSuchElementException e) {
                if (deadline - System.nanoTime() <= 0) {
                    throw timedOut(endpoint, timeout);
                }
                // A fresh connection failed validation; keep looking
                logger.debug("Discarded connection to {}: {}", endpoint, e.getMessage());
                continue;
            } catch (InterruptedException e) {
                if (closed.get()) {
                    Thread.interrupted();
                    throw new PoolShutdownException();
                }
                Thread.currentThread().interrupt();
                throw new ConnectionPoolException("Interrupted while waiting for a connection to " + endpoint, e);
            } catch (Exception e) {
                if (closed.get()) {
                    throw new PoolShutdownException();
                }
                throw new ConnectionPoolException("Failed to open connection to " + endpoint, e);
            }

            if (connection.isExpired(config.getMaxConnectionAge())) {
                logger.debug("Retiring connection {} past its maximum age", connection.getId());
                invalidateInPool(connection);
                continue;
            }

            if (connection.recordUse() > 1) {
                totalReused.incrementAndGet();
            }
            activeConnections.add(connection);
            if (closed.get()) {
                activeConnections.remove(connection);
                lifecycle.destroy(connection);
                throw new PoolShutdownException();
            }
            return connection;
        }
    }

    /**
     * Returns a borrowed connection to the pool. Connections marked unhealthy or
     * past their maximum age are destroyed instead. A connection this pool did
     * not hand out is closed rather than pooled.
     */
    public void release(Connection connection) {
        if (connection == null) {
            return;
        }
        PooledConnection pooled = untrack(connection);
        if (pooled == null) {
            discardUntracked(connection);
            return;
        }
        if (closed.get()) {
            lifecycle.destroy(pooled);
            return;
        }
        if (!pooled.isHealthy() || pooled.isExpired(config.getMaxConnectionAge())) {
            invalidateInPool(pooled);
            return;
        }
        pooled.touch();
        try {
            internalPool.returnObject(pooled.getEndpoint(), pooled);
        } catch (Exception e) {
            logger.warn("Failed to return connection {} to pool: {}", pooled.getId(), e.getMessage());
            lifecycle.destroy(pooled);
        }
    }

    /**
     * Destroys a borrowed connection instead of returning it to the pool,
     * freeing its slot.
     */
    public void invalidate(Connection connection) {
        if (connection == null) {
            return;
        }
        PooledConnection pooled = untrack(connection);
        if (pooled == null) {
            discardUntracked(connection);
            return;
        }
        if (closed.get()) {
            lifecycle.destroy(pooled);
        } else {
            invalidateInPool(pooled);
        }
    }

    /**
     * Borrows a connection, applies the operation and releases the connection
     * on every exit path.
     *
     * @throws ConnectionPoolException if the connection cannot be acquired or the operation fails
     */
    public <T> T withConnection(Endpoint endpoint, ConnectionFunction<T> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        PooledConnection connection = acquire(endpoint);
        try {
            return operation.apply(connection);
        } catch (ConnectionPoolException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionPoolException("Interrupted while using pooled connection", e);
        } catch (Exception e) {
            throw new ConnectionPoolException("Failed to execute operation with pooled connection", e);
        } finally {
            release(connection);
        }
    }

    public <T> T withConnection(String url, ConnectionFunction<T> operation) {
        return withConnection(Endpoint.of(url), operation);
    }

    /**
     * Opens idle connections for each endpoint up to the configured minimum.
     * Failures are reported to the listener and do not stop the warmup.
     *
     * @return the number of connections opened
     */
    public int warmup(Collection<Endpoint> endpoints) {
        ensureOpen();
        int opened = 0;
        for (Endpoint endpoint : endpoints) {
            knownEndpoints.add(endpoint);
            int deficit = config.getMinConnections()
                    - internalPool.getNumIdle(endpoint) - internalPool.getNumActive(endpoint);
            for (int i = 0; i < deficit; i++) {
                try {
                    long createdBefore = lifecycle.getCreatedCount();
                    internalPool.addObject(endpoint);
                    // addObject creates nothing once a cap is reached
                    opened += (int) (lifecycle.getCreatedCount() - createdBefore);
                } catch (Exception e) {
                    logger.warn("Warmup of {} failed: {}", endpoint, e.getMessage());
                    lifecycle.reportError(e, null);
                }
            }
        }
        logger.info("Warmed up {} connections across {} endpoints", opened, endpoints.size());
        return opened;
    }

    /**
     * Destroys the idle connections of an endpoint and marks its borrowed ones
     * for destruction on release.
     */
    public void removeEndpoint(String url) {
        Endpoint endpoint = Endpoint.of(url);
        knownEndpoints.remove(endpoint);
        for (PooledConnection connection : activeConnections) {
            if (connection.getEndpoint().equals(endpoint)) {
                connection.markUnhealthy();
            }
        }
        try {
            internalPool.clear(endpoint);
        } catch (Exception e) {
            logger.warn("Failed to clear idle connections of {}: {}", endpoint, e.getMessage());
            lifecycle.reportError(e, null);
        }
    }

    public PoolStats getStats() {
        return snapshot(Map.of());
    }

    /**
     * Same as {@link #getStats()} plus idle and active counts per endpoint URL.
     */
    public PoolStats getDetailedStats() {
        Map<String, PoolStats.EndpointStats> byEndpoint = new LinkedHashMap<>();
        Map<String, Integer> activeByUrl = new LinkedHashMap<>();
        for (PooledConnection connection : activeConnections) {
            activeByUrl.merge(connection.getEndpoint().getUrl(), 1, Integer::sum);
        }
        for (Endpoint endpoint : knownEndpoints) {
            int active = activeByUrl.getOrDefault(endpoint.getUrl(), 0);
            byEndpoint.put(endpoint.getUrl(), new PoolStats.EndpointStats(internalPool.getNumIdle(endpoint), active));
        }
        activeByUrl.forEach((url, active) ->
                byEndpoint.putIfAbsent(url, new PoolStats.EndpointStats(0, active)));
        return snapshot(byEndpoint);
    }

    public boolean isShutdown() {
        return closed.get();
    }

    /**
     * Stops background maintenance, fails every waiting caller, closes every
     * idle and borrowed connection and rejects further acquisitions.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (maintenance != null) {
            ExecutorUtils.shutdownGracefully(maintenance, Duration.ofSeconds(5));
        }
        // Interrupts waiters and destroys idle connections
        internalPool.close();
        List<PooledConnection> borrowed = new ArrayList<>(activeConnections);
        for (PooledConnection connection : borrowed) {
            lifecycle.destroy(connection);
        }
        logger.info("Connection pool shut down ({} borrowed connections closed, {} created in total)",
                borrowed.size(), lifecycle.getCreatedCount());
    }

    @Override
    public void close() {
        shutdown();
    }

    private void topUp() {
        for (Endpoint endpoint : knownEndpoints) {
            if (closed.get()) {
                return;
            }
            try {
                internalPool.preparePool(endpoint);
            } catch (Exception e) {
                logger.warn("Failed to top up {} to {} idle connections: {}",
                        endpoint, config.getMinConnections(), e.getMessage());
                lifecycle.reportError(e, null);
            }
        }
    }

    private PoolStats snapshot(Map<String, PoolStats.EndpointStats> byEndpoint) {
        return new PoolStats(
                activeConnections.size(),
                closed.get() ? 0 : internalPool.getNumIdle(),
                closed.get() ? 0 : internalPool.getNumWaiters(),
                lifecycle.getCreatedCount(),
                totalReused.get(),
                lifecycle.getDestroyedCount(),
                acquireTimeouts.get(),
                lifecycle.getHealthCheckFailures(),
                byEndpoint);
    }

    private PooledConnection untrack(Connection connection) {
        if (!(connection instanceof PooledConnection)) {
            return null;
        }
        PooledConnection pooled = (PooledConnection) connection;
        return activeConnections.remove(pooled) ? pooled : null;
    }

    private void discardUntracked(Connection connection) {
        if (connection instanceof PooledConnection && ((PooledConnection) connection).getOwner() == this) {
            // Already released or destroyed; a second release must not touch the idle copy
            logger.warn("Connection {} released more than once", connection.getId());
            return;
        }
        logger.warn("Closing untracked connection {}", connection.getId());
        try {
            connection.close();
        } catch (RuntimeException e) {
            logger.warn("Failed to close untracked connection {}: {}", connection.getId(), e.getMessage());
            lifecycle.reportError(e, connection);
        }
    }

    private void invalidateInPool(PooledConnection connection) {
        try {
            internalPool.invalidateObject(connection.getEndpoint(), connection);
        } catch (Exception e) {
            logger.warn("Failed to invalidate connection {}: {}", connection.getId(), e.getMessage());
            lifecycle.destroy(connection);
        }
    }

    private AcquireTimeoutException timedOut(Endpoint endpoint, Duration timeout) {
        acquireTimeouts.incrementAndGet();
        return new AcquireTimeoutException(endpoint, timeout);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new PoolShutdownException();
        }
    }
}
