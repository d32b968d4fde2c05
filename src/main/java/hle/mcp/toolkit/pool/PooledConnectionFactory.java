package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Connection;
import hle.mcp.toolkit.client.ConnectionFactory;
import hle.mcp.toolkit.client.Endpoint;
import org.apache.commons.pool2.BaseKeyedPooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.PooledObjectState;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bridges a {@link ConnectionFactory} to Apache Commons Pool2 and owns the
 * lifecycle side of pooling: counters, listener notifications and teardown.
 */
class PooledConnectionFactory extends BaseKeyedPooledObjectFactory<Endpoint, PooledConnection> {

    private static final Logger logger = LoggerFactory.getLogger(PooledConnectionFactory.class);

    private final ConnectionFactory connectionFactory;
    private final ConnectionPool owner;
    private final ConnectionPoolListener listener;
    private final Duration maxConnectionAge;
    private final Duration healthCheckInterval;

    private final AtomicLong created = new AtomicLong(0);
    private final AtomicLong destroyed = new AtomicLong(0);
    private final AtomicLong healthCheckFailures = new AtomicLong(0);

    PooledConnectionFactory(ConnectionFactory connectionFactory, ConnectionPool owner,
                            ConnectionPoolConfig config) {
        this.connectionFactory = connectionFactory;
        this.owner = owner;
        this.listener = config.getListener();
        this.maxConnectionAge = config.getMaxConnectionAge();
        this.healthCheckInterval = config.getHealthCheckInterval();
    }

    @Override
    public PooledConnection create(Endpoint endpoint) throws Exception {
        Connection connection = Objects.requireNonNull(connectionFactory.create(endpoint),
                "connection factory returned null for " + endpoint);
        PooledConnection pooled = new PooledConnection(endpoint, connection, owner);
        created.incrementAndGet();
        logger.debug("Created connection {} to {}", pooled.getId(), endpoint);
        notifyListener("onCreate", () -> listener.onCreate(connection));
        return pooled;
    }

    @Override
    public PooledObject<PooledConnection> wrap(PooledConnection connection) {
        return new DefaultPooledObject<>(connection);
    }

    @Override
    public boolean validateObject(Endpoint endpoint, PooledObject<PooledConnection> pooledObject) {
        PooledConnection connection = pooledObject.getObject();
        if (!connection.isHealthy() || connection.isExpired(maxConnectionAge)) {
            return false;
        }
        // Evictor runs can be more frequent than the health cadence
        if (pooledObject.getState() == PooledObjectState.EVICTION
                && !connection.isHealthCheckDue(healthCheckInterval)) {
            return true;
        }
        connection.recordHealthCheck();
        boolean alive;
        try {
            alive = connection.ping();
        } catch (RuntimeException e) {
            logger.debug("Ping of {} threw: {}", connection.getId(), e.getMessage());
            alive = false;
        }
        if (!alive) {
            healthCheckFailures.incrementAndGet();
            logger.warn("Health check failed for connection {} to {}", connection.getId(), endpoint);
        }
        return alive;
    }

    @Override
    public void destroyObject(Endpoint endpoint, PooledObject<PooledConnection> pooledObject) {
        destroy(pooledObject.getObject());
    }

    /**
     * Closes the connection once. Close failures are reported to the listener;
     * the destroy counter and {@code onDestroy} always run.
     */
    void destroy(PooledConnection connection) {
        if (!connection.markDestroyed()) {
            return;
        }
        Connection delegate = connection.getDelegate();
        try {
            delegate.close();
        } catch (RuntimeException e) {
            logger.warn("Failed to close connection {}: {}", connection.getId(), e.getMessage());
            reportError(e, delegate);
        } finally {
            destroyed.incrementAndGet();
            logger.debug("Destroyed connection {} to {}", connection.getId(), connection.getEndpoint());
            notifyListener("onDestroy", () -> listener.onDestroy(delegate));
        }
    }

    void reportError(Throwable error, Connection connection) {
        notifyListener("onError", () -> listener.onError(error, connection));
    }

    long getCreatedCount() {
        return created.get();
    }

    long getDestroyedCount() {
        return destroyed.get();
    }

    long getHealthCheckFailures() {
        return healthCheckFailures.get();
    }

    private void notifyListener(String callback, Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.warn("Connection pool listener {} failed: {}", callback, e.getMessage());
        }
    }
}
