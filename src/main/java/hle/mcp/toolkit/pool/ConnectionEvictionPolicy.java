package hle.mcp.toolkit.pool;

import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.EvictionConfig;
import org.apache.commons.pool2.impl.EvictionPolicy;

import java.time.Duration;

/**
 * Decides which idle connections the evictor retires: connections marked
 * unhealthy, connections older than the maximum age, and connections idle past
 * the idle timeout as long as the endpoint keeps more than its minimum.
 */
class ConnectionEvictionPolicy implements EvictionPolicy<PooledConnection> {

    private final Duration idleTimeout;
    private final Duration maxConnectionAge;
    private final int minConnections;

    ConnectionEvictionPolicy(ConnectionPoolConfig config) {
        this.idleTimeout = config.getIdleTimeout();
        this.maxConnectionAge = config.getMaxConnectionAge();
        this.minConnections = config.getMinConnections();
    }

    @Override
    public boolean evict(EvictionConfig config, PooledObject<PooledConnection> underTest, int idleCount) {
        PooledConnection connection = underTest.getObject();
        if (!connection.isHealthy() || connection.isExpired(maxConnectionAge)) {
            return true;
        }
        return idleCount > minConnections && connection.idleFor().compareTo(idleTimeout) > 0;
    }
}
