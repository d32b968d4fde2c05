package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Connection;
import hle.mcp.toolkit.client.Endpoint;
import hle.mcp.toolkit.model.PromptDefinition;
import hle.mcp.toolkit.model.ResourceDefinition;
import hle.mcp.toolkit.model.ToolCallResult;
import hle.mcp.toolkit.model.ToolDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A connection owned by a {@link ConnectionPool}, together with the
 * bookkeeping the pool needs to age, retire and reuse it.
 *
 * <p>Closing a borrowed {@code PooledConnection} gives it back to its pool, so
 * it can be used with try-with-resources:
 * <pre>{@code
 * try (PooledConnection connection = pool.acquire(endpoint)) {
 *     connection.callTool("search", Map.of("q", "pool"));
 * }
 * }</pre>
 */
public class PooledConnection implements Connection {

    private final Endpoint endpoint;
    private final Connection delegate;
    private final ConnectionPool owner;
    private final Instant createdAt;
    private volatile Instant lastUsedAt;
    private volatile Instant lastHealthCheckAt;
    private volatile boolean healthy = true;
    private final AtomicInteger useCount = new AtomicInteger(0);
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    PooledConnection(Endpoint endpoint, Connection delegate, ConnectionPool owner) {
        this.endpoint = endpoint;
        this.delegate = delegate;
        this.owner = owner;
        this.createdAt = Instant.now();
        this.lastUsedAt = createdAt;
        this.lastHealthCheckAt = createdAt;
    }

    @Override
    public String getId() {
        return delegate.getId();
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Gets the underlying connection produced by the factory.
     */
    public Connection getDelegate() {
        return delegate;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public int getUseCount() {
        return useCount.get();
    }

    public boolean isHealthy() {
        return healthy;
    }

    /**
     * Marks this connection so that it is destroyed instead of pooled when it
     * is released.
     */
    public void markUnhealthy() {
        this.healthy = false;
    }

    public boolean isExpired(Duration maxAge) {
        return Duration.between(createdAt, Instant.now()).compareTo(maxAge) > 0;
    }

    Duration idleFor() {
        return Duration.between(lastUsedAt, Instant.now());
    }

    int recordUse() {
        lastUsedAt = Instant.now();
        return useCount.incrementAndGet();
    }

    boolean isHealthCheckDue(Duration interval) {
        return Duration.between(lastHealthCheckAt, Instant.now()).compareTo(interval) >= 0;
    }

    void recordHealthCheck() {
        lastHealthCheckAt = Instant.now();
    }

    void touch() {
        lastUsedAt = Instant.now();
    }

    /**
     * @return true exactly once, for the caller that must tear the connection down
     */
    boolean markDestroyed() {
        return destroyed.compareAndSet(false, true);
    }

    boolean isDestroyed() {
        return destroyed.get();
    }

    ConnectionPool getOwner() {
        return owner;
    }

    @Override
    public ToolCallResult callTool(String name, Map<String, Object> arguments) {
        touch();
        return delegate.callTool(name, arguments);
    }

    @Override
    public List<ToolDefinition> listTools() {
        touch();
        return delegate.listTools();
    }

    @Override
    public List<ResourceDefinition> listResources() {
        touch();
        return delegate.listResources();
    }

    @Override
    public List<PromptDefinition> listPrompts() {
        touch();
        return delegate.listPrompts();
    }

    @Override
    public boolean ping() {
        return delegate.ping();
    }

    /**
     * Releases this connection back to the pool it was borrowed from.
     */
    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "PooledConnection[id=" + getId() + ", endpoint=" + endpoint + ", uses=" + useCount.get() + "]";
    }
}
