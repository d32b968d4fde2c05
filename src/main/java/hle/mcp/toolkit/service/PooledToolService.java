package hle.mcp.toolkit.service;

import hle.mcp.toolkit.batch.BatcherConfig;
import hle.mcp.toolkit.batch.CallBatcher;
import hle.mcp.toolkit.cache.CacherConfig;
import hle.mcp.toolkit.cache.DefinitionCacher;
import hle.mcp.toolkit.client.Connection;
import hle.mcp.toolkit.client.ConnectionFactory;
import hle.mcp.toolkit.client.Endpoint;
import hle.mcp.toolkit.model.PromptDefinition;
import hle.mcp.toolkit.model.ResourceDefinition;
import hle.mcp.toolkit.model.ToolCallResult;
import hle.mcp.toolkit.model.ToolDefinition;
import hle.mcp.toolkit.pool.ConnectionPool;
import hle.mcp.toolkit.pool.ConnectionPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A high-level client for one endpoint that combines the three components:
 * tool calls are batched and fanned out over pooled connections, and listings
 * are cached and fetched over pooled connections.
 *
 * <p><strong>Sizing:</strong>
 * <br>The batch fan-out is bounded by the pool's per-endpoint limit, so a
 * batch never asks for more connections than the pool may open.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (PooledToolService service = new PooledToolService(
 *         Endpoint.of("mcp://search"), endpoint -> openConnection(endpoint))) {
 *     List<ToolDefinition> tools = service.getTools().join();
 *     ToolCallResult result = service.callTool("search", Map.of("q", "pool")).join();
 * }
 * }</pre>
 */
public class PooledToolService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PooledToolService.class);

    private final Endpoint endpoint;
    private final ConnectionPool pool;
    private final CallBatcher batcher;
    private final DefinitionCacher cacher;

    /**
     * Creates a new service.
     *
     * @param endpoint the server every operation goes to
     * @param connectionFactory opens connections to the endpoint
     * @param poolConfig configuration for the connection pool
     * @param batcherConfig configuration for tool call batching
     * @param cacherConfig configuration for listing caching
     */
    public PooledToolService(Endpoint endpoint,
                             ConnectionFactory connectionFactory,
                             ConnectionPoolConfig poolConfig,
                             BatcherConfig batcherConfig,
                             CacherConfig cacherConfig) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
        this.pool = new ConnectionPool(connectionFactory, poolConfig);
        this.batcher = CallBatcher.withBatching(
                (name, arguments) -> pool.withConnection(endpoint, connection -> connection.callTool(name, arguments)),
                batcherConfig,
                poolConfig.getMaxConnections());
        this.cacher = new DefinitionCacher(cacherConfig,
                () -> pool.withConnection(endpoint, Connection::listTools),
                () -> pool.withConnection(endpoint, Connection::listResources),
                () -> pool.withConnection(endpoint, Connection::listPrompts));
    }

    /**
     * Creates a new service with default configuration.
     */
    public PooledToolService(Endpoint endpoint, ConnectionFactory connectionFactory) {
        this(endpoint, connectionFactory,
                ConnectionPoolConfig.defaultConfig(),
                BatcherConfig.defaultConfig(),
                CacherConfig.defaultConfig());
    }

    public CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments) {
        return batcher.call(name, arguments);
    }

    public CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments, int priority) {
        return batcher.call(name, arguments, priority);
    }

    /**
     * Calls a tool without waiting for a batch window.
     */
    public CompletableFuture<ToolCallResult> callToolImmediate(String name, Map<String, Object> arguments) {
        return batcher.callImmediate(name, arguments);
    }

    public CompletableFuture<List<ToolDefinition>> getTools() {
        return cacher.getTools();
    }

    public CompletableFuture<Optional<ToolDefinition>> getTool(String name) {
        return cacher.getTool(name);
    }

    public CompletableFuture<List<ResourceDefinition>> getResources() {
        return cacher.getResources();
    }

    public CompletableFuture<List<PromptDefinition>> getPrompts() {
        return cacher.getPrompts();
    }

    /**
     * Opens the configured minimum of idle connections ahead of the first call.
     */
    public int warmup() {
        return pool.warmup(List.of(endpoint));
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Gets combined statistics from the pool, batcher and cacher.
     */
    public String getStats() {
        return String.format("%s, %s, %s", pool.getStats(), batcher.getStats(), cacher.getStats());
    }

    /**
     * Gets the underlying connection pool (for advanced use cases).
     */
    public ConnectionPool getPool() {
        return pool;
    }

    public CallBatcher getBatcher() {
        return batcher;
    }

    public DefinitionCacher getCacher() {
        return cacher;
    }

    @Override
    public void close() {
        batcher.close();
        cacher.dispose();
        // Wait for borrowed connections to come back before shutting the pool down (with timeout)
        long deadline = System.currentTimeMillis() + 5000;
        while (pool.getStats().getActive() > 0 && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        pool.shutdown();
        logger.info("Tool service for {} closed", endpoint);
    }
}
