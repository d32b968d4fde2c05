package hle.mcp.toolkit.client;

import hle.mcp.toolkit.model.PromptDefinition;
import hle.mcp.toolkit.model.ResourceDefinition;
import hle.mcp.toolkit.model.ToolCallResult;
import hle.mcp.toolkit.model.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A simulated connection for tests and local experiments.
 * It blocks for a configurable latency on every remote operation and fails
 * with a configurable probability.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable response time (simulates network latency)</li>
 *   <li>Configurable failure rate (simulates server errors)</li>
 *   <li>Switchable health, observed through {@link #ping()}</li>
 *   <li>Fixed tool, resource and prompt listings</li>
 * </ul>
 *
 * <p>{@code callTool} echoes the tool name and arguments back as text.
 */
public class SimulatedConnection implements Connection {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedConnection.class);

    private static final AtomicInteger GLOBAL_REQUEST_COUNT = new AtomicInteger(0);

    private final String id;
    private final String endpoint;
    private final long minLatencyMs;
    private final long maxLatencyMs;
    private final double failureRate;
    private final List<ToolDefinition> tools;
    private final List<ResourceDefinition> resources;
    private final List<PromptDefinition> prompts;
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private final AtomicBoolean failOnClose = new AtomicBoolean(false);
    private final AtomicInteger requestCount = new AtomicInteger(0);
    private final AtomicInteger pingCount = new AtomicInteger(0);
    private final AtomicInteger closeCount = new AtomicInteger(0);

    private SimulatedConnection(Builder builder) {
        this.id = builder.id != null ? builder.id : "sim-" + UUID.randomUUID().toString().substring(0, 8);
        this.endpoint = builder.endpoint;
        this.minLatencyMs = builder.minLatencyMs;
        this.maxLatencyMs = builder.maxLatencyMs;
        this.failureRate = builder.failureRate;
        this.tools = Collections.unmodifiableList(new ArrayList<>(builder.tools));
        this.resources = Collections.unmodifiableList(new ArrayList<>(builder.resources));
        this.prompts = Collections.unmodifiableList(new ArrayList<>(builder.prompts));
        logger.debug("[{}] Opened connection to {}", id, endpoint);
    }

    @Override
    public String getId() {
        return id;
    }

    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public ToolCallResult callTool(String name, Map<String, Object> arguments) {
        simulateRoundTrip("callTool " + name);
        return ToolCallResult.text(name + ":" + (arguments == null ? Map.of() : arguments));
    }

    @Override
    public List<ToolDefinition> listTools() {
        simulateRoundTrip("listTools");
        return tools;
    }

    @Override
    public List<ResourceDefinition> listResources() {
        simulateRoundTrip("listResources");
        return resources;
    }

    @Override
    public List<PromptDefinition> listPrompts() {
        simulateRoundTrip("listPrompts");
        return prompts;
    }

    @Override
    public boolean ping() {
        pingCount.incrementAndGet();
        return connected.get() && healthy.get();
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        if (connected.compareAndSet(true, false)) {
            logger.debug("[{}] Closed after {} requests", id, requestCount.get());
        }
        if (failOnClose.get()) {
            throw new ConnectionException("Simulated close failure on " + id);
        }
    }

    /**
     * Flips the health reported by {@link #ping()}.
     */
    public void setHealthy(boolean healthy) {
        this.healthy.set(healthy);
    }

    /**
     * Makes every later {@link #close()} throw after marking the connection closed.
     */
    public void setFailOnClose(boolean failOnClose) {
        this.failOnClose.set(failOnClose);
    }

    public boolean isConnected() {
        return connected.get();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    public int getPingCount() {
        return pingCount.get();
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    /**
     * Gets the request count across all simulated connections.
     */
    public static int getGlobalRequestCount() {
        return GLOBAL_REQUEST_COUNT.get();
    }

    /**
     * Resets the global request counter (for testing).
     */
    public static void resetGlobalCounter() {
        GLOBAL_REQUEST_COUNT.set(0);
    }

    private void simulateRoundTrip(String operation) {
        if (!connected.get()) {
            throw new ConnectionException("Connection " + id + " is closed", true);
        }
        int global = GLOBAL_REQUEST_COUNT.incrementAndGet();
        int local = requestCount.incrementAndGet();
        logger.debug("[{}] Executing request #{} (global: #{}) on {}: {}",
                id, local, global, Thread.currentThread().getName(), operation);

        long latency = minLatencyMs;
        if (maxLatencyMs > minLatencyMs) {
            latency += ThreadLocalRandom.current().nextLong(maxLatencyMs - minLatencyMs + 1);
        }
        if (latency > 0) {
            try {
                Thread.sleep(latency);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Request interrupted", e, true);
            }
        }

        if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
            logger.debug("[{}] FAILED: {}", id, operation);
            throw new ConnectionException("Simulated server error for " + operation, true);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating SimulatedConnection with fluent API.
     */
    public static class Builder {
        private String id;
        private String endpoint = "mcp://localhost:3000";
        private long minLatencyMs = 0;
        private long maxLatencyMs = 0;
        private double failureRate = 0;
        private final List<ToolDefinition> tools = new ArrayList<>();
        private final List<ResourceDefinition> resources = new ArrayList<>();
        private final List<PromptDefinition> prompts = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder latency(long minMs, long maxMs) {
            if (minMs < 0 || maxMs < minMs) {
                throw new IllegalArgumentException("latency range must satisfy 0 <= min <= max");
            }
            this.minLatencyMs = minMs;
            this.maxLatencyMs = maxMs;
            return this;
        }

        public Builder failureRate(double rate) {
            if (rate < 0 || rate > 1) {
                throw new IllegalArgumentException("failureRate must be between 0 and 1");
            }
            this.failureRate = rate;
            return this;
        }

        public Builder tools(List<ToolDefinition> tools) {
            this.tools.clear();
            this.tools.addAll(tools);
            return this;
        }

        public Builder resources(List<ResourceDefinition> resources) {
            this.resources.clear();
            this.resources.addAll(resources);
            return this;
        }

        public Builder prompts(List<PromptDefinition> prompts) {
            this.prompts.clear();
            this.prompts.addAll(prompts);
            return this;
        }

        public SimulatedConnection build() {
            return new SimulatedConnection(this);
        }
    }
}
