package hle.mcp.toolkit.client;

import hle.mcp.toolkit.model.PromptDefinition;
import hle.mcp.toolkit.model.ResourceDefinition;
import hle.mcp.toolkit.model.ToolCallResult;
import hle.mcp.toolkit.model.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapts a {@link ToolClient} to the {@link Connection} contract.
 *
 * <p>Checked failures of the client are rethrown as {@link ConnectionException};
 * I/O failures are marked retryable.
 */
public class ClientConnection implements Connection {

    private static final Logger logger = LoggerFactory.getLogger(ClientConnection.class);

    private final String id;
    private final ToolClient client;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ClientConnection(String id, ToolClient client) {
        this.id = id;
        this.client = client;
    }

    public static ClientConnection wrap(ToolClient client) {
        return wrap(client, "conn-" + UUID.randomUUID().toString().substring(0, 8));
    }

    public static ClientConnection wrap(ToolClient client, String id) {
        Objects.requireNonNull(client, "client cannot be null");
        Objects.requireNonNull(id, "id cannot be null");
        return new ClientConnection(id, client);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public ToolCallResult callTool(String name, Map<String, Object> arguments) {
        return invoke("callTool " + name, () -> client.callTool(name, arguments));
    }

    @Override
    public List<ToolDefinition> listTools() {
        return invoke("listTools", client::listTools);
    }

    @Override
    public List<ResourceDefinition> listResources() {
        return invoke("listResources", client::listResources);
    }

    @Override
    public List<PromptDefinition> listPrompts() {
        return invoke("listPrompts", client::listPrompts);
    }

    @Override
    public boolean ping() {
        if (closed.get()) {
            return false;
        }
        try {
            client.ping();
            return true;
        } catch (Exception e) {
            logger.debug("Ping failed for {}: {}", id, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                client.disconnect();
            } catch (Exception e) {
                throw new ConnectionException("Failed to disconnect " + id, e);
            }
        }
    }

    private <T> T invoke(String operation, Callable<T> call) {
        if (closed.get()) {
            throw new ConnectionException("Connection " + id + " is closed", true);
        }
        try {
            return call.call();
        } catch (ConnectionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException(operation + " interrupted on " + id, e, true);
        } catch (IOException e) {
            throw new ConnectionException(operation + " failed on " + id, e, true);
        } catch (Exception e) {
            throw new ConnectionException(operation + " failed on " + id, e);
        }
    }

    @Override
    public String toString() {
        return "ClientConnection[id=" + id + "]";
    }
}
