package hle.mcp.toolkit.client;

import hle.mcp.toolkit.model.PromptDefinition;
import hle.mcp.toolkit.model.ResourceDefinition;
import hle.mcp.toolkit.model.ToolCallResult;
import hle.mcp.toolkit.model.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * A live connection to a tool server.
 *
 * <p>Implementations must be safe to hand from one thread to another, but a
 * connection is only ever used by one borrower at a time when it comes from a
 * pool. Transport failures are reported as {@link ConnectionException}.
 */
public interface Connection extends AutoCloseable {

    /**
     * Gets the unique identifier of this connection.
     */
    String getId();

    ToolCallResult callTool(String name, Map<String, Object> arguments);

    List<ToolDefinition> listTools();

    List<ResourceDefinition> listResources();

    List<PromptDefinition> listPrompts();

    /**
     * Checks that the remote side still answers.
     *
     * @return true if the connection is usable
     */
    boolean ping();

    /**
     * Closes the connection. Calling this more than once has no further effect.
     */
    @Override
    void close();
}
