package hle.mcp.toolkit.client;

import hle.mcp.toolkit.model.PromptDefinition;
import hle.mcp.toolkit.model.ResourceDefinition;
import hle.mcp.toolkit.model.ToolCallResult;
import hle.mcp.toolkit.model.ToolDefinition;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Minimal surface of a third-party tool client. Only {@link #callTool} and
 * {@link #listTools} are required; the remaining operations default to
 * "not supported" answers. Use {@link ClientConnection#wrap(ToolClient)} to
 * turn one into a poolable {@link Connection}.
 */
public interface ToolClient {

    ToolCallResult callTool(String name, Map<String, Object> arguments) throws Exception;

    List<ToolDefinition> listTools() throws Exception;

    default List<ResourceDefinition> listResources() throws Exception {
        return Collections.emptyList();
    }

    default List<PromptDefinition> listPrompts() throws Exception {
        return Collections.emptyList();
    }

    /**
     * Throws if the server does not answer. The default assumes it does.
     */
    default void ping() throws Exception {
    }

    default void disconnect() throws Exception {
    }
}
