package hle.mcp.toolkit.batch;

import hle.mcp.toolkit.model.ToolCallResult;

import java.util.Map;

/**
 * Performs a single tool call.
 */
@FunctionalInterface
public interface ToolCallFunction {

    ToolCallResult call(String name, Map<String, Object> arguments) throws Exception;
}
