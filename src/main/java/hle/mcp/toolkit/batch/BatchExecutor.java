package hle.mcp.toolkit.batch;

import hle.mcp.toolkit.model.ToolCall;
import hle.mcp.toolkit.model.ToolCallResult;

import java.util.List;

/**
 * Executes one batch of calls, typically over a pooled connection.
 *
 * <p>The returned list must be in the same order as {@code calls}. A missing or
 * null entry fails only the call at that index; throwing fails the whole batch.
 */
@FunctionalInterface
public interface BatchExecutor {

    List<ToolCallResult> execute(List<ToolCall> calls) throws Exception;
}
