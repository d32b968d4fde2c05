package hle.mcp.toolkit.batch;

import hle.mcp.toolkit.model.ToolCall;
import hle.mcp.toolkit.model.ToolCallResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A call waiting in the {@link CallBatcher} queue. The sequence number breaks
 * priority ties in arrival order.
 */
final class QueuedCall {

    private final ToolCall call;
    private final int priority;
    private final long sequence;
    private final Instant enqueuedAt;
    private final CompletableFuture<ToolCallResult> result = new CompletableFuture<>();

    QueuedCall(ToolCall call, int priority, long sequence) {
        this.call = call;
        this.priority = priority;
        this.sequence = sequence;
        this.enqueuedAt = Instant.now();
    }

    ToolCall getCall() {
        return call;
    }

    int getPriority() {
        return priority;
    }

    long getSequence() {
        return sequence;
    }

    Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    CompletableFuture<ToolCallResult> getResult() {
        return result;
    }

    /**
     * True if this call must be dispatched before {@code other}.
     */
    boolean precedes(QueuedCall other) {
        if (priority != other.priority) {
            return priority > other.priority;
        }
        return sequence < other.sequence;
    }
}
