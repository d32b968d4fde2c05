package hle.mcp.toolkit.batch;

/**
 * Completes the future of a batched call whose batch failed, or whose result
 * was missing from the executor's answer.
 */
public class BatchExecutionException extends RuntimeException {

    public BatchExecutionException(String message) {
        super(message);
    }

    public BatchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
