package hle.mcp.toolkit.client;

/**
 * Exception thrown when a connection fails to talk to its server.
 */
public class ConnectionException extends RuntimeException {

    private final boolean retryable;

    public ConnectionException(String message) {
        super(message);
        this.retryable = false;
    }

    public ConnectionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = false;
    }

    public ConnectionException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Returns true if the failure is transient (timeout, dropped link) and the
     * call may succeed on another attempt.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
