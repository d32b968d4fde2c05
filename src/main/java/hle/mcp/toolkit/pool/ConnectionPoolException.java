package hle.mcp.toolkit.pool;

/**
 * Exception thrown when connection pool operations fail.
 */
public class ConnectionPoolException extends RuntimeException {

    public ConnectionPoolException(String message) {
        super(message);
    }

    public ConnectionPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
