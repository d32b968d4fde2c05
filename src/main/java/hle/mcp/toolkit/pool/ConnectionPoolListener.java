package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Connection;

/**
 * Receives connection lifecycle notifications from a {@link ConnectionPool}.
 * All methods default to doing nothing; exceptions thrown by an implementation
 * are logged and otherwise ignored.
 */
public interface ConnectionPoolListener {

    ConnectionPoolListener NO_OP = new ConnectionPoolListener() {
    };

    default void onCreate(Connection connection) {
    }

    /**
     * Called once per destroyed connection, even when closing it failed.
     */
    default void onDestroy(Connection connection) {
    }

    /**
     * Called for failures that have no caller to report to: background top-up,
     * warmup and close failures.
     *
     * @param connection the connection involved, or null if none was created
     */
    default void onError(Throwable error, Connection connection) {
    }
}
