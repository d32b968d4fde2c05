package hle.mcp.toolkit.pool;

/**
 * Thrown to callers of a pool that has been shut down, including callers that
 * were still waiting for a connection when the shutdown happened.
 */
public class PoolShutdownException extends ConnectionPoolException {

    public PoolShutdownException() {
        super("Connection pool is shut down");
    }
}
