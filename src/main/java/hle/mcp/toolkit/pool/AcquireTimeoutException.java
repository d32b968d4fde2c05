package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Endpoint;

import java.time.Duration;

/**
 * Thrown when no connection for an endpoint became available before the
 * acquire deadline.
 */
public class AcquireTimeoutException extends ConnectionPoolException {

    private final Endpoint endpoint;
    private final Duration timeout;

    public AcquireTimeoutException(Endpoint endpoint, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for a connection to " + endpoint);
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
