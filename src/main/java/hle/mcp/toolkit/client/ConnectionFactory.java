package hle.mcp.toolkit.client;

/**
 * Opens new connections to an endpoint. May block and may fail.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection create(Endpoint endpoint) throws Exception;
}
