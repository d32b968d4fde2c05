package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Connection;

/**
 * Work performed with a borrowed connection.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface ConnectionFunction<T> {

    T apply(Connection connection) throws Exception;
}
