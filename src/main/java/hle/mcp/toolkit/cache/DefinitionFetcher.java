package hle.mcp.toolkit.cache;

import java.util.List;

/**
 * Fetches a full listing from the server, typically through a pooled connection.
 *
 * @param <T> the definition type
 */
@FunctionalInterface
public interface DefinitionFetcher<T> {

    List<T> fetch() throws Exception;
}
