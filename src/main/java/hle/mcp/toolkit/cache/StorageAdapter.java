package hle.mcp.toolkit.cache;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Persistent key-value store for serialized cache entries. The cacher treats
 * it as a best-effort mirror of its memory table: failures are logged and
 * never reach callers.
 */
public interface StorageAdapter {

    /**
     * @return the stored value, or empty if absent or past its time-to-live
     */
    Optional<String> get(String key) throws IOException;

    /**
     * @param ttl how long the value stays readable, or null for no limit
     */
    void set(String key, String value, Duration ttl) throws IOException;

    void delete(String key) throws IOException;

    void clear() throws IOException;
}
