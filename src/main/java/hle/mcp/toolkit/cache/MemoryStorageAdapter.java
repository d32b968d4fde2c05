package hle.mcp.toolkit.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link StorageAdapter} backed by a map. Handy in tests and for sharing
 * entries between cachers in one process.
 */
public class MemoryStorageAdapter implements StorageAdapter {

    private final ConcurrentMap<String, StoredValue> store = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        StoredValue stored = store.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (System.currentTimeMillis() >= stored.expiresAt) {
            store.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        long expiresAt = ttl == null ? Long.MAX_VALUE : System.currentTimeMillis() + ttl.toMillis();
        store.put(key, new StoredValue(value, expiresAt));
    }

    @Override
    public void delete(String key) {
        store.remove(key);
    }

    @Override
    public void clear() {
        store.clear();
    }

    public int size() {
        return store.size();
    }

    private static final class StoredValue {
        private final String value;
        private final long expiresAt;

        private StoredValue(String value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
