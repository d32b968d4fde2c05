package hle.mcp.toolkit.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Configuration for {@link DefinitionCacher}.
 *
 * <p>When no fetch executor is given the cacher starts and owns its own
 * thread pool, and shuts it down on {@link DefinitionCacher#dispose()}.
 */
public class CacherConfig {

    private final Duration ttl;
    private final boolean autoRefresh;
    private final Duration autoRefreshBeforeExpiry;
    private final StorageAdapter storage;
    private final CacheUpdateListener updateListener;
    private final ExecutorService fetchExecutor;

    private CacherConfig(Builder builder) {
        this.ttl = builder.ttl;
        this.autoRefresh = builder.autoRefresh;
        this.autoRefreshBeforeExpiry = builder.autoRefreshBeforeExpiry;
        this.storage = builder.storage;
        this.updateListener = builder.updateListener;
        this.fetchExecutor = builder.fetchExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CacherConfig defaultConfig() {
        return builder().build();
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isAutoRefresh() {
        return autoRefresh;
    }

    public Duration getAutoRefreshBeforeExpiry() {
        return autoRefreshBeforeExpiry;
    }

    public Optional<StorageAdapter> getStorage() {
        return Optional.ofNullable(storage);
    }

    public CacheUpdateListener getUpdateListener() {
        return updateListener;
    }

    public Optional<ExecutorService> getFetchExecutor() {
        return Optional.ofNullable(fetchExecutor);
    }

    public static class Builder {
        private Duration ttl = Duration.ofMinutes(5);
        private boolean autoRefresh = false;
        private Duration autoRefreshBeforeExpiry = Duration.ofSeconds(30);
        private StorageAdapter storage;
        private CacheUpdateListener updateListener = CacheUpdateListener.NO_OP;
        private ExecutorService fetchExecutor;

        private Builder() {}

        /**
         * Sets how long a fetched listing is served from memory.
         * Default: 5 minutes
         */
        public Builder ttl(Duration ttl) {
            Objects.requireNonNull(ttl, "ttl cannot be null");
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("ttl must be positive");
            }
            this.ttl = ttl;
            return this;
        }

        /**
         * Whether to refetch listings shortly before they expire.
         * Default: false
         */
        public Builder autoRefresh(boolean autoRefresh) {
            this.autoRefresh = autoRefresh;
            return this;
        }

        /**
         * Sets how long before expiry an auto-refresh starts.
         * Default: 30 seconds
         */
        public Builder autoRefreshBeforeExpiry(Duration autoRefreshBeforeExpiry) {
            Objects.requireNonNull(autoRefreshBeforeExpiry, "autoRefreshBeforeExpiry cannot be null");
            if (autoRefreshBeforeExpiry.isNegative()) {
                throw new IllegalArgumentException("autoRefreshBeforeExpiry must not be negative");
            }
            this.autoRefreshBeforeExpiry = autoRefreshBeforeExpiry;
            return this;
        }

        public Builder storage(StorageAdapter storage) {
            this.storage = storage;
            return this;
        }

        public Builder updateListener(CacheUpdateListener updateListener) {
            this.updateListener = Objects.requireNonNull(updateListener, "updateListener cannot be null");
            return this;
        }

        public Builder fetchExecutor(ExecutorService fetchExecutor) {
            this.fetchExecutor = fetchExecutor;
            return this;
        }

        public CacherConfig build() {
            return new CacherConfig(this);
        }
    }
}
