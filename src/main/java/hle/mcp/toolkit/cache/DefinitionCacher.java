package hle.mcp.toolkit.cache;

import hle.mcp.toolkit.concurrent.NamedThreadFactory;
import hle.mcp.toolkit.model.PromptDefinition;
import hle.mcp.toolkit.model.ResourceDefinition;
import hle.mcp.toolkit.model.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches the tool, resource and prompt listings of a server so that callers
 * do not pay a round trip for data that rarely changes.
 *
 * <p>Key features:
 * <ul>
 *   <li>Time-to-live expiry with optional refresh shortly before expiry</li>
 *   <li>At most one fetch in flight per listing; concurrent misses join it</li>
 *   <li>Stale-while-revalidate lookups that never wait on the network</li>
 *   <li>Optional {@link StorageAdapter} mirror that survives restarts</li>
 * </ul>
 *
 * <p>Foreground fetch failures reach the caller and cache nothing. Background
 * refresh failures are logged and leave the existing entry in place.
 *
 * <p>Example usage:
 * <pre>{@code
 * DefinitionCacher cacher = new DefinitionCacher(
 *     CacherConfig.builder().ttl(Duration.ofMinutes(1)).build(),
 *     () -> pool.withConnection(endpoint, Connection::listTools),
 *     null,
 *     null
 * );
 *
 * List<ToolDefinition> tools = cacher.getTools().join();
 * }</pre>
 */
public class DefinitionCacher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionCacher.class);

    private final CacherConfig config;
    private final CacheEntryCodec codec = new CacheEntryCodec();
    private final Slot<ToolDefinition> tools;
    private final Slot<ResourceDefinition> resources;
    private final Slot<PromptDefinition> prompts;
    private final StorageAdapter storage;
    private final ExecutorService fetchExecutor;
    private final boolean ownsFetchExecutor;
    private final ScheduledExecutorService refreshScheduler;

    // Guards the mutable state of every slot
    private final ReentrantLock lock = new ReentrantLock();
    private boolean disposed;

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);

    /**
     * Creates a cacher. Any fetcher may be null, in which case lookups of that
     * kind fail with {@link IllegalStateException}.
     */
    public DefinitionCacher(CacherConfig config,
                            DefinitionFetcher<ToolDefinition> fetchTools,
                            DefinitionFetcher<ResourceDefinition> fetchResources,
                            DefinitionFetcher<PromptDefinition> fetchPrompts) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.tools = new Slot<>(DefinitionKind.TOOLS, ToolDefinition.class, fetchTools);
        this.resources = new Slot<>(DefinitionKind.RESOURCES, ResourceDefinition.class, fetchResources);
        this.prompts = new Slot<>(DefinitionKind.PROMPTS, PromptDefinition.class, fetchPrompts);
        this.storage = config.getStorage().orElse(null);

        Optional<ExecutorService> executor = config.getFetchExecutor();
        this.ownsFetchExecutor = executor.isEmpty();
        this.fetchExecutor = executor.orElseGet(
                () -> Executors.newCachedThreadPool(new NamedThreadFactory("definition-cacher-fetch")));
        this.refreshScheduler = config.isAutoRefresh()
                ? Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("definition-cacher-refresh"))
                : null;
    }

    public CompletableFuture<List<ToolDefinition>> getTools() {
        return getTools(FetchOptions.defaults());
    }

    public CompletableFuture<List<ToolDefinition>> getTools(FetchOptions options) {
        return get(configured(tools), options);
    }

    public CompletableFuture<List<ResourceDefinition>> getResources() {
        return getResources(FetchOptions.defaults());
    }

    public CompletableFuture<List<ResourceDefinition>> getResources(FetchOptions options) {
        return get(configured(resources), options);
    }

    public CompletableFuture<List<PromptDefinition>> getPrompts() {
        return getPrompts(FetchOptions.defaults());
    }

    public CompletableFuture<List<PromptDefinition>> getPrompts(FetchOptions options) {
        return get(configured(prompts), options);
    }

    public CompletableFuture<Optional<ToolDefinition>> getTool(String name) {
        return getTools().thenApply(tools -> tools.stream()
                .filter(tool -> tool.getName().equals(name))
                .findFirst());
    }

    public CompletableFuture<Optional<ResourceDefinition>> getResource(String uri) {
        return getResources().thenApply(resources -> resources.stream()
                .filter(resource -> resource.getUri().equals(uri))
                .findFirst());
    }

    public CompletableFuture<Optional<PromptDefinition>> getPrompt(String name) {
        return getPrompts().thenApply(prompts -> prompts.stream()
                .filter(prompt -> prompt.getName().equals(name))
                .findFirst());
    }

    /**
     * Loads every kind that has a fetcher.
     */
    public CompletableFuture<Void> preload() {
        List<CompletableFuture<?>> loads = new ArrayList<>();
        for (Slot<?> slot : slots()) {
            if (slot.fetcher != null) {
                loads.add(get(slot, FetchOptions.defaults()));
            }
        }
        return CompletableFuture.allOf(loads.toArray(new CompletableFuture[0]));
    }

    /**
     * Removes the memory and stored entry of a kind and cancels its auto-refresh.
     */
    public void invalidate(DefinitionKind kind) {
        Slot<?> slot = slot(kind);
        lock.lock();
        try {
            slot.entry = null;
            cancelRefresh(slot);
        } finally {
            lock.unlock();
        }
        if (storage != null) {
            try {
                storage.delete(kind.getKey());
            } catch (IOException | RuntimeException e) {
                logger.warn("Failed to delete stored {} entry: {}", kind.getKey(), e.getMessage());
            }
        }
    }

    public void invalidateAll() {
        lock.lock();
        try {
            for (Slot<?> slot : slots()) {
                slot.entry = null;
                cancelRefresh(slot);
            }
        } finally {
            lock.unlock();
        }
        if (storage != null) {
            try {
                storage.clear();
            } catch (IOException | RuntimeException e) {
                logger.warn("Failed to clear cache storage: {}", e.getMessage());
            }
        }
    }

    /**
     * True if a memory entry exists for the kind and has not expired.
     */
    public boolean isValid(DefinitionKind kind) {
        Slot<?> slot = slot(kind);
        lock.lock();
        try {
            return slot.entry != null && !slot.entry.isExpired(System.currentTimeMillis());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> getExpiry(DefinitionKind kind) {
        Slot<?> slot = slot(kind);
        lock.lock();
        try {
            return slot.entry == null ? Optional.empty() : Optional.of(slot.entry.getExpiryInstant());
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            int entries = 0;
            long bytes = 0;
            for (Slot<?> slot : slots()) {
                if (slot.entry != null) {
                    entries++;
                    bytes += slot.entry.getSize();
                }
            }
            return new CacheStats(hits.get(), misses.get(), entries, bytes);
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        hits.set(0);
        misses.set(0);
    }

    /**
     * Cancels auto-refresh timers and clears the memory table. Stored entries
     * are kept. Fetches already running complete for their callers but are
     * not cached; later lookups fail.
     */
    public void dispose() {
        lock.lock();
        try {
            if (disposed) {
                return;
            }
            disposed = true;
            for (Slot<?> slot : slots()) {
                cancelRefresh(slot);
                slot.entry = null;
            }
        } finally {
            lock.unlock();
        }
        if (refreshScheduler != null) {
            refreshScheduler.shutdownNow();
        }
        if (ownsFetchExecutor) {
            fetchExecutor.shutdown();
        }
        logger.info("Definition cacher disposed: {}", getStats());
    }

    @Override
    public void close() {
        dispose();
    }

    private List<Slot<?>> slots() {
        return List.of(tools, resources, prompts);
    }

    private Slot<?> slot(DefinitionKind kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        switch (kind) {
            case TOOLS:
                return tools;
            case RESOURCES:
                return resources;
            case PROMPTS:
                return prompts;
            default:
                throw new IllegalArgumentException("Unknown definition kind: " + kind);
        }
    }

    private static <T> Slot<T> configured(Slot<T> slot) {
        if (slot.fetcher == null) {
            throw new IllegalStateException("No fetch function configured for " + slot.kind.getKey());
        }
        return slot;
    }

    private <T> CompletableFuture<List<T>> get(Slot<T> slot, FetchOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        boolean checkStorage;
        List<T> stale = null;
        Flight<T> refresh = null;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.failedFuture(new IllegalStateException("Cacher is disposed"));
            }
            CacheEntry<T> cached = slot.entry;
            if (cached != null && !options.isForceRefresh()) {
                if (!cached.isExpired(System.currentTimeMillis())) {
                    hits.incrementAndGet();
                    return CompletableFuture.completedFuture(cached.getData());
                }
                if (options.isStaleWhileRevalidate()) {
                    hits.incrementAndGet();
                    stale = cached.getData();
                    refresh = joinOrRegisterLocked(slot, true);
                }
            }
            checkStorage = cached == null && storage != null && !options.isForceRefresh();
        } finally {
            lock.unlock();
        }

        if (stale != null) {
            logger.debug("Serving stale {} while refreshing", slot.kind.getKey());
            launch(slot, refresh);
            return CompletableFuture.completedFuture(stale);
        }

        if (checkStorage) {
            Optional<CacheEntry<T>> stored = readStorage(slot);
            if (stored.isPresent()) {
                CacheEntry<T> entry = stored.get();
                lock.lock();
                try {
                    if (!disposed && slot.entry == null) {
                        slot.entry = entry;
                        scheduleRefresh(slot, entry.getExpiresAt());
                    }
                } finally {
                    lock.unlock();
                }
                hits.incrementAndGet();
                logger.debug("Promoted stored {} entry into memory", slot.kind.getKey());
                return CompletableFuture.completedFuture(entry.getData());
            }
        }

        misses.incrementAndGet();
        Flight<T> flight;
        lock.lock();
        try {
            if (disposed) {
                return CompletableFuture.failedFuture(new IllegalStateException("Cacher is disposed"));
            }
            flight = joinOrRegisterLocked(slot, false);
        } finally {
            lock.unlock();
        }
        launch(slot, flight);
        return flight.future.copy();
    }

    /**
     * Joins the fetch in flight for the kind or registers a new one, which the
     * caller must {@link #launch} once the lock is released.
     */
    private <T> Flight<T> joinOrRegisterLocked(Slot<T> slot, boolean background) {
        if (slot.pending != null) {
            return new Flight<>(slot.pending, false);
        }
        CompletableFuture<List<T>> fetch = new CompletableFuture<>();
        slot.pending = fetch;
        if (background) {
            fetch.whenComplete((data, error) -> {
                if (error != null) {
                    logger.warn("Background refresh of {} failed: {}", slot.kind.getKey(), error.getMessage());
                }
            });
        }
        return new Flight<>(fetch, true);
    }

    private <T> void launch(Slot<T> slot, Flight<T> flight) {
        if (!flight.isNew) {
            return;
        }
        try {
            fetchExecutor.execute(() -> fetchAndCache(slot, flight.future));
        } catch (RejectedExecutionException e) {
            clearPending(slot, flight.future);
            flight.future.completeExceptionally(e);
        }
    }

    private <T> void clearPending(Slot<T> slot, CompletableFuture<List<T>> fetch) {
        lock.lock();
        try {
            if (slot.pending == fetch) {
                slot.pending = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> void fetchAndCache(Slot<T> slot, CompletableFuture<List<T>> fetch) {
        DefinitionKind kind = slot.kind;
        List<T> data;
        try {
            logger.debug("Fetching {}", kind.getKey());
            List<T> fetched = slot.fetcher.fetch();
            data = fetched == null ? List.of() : fetched;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            clearPending(slot, fetch);
            fetch.completeExceptionally(e);
            return;
        }

        long now = System.currentTimeMillis();
        CacheEntry<T> entry = new CacheEntry<>(data, now, now + config.getTtl().toMillis(), codec.estimateSize(data));
        boolean cached;
        lock.lock();
        try {
            if (slot.pending == fetch) {
                slot.pending = null;
            }
            cached = !disposed;
            if (cached) {
                slot.entry = entry;
                scheduleRefresh(slot, entry.getExpiresAt());
            }
        } finally {
            lock.unlock();
        }

        if (cached) {
            writeStorage(kind, entry);
            try {
                config.getUpdateListener().onUpdate(kind);
            } catch (RuntimeException e) {
                logger.warn("Cache update listener failed for {}: {}", kind.getKey(), e.getMessage());
            }
        }
        fetch.complete(entry.getData());
    }

    private <T> Optional<CacheEntry<T>> readStorage(Slot<T> slot) {
        try {
            Optional<String> json = storage.get(slot.kind.getKey());
            if (json.isEmpty()) {
                return Optional.empty();
            }
            CacheEntry<T> entry = codec.decode(json.get(), slot.type);
            return entry.isExpired(System.currentTimeMillis()) ? Optional.empty() : Optional.of(entry);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to read stored {} entry, fetching instead: {}", slot.kind.getKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private void writeStorage(DefinitionKind kind, CacheEntry<?> entry) {
        if (storage == null) {
            return;
        }
        try {
            storage.set(kind.getKey(), codec.encode(entry), config.getTtl());
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to store {} entry: {}", kind.getKey(), e.getMessage());
        }
    }

    // Caller holds lock
    private <T> void scheduleRefresh(Slot<T> slot, long expiresAt) {
        if (refreshScheduler == null) {
            return;
        }
        cancelRefresh(slot);
        long delay = expiresAt - config.getAutoRefreshBeforeExpiry().toMillis() - System.currentTimeMillis();
        if (delay > 0) {
            slot.refreshTimer = refreshScheduler.schedule(() -> refreshInBackground(slot), delay, TimeUnit.MILLISECONDS);
        }
    }

    // Caller holds lock
    private void cancelRefresh(Slot<?> slot) {
        if (slot.refreshTimer != null) {
            slot.refreshTimer.cancel(false);
            slot.refreshTimer = null;
        }
    }

    private <T> void refreshInBackground(Slot<T> slot) {
        Flight<T> flight;
        lock.lock();
        try {
            if (disposed) {
                return;
            }
            slot.refreshTimer = null;
            flight = joinOrRegisterLocked(slot, true);
        } finally {
            lock.unlock();
        }
        logger.debug("Auto-refreshing {}", slot.kind.getKey());
        launch(slot, flight);
    }

    /**
     * Per-kind state. The mutable fields are guarded by the cacher's lock.
     */
    private static final class Slot<T> {
        private final DefinitionKind kind;
        private final Class<T> type;
        private final DefinitionFetcher<T> fetcher;

        private CacheEntry<T> entry;
        private CompletableFuture<List<T>> pending;
        private ScheduledFuture<?> refreshTimer;

        private Slot(DefinitionKind kind, Class<T> type, DefinitionFetcher<T> fetcher) {
            this.kind = kind;
            this.type = type;
            this.fetcher = fetcher;
        }
    }

    private static final class Flight<T> {
        private final CompletableFuture<List<T>> future;
        private final boolean isNew;

        private Flight(CompletableFuture<List<T>> future, boolean isNew) {
            this.future = future;
            this.isNew = isNew;
        }
    }
}
