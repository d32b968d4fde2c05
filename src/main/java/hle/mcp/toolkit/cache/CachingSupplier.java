package hle.mcp.toolkit.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches the result of one fetch for a fixed time-to-live, with at most one
 * fetch in flight. The fetch runs on the thread of the caller that found the
 * value missing; concurrent callers share its result.
 *
 * <pre>{@code
 * CachingSupplier<List<ToolDefinition>> tools =
 *     new CachingSupplier<>(() -> pool.withConnection(endpoint, Connection::listTools), Duration.ofMinutes(1));
 * List<ToolDefinition> current = tools.get().join();
 * }</pre>
 *
 * @param <T> the cached value type
 */
public class CachingSupplier<T> {

    private final Callable<T> fetch;
    private final long ttlMillis;
    private final ReentrantLock lock = new ReentrantLock();

    private boolean hasValue;
    private T value;
    private long expiresAt;
    private CompletableFuture<T> pending;
    // Bumped by invalidate so an older fetch cannot repopulate the value
    private long generation;

    public CachingSupplier(Callable<T> fetch, Duration ttl) {
        this.fetch = Objects.requireNonNull(fetch, "fetch cannot be null");
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.ttlMillis = ttl.toMillis();
    }

    public CachingSupplier(Callable<T> fetch) {
        this(fetch, Duration.ofMinutes(5));
    }

    /**
     * Returns the cached value, joins the fetch in flight, or fetches.
     * A failed fetch caches nothing.
     */
    public CompletableFuture<T> get() {
        CompletableFuture<T> mine;
        long startedIn;
        lock.lock();
        try {
            if (hasValue && System.currentTimeMillis() < expiresAt) {
                return CompletableFuture.completedFuture(value);
            }
            if (pending != null) {
                return pending.copy();
            }
            mine = new CompletableFuture<>();
            pending = mine;
            startedIn = generation;
        } finally {
            lock.unlock();
        }

        try {
            T fetched = fetch.call();
            lock.lock();
            try {
                if (generation == startedIn) {
                    value = fetched;
                    hasValue = true;
                    expiresAt = System.currentTimeMillis() + ttlMillis;
                }
                if (pending == mine) {
                    pending = null;
                }
            } finally {
                lock.unlock();
            }
            mine.complete(fetched);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            lock.lock();
            try {
                if (pending == mine) {
                    pending = null;
                }
            } finally {
                lock.unlock();
            }
            mine.completeExceptionally(e);
        }
        return mine;
    }

    /**
     * Drops the cached value and detaches any fetch in flight. That fetch
     * still completes for its callers, but the next {@link #get()} fetches again.
     */
    public void invalidate() {
        lock.lock();
        try {
            generation++;
            hasValue = false;
            value = null;
            pending = null;
        } finally {
            lock.unlock();
        }
    }
}
