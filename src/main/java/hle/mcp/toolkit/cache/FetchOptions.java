package hle.mcp.toolkit.cache;

/**
 * Per-call options for {@link DefinitionCacher} lookups.
 */
public final class FetchOptions {

    private static final FetchOptions DEFAULT = new FetchOptions(false, false);

    private final boolean forceRefresh;
    private final boolean staleWhileRevalidate;

    private FetchOptions(boolean forceRefresh, boolean staleWhileRevalidate) {
        this.forceRefresh = forceRefresh;
        this.staleWhileRevalidate = staleWhileRevalidate;
    }

    public static FetchOptions defaults() {
        return DEFAULT;
    }

    /**
     * Ignore the memory entry and fetch again.
     */
    public static FetchOptions forceRefresh() {
        return new FetchOptions(true, false);
    }

    /**
     * Serve an expired entry at once and refresh it in the background.
     */
    public static FetchOptions staleWhileRevalidate() {
        return new FetchOptions(false, true);
    }

    public boolean isForceRefresh() {
        return forceRefresh;
    }

    public boolean isStaleWhileRevalidate() {
        return staleWhileRevalidate;
    }
}
