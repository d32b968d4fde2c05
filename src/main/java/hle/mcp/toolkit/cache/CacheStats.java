package hle.mcp.toolkit.cache;

/**
 * Snapshot of {@link DefinitionCacher} counters.
 */
public class CacheStats {

    private final long hits;
    private final long misses;
    private final int entries;
    private final long bytesUsed;

    CacheStats(long hits, long misses, int entries, long bytesUsed) {
        this.hits = hits;
        this.misses = misses;
        this.entries = entries;
        this.bytesUsed = bytesUsed;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    /**
     * Gets hits over all lookups, or 0 before the first lookup.
     */
    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0 : (double) hits / total;
    }

    public int getEntries() {
        return entries;
    }

    public long getBytesUsed() {
        return bytesUsed;
    }

    @Override
    public String toString() {
        return String.format("DefinitionCacher[hits=%d, misses=%d, hitRate=%.2f, entries=%d, bytes=%d]",
                hits, misses, getHitRate(), entries, bytesUsed);
    }
}
