package hle.mcp.toolkit.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A cached listing with its fetch time, expiry and estimated footprint.
 * Timestamps are epoch milliseconds so entries serialize without extra modules.
 *
 * @param <T> the definition type
 */
public final class CacheEntry<T> {

    private final List<T> data;
    private final long fetchedAt;
    private final long expiresAt;
    private final long size;

    @JsonCreator
    public CacheEntry(@JsonProperty("data") List<T> data,
                      @JsonProperty("fetchedAt") long fetchedAt,
                      @JsonProperty("expiresAt") long expiresAt,
                      @JsonProperty("size") long size) {
        this.data = data == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(data));
        this.fetchedAt = fetchedAt;
        this.expiresAt = expiresAt;
        this.size = size;
    }

    public List<T> getData() {
        return data;
    }

    public long getFetchedAt() {
        return fetchedAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    /**
     * Gets the estimated in-memory size in bytes.
     */
    public long getSize() {
        return size;
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt;
    }

    @JsonIgnore
    public Instant getExpiryInstant() {
        return Instant.ofEpochMilli(expiresAt);
    }
}
