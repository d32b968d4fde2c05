package hle.mcp.toolkit.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A logical connection target. The URL is the partition key for pool limits;
 * the options are handed to the {@link ConnectionFactory} untouched and take
 * no part in equality.
 */
public final class Endpoint {

    private final String url;
    private final Map<String, Object> options;

    public Endpoint(String url, Map<String, Object> options) {
        this.url = Objects.requireNonNull(url, "url cannot be null");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url cannot be blank");
        }
        this.options = options == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static Endpoint of(String url) {
        return new Endpoint(url, null);
    }

    public static Endpoint of(String url, Map<String, Object> options) {
        return new Endpoint(url, options);
    }

    public String getUrl() {
        return url;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Endpoint)) {
            return false;
        }
        return url.equals(((Endpoint) o).url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return url;
    }
}
