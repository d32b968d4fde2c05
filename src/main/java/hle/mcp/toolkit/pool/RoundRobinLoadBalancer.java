package hle.mcp.toolkit.pool;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out endpoint URLs in rotation. Typically paired with a
 * {@link ConnectionPool} to spread acquisitions over replicas.
 */
public class RoundRobinLoadBalancer {

    private final CopyOnWriteArrayList<String> urls = new CopyOnWriteArrayList<>();
    private final AtomicInteger index = new AtomicInteger(0);

    public RoundRobinLoadBalancer(Collection<String> urls) {
        urls.forEach(this::add);
    }

    /**
     * @throws IllegalStateException if no URL is registered
     */
    public String next() {
        List<String> snapshot = List.copyOf(urls);
        if (snapshot.isEmpty()) {
            throw new IllegalStateException("No URLs available");
        }
        int i = Math.floorMod(index.getAndIncrement(), snapshot.size());
        return snapshot.get(i);
    }

    public void add(String url) {
        urls.addIfAbsent(url);
    }

    public void remove(String url) {
        urls.remove(url);
    }

    public List<String> getUrls() {
        return List.copyOf(urls);
    }
}
