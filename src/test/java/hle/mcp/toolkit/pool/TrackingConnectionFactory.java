package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Connection;
import hle.mcp.toolkit.client.ConnectionException;
import hle.mcp.toolkit.client.ConnectionFactory;
import hle.mcp.toolkit.client.Endpoint;
import hle.mcp.toolkit.client.SimulatedConnection;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Opens zero-latency simulated connections and remembers every one of them.
 */
class TrackingConnectionFactory implements ConnectionFactory {

    private final List<SimulatedConnection> created = new CopyOnWriteArrayList<>();
    private final Set<String> failingUrls = ConcurrentHashMap.newKeySet();

    @Override
    public Connection create(Endpoint endpoint) {
        if (failingUrls.contains(endpoint.getUrl())) {
            throw new ConnectionException("Cannot reach " + endpoint, true);
        }
        SimulatedConnection connection = SimulatedConnection.builder()
                .endpoint(endpoint.getUrl())
                .build();
        created.add(connection);
        return connection;
    }

    void failFor(String url) {
        failingUrls.add(url);
    }

    List<SimulatedConnection> getCreated() {
        return created;
    }

    int getCreatedCount() {
        return created.size();
    }
}
