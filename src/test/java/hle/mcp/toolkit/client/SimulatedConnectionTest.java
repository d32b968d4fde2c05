package hle.mcp.toolkit.client;

import hle.mcp.toolkit.model.ToolCallResult;
import hle.mcp.toolkit.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SimulatedConnection.
 */
class SimulatedConnectionTest {

    @BeforeEach
    void setUp() {
        SimulatedConnection.resetGlobalCounter();
    }

    @Test
    void shouldEchoToolCall() {
        SimulatedConnection connection = SimulatedConnection.builder().id("sim-1").build();

        ToolCallResult result = connection.callTool("search", Map.of("q", "pool"));

        assertEquals("search:{q=pool}", result.getText());
        assertFalse(result.isError());
        assertEquals(1, connection.getRequestCount());
        assertEquals(1, SimulatedConnection.getGlobalRequestCount());
    }

    @Test
    void shouldReturnConfiguredListings() {
        List<ToolDefinition> tools = List.of(ToolDefinition.of("search", "Searches"));
        SimulatedConnection connection = SimulatedConnection.builder().tools(tools).build();

        assertEquals(tools, connection.listTools());
        assertTrue(connection.listResources().isEmpty());
        assertTrue(connection.listPrompts().isEmpty());
    }

    @Test
    void shouldSimulateLatency() {
        SimulatedConnection connection = SimulatedConnection.builder().latency(50, 60).build();

        long start = System.currentTimeMillis();
        connection.callTool("slow", null);

        assertTrue(System.currentTimeMillis() - start >= 45);
    }

    @Test
    void shouldFailEveryCallAtFullFailureRate() {
        SimulatedConnection connection = SimulatedConnection.builder().failureRate(1.0).build();

        ConnectionException e = assertThrows(ConnectionException.class, () -> connection.callTool("x", null));
        assertTrue(e.isRetryable());
    }

    @Test
    void shouldRejectCallsAfterClose() {
        SimulatedConnection connection = SimulatedConnection.builder().build();

        connection.close();

        assertFalse(connection.isConnected());
        assertFalse(connection.ping());
        assertThrows(ConnectionException.class, connection::listTools);
        assertEquals(1, connection.getCloseCount());
    }

    @Test
    void shouldReportConfiguredHealth() {
        SimulatedConnection connection = SimulatedConnection.builder().build();
        assertTrue(connection.ping());

        connection.setHealthy(false);

        assertFalse(connection.ping());
        assertEquals(2, connection.getPingCount());
    }

    @Test
    void shouldFailCloseWhenConfigured() {
        SimulatedConnection connection = SimulatedConnection.builder().build();
        connection.setFailOnClose(true);

        assertThrows(ConnectionException.class, connection::close);
        assertFalse(connection.isConnected());
    }

    @Test
    void shouldRejectInvalidFailureRate() {
        assertThrows(IllegalArgumentException.class, () -> SimulatedConnection.builder().failureRate(1.5));
    }
}
