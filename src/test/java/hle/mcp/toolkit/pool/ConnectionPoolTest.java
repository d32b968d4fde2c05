package hle.mcp.toolkit.pool;

import hle.mcp.toolkit.client.Connection;
import hle.mcp.toolkit.client.Endpoint;
import hle.mcp.toolkit.client.SimulatedConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ConnectionPool.
 */
class ConnectionPoolTest {

    private static final Endpoint SEARCH = Endpoint.of("mcp://search");
    private static final Endpoint FILES = Endpoint.of("mcp://files");

    private TrackingConnectionFactory factory;
    private ConnectionPool pool;

    @BeforeEach
    void setUp() {
        factory = new TrackingConnectionFactory();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private ConnectionPool createPool(ConnectionPoolConfig config) {
        pool = new ConnectionPool(factory, config);
        return pool;
    }

    @Test
    void shouldReuseReleasedConnection() {
        createPool(ConnectionPoolConfig.builder().maxConnections(5).build());

        for (int i = 0; i < 10; i++) {
            String result = pool.withConnection(SEARCH, c -> c.callTool("echo", null).getText());
            assertEquals("echo:{}", result);
        }

        PoolStats stats = pool.getStats();
        assertEquals(1, factory.getCreatedCount());
        assertEquals(1, stats.getTotalCreated());
        assertEquals(9, stats.getTotalReused());
        assertEquals(0, stats.getActive());
        assertEquals(1, stats.getIdle());
    }

    @Test
    void shouldTrackActiveAndIdleCounts() {
        createPool(ConnectionPoolConfig.defaultConfig());

        PooledConnection first = pool.acquire(SEARCH);
        PooledConnection second = pool.acquire("mcp://search");
        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, pool.getStats().getActive());
        assertEquals(0, pool.getStats().getIdle());

        pool.release(first);
        second.close();

        PoolStats stats = pool.getStats();
        assertEquals(0, stats.getActive());
        assertEquals(2, stats.getIdle());
        assertEquals(2, stats.getTotal());
    }

    @Test
    void shouldReleaseConnectionWhenOperationFails() {
        createPool(ConnectionPoolConfig.defaultConfig());

        ConnectionPoolException e = assertThrows(ConnectionPoolException.class,
                () -> pool.withConnection(SEARCH, c -> {
                    throw new IllegalStateException("boom");
                }));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(0, pool.getStats().getActive());
        assertEquals(1, pool.getStats().getIdle());
    }

    @Test
    void shouldRethrowPoolExceptionsFromOperationUnwrapped() {
        createPool(ConnectionPoolConfig.defaultConfig());
        ConnectionPoolException original = new ConnectionPoolException("inner");

        ConnectionPoolException thrown = assertThrows(ConnectionPoolException.class,
                () -> pool.withConnection(SEARCH, c -> {
                    throw original;
                }));

        assertSame(original, thrown);
    }

    @Test
    void shouldCloseUntrackedConnectionOnRelease() {
        createPool(ConnectionPoolConfig.defaultConfig());
        SimulatedConnection stranger = SimulatedConnection.builder().build();

        pool.release(stranger);

        assertEquals(1, stranger.getCloseCount());
        assertEquals(0, pool.getStats().getIdle());
        assertEquals(0, pool.getStats().getTotalDestroyed());
    }

    @Test
    void shouldIgnoreSecondRelease() {
        createPool(ConnectionPoolConfig.defaultConfig());
        PooledConnection connection = pool.acquire(SEARCH);

        pool.release(connection);
        pool.release(connection);

        SimulatedConnection delegate = (SimulatedConnection) connection.getDelegate();
        assertEquals(0, delegate.getCloseCount());
        assertEquals(1, pool.getStats().getIdle());
    }

    @Test
    @Timeout(5)
    void shouldTrackConnectionsThatShareAnId() {
        pool = new ConnectionPool(
                endpoint -> SimulatedConnection.builder().id("primary").endpoint(endpoint.getUrl()).build(),
                ConnectionPoolConfig.builder()
                        .maxConnections(2)
                        .acquireTimeout(Duration.ofMillis(500))
                        .build());
        PooledConnection first = pool.acquire(SEARCH);
        PooledConnection second = pool.acquire(SEARCH);
        assertEquals(2, pool.getStats().getActive());

        pool.release(first);
        pool.release(second);
        assertEquals(0, pool.getStats().getActive());
        assertEquals(2, pool.getStats().getIdle());

        PooledConnection third = pool.acquire(SEARCH);
        PooledConnection fourth = pool.acquire(SEARCH);
        assertNotSame(third, fourth);
        assertEquals(2, pool.getStats().getTotalCreated());
        pool.release(third);
        pool.release(fourth);
    }

    @Test
    @Timeout(5)
    void shouldTimeOutWithoutChangingCounters() {
        createPool(ConnectionPoolConfig.builder()
                .maxConnections(1)
                .acquireTimeout(Duration.ofMillis(200))
                .build());
        PooledConnection held = pool.acquire(SEARCH);

        long start = System.nanoTime();
        AcquireTimeoutException e = assertThrows(AcquireTimeoutException.class, () -> pool.acquire(SEARCH));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs >= 150, "Timed out too early: " + elapsedMs + "ms");
        assertTrue(e.getMessage().contains("mcp://search"));
        PoolStats stats = pool.getStats();
        assertEquals(1, stats.getActive());
        assertEquals(0, stats.getIdle());
        assertEquals(1, stats.getTotalCreated());
        assertEquals(1, stats.getAcquireTimeouts());

        pool.release(held);
    }

    @Test
    @Timeout(10)
    void shouldServeWaitersInArrivalOrder() throws Exception {
        createPool(ConnectionPoolConfig.builder()
                .maxConnections(1)
                .acquireTimeout(Duration.ofSeconds(5))
                .build());
        PooledConnection held = pool.acquire(SEARCH);
        List<Integer> order = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(3);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                int caller = i;
                futures.add(executor.submit(() -> {
                    PooledConnection connection = pool.acquire(SEARCH);
                    order.add(caller);
                    pool.release(connection);
                }));
                // Wait for this caller to queue before starting the next
                waitUntil(() -> pool.getStats().getWaiting() == caller + 1);
            }

            assertEquals(3, pool.getStats().getWaiting());
            pool.release(held);

            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of(0, 1, 2), order);
        assertEquals(1, factory.getCreatedCount());
    }

    @Test
    void shouldDiscardConnectionThatFailsValidation() {
        createPool(ConnectionPoolConfig.defaultConfig());
        PooledConnection first = pool.acquire(SEARCH);
        pool.release(first);
        ((SimulatedConnection) first.getDelegate()).setHealthy(false);

        PooledConnection second = pool.acquire(SEARCH);

        assertNotEquals(first.getId(), second.getId());
        PoolStats stats = pool.getStats();
        assertEquals(2, stats.getTotalCreated());
        assertEquals(1, stats.getTotalDestroyed());
        assertEquals(1, stats.getHealthCheckFailures());
        assertFalse(((SimulatedConnection) first.getDelegate()).isConnected());
        pool.release(second);
    }

    @Test
    void shouldDestroyConnectionMarkedUnhealthyOnRelease() {
        createPool(ConnectionPoolConfig.defaultConfig());
        PooledConnection connection = pool.acquire(SEARCH);

        connection.markUnhealthy();
        pool.release(connection);

        assertEquals(0, pool.getStats().getIdle());
        assertEquals(1, pool.getStats().getTotalDestroyed());
    }

    @Test
    void shouldRetireConnectionPastMaxAge() throws InterruptedException {
        createPool(ConnectionPoolConfig.builder()
                .maxConnectionAge(Duration.ofMillis(100))
                .validateOnAcquire(false)
                .build());
        PooledConnection first = pool.acquire(SEARCH);
        pool.release(first);

        Thread.sleep(150);
        PooledConnection second = pool.acquire(SEARCH);

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, pool.getStats().getTotalCreated());
        assertEquals(1, pool.getStats().getTotalDestroyed());
        pool.release(second);
    }

    @Test
    void shouldInvalidateBorrowedConnection() {
        createPool(ConnectionPoolConfig.defaultConfig());
        PooledConnection connection = pool.acquire(SEARCH);

        pool.invalidate(connection);

        assertEquals(0, pool.getStats().getTotal());
        assertEquals(1, pool.getStats().getTotalDestroyed());
        assertFalse(((SimulatedConnection) connection.getDelegate()).isConnected());
    }

    @Test
    void shouldWarmUpToMinimumPerEndpoint() {
        createPool(ConnectionPoolConfig.builder().minConnections(2).build());

        int opened = pool.warmup(List.of(SEARCH, FILES));

        assertEquals(4, opened);
        PoolStats stats = pool.getDetailedStats();
        assertEquals(4, stats.getIdle());
        assertEquals(2, stats.getByEndpoint().get("mcp://search").getIdle());
        assertEquals(2, stats.getByEndpoint().get("mcp://files").getIdle());
        assertEquals(0, pool.warmup(List.of(SEARCH)));
    }

    @Test
    void shouldCountOnlyConnectionsWarmupOpened() {
        createPool(ConnectionPoolConfig.builder()
                .minConnections(2)
                .maxConnections(2)
                .build());
        PooledConnection first = pool.acquire(SEARCH);
        PooledConnection second = pool.acquire(SEARCH);

        assertEquals(0, pool.warmup(List.of(SEARCH)));
        assertEquals(2, factory.getCreatedCount());

        pool.release(first);
        pool.release(second);
    }

    @Test
    void shouldReportWarmupFailuresAndContinue() {
        AtomicInteger errors = new AtomicInteger();
        factory.failFor("mcp://broken");
        createPool(ConnectionPoolConfig.builder()
                .minConnections(2)
                .listener(new ConnectionPoolListener() {
                    @Override
                    public void onError(Throwable error, Connection connection) {
                        assertNull(connection);
                        errors.incrementAndGet();
                    }
                })
                .build());

        int opened = pool.warmup(List.of(Endpoint.of("mcp://broken"), SEARCH));

        assertEquals(2, opened);
        assertEquals(2, errors.get());
    }

    @Test
    void shouldWrapFactoryFailureOnAcquire() {
        factory.failFor("mcp://broken");
        createPool(ConnectionPoolConfig.defaultConfig());

        ConnectionPoolException e = assertThrows(ConnectionPoolException.class,
                () -> pool.acquire("mcp://broken"));

        assertFalse(e instanceof AcquireTimeoutException);
        assertNotNull(e.getCause());
    }

    @Test
    void shouldNotifyListenerOfLifecycleEvents() {
        List<String> events = new CopyOnWriteArrayList<>();
        createPool(ConnectionPoolConfig.builder()
                .listener(new ConnectionPoolListener() {
                    @Override
                    public void onCreate(Connection connection) {
                        events.add("create");
                    }

                    @Override
                    public void onDestroy(Connection connection) {
                        events.add("destroy");
                    }

                    @Override
                    public void onError(Throwable error, Connection connection) {
                        events.add("error:" + connection.getId());
                    }
                })
                .build());
        PooledConnection connection = pool.acquire(SEARCH);
        ((SimulatedConnection) connection.getDelegate()).setFailOnClose(true);

        pool.invalidate(connection);

        assertEquals(List.of("create", "error:" + connection.getId(), "destroy"), events);
        assertEquals(1, pool.getStats().getTotalDestroyed());
    }

    @Test
    void shouldRemoveEndpoint() {
        createPool(ConnectionPoolConfig.defaultConfig());
        PooledConnection held = pool.acquire(SEARCH);
        pool.release(pool.acquire(SEARCH));
        pool.release(pool.acquire(FILES));

        pool.removeEndpoint("mcp://search");

        assertEquals(1, pool.getStats().getIdle());
        assertEquals(1, pool.getStats().getTotalDestroyed());

        pool.release(held);
        assertEquals(1, pool.getStats().getIdle());
        assertEquals(2, pool.getStats().getTotalDestroyed());
        assertFalse(pool.getDetailedStats().getByEndpoint().containsKey("mcp://search"));
    }

    @Test
    @Timeout(10)
    void shouldRespectPerEndpointLimitUnderLoad() throws Exception {
        createPool(ConnectionPoolConfig.builder()
                .maxConnections(2)
                .acquireTimeout(Duration.ofSeconds(5))
                .build());
        AtomicInteger inUse = new AtomicInteger();
        AtomicInteger maxInUse = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(6);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 18; i++) {
                futures.add(executor.submit(() -> pool.withConnection(SEARCH, c -> {
                    maxInUse.accumulateAndGet(inUse.incrementAndGet(), Math::max);
                    Thread.sleep(10);
                    inUse.decrementAndGet();
                    return null;
                })));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(maxInUse.get() <= 2, "Endpoint limit exceeded: " + maxInUse.get());
        assertEquals(0, pool.getStats().getActive());
        assertTrue(pool.getStats().getTotalCreated() <= 2);
    }

    @Test
    @Timeout(5)
    void shouldRespectGlobalLimitAcrossEndpoints() {
        createPool(ConnectionPoolConfig.builder()
                .maxConnections(2)
                .maxTotalConnections(2)
                .acquireTimeout(Duration.ofMillis(200))
                .build());
        PooledConnection search = pool.acquire(SEARCH);
        PooledConnection files = pool.acquire(FILES);

        assertThrows(AcquireTimeoutException.class, () -> pool.acquire(FILES));

        PoolStats stats = pool.getDetailedStats();
        assertEquals(2, stats.getActive());
        assertEquals(1, stats.getByEndpoint().get("mcp://search").getActive());
        assertEquals(1, stats.getByEndpoint().get("mcp://files").getActive());
        pool.release(search);
        pool.release(files);
    }

    @Test
    @Timeout(10)
    void shouldServeConcurrentCallsWithBoundedConnections() throws Exception {
        createPool(ConnectionPoolConfig.builder()
                .maxConnections(3)
                .acquireTimeout(Duration.ofSeconds(5))
                .build());
        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch startLatch = new CountDownLatch(1);

        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                int n = i;
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    return pool.withConnection(SEARCH, c -> {
                        Thread.sleep(20);
                        return c.callTool("echo", java.util.Map.of("n", n)).getText();
                    });
                }));
            }
            startLatch.countDown();

            for (int i = 0; i < 10; i++) {
                assertEquals("echo:{n=" + i + "}", futures.get(i).get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        PoolStats stats = pool.getStats();
        assertTrue(stats.getTotalCreated() <= 3, "Created " + stats.getTotalCreated());
        assertEquals(0, stats.getActive());
        assertEquals(stats.getTotalCreated(), stats.getIdle());
    }

    @Test
    void shouldCloseEverythingOnShutdown() {
        createPool(ConnectionPoolConfig.defaultConfig());
        PooledConnection borrowed = pool.acquire(SEARCH);
        pool.release(pool.acquire(FILES));

        pool.shutdown();

        assertTrue(pool.isShutdown());
        assertFalse(((SimulatedConnection) borrowed.getDelegate()).isConnected());
        assertEquals(2, pool.getStats().getTotalDestroyed());
        assertThrows(PoolShutdownException.class, () -> pool.acquire(SEARCH));
        assertThrows(PoolShutdownException.class, () -> pool.warmup(List.of(SEARCH)));

        // Releasing after shutdown is harmless
        assertDoesNotThrow(() -> pool.release(borrowed));
        assertEquals(2, pool.getStats().getTotalDestroyed());
        assertDoesNotThrow(pool::shutdown);
    }

    @Test
    @Timeout(10)
    void shouldFailWaitersOnShutdown() throws Exception {
        createPool(ConnectionPoolConfig.builder()
                .maxConnections(1)
                .acquireTimeout(Duration.ofSeconds(3))
                .build());
        pool.acquire(SEARCH);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<PooledConnection> waiter = executor.submit(() -> pool.acquire(SEARCH));
            waitUntil(() -> pool.getStats().getWaiting() == 1);

            pool.shutdown();

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> waiter.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConnectionPoolException.class, e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static void waitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met in time");
            }
            Thread.sleep(10);
        }
    }
}
