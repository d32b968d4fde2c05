package hle.mcp.toolkit.batch;

import hle.mcp.toolkit.model.ToolCall;
import hle.mcp.toolkit.model.ToolCallResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the CallBatcher.
 */
class CallBatcherTest {

    private CallBatcher batcher;

    @AfterEach
    void tearDown() {
        if (batcher != null) {
            batcher.close();
        }
    }

    private static BatcherConfig.Builder manualFlush(int maxBatchSize) {
        return BatcherConfig.builder()
                .maxBatchSize(maxBatchSize)
                .maxWait(Duration.ofSeconds(10))
                .executeOnFull(false);
    }

    @Test
    @Timeout(5)
    void shouldDispatchHighestPriorityFirstThenArrivalOrder() throws Exception {
        RecordingExecutor executor = new RecordingExecutor();
        batcher = new CallBatcher(executor, manualFlush(3).build());
        int[] priorities = {0, 10, 0, 10, 100, 5};

        List<CompletableFuture<ToolCallResult>> futures = new ArrayList<>();
        for (int i = 0; i < priorities.length; i++) {
            futures.add(batcher.call("c" + i, Map.of(), priorities[i]));
        }
        batcher.flush().get(2, TimeUnit.SECONDS);

        assertEquals(List.of(List.of("c4", "c1", "c3")), executor.batchNames());
        assertEquals("c4", futures.get(4).get(1, TimeUnit.SECONDS).getText());
        assertEquals(3, batcher.getPendingCalls());

        batcher.flush().get(2, TimeUnit.SECONDS);
        assertEquals(List.of("c5", "c0", "c2"), executor.batchNames().get(1));
    }

    @Test
    @Timeout(5)
    void shouldDeliverEachResultToItsOwnCall() throws Exception {
        batcher = new CallBatcher(new RecordingExecutor(), manualFlush(10).build());

        CompletableFuture<ToolCallResult> a = batcher.call("a", Map.of());
        CompletableFuture<ToolCallResult> b = batcher.call("b", Map.of());
        batcher.flush();

        assertEquals("a", a.get(1, TimeUnit.SECONDS).getText());
        assertEquals("b", b.get(1, TimeUnit.SECONDS).getText());
    }

    @Test
    @Timeout(5)
    void shouldFailEveryCallWhenExecutorFails() throws Exception {
        batcher = new CallBatcher(calls -> {
            throw new IllegalStateException("server down");
        }, manualFlush(10).build());

        CompletableFuture<ToolCallResult> a = batcher.call("a", Map.of());
        CompletableFuture<ToolCallResult> b = batcher.call("b", Map.of());
        batcher.flush().get(2, TimeUnit.SECONDS);

        ExecutionException first = assertThrows(ExecutionException.class, a::get);
        ExecutionException second = assertThrows(ExecutionException.class, b::get);
        assertInstanceOf(BatchExecutionException.class, first.getCause());
        assertInstanceOf(IllegalStateException.class, first.getCause().getCause());
        assertSame(first.getCause(), second.getCause());
    }

    @Test
    @Timeout(5)
    void shouldFailOnlyCallsWithMissingResults() throws Exception {
        batcher = new CallBatcher(calls -> List.of(ToolCallResult.text("only one")), manualFlush(10).build());

        CompletableFuture<ToolCallResult> a = batcher.call("a", Map.of());
        CompletableFuture<ToolCallResult> b = batcher.call("b", Map.of());
        batcher.flush().get(2, TimeUnit.SECONDS);

        assertEquals("only one", a.get().getText());
        ExecutionException e = assertThrows(ExecutionException.class, b::get);
        assertInstanceOf(BatchExecutionException.class, e.getCause());
        assertEquals("No result returned for call 1", e.getCause().getMessage());
    }

    @Test
    @Timeout(5)
    void shouldFlushWhenWindowEnds() throws Exception {
        RecordingExecutor executor = new RecordingExecutor();
        batcher = new CallBatcher(executor, BatcherConfig.builder()
                .maxWait(Duration.ofMillis(50))
                .build());

        CompletableFuture<ToolCallResult> a = batcher.call("a", Map.of());
        CompletableFuture<ToolCallResult> b = batcher.call("b", Map.of());

        assertEquals("a", a.get(2, TimeUnit.SECONDS).getText());
        assertEquals("b", b.get(2, TimeUnit.SECONDS).getText());
        assertEquals(List.of(List.of("a", "b")), executor.batchNames());
    }

    @Test
    @Timeout(5)
    void shouldNotRestartWindowForLaterCalls() throws Exception {
        AtomicLong dispatchedAt = new AtomicLong();
        RecordingExecutor executor = new RecordingExecutor() {
            @Override
            public List<ToolCallResult> execute(List<ToolCall> calls) {
                dispatchedAt.set(System.nanoTime());
                return super.execute(calls);
            }
        };
        batcher = new CallBatcher(executor, BatcherConfig.builder()
                .maxWait(Duration.ofMillis(300))
                .build());

        long start = System.nanoTime();
        CompletableFuture<ToolCallResult> a = batcher.call("a", Map.of());
        Thread.sleep(200);
        CompletableFuture<ToolCallResult> b = batcher.call("b", Map.of());
        b.get(2, TimeUnit.SECONDS);

        long waitedMs = TimeUnit.NANOSECONDS.toMillis(dispatchedAt.get() - start);
        assertTrue(waitedMs < 450, "Window was restarted: " + waitedMs + "ms");
        assertTrue(a.isDone());
        assertEquals(1, executor.batchNames().size());
    }

    @Test
    @Timeout(5)
    void shouldFlushImmediatelyWhenFull() throws Exception {
        RecordingExecutor executor = new RecordingExecutor();
        batcher = new CallBatcher(executor, BatcherConfig.builder()
                .maxBatchSize(3)
                .maxWait(Duration.ofSeconds(10))
                .build());

        batcher.call("a", Map.of());
        batcher.call("b", Map.of());
        CompletableFuture<ToolCallResult> c = batcher.call("c", Map.of());

        assertEquals("c", c.get(2, TimeUnit.SECONDS).getText());
        assertEquals(List.of(List.of("a", "b", "c")), executor.batchNames());
    }

    @Test
    @Timeout(5)
    void shouldKeepOneBatchInFlight() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        RecordingExecutor executor = new RecordingExecutor() {
            @Override
            public List<ToolCallResult> execute(List<ToolCall> calls) {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                inFlight.decrementAndGet();
                return super.execute(calls);
            }
        };
        batcher = new CallBatcher(executor, BatcherConfig.builder()
                .maxBatchSize(1)
                .maxWait(Duration.ofMillis(20))
                .build());

        CompletableFuture<ToolCallResult> a = batcher.call("a", Map.of());
        CompletableFuture<ToolCallResult> b = batcher.call("b", Map.of());
        // b arrives while a is executing and must wait for the next batch
        assertFalse(b.isDone());
        assertEquals(1, batcher.getPendingCalls());
        release.countDown();

        assertEquals("a", a.get(2, TimeUnit.SECONDS).getText());
        assertEquals("b", b.get(2, TimeUnit.SECONDS).getText());
        assertEquals(1, maxInFlight.get());
        assertEquals(List.of(List.of("a"), List.of("b")), executor.batchNames());
    }

    @Test
    void shouldIgnoreFlushOfEmptyQueue() {
        RecordingExecutor executor = new RecordingExecutor();
        batcher = new CallBatcher(executor);

        assertTrue(batcher.flush().isDone());
        assertTrue(executor.batchNames().isEmpty());
        assertEquals(0, batcher.getStats().getTotalBatches());
    }

    @Test
    void shouldCancelQueuedCallsWithReason() {
        batcher = new CallBatcher(new RecordingExecutor(), manualFlush(10).build());
        CompletableFuture<ToolCallResult> a = batcher.call("a", Map.of());
        CompletableFuture<ToolCallResult> b = batcher.call("b", Map.of());

        batcher.cancelAll("shutting down");

        CancellationException e = assertThrows(CancellationException.class, a::join);
        assertEquals("shutting down", e.getMessage());
        assertThrows(CancellationException.class, b::join);
        assertEquals(0, batcher.getPendingCalls());
    }

    @Test
    @Timeout(5)
    void shouldBypassQueueForImmediateCalls() throws Exception {
        RecordingExecutor executor = new RecordingExecutor();
        batcher = new CallBatcher(executor, manualFlush(10).build());
        batcher.call("queued", Map.of());

        ToolCallResult result = batcher.callImmediate("now", Map.of()).get(2, TimeUnit.SECONDS);

        assertEquals("now", result.getText());
        assertEquals(List.of(List.of("now")), executor.batchNames());
        assertEquals(1, batcher.getPendingCalls());
    }

    @Test
    void shouldRejectCallsAfterClose() {
        batcher = new CallBatcher(new RecordingExecutor(), manualFlush(10).build());
        CompletableFuture<ToolCallResult> queued = batcher.call("a", Map.of());

        batcher.close();

        CancellationException cancelled = assertThrows(CancellationException.class, queued::join);
        assertEquals("Batcher closed", cancelled.getMessage());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> batcher.call("b", Map.of()).get());
        assertInstanceOf(RejectedExecutionException.class, e.getCause());
        assertThrows(ExecutionException.class, () -> batcher.callImmediate("c", Map.of()).get());
    }

    @Test
    @Timeout(5)
    void shouldTrackStatsAndNotifyListener() throws Exception {
        List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        batcher = new CallBatcher(new RecordingExecutor(), manualFlush(10)
                .listener((size, duration) -> batchSizes.add(size))
                .build());

        for (int i = 0; i < 5; i++) {
            batcher.call("c" + i, Map.of());
        }
        batcher.flush().get(2, TimeUnit.SECONDS);

        BatcherStats stats = batcher.getStats();
        assertEquals(5, stats.getTotalCalls());
        assertEquals(1, stats.getTotalBatches());
        assertEquals(5.0, stats.getAverageBatchSize(), 0.001);
        assertEquals(4, stats.getCallsSaved());
        assertEquals(List.of(5), batchSizes);

        batcher.resetStats();
        assertEquals(0, batcher.getStats().getTotalCalls());
        assertEquals(0.0, batcher.getStats().getAverageBatchSize(), 0.001);
    }

    @Test
    @Timeout(5)
    void shouldFanOutThroughCallFunction() throws Exception {
        batcher = CallBatcher.withBatching(
                (name, arguments) -> ToolCallResult.text(name + "=" + arguments.get("x")),
                manualFlush(10).build(),
                2);

        List<CompletableFuture<ToolCallResult>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(batcher.call("t" + i, Map.of("x", i)));
        }
        batcher.flush().get(2, TimeUnit.SECONDS);

        for (int i = 0; i < 4; i++) {
            assertEquals("t" + i + "=" + i, futures.get(i).get().getText());
        }
    }

    /**
     * Echoes each call's name and records the names of every batch.
     */
    static class RecordingExecutor implements BatchExecutor {
        private final List<List<String>> batches = new CopyOnWriteArrayList<>();

        @Override
        public List<ToolCallResult> execute(List<ToolCall> calls) {
            batches.add(calls.stream().map(ToolCall::getName).collect(Collectors.toList()));
            return calls.stream().map(call -> ToolCallResult.text(call.getName())).collect(Collectors.toList());
        }

        List<List<String>> batchNames() {
            return batches;
        }
    }
}
