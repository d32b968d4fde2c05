package hle.mcp.toolkit.batch;

import hle.mcp.toolkit.concurrent.ExecutorUtils;
import hle.mcp.toolkit.concurrent.NamedThreadFactory;
import hle.mcp.toolkit.model.ToolCall;
import hle.mcp.toolkit.model.ToolCallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Coalesces calls issued within a short window into a single executor
 * invocation, trading a little latency for fewer round trips.
 *
 * <p><strong>Ordering:</strong> the queue is kept sorted by priority
 * (higher first) and then arrival order, so each batch is the most urgent,
 * oldest-first slice of the queue.
 *
 * <p><strong>Window:</strong> the first call into an idle queue arms a flush
 * timer; later calls join the batch but never restart it. A full queue is
 * flushed at once when {@code executeOnFull} is set. At most one batch is in
 * flight; calls arriving meanwhile wait for the next window.
 *
 * <p>Example usage:
 * <pre>{@code
 * CallBatcher batcher = new CallBatcher(
 *     calls -> pool.withConnection(endpoint, conn -> runAll(conn, calls)),
 *     BatcherConfig.builder().maxBatchSize(5).build()
 * );
 *
 * CompletableFuture<ToolCallResult> a = batcher.call("lookup", Map.of("id", 1));
 * CompletableFuture<ToolCallResult> b = batcher.call("lookup", Map.of("id", 2));
 * }</pre>
 */
public class CallBatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CallBatcher.class);

    private final BatchExecutor executor;
    private final BatcherConfig config;
    private final boolean ownsExecutor;
    private final ScheduledExecutorService timer;
    private final ExecutorService worker;

    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock
    private final List<QueuedCall> queue = new ArrayList<>();
    private ScheduledFuture<?> flushTimer;
    private long timerGeneration;
    private long sequence;
    private boolean executing;
    private boolean closed;

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong totalBatches = new AtomicLong(0);
    private final AtomicLong batchedCalls = new AtomicLong(0);
    private final AtomicLong callsSaved = new AtomicLong(0);

    public CallBatcher(BatchExecutor executor, BatcherConfig config) {
        this(executor, config, false);
    }

    public CallBatcher(BatchExecutor executor) {
        this(executor, BatcherConfig.defaultConfig());
    }

    private CallBatcher(BatchExecutor executor, BatcherConfig config, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.ownsExecutor = ownsExecutor;
        this.timer = Executors.newSingleThreadScheduledExecutor(
                new NamedThreadFactory(config.getThreadNamePrefix() + "-timer"));
        this.worker = Executors.newCachedThreadPool(
                new NamedThreadFactory(config.getThreadNamePrefix() + "-worker"));
    }

    /**
     * Creates a batcher that fans each batch out to {@code callFunction} with
     * at most {@code concurrency} calls in flight (unbounded if {@code <= 0}).
     * Closing the batcher also stops the fan-out threads.
     */
    public static CallBatcher withBatching(ToolCallFunction callFunction, BatcherConfig config, int concurrency) {
        return new CallBatcher(new ParallelBatchExecutor(callFunction, concurrency), config, true);
    }

    public CompletableFuture<ToolCallResult> call(String name, Map<String, Object> arguments) {
        return call(name, arguments, 0);
    }

    /**
     * Queues a call for the next batch.
     *
     * @param priority higher values are dispatched first
     * @return a future completed with this call's result, or failed with a
     *         {@link BatchExecutionException}, a {@link CancellationException}
     *         or, once closed, a {@link RejectedExecutionException}
     */
    public CompletableFuture<ToolCallResult> call(String name, Map<String, Object> arguments, int priority) {
        Objects.requireNonNull(name, "name cannot be null");
        QueuedCall queued;
        boolean flushNow = false;
        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new RejectedExecutionException("Batcher is closed"));
            }
            queued = new QueuedCall(ToolCall.of(name, arguments), priority, sequence++);
            insertSorted(queued);
            totalCalls.incrementAndGet();
            if (config.isExecuteOnFull() && queue.size() >= config.getMaxBatchSize()) {
                flushNow = true;
            } else {
                scheduleFlush();
            }
        } finally {
            lock.unlock();
        }
        if (flushNow) {
            flush();
        }
        return queued.getResult();
    }

    /**
     * Sends a single call straight to the executor, bypassing the queue.
     */
    public CompletableFuture<ToolCallResult> callImmediate(String name, Map<String, Object> arguments) {
        Objects.requireNonNull(name, "name cannot be null");
        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new RejectedExecutionException("Batcher is closed"));
            }
        } finally {
            lock.unlock();
        }
        totalCalls.incrementAndGet();
        totalBatches.incrementAndGet();
        batchedCalls.incrementAndGet();

        ToolCall call = ToolCall.of(name, arguments);
        CompletableFuture<ToolCallResult> result = new CompletableFuture<>();
        try {
            worker.execute(() -> {
                try {
                    List<ToolCallResult> results = executor.execute(List.of(call));
                    ToolCallResult first = results == null || results.isEmpty() ? null : results.get(0);
                    if (first == null) {
                        result.completeExceptionally(new BatchExecutionException("No result returned for call 0"));
                    } else {
                        result.complete(first);
                    }
                } catch (Exception e) {
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                    }
                    result.completeExceptionally(new BatchExecutionException("Call " + name + " failed: " + e.getMessage(), e));
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Dispatches the front of the queue now, up to {@code maxBatchSize} calls.
     * Does nothing if the queue is empty or a batch is already in flight.
     *
     * @return a future completed once every call of the dispatched batch is settled
     */
    public CompletableFuture<Void> flush() {
        List<QueuedCall> batch;
        lock.lock();
        try {
            cancelTimer();
            if (queue.isEmpty() || executing) {
                return CompletableFuture.completedFuture(null);
            }
            int size = Math.min(queue.size(), config.getMaxBatchSize());
            List<QueuedCall> front = queue.subList(0, size);
            batch = new ArrayList<>(front);
            front.clear();
            executing = true;
        } finally {
            lock.unlock();
        }

        totalBatches.incrementAndGet();
        batchedCalls.addAndGet(batch.size());
        callsSaved.addAndGet(batch.size() - 1);

        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            worker.execute(() -> runBatch(batch, done));
        } catch (RejectedExecutionException e) {
            BatchExecutionException failure = new BatchExecutionException("Batcher is closed", e);
            batch.forEach(call -> call.getResult().completeExceptionally(failure));
            finishBatch();
            done.complete(null);
        }
        return done;
    }

    /**
     * Fails every queued call with a {@link CancellationException} carrying
     * {@code reason}. Calls already handed to the executor are unaffected.
     */
    public void cancelAll(String reason) {
        List<QueuedCall> cancelled;
        lock.lock();
        try {
            cancelTimer();
            cancelled = new ArrayList<>(queue);
            queue.clear();
        } finally {
            lock.unlock();
        }
        if (!cancelled.isEmpty()) {
            logger.debug("Cancelling {} queued calls: {}", cancelled.size(), reason);
        }
        for (QueuedCall call : cancelled) {
            call.getResult().completeExceptionally(new CancellationException(reason));
        }
    }

    public int getPendingCalls() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public BatcherStats getStats() {
        long batches = totalBatches.get();
        double average = batches == 0 ? 0 : (double) batchedCalls.get() / batches;
        return new BatcherStats(totalCalls.get(), batches, average, callsSaved.get());
    }

    public void resetStats() {
        totalCalls.set(0);
        totalBatches.set(0);
        batchedCalls.set(0);
        callsSaved.set(0);
    }

    /**
     * Cancels queued calls, waits for an in-flight batch to finish and stops
     * the batcher's threads. Later calls are rejected.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lock.unlock();
        }
        cancelAll("Batcher closed");
        timer.shutdownNow();
        ExecutorUtils.shutdownGracefully(worker, Duration.ofSeconds(30));
        if (ownsExecutor && executor instanceof AutoCloseable) {
            try {
                ((AutoCloseable) executor).close();
            } catch (Exception e) {
                logger.warn("Failed to close batch executor: {}", e.getMessage());
            }
        }
        logger.info("Call batcher closed: {}", getStats());
    }

    private void runBatch(List<QueuedCall> batch, CompletableFuture<Void> done) {
        long start = System.nanoTime();
        try {
            if (logger.isDebugEnabled()) {
                Duration queuedFor = Duration.between(batch.get(0).getEnqueuedAt(), Instant.now());
                logger.debug("Dispatching batch of {} calls (oldest queued {}ms)", batch.size(), queuedFor.toMillis());
            }
            List<ToolCall> calls = batch.stream().map(QueuedCall::getCall).collect(Collectors.toList());
            List<ToolCallResult> results;
            try {
                results = executor.execute(calls);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                logger.warn("Batch of {} calls failed: {}", batch.size(), e.getMessage());
                BatchExecutionException failure =
                        new BatchExecutionException("Batch of " + batch.size() + " calls failed: " + e.getMessage(), e);
                batch.forEach(call -> call.getResult().completeExceptionally(failure));
                return;
            }

            for (int i = 0; i < batch.size(); i++) {
                ToolCallResult result = results != null && i < results.size() ? results.get(i) : null;
                if (result != null) {
                    batch.get(i).getResult().complete(result);
                } else {
                    batch.get(i).getResult().completeExceptionally(
                            new BatchExecutionException("No result returned for call " + i));
                }
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            try {
                config.getListener().onBatch(batch.size(), duration);
            } catch (RuntimeException e) {
                logger.warn("Batch listener failed: {}", e.getMessage());
            }
        } finally {
            for (QueuedCall call : batch) {
                if (!call.getResult().isDone()) {
                    call.getResult().completeExceptionally(new BatchExecutionException("Batch aborted"));
                }
            }
            finishBatch();
            done.complete(null);
        }
    }

    private void finishBatch() {
        boolean flushNow = false;
        lock.lock();
        try {
            executing = false;
            if (!queue.isEmpty() && !closed) {
                if (config.isExecuteOnFull() && queue.size() >= config.getMaxBatchSize()) {
                    flushNow = true;
                } else {
                    scheduleFlush();
                }
            }
        } finally {
            lock.unlock();
        }
        if (flushNow) {
            flush();
        }
    }

    // Caller holds lock
    private void insertSorted(QueuedCall call) {
        int index = queue.size();
        while (index > 0 && call.precedes(queue.get(index - 1))) {
            index--;
        }
        queue.add(index, call);
    }

    // Caller holds lock
    private void scheduleFlush() {
        if (flushTimer != null || executing || closed) {
            return;
        }
        long generation = ++timerGeneration;
        flushTimer = timer.schedule(() -> onTimer(generation),
                config.getMaxWait().toMillis(), TimeUnit.MILLISECONDS);
    }

    // Caller holds lock
    private void cancelTimer() {
        if (flushTimer != null) {
            flushTimer.cancel(false);
            flushTimer = null;
        }
        timerGeneration++;
    }

    private void onTimer(long generation) {
        lock.lock();
        try {
            if (generation != timerGeneration) {
                return;
            }
            flushTimer = null;
        } finally {
            lock.unlock();
        }
        flush();
    }
}
