package hle.mcp.toolkit.batch;

import hle.mcp.toolkit.concurrent.ExecutorUtils;
import hle.mcp.toolkit.concurrent.NamedThreadFactory;
import hle.mcp.toolkit.model.ToolCall;
import hle.mcp.toolkit.model.ToolCallResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * A {@link BatchExecutor} that runs every call of a batch through a per-call
 * function in parallel and returns the results in call order.
 *
 * <p>A fair semaphore bounds how many calls of all batches run at once; a
 * non-positive concurrency means no bound. The first failing call fails the
 * batch and cancels the calls still running.
 */
public class ParallelBatchExecutor implements BatchExecutor, AutoCloseable {

    private final ToolCallFunction callFunction;
    private final Semaphore concurrencyLimiter;
    private final ExecutorService workerPool;

    public ParallelBatchExecutor(ToolCallFunction callFunction, int concurrency) {
        this.callFunction = Objects.requireNonNull(callFunction, "callFunction cannot be null");
        this.concurrencyLimiter = concurrency > 0 ? new Semaphore(concurrency, true) : null;
        this.workerPool = Executors.newCachedThreadPool(new NamedThreadFactory("parallel-batch"));
    }

    public ParallelBatchExecutor(ToolCallFunction callFunction) {
        this(callFunction, 0);
    }

    @Override
    public List<ToolCallResult> execute(List<ToolCall> calls) throws Exception {
        List<Future<ToolCallResult>> futures = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            futures.add(workerPool.submit(() -> invoke(call)));
        }

        List<ToolCallResult> results = new ArrayList<>(calls.size());
        try {
            for (Future<ToolCallResult> future : futures) {
                results.add(future.get());
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        } finally {
            for (Future<ToolCallResult> future : futures) {
                future.cancel(true);
            }
        }
        return results;
    }

    private ToolCallResult invoke(ToolCall call) throws Exception {
        if (concurrencyLimiter == null) {
            return callFunction.call(call.getName(), call.getArguments());
        }
        concurrencyLimiter.acquire();
        try {
            return callFunction.call(call.getName(), call.getArguments());
        } finally {
            concurrencyLimiter.release();
        }
    }

    /**
     * Gets the available permits, or -1 when concurrency is unbounded.
     */
    public int getAvailablePermits() {
        return concurrencyLimiter == null ? -1 : concurrencyLimiter.availablePermits();
    }

    @Override
    public void close() {
        ExecutorUtils.shutdownGracefully(workerPool, Duration.ofSeconds(30));
    }
}
