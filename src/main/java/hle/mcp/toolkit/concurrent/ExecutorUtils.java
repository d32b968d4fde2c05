package hle.mcp.toolkit.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

public final class ExecutorUtils {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorUtils.class);

    private ExecutorUtils() {
    }

    /**
     * Initiates an orderly shutdown and waits up to {@code timeout} for running
     * tasks to finish, then interrupts whatever is left.
     *
     * @return true if the executor terminated within the timeout
     */
    public static boolean shutdownGracefully(ExecutorService executor, Duration timeout) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            List<Runnable> dropped = executor.shutdownNow();
            logger.warn("Executor did not terminate within {}ms, interrupted ({} queued tasks dropped)",
                    timeout.toMillis(), dropped.size());
            return false;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
