package hle.mcp.toolkit.batch;

import java.time.Duration;

/**
 * Notified after each batch whose executor returned normally.
 */
@FunctionalInterface
public interface BatchListener {

    BatchListener NO_OP = (batchSize, duration) -> { };

    void onBatch(int batchSize, Duration duration);
}
