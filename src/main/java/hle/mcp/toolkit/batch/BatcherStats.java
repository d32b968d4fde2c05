package hle.mcp.toolkit.batch;

/**
 * Snapshot of {@link CallBatcher} counters.
 */
public class BatcherStats {

    private final long totalCalls;
    private final long totalBatches;
    private final double averageBatchSize;
    private final long callsSaved;

    BatcherStats(long totalCalls, long totalBatches, double averageBatchSize, long callsSaved) {
        this.totalCalls = totalCalls;
        this.totalBatches = totalBatches;
        this.averageBatchSize = averageBatchSize;
        this.callsSaved = callsSaved;
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getTotalBatches() {
        return totalBatches;
    }

    public double getAverageBatchSize() {
        return averageBatchSize;
    }

    /**
     * Gets the round trips avoided by batching: the sum of {@code size - 1} over all batches.
     */
    public long getCallsSaved() {
        return callsSaved;
    }

    @Override
    public String toString() {
        return String.format("CallBatcher[calls=%d, batches=%d, avgSize=%.2f, saved=%d]",
                totalCalls, totalBatches, averageBatchSize, callsSaved);
    }
}
