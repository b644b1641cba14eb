package com.ngramviz.core;

/**
 * Summary figures of a finished scan.
 */
public class TableStatistics {
    
    private final NgramMode mode;
    private final long inputSize;
    private final long total;
    private final int distinct;
    private final long peak;
    
    public TableStatistics(NgramMode mode, long inputSize, long total, int distinct, long peak) {
        this.mode = mode;
        this.inputSize = inputSize;
        this.total = total;
        this.distinct = distinct;
        this.peak = peak;
    }
    
    public static TableStatistics of(FrequencyTable table, long inputSize) {
        return new TableStatistics(table.getMode(), inputSize, table.getTotal(),
            table.getDistinctCount(), table.getPeak());
    }
    
    public NgramMode getMode() { return mode; }
    public long getInputSize() { return inputSize; }
    public long getTotal() { return total; }
    public int getDistinct() { return distinct; }
    public long getPeak() { return peak; }
    
    /**
     * Share of the 256^n key space that was observed, in percent.
     */
    public double getCoveragePercent() {
        return distinct * 100.0 / mode.getKeySpaceSize();
    }
    
    /**
     * Whether the total matches max(0, L - n + 1) for the recorded input size.
     */
    public boolean isConserved() {
        return total == mode.expectedTotal(inputSize);
    }
    
    @Override
    public String toString() {
        return String.format("%s scan: %d bytes, %d n-grams, %d distinct (%.2f%% of %d), peak %d",
            mode.getLabel(), inputSize, total, distinct, getCoveragePercent(),
            mode.getKeySpaceSize(), peak);
    }
}
