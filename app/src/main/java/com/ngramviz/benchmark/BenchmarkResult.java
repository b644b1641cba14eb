package com.ngramviz.benchmark;

/**
 * Result of benchmarking one scan strategy.
 */
public class BenchmarkResult {
    
    private final String benchmarkName;
    private final String serviceName;
    private final long inputSizeBytes;
    private final int distinctCount;
    private final long totalDuration;
    private final long minDuration;
    private final long maxDuration;
    private final int iterations;
    
    private BenchmarkResult(Builder builder) {
        this.benchmarkName = builder.benchmarkName;
        this.serviceName = builder.serviceName;
        this.inputSizeBytes = builder.inputSizeBytes;
        this.distinctCount = builder.distinctCount;
        this.totalDuration = builder.totalDuration;
        this.minDuration = builder.minDuration;
        this.maxDuration = builder.maxDuration;
        this.iterations = builder.iterations;
    }
    
    public String getBenchmarkName() { return benchmarkName; }
    public String getServiceName() { return serviceName; }
    public long getInputSizeBytes() { return inputSizeBytes; }
    public int getDistinctCount() { return distinctCount; }
    public long getTotalDuration() { return totalDuration; }
    public long getMinDuration() { return minDuration; }
    public long getMaxDuration() { return maxDuration; }
    public int getIterations() { return iterations; }
    
    public double getThroughputMBps() {
        if (totalDuration == 0) return 0;
        return (inputSizeBytes / 1_000_000.0) / (totalDuration / 1_000_000_000.0);
    }
    
    /**
     * Average duration in seconds.
     */
    public double getDurationSeconds() {
        return totalDuration / 1_000_000_000.0;
    }
    
    @Override
    public String toString() {
        return String.format("%s [%s]: %.2f MB/s, %d distinct, %.3fs avg (min %.3fs, max %.3fs)",
            benchmarkName, serviceName, getThroughputMBps(), distinctCount, getDurationSeconds(),
            minDuration / 1e9, maxDuration / 1e9);
    }
    
    public static class Builder {
        private String benchmarkName;
        private String serviceName;
        private long inputSizeBytes;
        private int distinctCount;
        private long totalDuration;
        private long minDuration;
        private long maxDuration;
        private int iterations = 1;
        
        public Builder benchmarkName(String name) {
            this.benchmarkName = name;
            return this;
        }
        
        public Builder serviceName(String name) {
            this.serviceName = name;
            return this;
        }
        
        public Builder inputSize(long bytes) {
            this.inputSizeBytes = bytes;
            return this;
        }
        
        public Builder distinctCount(int count) {
            this.distinctCount = count;
            return this;
        }
        
        public Builder totalDuration(long nanos) {
            this.totalDuration = nanos;
            return this;
        }
        
        public Builder minDuration(long nanos) {
            this.minDuration = nanos;
            return this;
        }
        
        public Builder maxDuration(long nanos) {
            this.maxDuration = nanos;
            return this;
        }
        
        public Builder iterations(int count) {
            this.iterations = count;
            return this;
        }
        
        public BenchmarkResult build() {
            return new BenchmarkResult(this);
        }
    }
}
