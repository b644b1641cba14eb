package com.ngramviz.benchmark;

import com.ngramviz.config.AppConfig;
import com.ngramviz.core.FrequencyTable;
import com.ngramviz.core.NgramMode;
import com.ngramviz.io.ScanStrategy;
import com.ngramviz.service.ChunkedFrequencyService;
import com.ngramviz.service.FrequencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Benchmark suite comparing the scan strategies on one file.
 * <p>
 * Every strategy must produce the same table as the first one; a mismatch aborts the suite.
 */
public class BenchmarkSuite {
    
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkSuite.class);
    
    private final int chunkSizeBytes;
    private final int warmupIterations;
    private final int measurementIterations;
    
    public BenchmarkSuite(AppConfig config) {
        this(config.getChunkSizeBytes(), config.getWarmupIterations(),
            config.getMeasurementIterations());
    }
    
    public BenchmarkSuite(int chunkSizeBytes, int warmupIterations, int measurementIterations) {
        if (measurementIterations <= 0) {
            throw new IllegalArgumentException("At least one measurement iteration is required");
        }
        this.chunkSizeBytes = chunkSizeBytes;
        this.warmupIterations = Math.max(0, warmupIterations);
        this.measurementIterations = measurementIterations;
    }
    
    /**
     * Run every scan strategy on {@code testFile}.
     * 
     * @throws IllegalStateException If two strategies disagree on the table
     */
    public BenchmarkComparison runFullSuite(Path testFile, NgramMode mode) throws IOException {
        logger.info("Starting benchmark suite on file: {} ({} scan)", testFile, mode.getLabel());
        
        List<BenchmarkResult> results = new ArrayList<>();
        FrequencyTable reference = null;
        
        for (ScanStrategy strategy : ScanStrategy.values()) {
            FrequencyService service = new ChunkedFrequencyService(strategy, chunkSizeBytes);
            TimedTable timed = benchmarkService(service, testFile, mode, strategy.getLabel());
            results.add(timed.result);
            
            if (reference == null) {
                reference = timed.table;
            } else if (!reference.equals(timed.table)) {
                throw new IllegalStateException("Strategy " + strategy.getLabel()
                    + " produced a different table than " + ScanStrategy.values()[0].getLabel());
            }
        }
        
        return new BenchmarkComparison(results);
    }
    
    private TimedTable benchmarkService(FrequencyService service, Path testFile,
                                        NgramMode mode, String benchmarkName) throws IOException {
        logger.info("Benchmarking {}: {}", benchmarkName, service.getServiceName());
        
        for (int i = 0; i < warmupIterations; i++) {
            logger.debug("Warmup iteration {}/{}", i + 1, warmupIterations);
            service.computeTable(testFile, mode, null);
        }
        
        long totalDuration = 0;
        long minDuration = Long.MAX_VALUE;
        long maxDuration = 0;
        long inputSize = Files.size(testFile);
        FrequencyTable table = null;
        
        for (int i = 0; i < measurementIterations; i++) {
            logger.debug("Measurement iteration {}/{}", i + 1, measurementIterations);
            
            long startTime = System.nanoTime();
            table = service.computeTable(testFile, mode, null);
            long duration = System.nanoTime() - startTime;
            
            totalDuration += duration;
            minDuration = Math.min(minDuration, duration);
            maxDuration = Math.max(maxDuration, duration);
        }
        
        BenchmarkResult result = new BenchmarkResult.Builder()
            .benchmarkName(benchmarkName)
            .serviceName(service.getServiceName())
            .inputSize(inputSize)
            .distinctCount(table.getDistinctCount())
            .totalDuration(totalDuration / measurementIterations)
            .minDuration(minDuration)
            .maxDuration(maxDuration)
            .iterations(measurementIterations)
            .build();
        
        logger.info("Benchmark complete: {}", result);
        return new TimedTable(result, table);
    }
    
    private static final class TimedTable {
        final BenchmarkResult result;
        final FrequencyTable table;
        
        TimedTable(BenchmarkResult result, FrequencyTable table) {
            this.result = result;
            this.table = table;
        }
    }
    
    /**
     * Comparison of benchmark results. The first result is the baseline.
     */
    public static class BenchmarkComparison {
        private final List<BenchmarkResult> results;
        
        public BenchmarkComparison(List<BenchmarkResult> results) {
            this.results = new ArrayList<>(results);
        }
        
        public List<BenchmarkResult> getResults() {
            return new ArrayList<>(results);
        }
        
        public BenchmarkResult getFastest() {
            return results.stream()
                .max((a, b) -> Double.compare(a.getThroughputMBps(), b.getThroughputMBps()))
                .orElse(null);
        }
        
        /**
         * Speedup of {@code result} relative to the baseline.
         */
        public double getSpeedup(BenchmarkResult result) {
            if (results.isEmpty() || result.getDurationSeconds() == 0) return 1.0;
            return results.get(0).getDurationSeconds() / result.getDurationSeconds();
        }
        
        public String getSummary() {
            StringBuilder sb = new StringBuilder();
            sb.append("=== Benchmark Results ===\n");
            sb.append(String.format("%-12s %10s %10s %10s %9s%n",
                "Strategy", "Avg", "Min", "Max", "Speedup"));
            
            for (BenchmarkResult result : results) {
                sb.append(String.format("%-12s %9.4fs %9.4fs %9.4fs %8.2fx%n",
                    result.getBenchmarkName(),
                    result.getDurationSeconds(),
                    result.getMinDuration() / 1e9,
                    result.getMaxDuration() / 1e9,
                    getSpeedup(result)));
            }
            
            if (!results.isEmpty()) {
                sb.append(String.format("Distinct n-grams: %d%n", results.get(0).getDistinctCount()));
            }
            
            return sb.toString();
        }
    }
}
