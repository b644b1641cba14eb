package com.ngramviz.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tracks timing metrics for the stages of one visualization run.
 */
public class StageMetrics {
    
    public enum Stage {
        READ_AND_COUNT("Read & Count"),
        PEAK_LOOKUP("Peak Lookup"),
        TONE_MAPPING("Tone Mapping"),
        OUTPUT_WRITE("Output Write");
        
        private final String displayName;
        
        Stage(String displayName) {
            this.displayName = displayName;
        }
        
        public String getDisplayName() {
            return displayName;
        }
    }
    
    private final Map<Stage, Long> stageTimes; // in nanoseconds
    private final Map<Stage, Long> stageDataSizes; // bytes processed
    
    public StageMetrics() {
        this.stageTimes = new EnumMap<>(Stage.class);
        this.stageDataSizes = new EnumMap<>(Stage.class);
    }
    
    /**
     * Record time taken for a stage.
     */
    public void recordStage(Stage stage, long nanoTime, long dataSize) {
        stageTimes.merge(stage, nanoTime, Long::sum);
        stageDataSizes.merge(stage, dataSize, Long::sum);
    }
    
    public double getStageTimeMs(Stage stage) {
        return stageTimes.getOrDefault(stage, 0L) / 1_000_000.0;
    }
    
    public double getStageTimeSec(Stage stage) {
        return stageTimes.getOrDefault(stage, 0L) / 1_000_000_000.0;
    }
    
    public boolean hasStage(Stage stage) {
        return stageTimes.containsKey(stage);
    }
    
    /**
     * Get throughput for a stage in MB/s.
     */
    public double getStageThroughputMBps(Stage stage) {
        long dataSize = stageDataSizes.getOrDefault(stage, 0L);
        double timeSec = getStageTimeSec(stage);
        if (timeSec == 0) return 0;
        return (dataSize / 1_000_000.0) / timeSec;
    }
    
    /**
     * Get percentage of total time spent in this stage.
     */
    public double getStagePercentage(Stage stage) {
        long stageTime = stageTimes.getOrDefault(stage, 0L);
        long totalTime = getTotalTimeNanos();
        if (totalTime == 0) return 0;
        return (stageTime * 100.0) / totalTime;
    }
    
    public long getTotalTimeNanos() {
        return stageTimes.values().stream().mapToLong(Long::longValue).sum();
    }
    
    /**
     * Get formatted summary of all stages.
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Stage Performance Breakdown:\n");
        
        for (Stage stage : Stage.values()) {
            if (stageTimes.containsKey(stage)) {
                sb.append(String.format("%-15s: %8.2f ms (%5.1f%%)",
                    stage.getDisplayName(),
                    getStageTimeMs(stage),
                    getStagePercentage(stage)));
                if (stageDataSizes.getOrDefault(stage, 0L) > 0) {
                    sb.append(String.format(" [%.2f MB/s]", getStageThroughputMBps(stage)));
                }
                sb.append('\n');
            }
        }
        
        return sb.toString();
    }
}
