package com.ngramviz.model;

import com.ngramviz.core.TableStatistics;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one visualization run.
 */
public class RenderResult {
    
    public enum OutputKind {
        HEATMAP, SLICES, SCATTER
    }
    
    private final String fileName;
    private final OutputKind outputKind;
    private final TableStatistics statistics;
    private final List<Path> outputs;
    private final StageMetrics stageMetrics;
    private final double durationSeconds;
    
    public RenderResult(String fileName, OutputKind outputKind, TableStatistics statistics,
                        List<Path> outputs, StageMetrics stageMetrics, double durationSeconds) {
        this.fileName = fileName;
        this.outputKind = outputKind;
        this.statistics = statistics;
        this.outputs = new ArrayList<>(outputs);
        this.stageMetrics = stageMetrics;
        this.durationSeconds = durationSeconds;
    }
    
    public String getFileName() {
        return fileName;
    }
    
    public OutputKind getOutputKind() {
        return outputKind;
    }
    
    public TableStatistics getStatistics() {
        return statistics;
    }
    
    public List<Path> getOutputs() {
        return new ArrayList<>(outputs);
    }
    
    public StageMetrics getStageMetrics() {
        return stageMetrics;
    }
    
    public double getDurationSeconds() {
        return durationSeconds;
    }
    
    public double getThroughputMBps() {
        if (durationSeconds == 0) return 0;
        return (statistics.getInputSize() / 1_000_000.0) / durationSeconds;
    }
    
    @Override
    public String toString() {
        return String.format("%s [%s]: %d file(s), %.2f MB/s (%.3fs)",
            fileName, outputKind, outputs.size(), getThroughputMBps(), durationSeconds);
    }
}
