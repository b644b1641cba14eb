package com.ngramviz.render;

import java.util.Collections;
import java.util.List;

/**
 * Everything an external 3D renderer receives: the points, the peak count and the curve label.
 */
public final class ScatterPlot {
    
    private final List<ScatterPoint> points;
    private final long peak;
    private final String curveLabel;
    private final int observedCount;
    
    public ScatterPlot(List<ScatterPoint> points, long peak, String curveLabel, int observedCount) {
        this.points = Collections.unmodifiableList(points);
        this.peak = peak;
        this.curveLabel = curveLabel;
        this.observedCount = observedCount;
    }
    
    public List<ScatterPoint> getPoints() {
        return points;
    }
    
    public long getPeak() {
        return peak;
    }
    
    public String getCurveLabel() {
        return curveLabel;
    }
    
    /**
     * Number of distinct triplets before the point cap was applied.
     */
    public int getObservedCount() {
        return observedCount;
    }
    
    public boolean isTruncated() {
        return points.size() < observedCount;
    }
    
    public String getTitle() {
        return String.format("Byte triplet frequencies (%s scale, peak %d)", curveLabel, peak);
    }
}
