package com.ngramviz.core;

import java.util.Locale;

/**
 * Curve turning a count, relative to the peak count, into a brightness ratio.
 */
public enum ToneCurve {
    
    /** Ratio follows the raw counts. */
    LINEAR("linear") {
        @Override
        double ratio(long count, long peak) {
            return (double) count / peak;
        }
    },
    
    /** Softer than linear. */
    SQRT("sqrt") {
        @Override
        double ratio(long count, long peak) {
            return Math.sqrt((double) count / peak);
        }
    },
    
    /** Highlights rare n-grams. */
    LOG("log") {
        @Override
        double ratio(long count, long peak) {
            return Math.log1p(count) / Math.log1p(peak);
        }
    };
    
    private final String label;
    
    ToneCurve(String label) {
        this.label = label;
    }
    
    /**
     * Unclamped ratio; both arguments are positive.
     */
    abstract double ratio(long count, long peak);
    
    public String getLabel() {
        return label;
    }
    
    public static ToneCurve fromString(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ToneCurve curve : values()) {
            if (curve.label.equals(normalized)) {
                return curve;
            }
        }
        throw new IllegalArgumentException("Unknown tone curve: " + value
            + " (expected linear, sqrt or log)");
    }
}
