package com.ngramviz.core;

import java.util.Locale;

/**
 * Tuple length of a scan: byte pairs for a 2D heatmap, byte triplets for a 3D volume.
 */
public enum NgramMode {
    PAIR(2, "pair"),
    TRIPLET(3, "triplet");
    
    private final int length;
    private final String label;
    
    NgramMode(int length, String label) {
        this.length = length;
        this.label = label;
    }
    
    /**
     * Number of bytes per n-gram.
     */
    public int getLength() {
        return length;
    }
    
    public String getLabel() {
        return label;
    }
    
    /**
     * Number of distinct keys (256^n).
     */
    public int getKeySpaceSize() {
        return 1 << (8 * length);
    }
    
    /**
     * Number of n-grams in a stream of the given length.
     */
    public long expectedTotal(long streamLength) {
        return Math.max(0, streamLength - length + 1);
    }
    
    /**
     * Parse a mode from its label ("pair", "triplet") or its dimensionality ("2d", "3d").
     */
    public static NgramMode fromString(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "pair":
            case "2":
            case "2d":
                return PAIR;
            case "triplet":
            case "3":
            case "3d":
                return TRIPLET;
            default:
                throw new IllegalArgumentException("Unknown n-gram mode: " + value);
        }
    }
}
