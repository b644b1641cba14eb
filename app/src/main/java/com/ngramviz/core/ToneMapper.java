package com.ngramviz.core;

/**
 * Maps occurrence counts onto display values in [0, 255].
 * <p>
 * A count of zero always maps to 0 and any positive count maps to at least 1, so "never
 * observed" stays distinguishable from "observed once". For a fixed peak the mapping is
 * non-decreasing in the count.
 */
public class ToneMapper {
    
    public static final int MAX_VALUE = 255;
    public static final double NO_GAMMA = 1.0;
    
    private final ToneCurve curve;
    private final double gamma;
    
    public ToneMapper(ToneCurve curve) {
        this(curve, NO_GAMMA);
    }
    
    public ToneMapper(ToneCurve curve, double gamma) {
        if (curve == null) {
            throw new IllegalArgumentException("Tone curve is required");
        }
        if (!(gamma > 0) || Double.isInfinite(gamma)) {
            throw new IllegalArgumentException("Gamma must be a positive finite number, got " + gamma);
        }
        this.curve = curve;
        this.gamma = gamma;
    }
    
    public ToneCurve getCurve() {
        return curve;
    }
    
    public double getGamma() {
        return gamma;
    }
    
    public int brightness(long count, long peak) {
        return brightness(count, peak, curve, gamma);
    }
    
    /**
     * Display value of {@code count} when the busiest n-gram occurred {@code peak} times.
     */
    public static int brightness(long count, long peak, ToneCurve curve, double gamma) {
        if (count <= 0 || peak <= 0) {
            return 0;
        }
        
        double ratio = curve.ratio(count, peak);
        ratio = Math.max(0.0, Math.min(1.0, ratio));
        if (gamma != NO_GAMMA) {
            ratio = Math.pow(ratio, gamma);
        }
        
        // ties go to the even level
        double scaled = Math.rint(ratio * MAX_VALUE);
        return (int) Math.min(MAX_VALUE, Math.max(1.0, scaled));
    }
    
    /**
     * Opacity used for scatter points: 0.2 for the faintest, 1.0 for the brightest.
     */
    public static double opacity(int brightness) {
        return 0.2 + (brightness / (double) MAX_VALUE) * 0.8;
    }
    
    @Override
    public String toString() {
        return gamma == NO_GAMMA
            ? curve.getLabel()
            : String.format("%s (gamma %.2f)", curve.getLabel(), gamma);
    }
}
