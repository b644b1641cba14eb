package com.ngramviz.render;

/**
 * One observed triplet prepared for a 3D scatter renderer.
 */
public final class ScatterPoint {
    
    private final int x;
    private final int y;
    private final int z;
    private final long count;
    private final int brightness;
    private final double opacity;
    
    public ScatterPoint(int x, int y, int z, long count, int brightness, double opacity) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.count = count;
        this.brightness = brightness;
        this.opacity = opacity;
    }
    
    public int getX() { return x; }
    public int getY() { return y; }
    public int getZ() { return z; }
    public long getCount() { return count; }
    public int getBrightness() { return brightness; }
    public double getOpacity() { return opacity; }
    
    @Override
    public String toString() {
        return String.format("(%d, %d, %d) x%d -> %d @ %.2f", x, y, z, count, brightness, opacity);
    }
}
