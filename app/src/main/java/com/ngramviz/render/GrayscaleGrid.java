package com.ngramviz.render;

/**
 * Immutable 256x256 raster of display values in [0, 255].
 */
public final class GrayscaleGrid {
    
    public static final int SIZE = 256;
    
    private final byte[] pixels;
    
    GrayscaleGrid(byte[] pixels) {
        if (pixels.length != SIZE * SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE * SIZE + " pixels, got " + pixels.length);
        }
        this.pixels = pixels;
    }
    
    /**
     * Display value at column {@code x}, row {@code y}.
     */
    public int get(int x, int y) {
        return pixels[y * SIZE + x] & 0xFF;
    }
    
    /**
     * Number of pixels brighter than black.
     */
    public int countLit() {
        int lit = 0;
        for (byte pixel : pixels) {
            if (pixel != 0) {
                lit++;
            }
        }
        return lit;
    }
    
    static Builder builder() {
        return new Builder();
    }
    
    static final class Builder {
        private byte[] pixels = new byte[SIZE * SIZE];
        
        Builder set(int x, int y, int value) {
            pixels[y * SIZE + x] = (byte) value;
            return this;
        }
        
        GrayscaleGrid build() {
            GrayscaleGrid grid = new GrayscaleGrid(pixels);
            pixels = null;
            return grid;
        }
    }
}
