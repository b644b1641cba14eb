package com.ngramviz.core;

import java.util.Arrays;

/**
 * Immutable pair or triplet of unsigned byte values, used as a frequency table key.
 */
public final class ByteTuple {
    
    private final int[] values;
    
    private ByteTuple(int[] values) {
        this.values = values;
    }
    
    public static ByteTuple of(int... values) {
        if (values.length != 2 && values.length != 3) {
            throw new IllegalArgumentException("Tuple length must be 2 or 3, got " + values.length);
        }
        for (int value : values) {
            if (value < 0 || value > 255) {
                throw new IllegalArgumentException("Byte value out of range: " + value);
            }
        }
        return new ByteTuple(values.clone());
    }
    
    /**
     * Rebuild a tuple from its flattened table index.
     */
    public static ByteTuple fromIndex(NgramMode mode, int index) {
        int[] values = new int[mode.getLength()];
        for (int i = values.length - 1; i >= 0; i--) {
            values[i] = index & 0xFF;
            index >>>= 8;
        }
        return new ByteTuple(values);
    }
    
    public int length() {
        return values.length;
    }
    
    public int get(int position) {
        return values[position];
    }
    
    /**
     * Flattened index: x*256+y for pairs, x*65536+y*256+z for triplets.
     */
    public int toIndex() {
        int index = 0;
        for (int value : values) {
            index = (index << 8) | value;
        }
        return index;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteTuple)) return false;
        return Arrays.equals(values, ((ByteTuple) o).values);
    }
    
    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(values[i]);
        }
        return sb.append(')').toString();
    }
}
