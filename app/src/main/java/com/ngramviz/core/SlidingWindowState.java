package com.ngramviz.core;

import java.util.Arrays;

/**
 * The last (n-1) bytes of everything counted so far, carried from one chunk to the next
 * so n-grams straddling a chunk boundary can be stitched together.
 * <p>
 * Instances are immutable; {@link #advance(byte[], int)} returns a new state.
 */
public final class SlidingWindowState {
    
    private static final byte[] NO_BYTES = new byte[0];
    
    private final NgramMode mode;
    private final byte[] tail;
    
    private SlidingWindowState(NgramMode mode, byte[] tail) {
        this.mode = mode;
        this.tail = tail;
    }
    
    /**
     * State before any byte has been read.
     */
    public static SlidingWindowState empty(NgramMode mode) {
        return new SlidingWindowState(mode, NO_BYTES);
    }
    
    public NgramMode getMode() {
        return mode;
    }
    
    /**
     * Number of carried bytes, between 0 and n-1.
     */
    public int size() {
        return tail.length;
    }
    
    public boolean isEmpty() {
        return tail.length == 0;
    }
    
    /**
     * Carried byte at the given position as an unsigned value, oldest first.
     */
    public int byteAt(int position) {
        return tail[position] & 0xFF;
    }
    
    /**
     * State after the first {@code length} bytes of {@code chunk} have been consumed.
     * Short chunks are merged with the bytes already carried.
     */
    public SlidingWindowState advance(byte[] chunk, int length) {
        int keep = mode.getLength() - 1;
        if (length >= keep) {
            return new SlidingWindowState(mode, Arrays.copyOfRange(chunk, length - keep, length));
        }
        
        int total = Math.min(keep, tail.length + length);
        byte[] next = new byte[total];
        int fromTail = total - length;
        System.arraycopy(tail, tail.length - fromTail, next, 0, fromTail);
        System.arraycopy(chunk, 0, next, fromTail, length);
        return new SlidingWindowState(mode, next);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlidingWindowState)) return false;
        SlidingWindowState other = (SlidingWindowState) o;
        return mode == other.mode && Arrays.equals(tail, other.tail);
    }
    
    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + Arrays.hashCode(tail);
    }
    
    @Override
    public String toString() {
        return "SlidingWindowState{mode=" + mode + ", tail=" + Arrays.toString(tail) + "}";
    }
}
