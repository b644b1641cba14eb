package com.ngramviz.core;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Occurrence counts for every n-gram of one scan, stored densely by flattened index.
 * <p>
 * A pair table holds 65,536 counters and a triplet table 16,777,216; the footprint is fixed
 * and independent of the input size. Entries with a count of zero are treated as absent.
 */
public final class FrequencyTable implements NgramSink {
    
    private final NgramMode mode;
    private final long[] counts;
    
    public FrequencyTable(NgramMode mode) {
        this.mode = mode;
        this.counts = new long[mode.getKeySpaceSize()];
    }
    
    public NgramMode getMode() {
        return mode;
    }
    
    /**
     * Record one occurrence of the n-gram with the given flattened index.
     */
    @Override
    public void accept(int index) {
        counts[index]++;
    }
    
    public long countAt(int index) {
        return counts[index];
    }
    
    public long count(ByteTuple tuple) {
        if (tuple.length() != mode.getLength()) {
            throw new IllegalArgumentException("Expected a " + mode.getLength()
                + "-byte tuple, got " + tuple);
        }
        return counts[tuple.toIndex()];
    }
    
    public long count(int x, int y) {
        requireMode(NgramMode.PAIR);
        return counts[(x << 8) | y];
    }
    
    public long count(int x, int y, int z) {
        requireMode(NgramMode.TRIPLET);
        return counts[(x << 16) | (y << 8) | z];
    }
    
    /**
     * Highest count in the table, 0 when empty.
     */
    public long getPeak() {
        long peak = 0;
        for (long count : counts) {
            if (count > peak) {
                peak = count;
            }
        }
        return peak;
    }
    
    /**
     * Sum of all counts; equals max(0, L - n + 1) for an input of L bytes.
     */
    public long getTotal() {
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        return total;
    }
    
    /**
     * Number of keys observed at least once.
     */
    public int getDistinctCount() {
        int distinct = 0;
        for (long count : counts) {
            if (count != 0) {
                distinct++;
            }
        }
        return distinct;
    }
    
    public boolean isEmpty() {
        return getDistinctCount() == 0;
    }
    
    /**
     * Visit every non-zero entry in ascending index order.
     */
    public void forEachNonZero(EntryVisitor visitor) {
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] != 0) {
                visitor.visit(i, counts[i]);
            }
        }
    }
    
    /**
     * Non-zero entries keyed by tuple, in ascending index order.
     */
    public Map<ByteTuple, Long> toMap() {
        Map<ByteTuple, Long> map = new LinkedHashMap<>();
        forEachNonZero((index, count) -> map.put(ByteTuple.fromIndex(mode, index), count));
        return map;
    }
    
    private void requireMode(NgramMode expected) {
        if (mode != expected) {
            throw new IllegalStateException("Table holds " + mode.getLabel()
                + " counts, not " + expected.getLabel() + " counts");
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrequencyTable)) return false;
        FrequencyTable other = (FrequencyTable) o;
        return mode == other.mode && Arrays.equals(counts, other.counts);
    }
    
    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + Arrays.hashCode(counts);
    }
    
    @Override
    public String toString() {
        return String.format("FrequencyTable[%s, total=%d, distinct=%d, peak=%d]",
            mode.getLabel(), getTotal(), getDistinctCount(), getPeak());
    }
    
    /**
     * Callback for {@link #forEachNonZero(EntryVisitor)}.
     */
    @FunctionalInterface
    public interface EntryVisitor {
        void visit(int index, long count);
    }
}
