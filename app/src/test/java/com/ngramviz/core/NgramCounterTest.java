package com.ngramviz.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Unit tests for the sliding-window counter.
 */
class NgramCounterTest {
    
    private static FrequencyTable count(NgramMode mode, byte[] data, int chunkSize) {
        NgramCounter counter = new NgramCounter(mode);
        FrequencyTable table = new FrequencyTable(mode);
        SlidingWindowState state = counter.initialState();
        for (int offset = 0; offset < data.length; offset += chunkSize) {
            int length = Math.min(chunkSize, data.length - offset);
            byte[] chunk = new byte[length];
            System.arraycopy(data, offset, chunk, 0, length);
            state = counter.step(state, chunk, length, table);
        }
        return table;
    }
    
    private static byte[] bytes(int... values) {
        byte[] data = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = (byte) values[i];
        }
        return data;
    }
    
    @Test
    void testPairExample() {
        FrequencyTable table = count(NgramMode.PAIR, bytes(0, 1, 2, 3, 2), 1024);
        
        Map<ByteTuple, Long> expected = new LinkedHashMap<>();
        expected.put(ByteTuple.of(0, 1), 1L);
        expected.put(ByteTuple.of(1, 2), 1L);
        expected.put(ByteTuple.of(2, 3), 1L);
        expected.put(ByteTuple.of(3, 2), 1L);
        
        assertEquals(expected, table.toMap());
        assertEquals(1, table.getPeak());
    }
    
    @Test
    void testTripletExample() {
        FrequencyTable table = count(NgramMode.TRIPLET, bytes(0, 1, 2, 3, 2, 1), 1024);
        
        Map<ByteTuple, Long> expected = new LinkedHashMap<>();
        expected.put(ByteTuple.of(0, 1, 2), 1L);
        expected.put(ByteTuple.of(1, 2, 3), 1L);
        expected.put(ByteTuple.of(2, 3, 2), 1L);
        expected.put(ByteTuple.of(3, 2, 1), 1L);
        
        assertEquals(expected, table.toMap());
        assertEquals(1, table.getPeak());
    }
    
    @Test
    void testTripletsAcrossEveryBoundary() {
        byte[] data = bytes(5, 6, 7, 8);
        
        for (int chunkSize = 1; chunkSize <= 4; chunkSize++) {
            FrequencyTable table = count(NgramMode.TRIPLET, data, chunkSize);
            
            assertEquals(2, table.getTotal(), "chunk size " + chunkSize);
            assertEquals(1, table.count(5, 6, 7), "chunk size " + chunkSize);
            assertEquals(1, table.count(6, 7, 8), "chunk size " + chunkSize);
        }
    }
    
    @Test
    void testRepeatedPairsAccumulate() {
        FrequencyTable table = count(NgramMode.PAIR, bytes(9, 9, 9, 9, 9), 2);
        
        assertEquals(4, table.count(9, 9));
        assertEquals(1, table.getDistinctCount());
        assertEquals(4, table.getPeak());
    }
    
    @Test
    void testChunkSizeInvariance() {
        byte[] data = new byte[20_000];
        new Random(7).nextBytes(data);
        
        for (NgramMode mode : NgramMode.values()) {
            FrequencyTable whole = count(mode, data, data.length);
            assertEquals(data.length - mode.getLength() + 1, whole.getTotal());
            
            for (int chunkSize : new int[] {1, 2, 7, 4096}) {
                assertEquals(whole, count(mode, data, chunkSize),
                    mode + " with chunk size " + chunkSize);
            }
        }
    }
    
    @Test
    void testShortFilesProduceEmptyTables() {
        for (NgramMode mode : NgramMode.values()) {
            assertTrue(count(mode, new byte[0], 16).isEmpty());
            assertTrue(count(mode, bytes(42), 16).isEmpty());
        }
        assertTrue(count(NgramMode.TRIPLET, bytes(1, 2), 1).isEmpty());
    }
    
    @Test
    void testEmptyChunkLeavesStateUnchanged() {
        NgramCounter counter = new NgramCounter(NgramMode.TRIPLET);
        CountingSink sink = new CountingSink();
        
        SlidingWindowState state = counter.step(counter.initialState(), bytes(1, 2), 2, sink);
        SlidingWindowState after = counter.step(state, new byte[8], 0, sink);
        
        assertEquals(state, after);
        assertEquals(0, sink.emitted);
    }
    
    @Test
    void testStepUsesOnlyGivenLength() {
        NgramCounter counter = new NgramCounter(NgramMode.PAIR);
        CountingSink sink = new CountingSink();
        
        // trailing bytes of a reused buffer must be ignored
        counter.step(counter.initialState(), bytes(1, 2, 99, 99), 2, sink);
        
        assertEquals(1, sink.emitted);
        assertEquals(1L, sink.counts.get((1 << 8) | 2));
    }
    
    @Test
    void testStateFromOtherModeRejected() {
        NgramCounter counter = new NgramCounter(NgramMode.PAIR);
        SlidingWindowState tripletState = SlidingWindowState.empty(NgramMode.TRIPLET);
        
        assertThrows(IllegalArgumentException.class,
            () -> counter.step(tripletState, bytes(1, 2), 2, new CountingSink()));
    }
    
    @Test
    void testHighByteValues() {
        FrequencyTable table = count(NgramMode.TRIPLET, bytes(255, 254, 255, 254), 1);
        
        assertEquals(1, table.count(255, 254, 255));
        assertEquals(1, table.count(254, 255, 254));
    }
}
