package com.ngramviz.core;

/**
 * Sliding-window n-gram scanner over a stream delivered in chunks.
 * <p>
 * The counter itself holds no stream state. Callers thread a {@link SlidingWindowState}
 * through successive {@link #step} calls, starting from {@link SlidingWindowState#empty}.
 * Every n-gram of the stream is emitted exactly once whatever the chunk sizes are, including
 * chunks of a single byte.
 */
public class NgramCounter {
    
    private final NgramMode mode;
    private final int windowMask;
    
    public NgramCounter(NgramMode mode) {
        this.mode = mode;
        this.windowMask = mode.getKeySpaceSize() - 1;
    }
    
    public NgramMode getMode() {
        return mode;
    }
    
    public SlidingWindowState initialState() {
        return SlidingWindowState.empty(mode);
    }
    
    /**
     * Emit every n-gram that ends inside {@code chunk[0, length)} and return the state to
     * pass along with the next chunk.
     */
    public SlidingWindowState step(SlidingWindowState state, byte[] chunk, int length,
                                   NgramSink sink) {
        if (state.getMode() != mode) {
            throw new IllegalArgumentException("State is for " + state.getMode()
                + " but counter scans " + mode);
        }
        if (length == 0) {
            return state;
        }
        
        emitBoundary(state, chunk, length, sink);
        emitInterior(chunk, length, sink);
        
        return state.advance(chunk, length);
    }
    
    /**
     * N-grams that start in the carried bytes and end in the new chunk.
     */
    private void emitBoundary(SlidingWindowState state, byte[] chunk, int length,
                              NgramSink sink) {
        int carried = state.size();
        int n = mode.getLength();
        
        for (int start = 0; start < carried; start++) {
            int fromChunk = n - (carried - start);
            if (fromChunk > length) {
                // a later start needs fewer chunk bytes
                continue;
            }
            
            int index = 0;
            for (int i = start; i < carried; i++) {
                index = (index << 8) | state.byteAt(i);
            }
            for (int i = 0; i < fromChunk; i++) {
                index = (index << 8) | (chunk[i] & 0xFF);
            }
            sink.accept(index);
        }
    }
    
    /**
     * N-grams lying entirely inside the chunk.
     */
    private void emitInterior(byte[] chunk, int length, NgramSink sink) {
        int warmup = mode.getLength() - 1;
        int window = 0;
        
        for (int i = 0; i < length; i++) {
            window = ((window << 8) | (chunk[i] & 0xFF)) & windowMask;
            if (i >= warmup) {
                sink.accept(window);
            }
        }
    }
}
