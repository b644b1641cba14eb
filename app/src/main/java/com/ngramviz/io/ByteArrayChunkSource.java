package com.ngramviz.io;

/**
 * Serves an in-memory array in chunks of a fixed size.
 */
public class ByteArrayChunkSource implements ChunkSource {
    
    private final byte[] data;
    private final int chunkSize;
    private final byte[] buffer;
    private int offset;
    
    public ByteArrayChunkSource(byte[] data, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        this.data = data;
        this.chunkSize = chunkSize;
        // whole array in one chunk needs no copy
        this.buffer = chunkSize >= data.length ? null : new byte[chunkSize];
    }
    
    /**
     * Single chunk holding the whole array.
     */
    public static ByteArrayChunkSource wholeArray(byte[] data) {
        return new ByteArrayChunkSource(data, Math.max(1, data.length));
    }
    
    @Override
    public ByteChunk nextChunk() {
        if (offset >= data.length) {
            return null;
        }
        
        if (buffer == null) {
            offset = data.length;
            return new ByteChunk(data, data.length);
        }
        
        int length = Math.min(chunkSize, data.length - offset);
        System.arraycopy(data, offset, buffer, 0, length);
        offset += length;
        return new ByteChunk(buffer, length);
    }
    
    @Override
    public long size() {
        return data.length;
    }
    
    @Override
    public void close() {
        offset = data.length;
    }
}
