package com.ngramviz.io;

/**
 * The first {@code length} bytes of {@code data}. Sources may reuse the backing array, so a
 * chunk is only valid until the next chunk is requested.
 */
public final class ByteChunk {
    
    private final byte[] data;
    private final int length;
    
    public ByteChunk(byte[] data, int length) {
        if (length <= 0 || length > data.length) {
            throw new IllegalArgumentException("Invalid chunk length " + length
                + " for buffer of " + data.length + " bytes");
        }
        this.data = data;
        this.length = length;
    }
    
    public byte[] getData() {
        return data;
    }
    
    public int getLength() {
        return length;
    }
}
