package com.ngramviz.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * Lazy, finite, non-restartable sequence of non-empty byte chunks in file order.
 */
public interface ChunkSource extends Closeable {
    
    /**
     * Next chunk, or {@code null} once the input is exhausted.
     * 
     * @throws IOException If reading fails; the source is unusable afterwards
     */
    ByteChunk nextChunk() throws IOException;
    
    /**
     * Total number of bytes this source will deliver.
     */
    long size();
    
    @Override
    void close() throws IOException;
}
