package com.ngramviz.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads a file through memory-mapped windows of one chunk each, copied into a reusable buffer.
 */
public class MappedChunkSource implements ChunkSource {
    
    private static final Logger logger = LoggerFactory.getLogger(MappedChunkSource.class);
    
    private final FileChannel channel;
    private final long size;
    private final byte[] buffer;
    private long offset;
    
    private MappedChunkSource(FileChannel channel, long size, int chunkSize) {
        this.channel = channel;
        this.size = size;
        this.buffer = new byte[(int) Math.max(1, Math.min(chunkSize, size))];
    }
    
    public static MappedChunkSource open(Path path, int chunkSize) throws IOException {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            long size = channel.size();
            logger.debug("Mapping {} ({} bytes) in {} byte windows", path, size, chunkSize);
            return new MappedChunkSource(channel, size, chunkSize);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }
    
    @Override
    public ByteChunk nextChunk() throws IOException {
        if (offset >= size) {
            return null;
        }
        
        int length = (int) Math.min(buffer.length, size - offset);
        MappedByteBuffer window = channel.map(FileChannel.MapMode.READ_ONLY, offset, length);
        window.get(buffer, 0, length);
        offset += length;
        
        return new ByteChunk(buffer, length);
    }
    
    @Override
    public long size() {
        return size;
    }
    
    @Override
    public void close() throws IOException {
        channel.close();
    }
}
