package com.ngramviz.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Streams a file through a single reusable buffer. Memory use is bounded by the chunk size.
 */
public class ChannelChunkSource implements ChunkSource {
    
    private static final Logger logger = LoggerFactory.getLogger(ChannelChunkSource.class);
    
    private final FileChannel channel;
    private final long size;
    private final byte[] buffer;
    private final ByteBuffer view;
    private boolean exhausted;
    private long chunksRead;
    
    private ChannelChunkSource(FileChannel channel, long size, int chunkSize) {
        this.channel = channel;
        this.size = size;
        this.buffer = new byte[(int) Math.max(1, Math.min(chunkSize, size))];
        this.view = ByteBuffer.wrap(buffer);
    }
    
    /**
     * Open {@code path} read-only.
     * 
     * @throws java.nio.file.NoSuchFileException If the file does not exist
     */
    public static ChannelChunkSource open(Path path, int chunkSize) throws IOException {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            long size = channel.size();
            logger.debug("Opened {} ({} bytes) with {} byte chunks", path, size, chunkSize);
            return new ChannelChunkSource(channel, size, chunkSize);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }
    
    @Override
    public ByteChunk nextChunk() throws IOException {
        if (exhausted) {
            return null;
        }
        
        view.clear();
        while (view.hasRemaining()) {
            if (channel.read(view) < 0) {
                exhausted = true;
                break;
            }
        }
        
        if (view.position() == 0) {
            exhausted = true;
            return null;
        }
        
        chunksRead++;
        return new ByteChunk(buffer, view.position());
    }
    
    @Override
    public long size() {
        return size;
    }
    
    @Override
    public void close() throws IOException {
        logger.debug("Closing channel after {} chunks", chunksRead);
        channel.close();
    }
}
