package com.ngramviz.service;

import com.ngramviz.core.FrequencyTable;
import com.ngramviz.core.NgramCounter;
import com.ngramviz.core.NgramMode;
import com.ngramviz.core.SlidingWindowState;
import com.ngramviz.io.ByteChunk;
import com.ngramviz.io.ChunkSource;
import com.ngramviz.io.ScanStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Single-threaded frequency scan feeding chunks from a {@link ScanStrategy} through an
 * {@link NgramCounter}.
 */
public class ChunkedFrequencyService implements FrequencyService {
    
    private static final Logger logger = LoggerFactory.getLogger(ChunkedFrequencyService.class);
    
    private final ScanStrategy strategy;
    private final int chunkSizeBytes;
    
    public ChunkedFrequencyService(int chunkSizeBytes) {
        this(ScanStrategy.STREAMING, chunkSizeBytes);
    }
    
    public ChunkedFrequencyService(ScanStrategy strategy, int chunkSizeBytes) {
        if (chunkSizeBytes <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSizeBytes);
        }
        this.strategy = strategy;
        this.chunkSizeBytes = chunkSizeBytes;
    }
    
    public ScanStrategy getStrategy() {
        return strategy;
    }
    
    public int getChunkSizeBytes() {
        return chunkSizeBytes;
    }
    
    @Override
    public FrequencyTable computeTable(Path input, NgramMode mode,
                                       Consumer<Double> progressCallback) throws IOException {
        logger.info("Scanning {} for {}s ({} strategy, {} byte chunks)",
            input, mode.getLabel(), strategy.getLabel(), chunkSizeBytes);
        
        try (ChunkSource source = strategy.open(input, chunkSizeBytes)) {
            return computeTable(source, mode, progressCallback);
        }
    }
    
    @Override
    public FrequencyTable computeTable(ChunkSource source, NgramMode mode,
                                       Consumer<Double> progressCallback) throws IOException {
        long startTime = System.nanoTime();
        long size = source.size();
        
        NgramCounter counter = new NgramCounter(mode);
        FrequencyTable table = new FrequencyTable(mode);
        SlidingWindowState state = counter.initialState();
        
        long consumed = 0;
        long chunks = 0;
        ByteChunk chunk;
        while ((chunk = source.nextChunk()) != null) {
            state = counter.step(state, chunk.getData(), chunk.getLength(), table);
            consumed += chunk.getLength();
            chunks++;
            
            if (progressCallback != null && size > 0) {
                progressCallback.accept(Math.min(1.0, (double) consumed / size));
            }
        }
        
        long duration = System.nanoTime() - startTime;
        logger.debug("Counted {} bytes in {} chunks in {} ms",
            consumed, chunks, duration / 1_000_000);
        
        return table;
    }
    
    @Override
    public String getServiceName() {
        return "CPU (" + strategy.getLabel() + ")";
    }
    
    @Override
    public boolean isAvailable() {
        return true;
    }
}
