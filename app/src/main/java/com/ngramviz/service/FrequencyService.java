package com.ngramviz.service;

import com.ngramviz.core.FrequencyTable;
import com.ngramviz.core.NgramMode;
import com.ngramviz.io.ChunkSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Service for computing n-gram frequency tables.
 */
public interface FrequencyService {
    
    /**
     * Scan a file.
     * 
     * @param input Input file path
     * @param mode Tuple length
     * @param progressCallback Callback for progress updates (0.0 to 1.0), may be null
     * @return The complete table; never a partial one
     * @throws java.nio.file.NoSuchFileException If the input does not exist
     * @throws IOException If reading fails
     */
    FrequencyTable computeTable(Path input, NgramMode mode,
                                Consumer<Double> progressCallback) throws IOException;
    
    /**
     * Drain an already opened source. The caller keeps ownership of the source.
     */
    FrequencyTable computeTable(ChunkSource source, NgramMode mode,
                                Consumer<Double> progressCallback) throws IOException;
    
    /**
     * Get service name.
     */
    String getServiceName();
    
    /**
     * Check if service is available.
     */
    boolean isAvailable();
}
