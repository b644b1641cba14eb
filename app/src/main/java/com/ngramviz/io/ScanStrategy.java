package com.ngramviz.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * How the input file is turned into chunks. All strategies yield identical tables;
 * only {@link #STREAMING} is memory-bounded for arbitrarily large inputs.
 */
public enum ScanStrategy {
    
    STREAMING("streaming") {
        @Override
        public ChunkSource open(Path path, int chunkSize) throws IOException {
            return ChannelChunkSource.open(path, chunkSize);
        }
    },
    
    MAPPED("mapped") {
        @Override
        public ChunkSource open(Path path, int chunkSize) throws IOException {
            return MappedChunkSource.open(path, chunkSize);
        }
    },
    
    /** Reads the file into memory in one go; limited to 2 GB inputs. */
    WHOLE_FILE("whole-file") {
        @Override
        public ChunkSource open(Path path, int chunkSize) throws IOException {
            return ByteArrayChunkSource.wholeArray(Files.readAllBytes(path));
        }
    };
    
    private final String label;
    
    ScanStrategy(String label) {
        this.label = label;
    }
    
    public abstract ChunkSource open(Path path, int chunkSize) throws IOException;
    
    public String getLabel() {
        return label;
    }
    
    public static ScanStrategy fromString(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ScanStrategy strategy : values()) {
            if (strategy.label.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown scan strategy: " + value
            + " (expected streaming, mapped or whole-file)");
    }
}
