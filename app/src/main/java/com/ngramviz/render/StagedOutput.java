package com.ngramviz.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a text file through a temporary sibling that is moved into place once complete,
 * so a failed write never leaves a partial file at the target path.
 */
final class StagedOutput {
    
    private static final Logger logger = LoggerFactory.getLogger(StagedOutput.class);
    
    @FunctionalInterface
    interface Content {
        void writeTo(Writer writer) throws IOException;
    }
    
    private StagedOutput() {
    }
    
    static void write(Path output, Charset charset, Content content) throws IOException {
        Path directory = output.toAbsolutePath().getParent();
        Path staging = Files.createTempFile(directory, "." + output.getFileName(), ".tmp");
        
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(staging, charset)) {
                content.writeTo(writer);
            }
            moveIntoPlace(staging, output);
        } finally {
            Files.deleteIfExists(staging);
        }
    }
    
    private static void moveIntoPlace(Path staging, Path output) throws IOException {
        try {
            Files.move(staging, output, StandardCopyOption.ATOMIC_MOVE,
                StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", output);
            Files.move(staging, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
