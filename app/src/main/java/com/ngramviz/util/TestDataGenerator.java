package com.ngramviz.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Random;

/**
 * Utility to generate test data files with different n-gram profiles.
 */
public class TestDataGenerator {
    
    private static final Logger logger = LoggerFactory.getLogger(TestDataGenerator.class);
    
    public enum Pattern {
        /** Uniform random bytes; approaches full key-space coverage. */
        RANDOM,
        /** "ABCD" repeated; only a handful of distinct n-grams. */
        REPETITIVE,
        /** 0, 1, ..., 255, 0, 1, ...; every n-gram is a run of consecutive values. */
        SEQUENTIAL
    }
    
    /**
     * Generate a file of {@code sizeBytes} bytes following {@code pattern}.
     */
    public static void generate(Pattern pattern, long sizeBytes, Path outputPath) throws IOException {
        logger.info("Generating {} byte {} test file: {}", sizeBytes,
            pattern.name().toLowerCase(Locale.ROOT), outputPath);
        
        switch (pattern) {
            case RANDOM:
                generateRandomFile(sizeBytes, outputPath);
                break;
            case REPETITIVE:
                writeRepeating("ABCD".getBytes(StandardCharsets.US_ASCII), sizeBytes, outputPath);
                break;
            case SEQUENTIAL:
                byte[] ramp = new byte[256];
                for (int i = 0; i < ramp.length; i++) {
                    ramp[i] = (byte) i;
                }
                writeRepeating(ramp, sizeBytes, outputPath);
                break;
            default:
                throw new IllegalArgumentException("Unknown pattern: " + pattern);
        }
    }
    
    /**
     * Generate a file with random data.
     */
    public static void generateRandomFile(long sizeBytes, Path outputPath) throws IOException {
        Random random = new Random(42); // Deterministic seed
        byte[] buffer = new byte[1024 * 1024]; // 1MB buffer
        
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(outputPath))) {
            long remaining = sizeBytes;
            
            while (remaining > 0) {
                int toWrite = (int) Math.min(buffer.length, remaining);
                random.nextBytes(buffer);
                out.write(buffer, 0, toWrite);
                remaining -= toWrite;
            }
        }
    }
    
    private static void writeRepeating(byte[] pattern, long sizeBytes, Path outputPath) throws IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(outputPath))) {
            long written = 0;
            
            while (written < sizeBytes) {
                int toWrite = (int) Math.min(pattern.length, sizeBytes - written);
                out.write(pattern, 0, toWrite);
                written += toWrite;
            }
        }
    }
    
    /**
     * CLI entry point.
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: TestDataGenerator <sizeBytes> [outputFile] [random|repetitive|sequential]");
            System.exit(1);
        }
        
        try {
            long sizeBytes = Long.parseLong(args[0]);
            String outputFile = args.length > 1 ? args[1] : "test-data-" + sizeBytes + ".bin";
            Pattern pattern = args.length > 2
                ? Pattern.valueOf(args[2].toUpperCase(Locale.ROOT))
                : Pattern.RANDOM;
            
            Path outputPath = Paths.get(outputFile);
            generate(pattern, sizeBytes, outputPath);
            
            System.out.println("Generated: " + outputPath.toAbsolutePath());
            
        } catch (Exception e) {
            logger.error("Failed to generate test file", e);
            System.exit(1);
        }
    }
}
