package com.ngramviz.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Writes grids as plain-text PPM (P3) images with equal R, G and B channels.
 */
public class PpmWriter {
    
    private static final Logger logger = LoggerFactory.getLogger(PpmWriter.class);
    
    public static final String MAGIC = "P3";
    public static final String EXTENSION = "ppm";
    
    /**
     * Write {@code grid} to {@code output}. The image is staged in a temporary sibling file
     * and moved into place, so a failed write never leaves a partial image behind.
     */
    public void write(GrayscaleGrid grid, Path output) throws IOException {
        StagedOutput.write(output, StandardCharsets.US_ASCII, writer -> write(grid, writer));
        logger.debug("Wrote {}", output);
    }
    
    /**
     * Header lines "P3", "256 256", "255" followed by one line per row, top row first.
     */
    public void write(GrayscaleGrid grid, Writer writer) throws IOException {
        writer.write(MAGIC + "\n");
        writer.write(GrayscaleGrid.SIZE + " " + GrayscaleGrid.SIZE + "\n");
        writer.write("255\n");
        
        StringBuilder row = new StringBuilder(GrayscaleGrid.SIZE * 12);
        for (int y = 0; y < GrayscaleGrid.SIZE; y++) {
            row.setLength(0);
            for (int x = 0; x < GrayscaleGrid.SIZE; x++) {
                if (x > 0) {
                    row.append(' ');
                }
                int value = grid.get(x, y);
                row.append(value).append(' ').append(value).append(' ').append(value);
            }
            row.append('\n');
            writer.write(row.toString());
        }
    }
}
