package com.ngramviz.render;

import com.ngramviz.core.FrequencyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the 256 first-byte slices of a triplet volume as separate images.
 */
public class SliceWriter {
    
    private static final Logger logger = LoggerFactory.getLogger(SliceWriter.class);
    
    private final GridEmitter emitter;
    private final PpmWriter ppmWriter;
    
    public SliceWriter(GridEmitter emitter, PpmWriter ppmWriter) {
        this.emitter = emitter;
        this.ppmWriter = ppmWriter;
    }
    
    /**
     * File name of slice {@code z}: {@code <stem>_slice_<zzz>.<extension>}.
     */
    public static String sliceFileName(String stem, int z, String extension) {
        return String.format("%s_slice_%03d.%s", stem, z, extension);
    }
    
    /**
     * Write every slice into {@code directory}, creating it if needed.
     * 
     * @return The written files, in slice order
     */
    public List<Path> writeSlices(FrequencyTable table, long peak, Path directory,
                                  String stem, String extension) throws IOException {
        Files.createDirectories(directory);
        logger.info("Writing {} slices to {}", GridEmitter.SLICE_COUNT, directory);
        
        List<Path> written = new ArrayList<>(GridEmitter.SLICE_COUNT);
        for (int z = 0; z < GridEmitter.SLICE_COUNT; z++) {
            GrayscaleGrid grid = emitter.slice(table, z, peak);
            Path target = directory.resolve(sliceFileName(stem, z, extension));
            ppmWriter.write(grid, target);
            written.add(target);
            
            if ((z + 1) % 64 == 0) {
                logger.debug("Wrote {}/{} slices", z + 1, GridEmitter.SLICE_COUNT);
            }
        }
        return written;
    }
}
