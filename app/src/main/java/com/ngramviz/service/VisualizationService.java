package com.ngramviz.service;

import com.ngramviz.config.AppConfig.VolumeOutput;
import com.ngramviz.core.FrequencyTable;
import com.ngramviz.core.NgramMode;
import com.ngramviz.core.TableStatistics;
import com.ngramviz.core.ToneMapper;
import com.ngramviz.model.RenderResult;
import com.ngramviz.model.StageMetrics;
import com.ngramviz.render.GrayscaleGrid;
import com.ngramviz.render.GridEmitter;
import com.ngramviz.render.PpmWriter;
import com.ngramviz.render.RendererUnavailableException;
import com.ngramviz.render.ScatterPlot;
import com.ngramviz.render.ScatterRenderer;
import com.ngramviz.render.SliceWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs a complete scan-and-render pass: count, find the peak, tone-map and write.
 * <p>
 * Output is only produced after counting finished without error.
 */
public class VisualizationService {
    
    private static final Logger logger = LoggerFactory.getLogger(VisualizationService.class);
    
    private final FrequencyService frequencyService;
    private final GridEmitter emitter;
    private final PpmWriter ppmWriter;
    private final ScatterRenderer scatterRenderer;
    private final VolumeOutput volumeOutput;
    private final int maxScatterPoints;
    
    public VisualizationService(FrequencyService frequencyService, ToneMapper toneMapper,
                                ScatterRenderer scatterRenderer, VolumeOutput volumeOutput,
                                int maxScatterPoints) {
        this.frequencyService = frequencyService;
        this.emitter = new GridEmitter(toneMapper);
        this.ppmWriter = new PpmWriter();
        this.scatterRenderer = scatterRenderer;
        this.volumeOutput = volumeOutput;
        this.maxScatterPoints = maxScatterPoints;
    }
    
    /**
     * Scan {@code input} and write the visualization.
     * <p>
     * Pair scans write one image to {@code output}. Triplet scans write either 256 slice images
     * into {@code <parent>/<stem>_slices/}, or a scatter document {@code <parent>/<stem>.<ext>}.
     * 
     * @throws java.nio.file.NoSuchFileException If the input does not exist
     * @throws IOException If reading or writing fails
     * @throws RendererUnavailableException If scatter output is requested without a usable
     *                                      renderer; checked before the input is read
     */
    public RenderResult render(Path input, Path output, NgramMode mode,
                               Consumer<Double> progressCallback)
            throws IOException, RendererUnavailableException {
        boolean scatter = mode == NgramMode.TRIPLET && volumeOutput == VolumeOutput.SCATTER;
        if (scatter && !scatterRenderer.isAvailable()) {
            throw new RendererUnavailableException("Scatter output requested but "
                + scatterRenderer.getRendererName() + " renderer is unavailable");
        }
        
        StageMetrics metrics = new StageMetrics();
        long startTime = System.nanoTime();
        
        long stageStart = System.nanoTime();
        FrequencyTable table = frequencyService.computeTable(input, mode, progressCallback);
        long inputSize = Files.size(input);
        metrics.recordStage(StageMetrics.Stage.READ_AND_COUNT, System.nanoTime() - stageStart, inputSize);
        
        stageStart = System.nanoTime();
        TableStatistics statistics = TableStatistics.of(table, inputSize);
        long peak = statistics.getPeak();
        metrics.recordStage(StageMetrics.Stage.PEAK_LOOKUP, System.nanoTime() - stageStart, 0);
        logger.info("{}", statistics);
        
        if (!statistics.isConserved()) {
            // the file changed while it was being read
            logger.warn("Counted {} n-grams but a {} byte input holds {}",
                statistics.getTotal(), inputSize, mode.expectedTotal(inputSize));
        }
        
        createParentDirectories(output);
        
        List<Path> outputs;
        RenderResult.OutputKind kind;
        if (mode == NgramMode.PAIR) {
            outputs = writeHeatmap(table, peak, output, metrics);
            kind = RenderResult.OutputKind.HEATMAP;
        } else if (scatter) {
            outputs = writeScatter(table, peak, output, metrics);
            kind = RenderResult.OutputKind.SCATTER;
        } else {
            outputs = writeSlices(table, peak, output, metrics);
            kind = RenderResult.OutputKind.SLICES;
        }
        
        double duration = (System.nanoTime() - startTime) / 1_000_000_000.0;
        RenderResult result = new RenderResult(input.getFileName().toString(), kind,
            statistics, outputs, metrics, duration);
        
        logger.info("Render complete: {}", result);
        logger.info("\n{}", metrics.getSummary());
        return result;
    }
    
    private List<Path> writeHeatmap(FrequencyTable table, long peak, Path output,
                                    StageMetrics metrics) throws IOException {
        long stageStart = System.nanoTime();
        GrayscaleGrid grid = emitter.heatmap(table, peak);
        metrics.recordStage(StageMetrics.Stage.TONE_MAPPING, System.nanoTime() - stageStart, 0);
        
        stageStart = System.nanoTime();
        ppmWriter.write(grid, output);
        metrics.recordStage(StageMetrics.Stage.OUTPUT_WRITE, System.nanoTime() - stageStart, Files.size(output));
        return Collections.singletonList(output);
    }
    
    private List<Path> writeSlices(FrequencyTable table, long peak, Path output,
                                   StageMetrics metrics) throws IOException {
        String stem = stem(output);
        String extension = extension(output, PpmWriter.EXTENSION);
        Path directory = parentOf(output).resolve(stem + "_slices");
        
        // slices are tone-mapped while they are written
        long stageStart = System.nanoTime();
        List<Path> written = new SliceWriter(emitter, ppmWriter)
            .writeSlices(table, peak, directory, stem, extension);
        metrics.recordStage(StageMetrics.Stage.OUTPUT_WRITE, System.nanoTime() - stageStart, 0);
        return written;
    }
    
    private List<Path> writeScatter(FrequencyTable table, long peak, Path output,
                                    StageMetrics metrics) throws IOException, RendererUnavailableException {
        long stageStart = System.nanoTime();
        ScatterPlot plot = emitter.scatter(table, peak, maxScatterPoints);
        metrics.recordStage(StageMetrics.Stage.TONE_MAPPING, System.nanoTime() - stageStart, 0);
        
        Path document = parentOf(output).resolve(stem(output) + "." + scatterRenderer.getExtension());
        stageStart = System.nanoTime();
        scatterRenderer.render(plot, document);
        metrics.recordStage(StageMetrics.Stage.OUTPUT_WRITE, System.nanoTime() - stageStart, 0);
        return Collections.singletonList(document);
    }
    
    private static void createParentDirectories(Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            logger.info("Created output directory: {}", parent);
        }
    }
    
    private static Path parentOf(Path output) {
        return output.toAbsolutePath().getParent();
    }
    
    static String stem(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
    
    static String extension(Path output, String fallback) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1) : fallback;
    }
}
