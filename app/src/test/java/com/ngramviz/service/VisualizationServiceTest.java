package com.ngramviz.service;

import com.ngramviz.config.AppConfig.VolumeOutput;
import com.ngramviz.core.NgramMode;
import com.ngramviz.core.ToneCurve;
import com.ngramviz.core.ToneMapper;
import com.ngramviz.model.RenderResult;
import com.ngramviz.model.StageMetrics;
import com.ngramviz.render.HtmlScatterRenderer;
import com.ngramviz.render.RendererUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * End-to-end tests from input file to written images.
 */
class VisualizationServiceTest {
    
    @TempDir
    Path tempDir;
    
    private VisualizationService service(VolumeOutput volumeOutput, String template) {
        return new VisualizationService(
            new ChunkedFrequencyService(7),
            new ToneMapper(ToneCurve.LOG, 0.4),
            new HtmlScatterRenderer(template),
            volumeOutput,
            100_000);
    }
    
    private VisualizationService service(VolumeOutput volumeOutput) {
        return service(volumeOutput, "templates/scatter.html");
    }
    
    private Path input(byte... data) throws IOException {
        Path file = tempDir.resolve("input.bin");
        Files.write(file, data);
        return file;
    }
    
    private static void assertWellFormedRaster(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.US_ASCII);
        assertEquals("P3", lines.get(0));
        assertEquals("256 256", lines.get(1));
        assertEquals("255", lines.get(2));
        assertEquals(259, lines.size(), file.toString());
        for (int row = 3; row < lines.size(); row++) {
            assertEquals(768, lines.get(row).split(" ").length);
        }
    }
    
    private static long litPixels(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file, StandardCharsets.US_ASCII)) {
            return lines.skip(3)
                .flatMap(line -> Stream.of(line.split(" ")))
                .filter(value -> !value.equals("0"))
                .count() / 3;
        }
    }
    
    @Test
    void testPairHeatmap() throws Exception {
        Path output = tempDir.resolve("out/heatmap.ppm");
        
        RenderResult result = service(VolumeOutput.SLICES)
            .render(input((byte) 0, (byte) 1, (byte) 2, (byte) 3, (byte) 2), output, NgramMode.PAIR, null);
        
        assertEquals(RenderResult.OutputKind.HEATMAP, result.getOutputKind());
        assertEquals(List.of(output), result.getOutputs());
        assertEquals(4, result.getStatistics().getTotal());
        assertEquals(1, result.getStatistics().getPeak());
        assertWellFormedRaster(output);
        assertEquals(4, litPixels(output));
        
        StageMetrics metrics = result.getStageMetrics();
        assertTrue(metrics.hasStage(StageMetrics.Stage.READ_AND_COUNT));
        assertTrue(metrics.hasStage(StageMetrics.Stage.OUTPUT_WRITE));
    }
    
    @Test
    void testEmptyInputGivesBlackImage() throws Exception {
        Path output = tempDir.resolve("black.ppm");
        
        RenderResult result = service(VolumeOutput.SLICES)
            .render(input((byte) 9), output, NgramMode.PAIR, null);
        
        assertEquals(0, result.getStatistics().getDistinct());
        assertWellFormedRaster(output);
        assertEquals(0, litPixels(output));
    }
    
    @Test
    void testTripletSlices() throws Exception {
        Path output = tempDir.resolve("volume.ppm");
        
        RenderResult result = service(VolumeOutput.SLICES)
            .render(input((byte) 5, (byte) 6, (byte) 7, (byte) 8), output, NgramMode.TRIPLET, null);
        
        List<Path> slices = result.getOutputs();
        assertEquals(256, slices.size());
        assertEquals(tempDir.resolve("volume_slices").resolve("volume_slice_000.ppm"), slices.get(0));
        assertEquals("volume_slice_255.ppm", slices.get(255).getFileName().toString());
        
        for (Path slice : slices) {
            assertWellFormedRaster(slice);
        }
        assertEquals(1, litPixels(slices.get(5)));
        assertEquals(1, litPixels(slices.get(6)));
        assertEquals(0, litPixels(slices.get(7)));
    }
    
    @Test
    void testTripletScatter() throws Exception {
        Path output = tempDir.resolve("volume.ppm");
        
        RenderResult result = service(VolumeOutput.SCATTER)
            .render(input((byte) 0, (byte) 1, (byte) 2, (byte) 3, (byte) 2, (byte) 1),
                output, NgramMode.TRIPLET, null);
        
        assertEquals(RenderResult.OutputKind.SCATTER, result.getOutputKind());
        Path document = result.getOutputs().get(0);
        assertEquals(tempDir.resolve("volume.html"), document);
        assertTrue(Files.readString(document).contains("\"x\":[0,1,2,3]"));
    }
    
    @Test
    void testScatterWithoutRendererFailsBeforeReading() throws IOException {
        Path output = tempDir.resolve("volume.html");
        Path missingInput = tempDir.resolve("missing.bin");
        
        // the renderer check runs before the input is opened
        assertThrows(RendererUnavailableException.class,
            () -> service(VolumeOutput.SCATTER, "templates/none.html")
                .render(missingInput, output, NgramMode.TRIPLET, null));
        assertFalse(Files.exists(output));
    }
    
    @Test
    void testMissingInputWritesNothing() {
        Path output = tempDir.resolve("never.ppm");
        
        assertThrows(NoSuchFileException.class,
            () -> service(VolumeOutput.SLICES)
                .render(tempDir.resolve("missing.bin"), output, NgramMode.PAIR, null));
        assertFalse(Files.exists(output));
    }
    
    @Test
    void testOutputNaming() {
        assertEquals("dump", VisualizationService.stem(Path.of("out/dump.ppm")));
        assertEquals("dump", VisualizationService.stem(Path.of("dump")));
        assertEquals("pnm", VisualizationService.extension(Path.of("dump.pnm"), "ppm"));
        assertEquals("ppm", VisualizationService.extension(Path.of("dump"), "ppm"));
    }
}
