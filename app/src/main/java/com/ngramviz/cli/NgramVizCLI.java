package com.ngramviz.cli;

import com.ngramviz.benchmark.BenchmarkSuite;
import com.ngramviz.config.AppConfig;
import com.ngramviz.core.FrequencyTable;
import com.ngramviz.core.NgramMode;
import com.ngramviz.core.TableStatistics;
import com.ngramviz.model.RenderResult;
import com.ngramviz.render.RendererUnavailableException;
import com.ngramviz.service.FrequencyService;
import com.ngramviz.service.ServiceFactory;
import com.ngramviz.service.VisualizationService;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line interface for ngramviz.
 * 
 * Usage:
 *   Render:    java -jar ngramviz.jar render <input-file> [-o output.ppm] [options]
 *   Stats:     java -jar ngramviz.jar stats <input-file> [--mode pair|triplet]
 *   Benchmark: java -jar ngramviz.jar benchmark <input-file> [--mode pair|triplet]
 */
public class NgramVizCLI {
    
    private static final Logger logger = LoggerFactory.getLogger(NgramVizCLI.class);
    
    private static final Map<String, String> OPTION_KEYS = new HashMap<>();
    
    static {
        OPTION_KEYS.put("-o", "output.path");
        OPTION_KEYS.put("--output", "output.path");
        OPTION_KEYS.put("--mode", "scan.mode");
        OPTION_KEYS.put("--chunk-size", "scan.chunk-size");
        OPTION_KEYS.put("--strategy", "scan.strategy");
        OPTION_KEYS.put("--scale", "render.scale");
        OPTION_KEYS.put("--gamma", "render.gamma");
        OPTION_KEYS.put("--volume", "render.volume-output");
        OPTION_KEYS.put("--max-points", "render.max-scatter-points");
    }
    
    public static void main(String[] args) {
        System.exit(run(args, new AppConfig(), System.out, System.err));
    }
    
    /**
     * Execute a command.
     * 
     * @return Process exit status: 0 on success, 1 on any error
     */
    public static int run(String[] args, AppConfig baseConfig, PrintStream out, PrintStream err) {
        if (args.length < 2) {
            printUsage(out);
            return 1;
        }
        
        String operation = args[0].toLowerCase(Locale.ROOT);
        String inputPath = null;
        Map<String, Object> overrides = new HashMap<>();
        
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            String key = OPTION_KEYS.get(arg);
            if (key != null) {
                if (i + 1 >= args.length) {
                    err.println("Missing value for option " + arg);
                    return 1;
                }
                overrides.put(key, args[++i]);
            } else if (arg.startsWith("-")) {
                err.println("Unknown option: " + arg);
                printUsage(out);
                return 1;
            } else if (inputPath == null) {
                inputPath = arg;
            } else {
                err.println("Unexpected argument: " + arg);
                return 1;
            }
        }
        
        if (inputPath == null) {
            err.println("Error: No input file given");
            printUsage(out);
            return 1;
        }
        
        AppConfig config;
        NgramMode mode;
        try {
            config = baseConfig.withOverrides(overrides);
            mode = config.getMode();
            // fail on bad values before any work starts
            config.createToneMapper();
            config.getChunkSizeBytes();
            config.getScanStrategy();
            config.getVolumeOutput();
            config.getMaxScatterPoints();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Invalid option: " + e.getMessage());
            return 1;
        }
        
        Path input = Paths.get(inputPath);
        if (Files.isDirectory(input)) {
            err.println("Error: Input is a directory: " + inputPath);
            return 1;
        }
        
        try {
            switch (operation) {
                case "render":
                case "r":
                    render(config, input, mode, out);
                    break;
                    
                case "stats":
                case "s":
                    stats(config, input, mode, out);
                    break;
                    
                case "benchmark":
                case "b":
                    benchmark(config, input, mode, out);
                    break;
                    
                default:
                    err.println("Unknown operation: " + operation);
                    printUsage(out);
                    return 1;
            }
            return 0;
            
        } catch (NoSuchFileException e) {
            err.println("Error: Input file does not exist: " + inputPath);
            return 1;
        } catch (RendererUnavailableException e) {
            logger.error("Scatter renderer unavailable", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Operation failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            logger.error("Unexpected error", e);
            err.println("Unexpected error: " + e.getMessage());
            return 1;
        }
    }
    
    private static void render(AppConfig config, Path input, NgramMode mode, PrintStream out)
            throws IOException, RendererUnavailableException {
        VisualizationService service = ServiceFactory.createVisualizationService(config);
        Path output = config.getOutputPath();
        
        out.println("Rendering...");
        out.println("  Input:  " + input);
        out.println("  Mode:   " + mode.getLabel());
        out.println("  Scale:  " + config.createToneMapper());
        
        int[] lastPercent = {-1};
        RenderResult result = service.render(input, output, mode, progress -> {
            int percent = (int) (progress * 100);
            if (percent != lastPercent[0]) {
                lastPercent[0] = percent;
                out.print("\rProgress: " + percent + "%");
            }
        });
        
        TableStatistics stats = result.getStatistics();
        out.println();
        out.println();
        out.println("Render complete!");
        out.println("  Size:     " + formatSize(stats.getInputSize()));
        out.println("  Distinct: " + stats.getDistinct() + " " + mode.getLabel() + "s");
        out.println("  Peak:     " + stats.getPeak());
        if (result.getOutputs().size() == 1) {
            out.println("  Output:   " + result.getOutputs().get(0));
        } else {
            out.println("  Output:   " + result.getOutputs().size() + " files in "
                + result.getOutputs().get(0).getParent());
        }
        out.println("  Time:     " + String.format("%.2f", result.getDurationSeconds()) + " seconds");
    }
    
    private static void stats(AppConfig config, Path input, NgramMode mode, PrintStream out)
            throws IOException {
        FrequencyService service = ServiceFactory.createFrequencyService(config);
        FrequencyTable table = service.computeTable(input, mode, null);
        TableStatistics stats = TableStatistics.of(table, Files.size(input));
        
        out.println("File: " + input);
        out.println(String.format("Size: %,d bytes", stats.getInputSize()));
        out.println(String.format("Total %ss: %,d", mode.getLabel(), stats.getTotal()));
        out.println(String.format("Unique %ss: %,d", mode.getLabel(), stats.getDistinct()));
        out.println(String.format("Peak count: %,d", stats.getPeak()));
        out.println(String.format("Percentage of possible %ss: %.2f%%",
            mode.getLabel(), stats.getCoveragePercent()));
    }
    
    private static void benchmark(AppConfig config, Path input, NgramMode mode, PrintStream out)
            throws IOException {
        if (!Files.exists(input)) {
            throw new NoSuchFileException(input.toString());
        }
        BenchmarkSuite suite = new BenchmarkSuite(config);
        BenchmarkSuite.BenchmarkComparison comparison = suite.runFullSuite(input, mode);
        out.print(comparison.getSummary());
    }
    
    private static String formatSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.2f KB", bytes / 1024.0);
        if (bytes < 1024 * 1024 * 1024) return String.format("%.2f MB", bytes / (1024.0 * 1024));
        return String.format("%.2f GB", bytes / (1024.0 * 1024 * 1024));
    }
    
    private static void printUsage(PrintStream out) {
        out.println("ngramviz - Byte n-gram heatmaps for binary files");
        out.println();
        out.println("Usage:");
        out.println("  Render:    java -jar ngramviz.jar render <input-file> [-o <output>] [options]");
        out.println("  Stats:     java -jar ngramviz.jar stats <input-file> [--mode pair|triplet]");
        out.println("  Benchmark: java -jar ngramviz.jar benchmark <input-file> [--mode pair|triplet]");
        out.println();
        out.println("Options:");
        out.println("  -o, --output <path>     Output image (default: output.ppm)");
        out.println("  --mode pair|triplet     2D pair heatmap or 3D triplet volume (default: pair)");
        out.println("  --scale linear|sqrt|log Tone curve (default: log)");
        out.println("  --gamma <g>             Gamma correction, 1 disables it (default: 0.4)");
        out.println("  --chunk-size <size>     Read size, e.g. 4096 or \"4 MiB\" (default: 1 MiB)");
        out.println("  --volume slices|scatter Triplet output (default: slices)");
        out.println("  --max-points <n>        Scatter point cap (default: 100000)");
        out.println("  --strategy streaming|mapped|whole-file");
        out.println();
        out.println("Examples:");
        out.println("  java -jar ngramviz.jar render firmware.bin -o firmware.ppm --scale sqrt");
        out.println("  java -jar ngramviz.jar render archive.zip -o out/archive.ppm --mode triplet");
        out.println("  java -jar ngramviz.jar render data.bin -o data.html --mode triplet --volume scatter");
        out.println();
        out.println("Short forms:");
        out.println("  'r' for render, 's' for stats, 'b' for benchmark");
    }
}
