package com.ngramviz.config;

import com.ngramviz.core.NgramMode;
import com.ngramviz.core.ToneCurve;
import com.ngramviz.core.ToneMapper;
import com.ngramviz.io.ScanStrategy;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Application configuration wrapper over the {@code ngramviz} block.
 */
public class AppConfig {
    
    public static final String ROOT = "ngramviz";
    
    private final Config config;
    
    public AppConfig() {
        this(ConfigFactory.load());
    }
    
    public AppConfig(Config config) {
        this.config = config.getConfig(ROOT);
    }
    
    /**
     * Copy of this configuration with some keys (relative to the {@code ngramviz} root)
     * replaced.
     */
    public AppConfig withOverrides(Map<String, ?> overrides) {
        Config layered = ConfigFactory.parseMap(overrides)
            .atPath(ROOT)
            .withFallback(config.atPath(ROOT));
        return new AppConfig(layered);
    }
    
    // Scan settings
    public NgramMode getMode() {
        return NgramMode.fromString(config.getString("scan.mode"));
    }
    
    public int getChunkSizeBytes() {
        long bytes = config.getBytes("scan.chunk-size");
        if (bytes <= 0 || bytes > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("scan.chunk-size must be between 1 byte and 2 GB, got " + bytes);
        }
        return (int) bytes;
    }
    
    public ScanStrategy getScanStrategy() {
        return ScanStrategy.fromString(config.getString("scan.strategy"));
    }
    
    // Render settings
    public ToneCurve getToneCurve() {
        return ToneCurve.fromString(config.getString("render.scale"));
    }
    
    public double getGamma() {
        return config.getDouble("render.gamma");
    }
    
    public ToneMapper createToneMapper() {
        return new ToneMapper(getToneCurve(), getGamma());
    }
    
    public VolumeOutput getVolumeOutput() {
        return VolumeOutput.fromString(config.getString("render.volume-output"));
    }
    
    public int getMaxScatterPoints() {
        int cap = config.getInt("render.max-scatter-points");
        if (cap <= 0) {
            throw new IllegalArgumentException("render.max-scatter-points must be positive, got " + cap);
        }
        return cap;
    }
    
    public String getScatterTemplate() {
        return config.getString("render.scatter-template");
    }
    
    // Output settings
    public Path getOutputPath() {
        return Paths.get(config.getString("output.path"));
    }
    
    // Benchmark settings
    public int getWarmupIterations() {
        return config.getInt("benchmark.warmup-iterations");
    }
    
    public int getMeasurementIterations() {
        return config.getInt("benchmark.measurement-iterations");
    }
    
    /**
     * How triplet volumes are emitted.
     */
    public enum VolumeOutput {
        SLICES,
        SCATTER;
        
        public static VolumeOutput fromString(String value) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "slices":
                    return SLICES;
                case "scatter":
                    return SCATTER;
                default:
                    throw new IllegalArgumentException("Unknown volume output: " + value
                        + " (expected slices or scatter)");
            }
        }
    }
}
