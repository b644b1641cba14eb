package com.ngramviz.config;

import com.ngramviz.core.NgramMode;
import com.ngramviz.core.ToneCurve;
import com.ngramviz.io.ScanStrategy;
import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

class AppConfigTest {
    
    @Test
    void testDefaults() {
        AppConfig config = new AppConfig();
        
        assertEquals(NgramMode.PAIR, config.getMode());
        assertEquals(ToneCurve.LOG, config.getToneCurve());
        assertEquals(0.4, config.getGamma(), 1e-9);
        assertEquals(1024 * 1024, config.getChunkSizeBytes());
        assertEquals(ScanStrategy.STREAMING, config.getScanStrategy());
        assertEquals(AppConfig.VolumeOutput.SLICES, config.getVolumeOutput());
        assertEquals(100_000, config.getMaxScatterPoints());
    }
    
    @Test
    void testOverrides() {
        AppConfig config = new AppConfig().withOverrides(Map.of(
            "scan.mode", "triplet",
            "scan.chunk-size", "4 KiB",
            "render.scale", "sqrt",
            "render.gamma", "1",
            "render.max-scatter-points", "50"));
        
        assertEquals(NgramMode.TRIPLET, config.getMode());
        assertEquals(4096, config.getChunkSizeBytes());
        assertEquals(ToneCurve.SQRT, config.getToneCurve());
        assertEquals(1.0, config.createToneMapper().getGamma(), 1e-9);
        assertEquals(50, config.getMaxScatterPoints());
        // untouched keys keep their defaults
        assertEquals(ScanStrategy.STREAMING, config.getScanStrategy());
    }
    
    @Test
    void testInvalidValues() {
        AppConfig base = new AppConfig();
        
        assertThrows(IllegalArgumentException.class,
            () -> base.withOverrides(Map.of("scan.mode", "quad")).getMode());
        assertThrows(IllegalArgumentException.class,
            () -> base.withOverrides(Map.of("render.gamma", "0")).createToneMapper());
        assertThrows(IllegalArgumentException.class,
            () -> base.withOverrides(Map.of("scan.chunk-size", "0")).getChunkSizeBytes());
        assertThrows(IllegalArgumentException.class,
            () -> base.withOverrides(Map.of("render.volume-output", "cube")).getVolumeOutput());
        assertThrows(ConfigException.class,
            () -> base.withOverrides(Map.of("render.max-scatter-points", "many")).getMaxScatterPoints());
    }
}
