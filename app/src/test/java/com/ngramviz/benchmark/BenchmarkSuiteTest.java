package com.ngramviz.benchmark;

import com.ngramviz.core.NgramMode;
import com.ngramviz.io.ScanStrategy;
import com.ngramviz.util.TestDataGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;

/**
 * Tests for benchmark suite.
 */
class BenchmarkSuiteTest {
    
    @TempDir
    Path tempDir;
    
    private BenchmarkSuite suite;
    
    @BeforeEach
    void setUp() {
        suite = new BenchmarkSuite(64 * 1024, 0, 1);
    }
    
    @Test
    void testBenchmarkWithSmallFile() throws Exception {
        Path testFile = tempDir.resolve("test.bin");
        TestDataGenerator.generateRandomFile(1024 * 1024, testFile);
        
        BenchmarkSuite.BenchmarkComparison comparison = suite.runFullSuite(testFile, NgramMode.PAIR);
        
        assertNotNull(comparison);
        assertEquals(ScanStrategy.values().length, comparison.getResults().size());
        
        BenchmarkResult result = comparison.getResults().get(0);
        assertEquals("streaming", result.getBenchmarkName());
        assertTrue(result.getThroughputMBps() > 0);
        assertTrue(result.getDurationSeconds() > 0);
        assertTrue(result.getDistinctCount() > 65_000);
        
        assertNotNull(comparison.getFastest());
        assertEquals(1.0, comparison.getSpeedup(result), 1e-9);
        assertTrue(comparison.getSummary().contains("whole-file"));
    }
    
    @Test
    void testAllStrategiesAgreeOnDistinctCount() throws Exception {
        Path testFile = tempDir.resolve("abcd.bin");
        TestDataGenerator.generate(TestDataGenerator.Pattern.REPETITIVE, 10_000, testFile);
        
        BenchmarkSuite.BenchmarkComparison comparison = suite.runFullSuite(testFile, NgramMode.TRIPLET);
        
        for (BenchmarkResult result : comparison.getResults()) {
            // ABC, BCD, CDA, DAB
            assertEquals(4, result.getDistinctCount(), result.getBenchmarkName());
        }
    }
    
    @Test
    void testRequiresMeasurementIterations() {
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkSuite(1024, 0, 0));
    }
}
