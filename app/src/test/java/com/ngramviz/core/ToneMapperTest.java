package com.ngramviz.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for tone mapping.
 */
class ToneMapperTest {
    
    @Test
    void testZeroCountIsBlack() {
        for (ToneCurve curve : ToneCurve.values()) {
            assertEquals(0, ToneMapper.brightness(0, 100, curve, 1.0));
            assertEquals(0, ToneMapper.brightness(0, 0, curve, 0.4));
        }
    }
    
    @Test
    void testZeroPeakIsBlack() {
        assertEquals(0, ToneMapper.brightness(5, 0, ToneCurve.LINEAR, 1.0));
    }
    
    @Test
    void testPeakIsWhite() {
        for (ToneCurve curve : ToneCurve.values()) {
            assertEquals(255, ToneMapper.brightness(1000, 1000, curve, 1.0), curve.getLabel());
            assertEquals(255, ToneMapper.brightness(1000, 1000, curve, 0.4), curve.getLabel());
        }
    }
    
    @Test
    void testRareCountNeverRoundsToBlack() {
        // 1/1,000,000 of 255 rounds to 0 without the floor
        assertEquals(1, ToneMapper.brightness(1, 1_000_000, ToneCurve.LINEAR, 1.0));
    }
    
    @Test
    void testLinearCurve() {
        assertEquals(128, ToneMapper.brightness(50, 100, ToneCurve.LINEAR, 1.0));
        assertEquals(26, ToneMapper.brightness(10, 100, ToneCurve.LINEAR, 1.0));
    }
    
    @Test
    void testHalfLevelRoundsToEven() {
        // 1665/1998 * 255 = 212.5
        assertEquals(212, ToneMapper.brightness(1665, 1998, ToneCurve.LINEAR, 1.0));
        // 10/100 * 255 = 25.5
        assertEquals(26, ToneMapper.brightness(10, 100, ToneCurve.LINEAR, 1.0));
        // 1/2 * 255 = 127.5
        assertEquals(128, ToneMapper.brightness(1, 2, ToneCurve.LINEAR, 1.0));
    }
    
    @Test
    void testSqrtCurve() {
        // sqrt(0.25) = 0.5
        assertEquals(128, ToneMapper.brightness(25, 100, ToneCurve.SQRT, 1.0));
    }
    
    @Test
    void testLogCurve() {
        // ln(1+3) / ln(1+15) = 0.5, so 127.5 goes to the even 128
        assertEquals(128, ToneMapper.brightness(3, 15, ToneCurve.LOG, 1.0));
        assertTrue(ToneMapper.brightness(1, 1000, ToneCurve.LOG, 1.0)
            > ToneMapper.brightness(1, 1000, ToneCurve.LINEAR, 1.0));
    }
    
    @Test
    void testGammaBrightensMidtones() {
        int plain = ToneMapper.brightness(25, 100, ToneCurve.LINEAR, 1.0);
        int corrected = ToneMapper.brightness(25, 100, ToneCurve.LINEAR, 0.5);
        
        assertEquals(64, plain);
        assertEquals(128, corrected);
    }
    
    @Test
    void testCountAbovePeakIsClamped() {
        assertEquals(255, ToneMapper.brightness(200, 100, ToneCurve.LINEAR, 1.0));
    }
    
    @Test
    void testInvalidGammaRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ToneMapper(ToneCurve.LOG, 0));
        assertThrows(IllegalArgumentException.class, () -> new ToneMapper(ToneCurve.LOG, -1));
        assertThrows(IllegalArgumentException.class, () -> new ToneMapper(ToneCurve.LOG, Double.NaN));
        assertThrows(IllegalArgumentException.class,
            () -> new ToneMapper(ToneCurve.LOG, Double.POSITIVE_INFINITY));
    }
    
    @Test
    void testOpacityRange() {
        assertEquals(0.2, ToneMapper.opacity(0), 1e-9);
        assertEquals(1.0, ToneMapper.opacity(255), 1e-9);
        assertTrue(ToneMapper.opacity(1) > 0.2);
    }
    
    @Test
    void testCurveLabels() {
        assertEquals(ToneCurve.LOG, ToneCurve.fromString("log"));
        assertEquals(ToneCurve.SQRT, ToneCurve.fromString(" SQRT "));
        assertEquals(ToneCurve.LINEAR, ToneCurve.fromString("linear"));
        assertThrows(IllegalArgumentException.class, () -> ToneCurve.fromString("cubic"));
    }
}
