package com.backtestplatform.backtest.producer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalIndicatorsTest {

    // newest first
    private static final List<Double> RISING = List.of(110.0, 109.0, 108.0, 107.0, 106.0, 105.0, 104.0,
        103.0, 102.0, 101.0, 100.0, 99.0, 98.0, 97.0, 96.0, 95.0);

    @Nested
    @DisplayName("RSI")
    class Rsi {

        @Test
        @DisplayName("only gains → 100")
        void allGains() {
            assertEquals(100.0, TechnicalIndicators.rsi(RISING, 14));
        }

        @Test
        @DisplayName("only losses → 0")
        void allLosses() {
            List<Double> falling = new java.util.ArrayList<>(RISING);
            Collections.reverse(falling);
            assertEquals(0.0, TechnicalIndicators.rsi(falling, 14), 1e-9);
        }

        @Test
        @DisplayName("flat series → 50")
        void flat() {
            assertEquals(50.0, TechnicalIndicators.rsi(Collections.nCopies(20, 42.0), 14));
        }

        @Test
        @DisplayName("fewer than period + 1 prices → NaN")
        void insufficient() {
            assertTrue(Double.isNaN(TechnicalIndicators.rsi(RISING.subList(0, 14), 14)));
        }
    }

    @Test
    void smaUsesNewestPrices() {
        assertEquals(108.0, TechnicalIndicators.sma(RISING, 5), 1e-9);
        assertTrue(Double.isNaN(TechnicalIndicators.sma(RISING, 100)));
    }

    @Test
    void emaOfConstantIsConstant() {
        assertEquals(7.0, TechnicalIndicators.ema(Collections.nCopies(12, 7.0), 5), 1e-12);
    }

    @Test
    void emaLagsBehindATrend() {
        double ema = TechnicalIndicators.ema(RISING.subList(0, 10), 5);
        assertTrue(ema < 110.0 && ema > TechnicalIndicators.sma(RISING, 10));
    }

    @Test
    void zScoreOfFlatWindowIsZero() {
        assertEquals(0.0, TechnicalIndicators.zScore(Collections.nCopies(20, 10.0), 20));
    }

    @Test
    void momentumIsFractionalChange() {
        assertEquals(110.0 / 106.0 - 1.0, TechnicalIndicators.momentum(RISING, 4), 1e-12);
        assertTrue(Double.isNaN(TechnicalIndicators.momentum(RISING.subList(0, 3), 4)));
    }
}
