package com.chicu.signalbot.market;

import com.chicu.signalbot.market.CandleProvider.Candle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandleResamplerTest {

    private static final long HOUR_MS = 3_600_000L;

    @Test
    void hourly_shouldMergeIntoFourHourBuckets() {
        List<Candle> hourly = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            hourly.add(new Candle(i * HOUR_MS, 100 + i, 101 + i, 99 + i, 100.5 + i, 10));
        }

        List<Candle> out = CandleResampler.resample(hourly, 4 * 3600, 10);

        assertEquals(2, out.size());
        Candle first = out.get(0);
        assertEquals(0, first.time());
        assertEquals(100, first.open(), 1e-9);
        assertEquals(104, first.high(), 1e-9);
        assertEquals(99, first.low(), 1e-9);
        assertEquals(103.5, first.close(), 1e-9);
        assertEquals(40, first.volume(), 1e-9);
        assertEquals(4 * HOUR_MS, out.get(1).time());
    }

    @Test
    void unsortedInput_shouldBeSortedFirst() {
        List<Candle> hourly = List.of(
                new Candle(HOUR_MS, 2, 3, 1, 2.5, 1),
                new Candle(0, 1, 2, 0.5, 1.5, 1));

        Candle merged = CandleResampler.resample(hourly, 2 * 3600, 5).get(0);

        assertEquals(1, merged.open(), 1e-9);
        assertEquals(2.5, merged.close(), 1e-9);
    }

    @Test
    void limit_shouldKeepNewestBuckets() {
        List<Candle> hourly = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            hourly.add(new Candle(i * HOUR_MS, 1, 1, 1, 1, 1));
        }

        List<Candle> out = CandleResampler.resample(hourly, 2 * 3600, 2);

        assertEquals(2, out.size());
        assertEquals(10 * HOUR_MS, out.get(1).time());
    }

    @Test
    void empty_shouldStayEmpty() {
        assertTrue(CandleResampler.resample(List.of(), 3600, 10).isEmpty());
        assertTrue(CandleResampler.resample(null, 3600, 10).isEmpty());
    }
}
