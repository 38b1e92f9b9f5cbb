package com.chicu.signalbot.market;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ⏱️ Склейка мелких свечей в крупные (биржа не отдаёт, например, 4h напрямую).
 * Корзины выровнены от эпохи.
 */
public final class CandleResampler {

    private CandleResampler() {
    }

    public static List<CandleProvider.Candle> resample(List<CandleProvider.Candle> candles,
                                                       long stepSeconds,
                                                       int limit) {
        if (candles == null || candles.isEmpty()) return List.of();

        List<CandleProvider.Candle> sorted = new ArrayList<>(candles);
        sorted.sort(Comparator.comparingLong(CandleProvider.Candle::time));

        long stepMs = stepSeconds * 1000L;
        Map<Long, Bucket> buckets = new LinkedHashMap<>();

        for (var c : sorted) {
            long bucketMs = Math.floorDiv(c.time(), stepMs) * stepMs;
            buckets.computeIfAbsent(bucketMs, Bucket::new).add(c);
        }

        List<CandleProvider.Candle> out = new ArrayList<>(buckets.size());
        for (Bucket b : buckets.values()) out.add(b.toCandle());

        int from = Math.max(0, out.size() - limit);
        return out.subList(from, out.size());
    }

    private static class Bucket {
        final long time;
        double open, high, low, close, volume;
        boolean first = true;

        Bucket(long time) {
            this.time = time;
        }

        void add(CandleProvider.Candle c) {
            if (first) {
                open = c.open();
                high = c.high();
                low = c.low();
                first = false;
            }
            high = Math.max(high, c.high());
            low = Math.min(low, c.low());
            close = c.close();
            volume += c.volume();
        }

        CandleProvider.Candle toCandle() {
            return new CandleProvider.Candle(time, open, high, low, close, volume);
        }
    }
}
