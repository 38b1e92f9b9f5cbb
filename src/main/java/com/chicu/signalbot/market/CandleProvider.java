package com.chicu.signalbot.market;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Поставщик свечей для сканеров.
 *
 * ОДИН общий тип свечи на весь проект:
 *  - time в миллисекундах (long), время открытия
 *  - цены и объём в double
 */
public interface CandleProvider {

    record Candle(
            long time,
            double open,
            double high,
            double low,
            double close,
            double volume
    ) {

        public static Candle fromInstant(
                Instant instant,
                double open,
                double high,
                double low,
                double close,
                double volume
        ) {
            return new Candle(instant.toEpochMilli(), open, high, low, close, volume);
        }
    }

    /**
     * Последние свечи по возрастанию времени.
     *
     * @param productId   например "AVAX-USD"
     * @param granularity размер свечи
     * @param limit       максимум свечей в ответе
     */
    List<Candle> getRecentCandles(String productId, Duration granularity, int limit);
}
