package com.chicu.signalbot.scan;

import com.chicu.signalbot.common.enums.MovingAverageType;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Заводские настройки трёх стратегий. Конфиг переопределяет любое поле.
 */
public record StrategyPreset(
        String id,
        String displayName,
        String defaultChannel,
        Duration defaultInterval,
        Duration granularity,
        List<String> defaultProducts,
        StrategyParams params
) {

    public static final String DAY = "day";
    public static final String SWING = "swing";
    public static final String LONG = "long";

    public static final StrategyPreset DAY_TRADER = new StrategyPreset(
            DAY, "Day Trader", "day-trade",
            Duration.ofMinutes(5), Duration.ofMinutes(5),
            List.of("AVAX-USD", "SOL-USD", "ADA-USD", "GRT-USD", "CRV-USD"),
            StrategyParams.builder()
                    .trendPeriod(50)
                    .shortPeriod(9)
                    .longPeriod(21)
                    .volumeSpikeMultiplier(2.0)
                    .riskPerTradePercent(0.5)
                    .atrStopLossMultiplier(2.0)
                    .build());

    public static final StrategyPreset SWING_TRADER = new StrategyPreset(
            SWING, "Aggressive Swing Trader", "swing-trade",
            Duration.ofHours(4), Duration.ofHours(4),
            List.of("MATIC-USD", "QNT-USD", "LCX-USD"),
            StrategyParams.builder()
                    .trendPeriod(50)
                    .shortPeriod(20)
                    .longPeriod(50)
                    .volumeSpikeMultiplier(1.5)
                    .riskPerTradePercent(1.0)
                    .atrStopLossMultiplier(2.5)
                    .build());

    public static final StrategyPreset LONG_TERM = new StrategyPreset(
            LONG, "Long-Term Investor", "long-term-trade",
            Duration.ofHours(24), Duration.ofDays(1),
            List.of("AVAX-USD", "CHZ-USD", "ICP-USD"),
            StrategyParams.builder()
                    .trendIndicator(MovingAverageType.SMA)
                    .signalIndicator(MovingAverageType.SMA)
                    .trendPeriod(30)
                    .shortPeriod(50)
                    .longPeriod(200)
                    .volumeFilterEnabled(false)
                    .riskPerTradePercent(1.0)
                    .atrStopLossMultiplier(2.5)
                    .build());

    public static List<StrategyPreset> all() {
        return List.of(DAY_TRADER, SWING_TRADER, LONG_TERM);
    }

    /** "A|B, c" → [A, B, C]; пусто → пустой список. */
    public static List<String> parseProducts(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split("[|,]"))
                .map(ScanStrategy::normalize)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
