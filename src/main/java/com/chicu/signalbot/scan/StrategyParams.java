package com.chicu.signalbot.scan;

import com.chicu.signalbot.common.enums.MovingAverageType;
import lombok.Builder;
import lombok.Value;

/**
 * Параметры индикаторов одной стратегии сканирования.
 */
@Value
@Builder(toBuilder = true)
public class StrategyParams {

    @Builder.Default MovingAverageType trendIndicator = MovingAverageType.EMA;
    @Builder.Default int trendPeriod = 50;
    @Builder.Default MovingAverageType signalIndicator = MovingAverageType.EMA;
    @Builder.Default int shortPeriod = 9;
    @Builder.Default int longPeriod = 21;

    @Builder.Default int rsiPeriod = 14;
    @Builder.Default double rsiOverbought = 70;
    @Builder.Default double rsiOversold = 30;

    @Builder.Default int macdFast = 12;
    @Builder.Default int macdSlow = 26;
    @Builder.Default int macdSignal = 9;

    @Builder.Default int atrPeriod = 14;
    @Builder.Default double atrStopLossMultiplier = 2.0;

    @Builder.Default boolean volumeFilterEnabled = true;
    @Builder.Default int volumeMaPeriod = 20;
    @Builder.Default double volumeSpikeMultiplier = 2.0;

    @Builder.Default double portfolioSize = 100_000.0;
    @Builder.Default double riskPerTradePercent = 0.5;

    /** Сколько свечей нужно, чтобы все индикаторы были осмысленны. */
    public int requiredCandles() {
        int need = Math.max(longPeriod, trendPeriod);
        need = Math.max(need, macdSlow + macdSignal);
        need = Math.max(need, rsiPeriod + 1);
        need = Math.max(need, atrPeriod + 1);
        need = Math.max(need, volumeMaPeriod);
        return need + 2;
    }
}
