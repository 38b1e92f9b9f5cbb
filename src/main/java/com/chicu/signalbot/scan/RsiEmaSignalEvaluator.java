package com.chicu.signalbot.scan;

import com.chicu.signalbot.common.enums.MovingAverageType;
import com.chicu.signalbot.market.CandleProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Пересечение короткой и длинной средней, подтверждённое трендом, RSI, MACD и всплеском объёма.
 *
 *  BUY:  короткая пересекла длинную снизу вверх, цена выше трендовой средней,
 *         RSI ниже зоны перекупленности, гистограмма MACD > 0
 *  SELL: зеркально
 */
@Slf4j
@RequiredArgsConstructor
public class RsiEmaSignalEvaluator implements SignalEvaluator {

    private final StrategyParams params;

    @Override
    public Optional<Signal> evaluate(String asset, List<CandleProvider.Candle> series) {
        if (series == null || series.size() < params.requiredCandles()) {
            log.debug("⏭ {}: not enough candles ({} < {})",
                    asset, series == null ? 0 : series.size(), params.requiredCandles());
            return Optional.empty();
        }

        double[] closes = IndicatorMath.closes(series);
        int last = closes.length - 1;
        double close = closes[last];

        double[] fast = average(params.getSignalIndicator(), closes, params.getShortPeriod());
        double[] slow = average(params.getSignalIndicator(), closes, params.getLongPeriod());
        double[] trendLine = average(params.getTrendIndicator(), closes, params.getTrendPeriod());

        boolean crossUp = fast[last - 1] <= slow[last - 1] && fast[last] > slow[last];
        boolean crossDown = fast[last - 1] >= slow[last - 1] && fast[last] < slow[last];
        if (!crossUp && !crossDown) {
            return Optional.empty();
        }

        boolean uptrend = close > trendLine[last];
        String trend = uptrend ? "Uptrend" : "Downtrend";

        double rsi = IndicatorMath.rsi(closes, params.getRsiPeriod());
        double hist = IndicatorMath.macdHistogram(closes,
                params.getMacdFast(), params.getMacdSlow(), params.getMacdSignal());

        if (!volumeConfirmed(series)) {
            log.debug("⏭ {}: crossover without volume spike", asset);
            return Optional.empty();
        }

        String reason = String.format(Locale.ROOT, "%s crossover, RSI %.1f, MACD hist %.4f",
                params.getSignalIndicator(), rsi, hist);

        if (crossUp && uptrend && rsi < params.getRsiOverbought() && hist > 0) {
            return Optional.of(Signal.buy(asset, close, trend, reason, tradePlan(series, close)));
        }
        if (crossDown && !uptrend && rsi > params.getRsiOversold() && hist < 0) {
            return Optional.of(Signal.sell(asset, close, trend, reason));
        }
        return Optional.empty();
    }

    // ---------- helpers ----------

    private static double[] average(MovingAverageType type, double[] closes, int period) {
        return type == MovingAverageType.SMA
                ? IndicatorMath.sma(closes, period)
                : IndicatorMath.ema(closes, period);
    }

    private boolean volumeConfirmed(List<CandleProvider.Candle> series) {
        if (!params.isVolumeFilterEnabled()) {
            return true;
        }
        double[] volumes = IndicatorMath.volumes(series);
        double[] ma = IndicatorMath.sma(volumes, params.getVolumeMaPeriod());
        int last = volumes.length - 1;
        // среднее до текущего бара
        return volumes[last] > ma[last - 1] * params.getVolumeSpikeMultiplier();
    }

    private TradePlan tradePlan(List<CandleProvider.Candle> series, double close) {
        double atr = IndicatorMath.atr(series, params.getAtrPeriod());
        double stop = close - atr * params.getAtrStopLossMultiplier();
        double riskPerUnit = close - stop;
        if (riskPerUnit <= 0) {
            return null;
        }
        double riskUsd = params.getPortfolioSize() * params.getRiskPerTradePercent() / 100.0;
        double size = riskUsd / riskPerUnit;
        return new TradePlan(stop, size, size * close);
    }
}
