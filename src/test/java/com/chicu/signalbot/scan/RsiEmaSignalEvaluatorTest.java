package com.chicu.signalbot.scan;

import com.chicu.signalbot.common.enums.SignalType;
import com.chicu.signalbot.market.CandleProvider.Candle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RsiEmaSignalEvaluatorTest {

    private final StrategyParams params = StrategyParams.builder()
            .trendPeriod(20)
            .shortPeriod(3)
            .longPeriod(8)
            .rsiPeriod(5)
            .rsiOverbought(80)
            .rsiOversold(20)
            .macdFast(3)
            .macdSlow(6)
            .macdSignal(3)
            .atrPeriod(5)
            .volumeMaPeriod(5)
            .volumeSpikeMultiplier(2.0)
            .portfolioSize(100_000)
            .riskPerTradePercent(0.5)
            .atrStopLossMultiplier(2.0)
            .build();

    private final RsiEmaSignalEvaluator evaluator = new RsiEmaSignalEvaluator(params);

    /** Рост 30 баров, откат 8 баров, резкий отскок на последнем. */
    private static List<Double> bullishReversal() {
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < 30; i++) closes.add(100.0 + i);
        for (int i = 1; i <= 8; i++) closes.add(129 - 1.5 * i);
        closes.add(135.0);
        return closes;
    }

    private static List<Double> bearishReversal() {
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < 30; i++) closes.add(200.0 - i);
        for (int i = 1; i <= 8; i++) closes.add(171 + 1.5 * i);
        closes.add(165.0);
        return closes;
    }

    private static List<Candle> candles(List<Double> closes, double lastVolume) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            double c = closes.get(i);
            double v = i == closes.size() - 1 ? lastVolume : 10;
            out.add(new Candle(i * 300_000L, c, c + 1, c - 1, c, v));
        }
        return out;
    }

    @Test
    void bullishCrossoverWithVolume_shouldBuyWithTradePlan() {
        Optional<Signal> s = evaluator.evaluate("AVAX-USD", candles(bullishReversal(), 50));

        assertTrue(s.isPresent());
        assertEquals(SignalType.BUY, s.get().getType());
        assertEquals("Uptrend", s.get().getTrend());
        assertEquals(135.0, s.get().getClosePrice(), 1e-9);

        TradePlan plan = s.get().getTradePlan();
        assertNotNull(plan);
        assertTrue(plan.stopLoss() < 135.0);
        // риск на сделку = 0.5% от 100k
        assertEquals(500.0, (135.0 - plan.stopLoss()) * plan.positionSizeCrypto(), 1e-6);
        assertEquals(plan.positionSizeCrypto() * 135.0, plan.positionSizeUsd(), 1e-6);
        assertEquals("AVAX", s.get().baseCurrency());
    }

    @Test
    void bearishCrossoverWithVolume_shouldSellWithoutPlan() {
        Optional<Signal> s = evaluator.evaluate("SOL-USD", candles(bearishReversal(), 50));

        assertTrue(s.isPresent());
        assertEquals(SignalType.SELL, s.get().getType());
        assertEquals("Downtrend", s.get().getTrend());
        assertNull(s.get().getTradePlan());
    }

    @Test
    void crossoverWithoutVolumeSpike_shouldBeFiltered() {
        assertTrue(evaluator.evaluate("AVAX-USD", candles(bullishReversal(), 10)).isEmpty());
    }

    @Test
    void volumeFilterDisabled_shouldSignalOnPlainVolume() {
        RsiEmaSignalEvaluator noVolume = new RsiEmaSignalEvaluator(params.toBuilder().volumeFilterEnabled(false).build());
        assertTrue(noVolume.evaluate("AVAX-USD", candles(bullishReversal(), 10)).isPresent());
    }

    @Test
    void overboughtRsi_shouldBlockBuy() {
        RsiEmaSignalEvaluator strict = new RsiEmaSignalEvaluator(params.toBuilder().rsiOverbought(70).build());
        assertTrue(strict.evaluate("AVAX-USD", candles(bullishReversal(), 50)).isEmpty());
    }

    @Test
    void noCrossover_shouldBeEmpty() {
        List<Double> rising = new ArrayList<>();
        for (int i = 0; i < 40; i++) rising.add(100.0 + i);
        assertTrue(evaluator.evaluate("AVAX-USD", candles(rising, 50)).isEmpty());
    }

    @Test
    void tooFewCandles_shouldBeEmpty() {
        List<Double> shortSeries = bullishReversal().subList(20, 39);
        assertTrue(shortSeries.size() < params.requiredCandles());
        assertTrue(evaluator.evaluate("AVAX-USD", candles(shortSeries, 50)).isEmpty());
        assertTrue(evaluator.evaluate("AVAX-USD", null).isEmpty());
    }
}
