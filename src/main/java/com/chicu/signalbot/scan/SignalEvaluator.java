package com.chicu.signalbot.scan;

import com.chicu.signalbot.market.CandleProvider;

import java.util.List;
import java.util.Optional;

/**
 * Чистая функция над рядом свечей: сигнал или ничего.
 * Вызывается синхронно внутри действия сканера.
 */
@FunctionalInterface
public interface SignalEvaluator {

    Optional<Signal> evaluate(String asset, List<CandleProvider.Candle> series);
}
