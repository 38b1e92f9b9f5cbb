package com.chicu.signalbot.scan;

/**
 * План входа: стоп по ATR и размер позиции от риска на сделку.
 */
public record TradePlan(
        double stopLoss,
        double positionSizeCrypto,
        double positionSizeUsd
) {
}
