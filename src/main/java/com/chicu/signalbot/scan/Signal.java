package com.chicu.signalbot.scan;

import com.chicu.signalbot.common.enums.SignalType;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class Signal {

    private final String asset;        // AVAX-USD
    private final SignalType type;     // BUY / SELL
    private final double closePrice;
    private final String trend;        // Uptrend / Downtrend
    private final String reason;
    private final TradePlan tradePlan; // только для BUY, иначе null

    // ================================
    // FACTORY METHODS
    // ================================
    public static Signal buy(String asset, double price, String trend, String reason, TradePlan plan) {
        return new Signal(asset, SignalType.BUY, price, trend, reason, plan);
    }

    public static Signal sell(String asset, double price, String trend, String reason) {
        return new Signal(asset, SignalType.SELL, price, trend, reason, null);
    }

    /** "AVAX" из "AVAX-USD" */
    public String baseCurrency() {
        int dash = asset.indexOf('-');
        return dash > 0 ? asset.substring(0, dash) : asset;
    }
}
