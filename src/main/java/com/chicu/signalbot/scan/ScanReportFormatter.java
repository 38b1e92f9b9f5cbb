package com.chicu.signalbot.scan;

import com.chicu.signalbot.common.enums.SignalType;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Тексты сообщений сканера. Discord режет сообщения длиннее 2000 символов.
 */
public final class ScanReportFormatter {

    static final int MAX_MESSAGE = 2000;

    private ScanReportFormatter() {
    }

    public static String signals(ScanStrategy strategy, List<Signal> signals,
                                 Map<String, Double> prices, String ownerId) {
        StringBuilder sb = new StringBuilder();
        if (ownerId != null && !ownerId.isBlank()) {
            sb.append("<@").append(ownerId).append("> ");
        }
        sb.append("🚨 ").append(strategy.getDisplayName()).append(" signals detected!\n");
        sb.append("**🚀 ").append(strategy.getDisplayName()).append(" Signals** — found ")
                .append(signals.size()).append(" actionable signals\n\n");

        appendPrices(sb, prices);

        for (Signal s : signals) {
            sb.append(emoji(s)).append(" **").append(s.getType()).append("** ").append(s.getAsset()).append('\n');
            sb.append("Price: ").append(money(s.getClosePrice())).append('\n');
            sb.append("Trend: ").append(s.getTrend()).append('\n');
            TradePlan plan = s.getTradePlan();
            if (plan != null) {
                sb.append("Stop Loss: ").append(money(plan.stopLoss())).append('\n');
                sb.append("Position Size: ")
                        .append(String.format(Locale.ROOT, "%.6f", plan.positionSizeCrypto()))
                        .append(' ').append(s.baseCurrency()).append('\n');
                sb.append("USD Value: ").append(money(plan.positionSizeUsd())).append('\n');
            }
            sb.append('\n');
        }
        return truncate(sb.toString());
    }

    public static String ownerSummary(ScanStrategy strategy, List<Signal> signals, Map<String, Double> prices) {
        StringBuilder sb = new StringBuilder();
        sb.append("🚨 **").append(strategy.getDisplayName().toUpperCase(Locale.ROOT)).append(" SIGNALS**\n");
        sb.append(signals.size()).append(" new ").append(strategy.getDisplayName().toLowerCase(Locale.ROOT))
                .append(" signals detected!\n\n");
        appendPrices(sb, prices);
        for (Signal s : signals) {
            sb.append(emoji(s)).append(" **").append(s.getType()).append("** ")
                    .append(s.getAsset()).append(" @ ").append(money(s.getClosePrice())).append('\n');
        }
        sb.append("\nCheck #").append(strategy.getChannelName()).append(" for full details");
        return truncate(sb.toString());
    }

    public static String status(ScanStrategy strategy, String message, Map<String, Double> prices) {
        StringBuilder sb = new StringBuilder();
        sb.append("📊 **").append(strategy.getDisplayName()).append(" Status**\n");
        sb.append(message).append('\n');
        if (prices != null && !prices.isEmpty()) {
            sb.append('\n');
            appendPrices(sb, prices);
        }
        return truncate(sb.toString());
    }

    // ---------- helpers ----------

    private static void appendPrices(StringBuilder sb, Map<String, Double> prices) {
        if (prices == null || prices.isEmpty()) return;
        sb.append("💰 **Current Prices:**\n");
        prices.forEach((asset, price) ->
                sb.append("• ").append(asset).append(": ").append(money(price)).append('\n'));
        sb.append('\n');
    }

    private static String emoji(Signal s) {
        return s.getType() == SignalType.BUY ? "🟢" : "🔴";
    }

    static String money(double v) {
        return String.format(Locale.ROOT, "$%.2f", v);
    }

    static String truncate(String s) {
        return s.length() <= MAX_MESSAGE ? s : s.substring(0, MAX_MESSAGE - 1) + "…";
    }
}
