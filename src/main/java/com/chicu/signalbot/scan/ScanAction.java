package com.chicu.signalbot.scan;

import com.chicu.signalbot.chat.ChatException;
import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.engine.ActionResult;
import com.chicu.signalbot.engine.WorkerAction;
import com.chicu.signalbot.market.CandleProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Действие воркера-сканера: свечи по каждой монете → SignalEvaluator → отчёт в канал стратегии.
 * Ошибка по одной монете не роняет весь скан.
 */
@Slf4j
public class ScanAction implements WorkerAction {

    private final ScanStrategy strategy;
    private final CandleProvider candles;
    private final ChatGateway chat;
    private final String ownerId;

    private final AtomicBoolean announced = new AtomicBoolean();

    public ScanAction(ScanStrategy strategy, CandleProvider candles, ChatGateway chat, String ownerId) {
        this.strategy = strategy;
        this.candles = candles;
        this.chat = chat;
        this.ownerId = ownerId;
    }

    public record ScanOutcome(List<Signal> signals, Map<String, Double> prices, List<String> failed) {

        public boolean allFailed(int total) {
            return total > 0 && failed.size() == total;
        }
    }

    @Override
    public ActionResult run() {
        String channel = strategy.getChannelName();
        log.info("🔎 Running scan for {}", strategy.getDisplayName());

        if (!chat.channelExists(channel)) {
            log.info("⏭ {} channel '{}' not found, skipping scan", strategy.getDisplayName(), channel);
            return ActionResult.skipped("channel '" + channel + "' not found");
        }

        if (announced.compareAndSet(false, true)) {
            chat.sendMessage(channel, ScanReportFormatter.status(strategy,
                    "🟢 " + strategy.getDisplayName() + " scanner is now active and monitoring the market", null));
        }

        List<String> products = strategy.getProducts();
        ScanOutcome outcome = scan(products);

        if (outcome.allFailed(products.size())) {
            String msg = "❌ " + strategy.getDisplayName() + " scan error: no market data for "
                    + String.join(", ", outcome.failed());
            chat.sendMessage(channel, ScanReportFormatter.status(strategy, msg, null));
            return ActionResult.failed("no market data for any product");
        }

        if (outcome.signals().isEmpty()) {
            chat.sendMessage(channel, ScanReportFormatter.status(strategy,
                    "No actionable " + strategy.getDisplayName().toLowerCase(Locale.ROOT) + " signals found",
                    outcome.prices()));
            return ActionResult.ok("no signals");
        }

        chat.sendMessage(channel, ScanReportFormatter.signals(strategy, outcome.signals(), outcome.prices(), ownerId));
        notifyOwner(outcome);
        return ActionResult.ok(outcome.signals().size() + " signals");
    }

    /** Без отправки сообщений. */
    public ScanOutcome scan(List<String> products) {
        List<Signal> signals = new ArrayList<>();
        Map<String, Double> prices = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();

        for (String product : products) {
            try {
                List<CandleProvider.Candle> series =
                        candles.getRecentCandles(product, strategy.getGranularity(), strategy.getLookback());
                if (series.isEmpty()) {
                    failed.add(product);
                    continue;
                }
                prices.put(product, series.get(series.size() - 1).close());

                Optional<Signal> signal = strategy.getEvaluator().evaluate(product, series);
                signal.ifPresent(signals::add);
            } catch (Exception e) {
                log.error("❌ {} scan failed for {}: {}", strategy.getDisplayName(), product, e.getMessage());
                failed.add(product);
            }
        }

        log.info("📊 Scan completed for {}: {} signals, {} failed", strategy.getDisplayName(), signals.size(), failed.size());
        return new ScanOutcome(signals, prices, failed);
    }

    private void notifyOwner(ScanOutcome outcome) {
        if (ownerId == null || ownerId.isBlank()) {
            return;
        }
        try {
            chat.sendDirectMessage(ownerId, ScanReportFormatter.ownerSummary(strategy, outcome.signals(), outcome.prices()));
        } catch (ChatException e) {
            log.warn("⚠ Could not DM owner {}: {}", ownerId, e.getMessage());
        }
    }
}
