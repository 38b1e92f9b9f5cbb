package com.chicu.signalbot.command;

import com.chicu.signalbot.engine.ActionResult;
import com.chicu.signalbot.engine.ScheduledWorker;
import com.chicu.signalbot.engine.WorkerStatus;
import com.chicu.signalbot.scan.ScanStrategy;
import com.chicu.signalbot.scan.StrategyPreset;
import com.chicu.signalbot.util.TimeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * !crypto [all|status|scan|start|stop|search|add_product|remove_product|list_products] [strategy] [product]
 * Стратегия по умолчанию: day.
 */
@Slf4j
@RequiredArgsConstructor
public class CryptoCommand implements BotCommand {

    private final BotContext context;

    @Override
    public String name() {
        return "crypto";
    }

    @Override
    public String help() {
        return "`" + context.getPrefix() + "crypto [all|status|scan|start|stop|search|add_product|remove_product|list_products] [strategy] [product]` - Market scanners";
    }

    @Override
    public void execute(List<String> args, CommandContext ctx) {
        if (args.isEmpty()) {
            ctx.reply(usage());
            return;
        }

        String action = args.get(0).toLowerCase(Locale.ROOT);
        if ("all".equals(action)) {
            ctx.reply(allStatus());
            return;
        }

        // [strategy] необязателен: первое слово, если это известная стратегия
        List<String> rest = args.subList(1, args.size());
        String strategyId = StrategyPreset.DAY;
        if (!rest.isEmpty() && context.getCatalog().isKnown(rest.get(0))) {
            strategyId = rest.get(0).toLowerCase(Locale.ROOT);
            rest = rest.subList(1, rest.size());
        }

        Optional<ScanStrategy> strategy = context.getCatalog().find(strategyId);
        Optional<ScheduledWorker> worker = context.getRegistry().find(strategyId);
        if (strategy.isEmpty() || worker.isEmpty()) {
            ctx.reply(invalidStrategy());
            return;
        }

        String product = rest.isEmpty() ? null : String.join(" ", rest);

        switch (action) {
            case "status" -> ctx.reply(status(strategy.get(), worker.get().status()));
            case "scan" -> scan(strategy.get(), worker.get(), ctx);
            case "start" -> start(strategy.get(), worker.get(), ctx);
            case "stop" -> ctx.reply(worker.get().stop()
                    ? strategy.get().getDisplayName() + " scanner stopped"
                    : strategy.get().getDisplayName() + " scanner is already stopped");
            case "search" -> search(strategy.get(), ctx);
            case "add_product" -> addProduct(strategy.get(), product, ctx);
            case "remove_product" -> removeProduct(strategy.get(), product, ctx);
            case "list_products" -> listProducts(strategy.get(), ctx);
            default -> ctx.reply("Invalid action. Use: status, scan, stop, start, search, add_product, "
                    + "remove_product, list_products, or all");
        }
    }

    // ================================================================
    // ACTIONS
    // ================================================================

    private void scan(ScanStrategy strategy, ScheduledWorker worker, CommandContext ctx) {
        ctx.reply("Running manual " + strategy.getId() + " scan...");
        ActionResult r = worker.triggerNow();
        switch (r.status()) {
            case FAILED -> ctx.reply("❌ " + strategy.getDisplayName() + " scan error: " + r.message());
            case SKIPPED -> ctx.reply("⚠ " + strategy.getDisplayName() + " scan skipped: " + r.message());
            case OK -> {
                if ("no signals".equals(r.message())) {
                    ctx.reply("No " + strategy.getId() + " signals found");
                } else {
                    ctx.reply("✅ " + strategy.getDisplayName() + " scan finished: " + r.message());
                }
            }
        }
    }

    private void start(ScanStrategy strategy, ScheduledWorker worker, CommandContext ctx) {
        if (worker.getInterval().isDisabled()) {
            ctx.reply("⚠ " + strategy.getDisplayName() + " auto scan is disabled (interval is 0 or invalid). Use `"
                    + context.getPrefix() + "crypto scan " + strategy.getId() + "`.");
            return;
        }
        ctx.reply(worker.start()
                ? strategy.getDisplayName() + " scanner started"
                : strategy.getDisplayName() + " scanner is already running");
    }

    private void search(ScanStrategy strategy, CommandContext ctx) {
        ctx.reply("Searching for " + strategy.getId() + " trading channels...");
        if (context.getChat().channelExists(strategy.getChannelName())) {
            ctx.reply("✅ Found " + strategy.getDisplayName() + " channel: " + strategy.getChannelName());
        } else {
            ctx.reply("❌ No " + strategy.getChannelName() + " channel found in any guild");
        }
    }

    private void addProduct(ScanStrategy strategy, String product, CommandContext ctx) {
        if (product == null) {
            ctx.reply("Usage: `" + context.getPrefix() + "crypto add_product " + strategy.getId() + " <product_id>`");
            return;
        }
        String id = ScanStrategy.normalize(product);
        ctx.reply(strategy.addProduct(id)
                ? "✅ Added " + id + " to " + strategy.getDisplayName() + " products"
                : "❌ " + id + " is already in " + strategy.getDisplayName() + " products");
    }

    private void removeProduct(ScanStrategy strategy, String product, CommandContext ctx) {
        if (product == null) {
            ctx.reply("Usage: `" + context.getPrefix() + "crypto remove_product " + strategy.getId() + " <product_id>`");
            return;
        }
        String id = ScanStrategy.normalize(product);
        ctx.reply(strategy.removeProduct(id)
                ? "✅ Removed " + id + " from " + strategy.getDisplayName() + " products"
                : "❌ " + id + " is not in " + strategy.getDisplayName() + " products");
    }

    private void listProducts(ScanStrategy strategy, CommandContext ctx) {
        List<String> products = strategy.getProducts();
        if (products.isEmpty()) {
            ctx.reply("❌ No products configured for " + strategy.getDisplayName());
            return;
        }
        ctx.reply("**" + strategy.getDisplayName() + " Products**\n"
                + products.stream().map(p -> "• " + p).collect(Collectors.joining("\n"))
                + "\nTotal Products: " + products.size());
    }

    // ================================================================
    // TEXTS
    // ================================================================

    String status(ScanStrategy strategy, WorkerStatus s) {
        StringBuilder sb = new StringBuilder("**" + strategy.getDisplayName() + " Scanner Status**\n");
        sb.append("Scanner: ").append(s.isRunning() ? "🟢 Running" : "🔴 Stopped");
        if (s.isManualOnly()) {
            sb.append(" (manual only)");
        } else {
            sb.append(" (every ").append(s.interval().label()).append(')');
        }
        sb.append('\n');
        sb.append("Channel: ").append(strategy.getChannelName()).append('\n');
        sb.append("Strategy: ").append(strategy.getDisplayName()).append('\n');
        if (s.nextTrigger() != null) {
            sb.append("Next scan: ").append(TimeUtil.format(s.nextTrigger(), context.getReferenceOffset()))
                    .append(" (in ").append(TimeUtil.formatDuration(s.timeRemaining())).append(")\n");
        }
        if (s.lastResult() != null) {
            sb.append("Last scan: ").append(s.lastResult().status()).append(": ").append(s.lastResult().message());
        }
        return sb.toString().trim();
    }

    String allStatus() {
        List<ScanStrategy> enabled = context.getCatalog().enabled().stream()
                .filter(s -> context.getRegistry().contains(s.getId()))
                .toList();
        if (enabled.isEmpty()) {
            return "📊 **All Crypto Scanners Status**\nNo strategies are currently enabled. Check your configuration.";
        }

        StringBuilder sb = new StringBuilder("📊 **All Crypto Scanners Status**\n");
        for (ScanStrategy s : enabled) {
            WorkerStatus st = context.getRegistry().get(s.getId()).status();
            sb.append("**").append(s.getDisplayName()).append("**\n")
                    .append("Status: ").append(st.isRunning() ? "🟢 Running" : "🔴 Stopped").append('\n')
                    .append("Channel: ").append(s.getChannelName()).append('\n');
        }

        List<String> disabled = context.getCatalog().disabledIds();
        if (!disabled.isEmpty()) {
            sb.append("🔴 **Disabled Strategies**\n")
                    .append("The following strategies are disabled (no channel configured): ")
                    .append(String.join(", ", disabled));
        }
        return sb.toString().trim();
    }

    private String invalidStrategy() {
        List<String> available = context.getCatalog().enabled().stream()
                .map(ScanStrategy::getId)
                .filter(id -> context.getRegistry().contains(id))
                .toList();
        if (available.isEmpty()) {
            return "No strategies are currently enabled. Check your configuration.";
        }
        return "Invalid or disabled strategy. Available strategies: " + String.join(", ", available);
    }

    private String usage() {
        String strategies = context.getCatalog().enabled().stream()
                .map(ScanStrategy::getId)
                .collect(Collectors.joining("|"));
        String p = context.getPrefix();
        return "Available commands:\n"
                + "`" + p + "crypto status [strategy]` - Check scanner status\n"
                + "`" + p + "crypto scan [strategy]` - Run manual scan\n"
                + "`" + p + "crypto stop [strategy]` - Stop scanner\n"
                + "`" + p + "crypto start [strategy]` - Start scanner\n"
                + "`" + p + "crypto search [strategy]` - Look for the strategy channel\n"
                + "`" + p + "crypto all` - Check all scanners\n"
                + "`" + p + "crypto add_product [strategy] <product_id>` - Add product to strategy\n"
                + "`" + p + "crypto remove_product [strategy] <product_id>` - Remove product from strategy\n"
                + "`" + p + "crypto list_products [strategy]` - List products for strategy\n\n"
                + "Available strategies: " + (strategies.isEmpty() ? "none" : strategies);
    }
}
