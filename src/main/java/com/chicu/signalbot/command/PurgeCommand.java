package com.chicu.signalbot.command;

import com.chicu.signalbot.engine.ScheduledWorker;
import com.chicu.signalbot.engine.WorkerNotConfiguredException;
import com.chicu.signalbot.engine.WorkerStatus;
import com.chicu.signalbot.engine.confirm.ConfirmationAlreadyPendingException;
import com.chicu.signalbot.engine.confirm.PendingConfirmation;
import com.chicu.signalbot.util.TimeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * !purge status | start | stop | now
 */
@Slf4j
@RequiredArgsConstructor
public class PurgeCommand implements BotCommand {

    public static final String WORKER = "purge";

    private final BotContext context;

    @Override
    public String name() {
        return "purge";
    }

    @Override
    public String help() {
        return "`" + context.getPrefix() + "purge status|start|stop|now` - Request channel auto purge";
    }

    @Override
    public void execute(List<String> args, CommandContext ctx) {
        String action = args.isEmpty() ? "" : args.get(0).toLowerCase(Locale.ROOT);

        ScheduledWorker worker;
        try {
            worker = context.getRegistry().get(WORKER);
        } catch (WorkerNotConfiguredException e) {
            ctx.reply("❌ Purge is not set up: no request channel is configured (REQUEST_CHANNEL_NAME).");
            return;
        }

        switch (action) {
            case "status" -> ctx.reply(status(worker.status()));
            case "start" -> start(worker, ctx);
            case "stop" -> ctx.reply(worker.stop()
                    ? "🛑 Auto purge stopped."
                    : "ℹ Auto purge is already stopped.");
            case "now" -> now(worker, ctx);
            default -> ctx.reply("Usage: " + help());
        }
    }

    // ================================================================
    // ACTIONS
    // ================================================================

    private void start(ScheduledWorker worker, CommandContext ctx) {
        if (worker.getInterval().isDisabled()) {
            ctx.reply("⚠ Auto purge is disabled (interval is 0 or invalid). Use `"
                    + context.getPrefix() + "purge now` to purge manually.");
            return;
        }
        if (!worker.start()) {
            ctx.reply("ℹ Auto purge is already running.");
            return;
        }
        WorkerStatus s = worker.status();
        ctx.reply("▶ Auto purge started. Next purge at " + TimeUtil.format(s.nextTrigger(), context.getReferenceOffset()) + ".");
    }

    private void now(ScheduledWorker worker, CommandContext ctx) {
        PendingConfirmation ticket;
        try {
            ticket = context.getGate().request(WORKER, ctx.authorId(), worker::triggerNow,
                    t -> ctx.reply("❌ Purge cancelled: not confirmed within "
                            + context.getGate().getWindow().toSeconds() + " seconds."));
        } catch (ConfirmationAlreadyPendingException e) {
            ctx.reply("⏳ You already have a purge waiting for confirmation.");
            return;
        }

        ctx.promptConfirmation("⚠ <@" + ctx.authorId() + ">, react with ✅ within "
                + context.getGate().getWindow().toSeconds() + " seconds to purge #" + worker.getTarget() + ".",
                ticket.getId());
    }

    String status(WorkerStatus s) {
        StringBuilder sb = new StringBuilder("🧹 **Purge Status**\n");
        sb.append("Channel: #").append(s.target()).append('\n');
        if (s.isManualOnly()) {
            sb.append("Auto purge: disabled (manual only)\n");
        } else {
            sb.append("Auto purge: ").append(s.isRunning() ? "🟢 Running" : "🔴 Stopped")
                    .append(" (every ").append(s.interval().label()).append(")\n");
        }
        if (s.nextTrigger() != null) {
            sb.append("Next purge: ").append(TimeUtil.format(s.nextTrigger(), context.getReferenceOffset()))
                    .append(" (in ").append(TimeUtil.formatDuration(s.timeRemaining())).append(")\n");
        }
        if (s.lastRunAt() != null) {
            sb.append("Last run: ").append(TimeUtil.format(s.lastRunAt(), context.getReferenceOffset()));
            if (s.lastResult() != null) {
                sb.append(" → ").append(s.lastResult().status()).append(": ").append(s.lastResult().message());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }
}
