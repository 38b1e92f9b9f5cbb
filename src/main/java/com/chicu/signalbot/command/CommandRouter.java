package com.chicu.signalbot.command;

import com.chicu.signalbot.engine.ActionResult;
import com.chicu.signalbot.engine.confirm.ConfirmationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Разбор "!команда арг1 арг2" и диспетчеризация по {@link BotCommand}.
 * "!help" обрабатывается здесь же.
 */
@Slf4j
public class CommandRouter {

    private final BotContext context;
    private final Map<String, BotCommand> commands = new LinkedHashMap<>();

    public CommandRouter(BotContext context, List<BotCommand> commands) {
        this.context = context;
        for (BotCommand c : commands) {
            this.commands.put(c.name().toLowerCase(Locale.ROOT), c);
        }
    }

    public String getPrefix() {
        return context.getPrefix();
    }

    /**
     * @return false, если это не команда бота
     */
    public boolean handle(String content, CommandContext ctx) {
        String prefix = context.getPrefix();
        if (content == null || !content.startsWith(prefix)) {
            return false;
        }

        String body = content.substring(prefix.length()).trim();
        if (body.isEmpty()) {
            return false;
        }

        List<String> tokens = Arrays.asList(body.split("\\s+"));
        String name = tokens.get(0).toLowerCase(Locale.ROOT);
        List<String> args = tokens.subList(1, tokens.size());

        if ("help".equals(name)) {
            ctx.reply(helpText());
            return true;
        }

        BotCommand command = commands.get(name);
        if (command == null) {
            return false;
        }

        log.info("💬 Command '{}' args={} from {}", name, args, ctx.authorId());
        try {
            command.execute(args, ctx);
        } catch (Exception e) {
            log.error("❌ Command '{}' failed: {}", name, e.getMessage(), e);
            ctx.reply("❌ Command failed: " + e.getMessage());
        }
        return true;
    }

    // ================================================================
    // CONFIRMATION
    // ================================================================

    /**
     * Реакция на сообщение-запрос подтверждения.
     */
    public void onConfirmation(String ticketId, String responderId, CommandContext ctx) {
        ConfirmationResult result = context.getGate().acknowledge(ticketId, responderId);

        switch (result.outcome()) {
            case EXECUTED -> {
                ActionResult r = result.actionResult();
                if (r.isFailed()) {
                    ctx.reply("❌ Confirmed action failed: " + r.message());
                } else {
                    ctx.reply("✅ Confirmed: " + r.message());
                }
            }
            case WRONG_RESPONDER -> ctx.reply("⚠ <@" + responderId + ">, only the user who asked can confirm this.");
            case ALREADY_CONSUMED -> ctx.reply("ℹ This request was already confirmed.");
            case EXPIRED -> ctx.reply("⌛ This confirmation has expired. Run the command again.");
        }
    }

    // ================================================================
    // HELP
    // ================================================================
    String helpText() {
        StringBuilder sb = new StringBuilder("**Commands**\n");
        for (BotCommand c : commands.values()) {
            sb.append(c.help()).append('\n');
        }
        sb.append('`').append(context.getPrefix()).append("help` - Show this message");
        return sb.toString();
    }
}
