package com.chicu.signalbot.command;

import com.chicu.signalbot.debrid.DebridAccountStatus;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * !AD status
 */
@RequiredArgsConstructor
public class DebridCommand implements BotCommand {

    private final BotContext context;

    @Override
    public String name() {
        return "AD";
    }

    @Override
    public String help() {
        return "`" + context.getPrefix() + "AD status` - Check AllDebrid API authentication";
    }

    @Override
    public void execute(List<String> args, CommandContext ctx) {
        if (args.isEmpty() || !"status".equalsIgnoreCase(args.get(0))) {
            ctx.reply("Use `" + context.getPrefix() + "AD status` to check AllDebrid API authentication status");
            return;
        }
        ctx.reply(describe(context.getDebrid().status()));
    }

    static String describe(DebridAccountStatus s) {
        return switch (s.kind()) {
            case OK -> "✅ **AllDebrid API Status**\nAuthentication successful\nUsername: " + s.username()
                    + "\nPremium: " + (s.premium() ? "Yes" : "No");
            case NOT_CONFIGURED -> "❌ **Error:** ALLDEBRID_API_KEY is not configured";
            case API_ERROR -> "❌ **API Error:** " + s.message();
            case UNAUTHORIZED -> "❌ **Authentication Failed:** Invalid API key";
            case RATE_LIMITED -> "⚠️ **Rate Limited:** Too many requests to AllDebrid API";
            case HTTP_ERROR -> "❌ **HTTP Error:** Status code " + s.httpStatus();
            case CONNECTION_ERROR -> "❌ **Connection Error:** " + s.message();
        };
    }
}
