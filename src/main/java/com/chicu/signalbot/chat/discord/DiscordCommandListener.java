package com.chicu.signalbot.chat.discord;

import com.chicu.signalbot.chat.ConfirmationPrompts;
import com.chicu.signalbot.command.CommandRouter;
import com.chicu.signalbot.engine.SchedulerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionAddEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;

import java.time.Duration;
import java.util.Optional;

/**
 * Сообщения с префиксом → {@link CommandRouter}; ✅ на запросе подтверждения → gate.
 * Обработка уходит в пул планировщика: поток событий JDA не ждёт очистку или скан.
 */
@Slf4j
@RequiredArgsConstructor
public class DiscordCommandListener extends ListenerAdapter {

    private final CommandRouter router;
    private final ConfirmationPrompts prompts;
    private final SchedulerService scheduler;

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (event.getAuthor().isBot()) {
            return;
        }
        String content = event.getMessage().getContentRaw();
        if (!content.startsWith(router.getPrefix())) {
            return;
        }
        if (event.isFromGuild()
                && !event.getGuild().getSelfMember().hasPermission(event.getGuildChannel(), Permission.MESSAGE_SEND)) {
            log.debug("⏭ No send permission in #{}, command ignored", event.getChannel().getName());
            return;
        }

        JdaCommandContext ctx = new JdaCommandContext(event.getChannel(), event.getAuthor().getId(), prompts);
        scheduler.scheduleOnce("command:" + event.getMessageId(), () -> router.handle(content, ctx), Duration.ZERO);
    }

    @Override
    public void onMessageReactionAdd(MessageReactionAddEvent event) {
        if (event.getUserIdLong() == event.getJDA().getSelfUser().getIdLong()) {
            return;
        }
        if (!JdaCommandContext.CONFIRM.getName().equals(event.getEmoji().getName())) {
            return;
        }

        Optional<String> ticket = prompts.ticketFor(event.getMessageId());
        if (ticket.isEmpty()) {
            return;
        }

        JdaCommandContext ctx = new JdaCommandContext(event.getChannel(), event.getUserId(), prompts);
        String responderId = event.getUserId();
        scheduler.scheduleOnce("confirm-ack:" + ticket.get() + ":" + responderId,
                () -> router.onConfirmation(ticket.get(), responderId, ctx), Duration.ZERO);
    }
}
