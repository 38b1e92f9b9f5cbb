package com.chicu.signalbot.chat.discord;

import com.chicu.signalbot.chat.ConfirmationPrompts;
import com.chicu.signalbot.command.CommandContext;
import com.chicu.signalbot.command.CommandRouter;
import com.chicu.signalbot.engine.ManualScheduler;
import com.chicu.signalbot.engine.MutableClock;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionAddEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DiscordCommandListenerTest {

    private CommandRouter router;
    private ConfirmationPrompts prompts;
    private ManualScheduler scheduler;
    private DiscordCommandListener listener;

    @BeforeEach
    void setUp() {
        router = mock(CommandRouter.class);
        when(router.getPrefix()).thenReturn("!");
        prompts = new ConfirmationPrompts(new MutableClock(Instant.parse("2026-10-18T16:00:00Z")), Duration.ofSeconds(15));
        scheduler = new ManualScheduler();
        listener = new DiscordCommandListener(router, prompts, scheduler);
    }

    private MessageReactionAddEvent reaction(String messageId, String userId, String emoji) {
        MessageReactionAddEvent event = mock(MessageReactionAddEvent.class, RETURNS_DEEP_STUBS);
        when(event.getUserIdLong()).thenReturn(Long.parseLong(userId));
        when(event.getUserId()).thenReturn(userId);
        when(event.getJDA().getSelfUser().getIdLong()).thenReturn(1L);
        when(event.getEmoji().getName()).thenReturn(emoji);
        when(event.getMessageId()).thenReturn(messageId);
        return event;
    }

    @Test
    void confirmation_shouldRunOnSchedulerPool_notOnEventThread() {
        prompts.bind("500", "ticket-1");

        listener.onMessageReactionAdd(reaction("500", "42", "✅"));

        verify(router, never()).onConfirmation(anyString(), anyString(), any());

        scheduler.runPending("confirm-ack:ticket-1:42");

        verify(router).onConfirmation(eq("ticket-1"), eq("42"), any(CommandContext.class));
    }

    @Test
    void botOwnReaction_shouldBeIgnored() {
        prompts.bind("500", "ticket-1");

        listener.onMessageReactionAdd(reaction("500", "1", "✅"));

        assertFalse(scheduler.isPending("confirm-ack:ticket-1:1"));
    }

    @Test
    void otherEmojiOrUnknownMessage_shouldBeIgnored() {
        prompts.bind("500", "ticket-1");

        listener.onMessageReactionAdd(reaction("500", "42", "👍"));
        listener.onMessageReactionAdd(reaction("501", "42", "✅"));

        assertFalse(scheduler.isPending("confirm-ack:ticket-1:42"));
        verify(router, never()).onConfirmation(anyString(), anyString(), any());
    }

    @Test
    void command_shouldBeHandedToSchedulerPool() {
        MessageReceivedEvent event = mock(MessageReceivedEvent.class, RETURNS_DEEP_STUBS);
        when(event.getAuthor().isBot()).thenReturn(false);
        when(event.getAuthor().getId()).thenReturn("42");
        when(event.getMessage().getContentRaw()).thenReturn("!purge now");
        when(event.isFromGuild()).thenReturn(false);
        when(event.getMessageId()).thenReturn("700");

        listener.onMessageReceived(event);

        verify(router, never()).handle(anyString(), any());
        scheduler.runPending("command:700");
        verify(router).handle(eq("!purge now"), any(CommandContext.class));
    }
}
