package com.chicu.signalbot.chat.discord;

import com.chicu.signalbot.chat.ConfirmationPrompts;
import com.chicu.signalbot.command.CommandContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.entities.emoji.Emoji;

@Slf4j
@RequiredArgsConstructor
class JdaCommandContext implements CommandContext {

    static final Emoji CONFIRM = Emoji.fromUnicode("✅");

    private final MessageChannel channel;
    private final String authorId;
    private final ConfirmationPrompts prompts;

    @Override
    public String authorId() {
        return authorId;
    }

    @Override
    public void reply(String text) {
        channel.sendMessage(text).queue(
                null,
                e -> log.warn("⚠ Reply to #{} failed: {}", channel.getName(), e.getMessage()));
    }

    @Override
    public void promptConfirmation(String text, String ticketId) {
        // привязка до реакции бота, иначе быстрый ✅ пользователя может прийти раньше
        Message prompt = channel.sendMessage(text).complete();
        prompts.bind(prompt.getId(), ticketId);
        prompt.addReaction(CONFIRM).queue();
    }
}
