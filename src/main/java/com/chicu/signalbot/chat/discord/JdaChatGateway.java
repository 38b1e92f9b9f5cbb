package com.chicu.signalbot.chat.discord;

import com.chicu.signalbot.chat.ChatCapability;
import com.chicu.signalbot.chat.ChatException;
import com.chicu.signalbot.chat.ChatGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.InsufficientPermissionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link ChatGateway} поверх JDA. Вызывается с потоков воркеров, поэтому
 * всё блокирующее (complete/join), а не queue().
 */
@Slf4j
@RequiredArgsConstructor
public class JdaChatGateway implements ChatGateway {

    private final JDA jda;

    @Override
    public boolean channelExists(String channelName) {
        return find(channelName).isPresent();
    }

    @Override
    public void sendMessage(String channelName, String content) {
        TextChannel channel = require(channelName);
        try {
            channel.sendMessage(content).complete();
        } catch (ErrorResponseException | InsufficientPermissionException e) {
            throw new ChatException("cannot send to #" + channelName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void sendDirectMessage(String userId, String content) {
        try {
            User user = jda.retrieveUserById(userId).complete();
            user.openPrivateChannel().complete().sendMessage(content).complete();
        } catch (ErrorResponseException e) {
            throw new ChatException("cannot DM user " + userId + ": " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new ChatException("invalid user id '" + userId + "'", e);
        }
    }

    @Override
    public boolean hasPermission(String channelName, ChatCapability capability) {
        return find(channelName)
                .map(c -> c.getGuild().getSelfMember().hasPermission(c, toPermission(capability)))
                .orElse(false);
    }

    @Override
    public int purgeChannel(String channelName) {
        TextChannel channel = require(channelName);
        try {
            List<Message> messages = new ArrayList<>();
            for (Message m : channel.getIterableHistory()) {
                messages.add(m);
            }
            if (messages.isEmpty()) {
                return 0;
            }

            List<CompletableFuture<Void>> parts = channel.purgeMessages(messages);
            CompletableFuture.allOf(parts.toArray(new CompletableFuture[0])).join();

            log.debug("🧹 #{}: {} messages deleted", channelName, messages.size());
            return messages.size();

        } catch (InsufficientPermissionException | ErrorResponseException e) {
            throw new ChatException("cannot purge #" + channelName + ": " + e.getMessage(), e);
        } catch (CompletionException e) {
            throw new ChatException("purge of #" + channelName + " failed: " + e.getCause().getMessage(), e);
        }
    }

    // ---------- helpers ----------

    private Optional<TextChannel> find(String channelName) {
        if (channelName == null || channelName.isBlank()) {
            return Optional.empty();
        }
        return jda.getTextChannelsByName(channelName.trim(), true).stream().findFirst();
    }

    private TextChannel require(String channelName) {
        return find(channelName)
                .orElseThrow(() -> new ChatException("channel '" + channelName + "' not found"));
    }

    static Permission toPermission(ChatCapability capability) {
        return switch (capability) {
            case SEND_MESSAGES -> Permission.MESSAGE_SEND;
            case MANAGE_MESSAGES -> Permission.MESSAGE_MANAGE;
            case READ_HISTORY -> Permission.MESSAGE_HISTORY;
            case ADD_REACTIONS -> Permission.MESSAGE_ADD_REACTION;
        };
    }
}
