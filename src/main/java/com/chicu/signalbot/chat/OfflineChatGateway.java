package com.chicu.signalbot.chat;

import lombok.extern.slf4j.Slf4j;

/**
 * Без токена Discord: каналов нет, отправка только в лог.
 * Воркеры регистрируются как обычно, действия уходят в skipped/failed.
 */
@Slf4j
public class OfflineChatGateway implements ChatGateway {

    @Override
    public boolean channelExists(String channelName) {
        return false;
    }

    @Override
    public void sendMessage(String channelName, String content) {
        log.info("📴 [offline] #{}: {}", channelName, content);
    }

    @Override
    public void sendDirectMessage(String userId, String content) {
        log.info("📴 [offline] DM {}: {}", userId, content);
    }

    @Override
    public boolean hasPermission(String channelName, ChatCapability capability) {
        return false;
    }

    @Override
    public int purgeChannel(String channelName) {
        throw new ChatException("chat is offline, channel '" + channelName + "' is unavailable");
    }
}
