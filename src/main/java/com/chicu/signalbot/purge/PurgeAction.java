package com.chicu.signalbot.purge;

import com.chicu.signalbot.chat.ChatCapability;
import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.engine.ActionResult;
import com.chicu.signalbot.engine.WorkerAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Полная очистка канала заявок.
 */
@Slf4j
@RequiredArgsConstructor
public class PurgeAction implements WorkerAction {

    private final String channelName;
    private final ChatGateway chat;

    @Override
    public ActionResult run() {
        if (!chat.channelExists(channelName)) {
            log.warn("⚠ Purge: channel '{}' not found", channelName);
            return ActionResult.failed("channel '" + channelName + "' not found");
        }
        if (!chat.hasPermission(channelName, ChatCapability.MANAGE_MESSAGES)) {
            log.warn("⚠ Purge: no Manage Messages permission in '{}'", channelName);
            return ActionResult.failed("missing Manage Messages permission in #" + channelName);
        }

        int removed = chat.purgeChannel(channelName);
        log.info("🧹 Purge: removed {} messages from '{}'", removed, channelName);

        chat.sendMessage(channelName, "🧹 This channel has been purged (" + removed + " messages removed).");
        return ActionResult.ok(removed + " messages removed");
    }
}
