package com.chicu.signalbot.purge;

import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.engine.ReminderLadder;
import com.chicu.signalbot.engine.ReminderListener;
import com.chicu.signalbot.util.TimeUtil;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Напоминания в сам канал: "будет очищен через N часов/минут".
 */
@RequiredArgsConstructor
public class PurgeReminderNotifier implements ReminderListener {

    private final String channelName;
    private final ChatGateway chat;
    private final ZoneOffset referenceOffset;

    @Override
    public void onReminder(String workerName, ReminderLadder.Reminder reminder, Instant trigger) {
        chat.sendMessage(channelName, "⏰ This channel will be purged in " + reminder.describe()
                + " (at " + TimeUtil.format(trigger, referenceOffset) + ").");
    }
}
