package com.chicu.signalbot.engine;

import java.time.Instant;

@FunctionalInterface
public interface ReminderListener {

    ReminderListener NONE = (worker, reminder, trigger) -> { };

    void onReminder(String workerName, ReminderLadder.Reminder reminder, Instant trigger);
}
