package com.chicu.signalbot.common.enums;

/** Шаг лесенки напоминаний перед запуском. */
public enum ReminderKind {
    /** Каждый час, пока до запуска больше часа. */
    HOURLY,
    /** Каждые 15 минут в последний час. */
    FINE_GRAINED
}
