package com.chicu.signalbot.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Период авто-запуска воркера.
 * Нулевой период = авто-расписание выключено, только ручной запуск.
 */
public record IntervalSpec(Duration period) {

    public static final IntervalSpec DISABLED = new IntervalSpec(Duration.ZERO);

    public IntervalSpec {
        Objects.requireNonNull(period, "period");
        if (period.isNegative()) {
            throw new IllegalArgumentException("period must be >= 0");
        }
    }

    public static IntervalSpec ofHours(int hours) {
        return new IntervalSpec(Duration.ofHours(hours));
    }

    public boolean isDisabled() {
        return period.isZero();
    }

    public long hours() {
        return period.toHours();
    }

    /** "6h", "5m", "off" */
    public String label() {
        if (isDisabled()) return "off";
        if (period.toMinutesPart() == 0 && period.toSecondsPart() == 0) {
            return period.toHours() + "h";
        }
        return period.toMinutes() + "m";
    }
}
