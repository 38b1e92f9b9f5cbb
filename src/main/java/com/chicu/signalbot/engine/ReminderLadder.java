package com.chicu.signalbot.engine;

import com.chicu.signalbot.common.enums.ReminderKind;

import java.time.Duration;
import java.util.Optional;

/**
 * Лесенка напоминаний: часовые границы до последнего часа,
 * затем 45 / 30 / 15 минут.
 *
 * Состояния нет. Вызывающий передаёт остаток времени до запуска и
 * остаток, при котором было отправлено последнее напоминание
 * для этого же запуска (или null).
 */
public final class ReminderLadder {

    public static final Duration HOUR = Duration.ofHours(1);
    public static final Duration QUARTER = Duration.ofMinutes(15);

    private final Duration tolerance;

    /**
     * @param tolerance окно после границы, в котором она считается "пересечённой"
     *                  (гранулярность пробуждений воркера)
     */
    public ReminderLadder(Duration tolerance) {
        if (tolerance == null || tolerance.isZero() || tolerance.isNegative()) {
            throw new IllegalArgumentException("tolerance must be > 0");
        }
        this.tolerance = tolerance;
    }

    public static ReminderLadder withMinuteTolerance() {
        return new ReminderLadder(Duration.ofMinutes(1));
    }

    public Duration getTolerance() {
        return tolerance;
    }

    public record Reminder(ReminderKind kind, Duration boundary) {

        /** "1 hour", "5 hours", "15 minutes" */
        public String describe() {
            if (kind == ReminderKind.HOURLY) {
                long h = boundary.toHours();
                return h == 1 ? "1 hour" : h + " hours";
            }
            return boundary.toMinutes() + " minutes";
        }
    }

    public Optional<Reminder> shouldRemind(Duration remaining, Duration lastRemindedAt) {
        if (remaining == null || remaining.isZero() || remaining.isNegative()) {
            return Optional.empty();
        }

        Duration boundary = boundaryAtOrAbove(remaining);
        if (boundary.minus(remaining).compareTo(tolerance) >= 0) {
            return Optional.empty();
        }
        if (lastRemindedAt != null && lastRemindedAt.compareTo(boundary) <= 0) {
            // по этой границе (или более поздней) уже напоминали
            return Optional.empty();
        }

        ReminderKind kind = boundary.compareTo(HOUR) >= 0
                ? ReminderKind.HOURLY
                : ReminderKind.FINE_GRAINED;
        return Optional.of(new Reminder(kind, boundary));
    }

    /**
     * Ближайшая граница строго ниже remaining (остаток, на котором стоит проснуться).
     * Пусто, если границ до запуска больше нет.
     */
    public Optional<Duration> nextBoundary(Duration remaining) {
        if (remaining == null || remaining.compareTo(QUARTER) <= 0) {
            return Optional.empty();
        }
        Duration step = remaining.compareTo(HOUR) > 0 ? HOUR : QUARTER;
        Duration below = floorTo(remaining, step);
        if (below.equals(remaining)) {
            below = below.minus(step);
        }
        return below.isZero() ? Optional.empty() : Optional.of(below);
    }

    // ---------- helpers ----------

    private Duration boundaryAtOrAbove(Duration remaining) {
        Duration step = remaining.compareTo(HOUR) > 0 ? HOUR : QUARTER;
        Duration floor = floorTo(remaining, step);
        return floor.equals(remaining) ? floor : floor.plus(step);
    }

    private static Duration floorTo(Duration value, Duration step) {
        long n = value.toNanos() / step.toNanos();
        return step.multipliedBy(n);
    }
}
