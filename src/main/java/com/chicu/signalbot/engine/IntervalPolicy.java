package com.chicu.signalbot.engine;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Закрытый набор допустимых периодов + расчёт ближайшей границы,
 * выровненной от полуночи в опорном часовом поясе.
 *
 * Пояс задаётся фиксированным смещением (по умолчанию -07:00, PDT).
 * Переходы на летнее/зимнее время НЕ отслеживаются: расписание
 * детерминировано, но зимой сдвинуто на час относительно местного времени.
 */
public final class IntervalPolicy {

    public static final ZoneOffset PDT = ZoneOffset.ofHours(-7);

    private static final Duration DAY = Duration.ofDays(1);

    private final ZoneOffset referenceOffset;
    private final Set<Duration> allowed;

    private IntervalPolicy(ZoneOffset referenceOffset, Set<Duration> allowed) {
        this.referenceOffset = referenceOffset;
        this.allowed = Collections.unmodifiableSet(new TreeSet<>(allowed));
    }

    /** Часовая политика: {0,1,2,3,4,6,12}. */
    public static IntervalPolicy hourly(ZoneOffset referenceOffset) {
        return of(referenceOffset,
                Duration.ZERO,
                Duration.ofHours(1), Duration.ofHours(2), Duration.ofHours(3),
                Duration.ofHours(4), Duration.ofHours(6), Duration.ofHours(12));
    }

    /**
     * Произвольный набор периодов. Каждый ненулевой период обязан делить сутки,
     * иначе выравнивание от полуночи теряет смысл.
     */
    public static IntervalPolicy of(ZoneOffset referenceOffset, Duration... periods) {
        Set<Duration> set = new TreeSet<>(Arrays.asList(periods));
        for (Duration d : set) {
            if (d.isNegative() || d.compareTo(DAY) > 0
                    || (!d.isZero() && DAY.toNanos() % d.toNanos() != 0)) {
                throw new IllegalArgumentException("period " + d + " does not divide a day");
            }
        }
        return new IntervalPolicy(referenceOffset, set);
    }

    public ZoneOffset getReferenceOffset() {
        return referenceOffset;
    }

    public Set<Duration> getAllowed() {
        return allowed;
    }

    // ==============================================================
    // VALIDATE
    // ==============================================================

    public IntervalSpec validate(Integer hours) {
        if (hours == null) {
            throw new InvalidIntervalException("interval is not set");
        }
        return validate(Duration.ofHours(hours));
    }

    /** Сырое значение из конфига: только целое число часов. */
    public IntervalSpec validate(String rawHours) {
        if (rawHours == null || rawHours.isBlank()) {
            throw new InvalidIntervalException("interval is not set");
        }
        int hours;
        try {
            hours = Integer.parseInt(rawHours.trim());
        } catch (NumberFormatException e) {
            throw new InvalidIntervalException("interval '" + rawHours + "' is not an integer");
        }
        return validate(hours);
    }

    public IntervalSpec validate(Duration period) {
        if (period == null || !allowed.contains(period)) {
            throw new InvalidIntervalException("interval " + period + " is not one of " + describeAllowed());
        }
        return period.isZero() ? IntervalSpec.DISABLED : new IntervalSpec(period);
    }

    public String describeAllowed() {
        return allowed.stream()
                .map(d -> new IntervalSpec(d).label())
                .map(l -> l.equals("off") ? "0" : l)
                .collect(Collectors.joining(", ", "{", "}"));
    }

    // ==============================================================
    // NEXT TRIGGER
    // ==============================================================

    /**
     * Наименьшая граница midnight + k * period, строго позже now.
     */
    public Instant nextTrigger(IntervalSpec spec, Instant now) {
        if (spec.isDisabled()) {
            throw new DisabledIntervalException();
        }
        LocalDate day = now.atOffset(referenceOffset).toLocalDate();
        Instant midnight = day.atStartOfDay().toInstant(referenceOffset);

        long periodNanos = spec.period().toNanos();
        long elapsedNanos = Duration.between(midnight, now).toNanos();
        long k = elapsedNanos / periodNanos + 1;

        return midnight.plus(spec.period().multipliedBy(k));
    }

    public Duration timeUntil(IntervalSpec spec, Instant now) {
        Duration d = Duration.between(now, nextTrigger(spec, now));
        return d.isNegative() ? Duration.ZERO : d;
    }
}
