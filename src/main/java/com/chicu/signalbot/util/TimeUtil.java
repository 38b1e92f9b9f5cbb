package com.chicu.signalbot.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class TimeUtil {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /** "2026-10-18 06:00 (-07:00)" */
    public static String format(Instant instant, ZoneOffset offset) {
        if (instant == null) return "—";
        return TIME.format(instant.atOffset(offset)) + " (" + offset.getId() + ")";
    }

    /** "5h 12m", "14m", "<1m" */
    public static String formatDuration(Duration d) {
        if (d == null) return "—";
        long minutes = d.toMinutes();
        if (minutes < 1) return "<1m";
        long h = minutes / 60;
        long m = minutes % 60;
        if (h == 0) return m + "m";
        return m == 0 ? h + "h" : h + "h " + m + "m";
    }
}
