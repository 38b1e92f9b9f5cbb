package com.chicu.signalbot.debrid;

/**
 * Итог проверки ключа AllDebrid.
 */
public record DebridAccountStatus(
        Kind kind,
        String username,
        boolean premium,
        int httpStatus,
        String message
) {

    public enum Kind {
        OK,
        NOT_CONFIGURED,
        API_ERROR,
        UNAUTHORIZED,
        RATE_LIMITED,
        HTTP_ERROR,
        CONNECTION_ERROR
    }

    public static DebridAccountStatus ok(String username, boolean premium) {
        return new DebridAccountStatus(Kind.OK, username, premium, 200, null);
    }

    public static DebridAccountStatus failure(Kind kind, int httpStatus, String message) {
        return new DebridAccountStatus(kind, null, false, httpStatus, message);
    }
}
