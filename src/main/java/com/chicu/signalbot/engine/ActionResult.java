package com.chicu.signalbot.engine;

/**
 * Итог одного запуска действия воркера.
 */
public record ActionResult(Status status, String message) {

    public enum Status {
        OK,
        SKIPPED,
        FAILED
    }

    public static ActionResult ok(String message) {
        return new ActionResult(Status.OK, message);
    }

    public static ActionResult skipped(String reason) {
        return new ActionResult(Status.SKIPPED, reason);
    }

    public static ActionResult failed(String reason) {
        return new ActionResult(Status.FAILED, reason);
    }

    public static ActionResult failed(Throwable t) {
        String m = t.getMessage();
        return failed(m != null && !m.isBlank() ? m : t.getClass().getSimpleName());
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
