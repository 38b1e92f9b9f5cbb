package com.chicu.signalbot.engine.confirm;

/** Чем закончилась попытка подтверждения. */
public enum ConfirmationOutcome {
    /** Первое подтверждение в окне: действие выполнено. */
    EXECUTED,
    /** Подтвердил не тот, кто запросил; билет остаётся в ожидании. */
    WRONG_RESPONDER,
    /** Действие уже забрано предыдущим подтверждением. */
    ALREADY_CONSUMED,
    /** Окно истекло (или билет неизвестен). */
    EXPIRED;

    public boolean isIgnored() {
        return this == WRONG_RESPONDER || this == ALREADY_CONSUMED;
    }
}
