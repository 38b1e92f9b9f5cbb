package com.chicu.signalbot.engine.confirm;

/**
 * Уведомление инициатора, что билет истёк без подтверждения.
 * Молча терять отмену нельзя.
 */
@FunctionalInterface
public interface ConfirmationListener {

    void onCancelled(PendingConfirmation ticket);
}
