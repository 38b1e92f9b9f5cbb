package com.chicu.signalbot.command;

/**
 * Одно входящее сообщение-команда глазами обработчика.
 */
public interface CommandContext {

    String authorId();

    void reply(String text);

    /**
     * Отправляет запрос подтверждения с реакцией ✅ и связывает сообщение с билетом:
     * реакция на него уходит в {@link CommandRouter#onConfirmation}.
     */
    void promptConfirmation(String text, String ticketId);
}
