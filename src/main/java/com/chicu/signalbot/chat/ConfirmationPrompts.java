package com.chicu.signalbot.chat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * id сообщения-запроса → id билета подтверждения.
 * Привязка живёт ещё одно окно после дедлайна, чтобы поздняя реакция получила ответ "expired".
 */
public class ConfirmationPrompts {

    private record Binding(String ticketId, Instant forgetAt) {
    }

    private final Clock clock;
    private final Duration window;
    private final Map<String, Binding> byMessage = new ConcurrentHashMap<>();

    public ConfirmationPrompts(Clock clock, Duration window) {
        this.clock = clock;
        this.window = window;
    }

    public void bind(String messageId, String ticketId) {
        Instant now = clock.instant();
        byMessage.values().removeIf(b -> !now.isBefore(b.forgetAt()));
        byMessage.put(messageId, new Binding(ticketId, now.plus(window.multipliedBy(2))));
    }

    public Optional<String> ticketFor(String messageId) {
        Binding b = messageId != null ? byMessage.get(messageId) : null;
        return b == null ? Optional.empty() : Optional.of(b.ticketId());
    }

    public int size() {
        return byMessage.size();
    }
}
