package com.chicu.signalbot.engine.confirm;

import com.chicu.signalbot.engine.ActionResult;
import com.chicu.signalbot.engine.SchedulerService;
import com.chicu.signalbot.engine.WorkerAction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Короткое одноразовое рукопожатие перед ручным действием.
 *
 *  - request(): билет с окном подтверждения, дедлайн стартует сразу
 *  - acknowledge(): первое подтверждение инициатора в окне выполняет действие ровно один раз
 *  - по дедлайну билет сам отменяется и инициатор получает уведомление
 *
 * Повторный запрос для той же пары (key, initiator), пока первый ждёт, отклоняется.
 */
@Slf4j
public class ConfirmationGate {

    private static final String TASK_PREFIX = "confirm:";

    private final SchedulerService scheduler;
    private final Clock clock;
    private final Duration window;

    /** id → билет. Забранные билеты живут до дедлайна, чтобы опоздавшие получили ALREADY_CONSUMED. */
    private final Map<String, PendingConfirmation> tickets = new ConcurrentHashMap<>();

    /** key|initiator → id ожидающего билета */
    private final Map<String, String> pendingByPair = new ConcurrentHashMap<>();

    public ConfirmationGate(SchedulerService scheduler, Clock clock, Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("confirmation window must be > 0");
        }
        this.scheduler = scheduler;
        this.clock = clock;
        this.window = window;
    }

    public Duration getWindow() {
        return window;
    }

    // ================================================================
    // REQUEST
    // ================================================================
    public synchronized PendingConfirmation request(String key,
                                                    String initiator,
                                                    WorkerAction action,
                                                    ConfirmationListener listener) {
        String pair = pair(key, initiator);

        String existingId = pendingByPair.get(pair);
        if (existingId != null) {
            PendingConfirmation existing = tickets.get(existingId);
            if (existing != null && existing.isPending()) {
                if (!existing.isExpiredAt(clock.instant())) {
                    throw new ConfirmationAlreadyPendingException(existing);
                }
                expire(existing);
            }
            pendingByPair.remove(pair, existingId);
        }

        String id = UUID.randomUUID().toString().replace("-", "");
        Instant deadline = clock.instant().plus(window);

        PendingConfirmation ticket = new PendingConfirmation(id, key, initiator, deadline, action, listener);
        tickets.put(id, ticket);
        pendingByPair.put(pair, id);

        scheduler.scheduleOnce(TASK_PREFIX + id, () -> onDeadline(id), window);

        log.info("❓ Confirmation {} requested: key={} initiator={} deadline={}", id, key, initiator, deadline);
        return ticket;
    }

    // ================================================================
    // ACKNOWLEDGE
    // ================================================================
    public ConfirmationResult acknowledge(String ticketId, String responder) {
        PendingConfirmation ticket = ticketId != null ? tickets.get(ticketId) : null;
        if (ticket == null) {
            return ConfirmationResult.of(ConfirmationOutcome.EXPIRED);
        }

        if (ticket.state() == PendingConfirmation.State.CLAIMED) {
            return ConfirmationResult.of(ConfirmationOutcome.ALREADY_CONSUMED);
        }
        if (ticket.isExpiredAt(clock.instant())) {
            expire(ticket);
            return ConfirmationResult.of(ConfirmationOutcome.EXPIRED);
        }
        if (!ticket.getInitiator().equals(responder)) {
            log.debug("⏭ Confirmation {} ignored: responder {} is not initiator", ticketId, responder);
            return ConfirmationResult.of(ConfirmationOutcome.WRONG_RESPONDER);
        }

        if (!ticket.claim()) {
            // проиграли гонку: другой подтвердил или дедлайн успел раньше
            return ConfirmationResult.of(ticket.state() == PendingConfirmation.State.CLAIMED
                    ? ConfirmationOutcome.ALREADY_CONSUMED
                    : ConfirmationOutcome.EXPIRED);
        }

        pendingByPair.remove(pair(ticket.getKey(), ticket.getInitiator()), ticketId);

        log.info("✅ Confirmation {} accepted by {}", ticketId, responder);
        ActionResult result;
        try {
            result = ticket.action().run();
            if (result == null) {
                result = ActionResult.ok("done");
            }
        } catch (Exception e) {
            log.error("❌ Confirmed action '{}' failed: {}", ticket.getKey(), e.getMessage(), e);
            result = ActionResult.failed(e);
        }
        return ConfirmationResult.executed(result);
    }

    // ================================================================
    // QUERY
    // ================================================================
    public Optional<PendingConfirmation> findPending(String key, String initiator) {
        String id = pendingByPair.get(pair(key, initiator));
        if (id == null) return Optional.empty();
        PendingConfirmation t = tickets.get(id);
        return t != null && t.isPending() ? Optional.of(t) : Optional.empty();
    }

    // ================================================================
    // TIMEOUT
    // ================================================================
    private void onDeadline(String id) {
        PendingConfirmation ticket = tickets.remove(id);
        if (ticket != null) {
            expire(ticket);
        }
    }

    private void expire(PendingConfirmation ticket) {
        if (!ticket.expire()) {
            return;
        }
        pendingByPair.remove(pair(ticket.getKey(), ticket.getInitiator()), ticket.getId());
        scheduler.cancel(TASK_PREFIX + ticket.getId());
        tickets.remove(ticket.getId());

        log.info("⌛ Confirmation {} for '{}' expired", ticket.getId(), ticket.getKey());
        if (ticket.listener() == null) {
            return;
        }
        try {
            ticket.listener().onCancelled(ticket);
        } catch (Exception e) {
            log.warn("⚠ Cancel notification for {} failed: {}", ticket.getId(), e.getMessage(), e);
        }
    }

    private static String pair(String key, String initiator) {
        return key + "|" + initiator;
    }
}
