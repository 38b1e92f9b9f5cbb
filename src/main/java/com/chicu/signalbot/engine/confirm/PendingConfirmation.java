package com.chicu.signalbot.engine.confirm;

import com.chicu.signalbot.engine.WorkerAction;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Одноразовый билет подтверждения.
 * Единственный слот выполнения забирается CAS-ом PENDING → CLAIMED.
 */
@Getter
public class PendingConfirmation {

    enum State {
        PENDING,
        CLAIMED,
        EXPIRED
    }

    private final String id;
    /** что подтверждаем: имя воркера */
    private final String key;
    private final String initiator;
    private final Instant deadline;

    @Getter(AccessLevel.NONE)
    private final WorkerAction action;

    @Getter(AccessLevel.NONE)
    private final ConfirmationListener listener;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    PendingConfirmation(String id,
                        String key,
                        String initiator,
                        Instant deadline,
                        WorkerAction action,
                        ConfirmationListener listener) {
        this.id = id;
        this.key = key;
        this.initiator = initiator;
        this.deadline = deadline;
        this.action = action;
        this.listener = listener;
    }

    public boolean isAcknowledged() {
        return state.get() == State.CLAIMED;
    }

    public boolean isPending() {
        return state.get() == State.PENDING;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(deadline);
    }

    WorkerAction action() {
        return action;
    }

    ConfirmationListener listener() {
        return listener;
    }

    State state() {
        return state.get();
    }

    boolean claim() {
        return state.compareAndSet(State.PENDING, State.CLAIMED);
    }

    boolean expire() {
        return state.compareAndSet(State.PENDING, State.EXPIRED);
    }
}
