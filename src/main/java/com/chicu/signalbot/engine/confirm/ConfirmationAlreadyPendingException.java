package com.chicu.signalbot.engine.confirm;

import lombok.Getter;

@Getter
public class ConfirmationAlreadyPendingException extends RuntimeException {

    private final PendingConfirmation pending;

    public ConfirmationAlreadyPendingException(PendingConfirmation pending) {
        super("confirmation for '" + pending.getKey() + "' is already pending until " + pending.getDeadline());
        this.pending = pending;
    }
}
