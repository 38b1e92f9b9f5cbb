package com.chicu.signalbot.engine.confirm;

import com.chicu.signalbot.engine.ActionResult;

/**
 * @param actionResult результат действия, только для EXECUTED
 */
public record ConfirmationResult(ConfirmationOutcome outcome, ActionResult actionResult) {

    public static ConfirmationResult of(ConfirmationOutcome outcome) {
        return new ConfirmationResult(outcome, null);
    }

    public static ConfirmationResult executed(ActionResult result) {
        return new ConfirmationResult(ConfirmationOutcome.EXECUTED, result);
    }
}
