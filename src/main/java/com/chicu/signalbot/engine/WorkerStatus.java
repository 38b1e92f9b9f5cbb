package com.chicu.signalbot.engine;

import com.chicu.signalbot.common.enums.WorkerState;

import java.time.Duration;
import java.time.Instant;

/**
 * Снимок состояния воркера для команд статуса и REST.
 * nextTrigger / timeRemaining = null, если воркер остановлен или работает только вручную.
 */
public record WorkerStatus(
        String name,
        String target,
        WorkerState state,
        IntervalSpec interval,
        Instant nextTrigger,
        Duration timeRemaining,
        Instant lastRunAt,
        ActionResult lastResult
) {

    public boolean isRunning() {
        return state == WorkerState.RUNNING;
    }

    public boolean isManualOnly() {
        return interval.isDisabled();
    }
}
