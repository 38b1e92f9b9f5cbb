package com.chicu.signalbot.engine;

public class DisabledIntervalException extends RuntimeException {

    public DisabledIntervalException() {
        super("auto scheduling is disabled for this interval");
    }
}
