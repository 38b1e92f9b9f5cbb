package com.chicu.signalbot.engine;

public class InvalidIntervalException extends RuntimeException {

    public InvalidIntervalException(String message) {
        super(message);
    }
}
