package com.chicu.signalbot.engine;

import lombok.Getter;

@Getter
public class WorkerNotConfiguredException extends RuntimeException {

    private final String workerName;

    public WorkerNotConfiguredException(String workerName) {
        super("worker '" + workerName + "' is not configured");
        this.workerName = workerName;
    }
}
