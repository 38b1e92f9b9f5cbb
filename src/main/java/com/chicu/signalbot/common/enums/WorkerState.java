package com.chicu.signalbot.common.enums;

public enum WorkerState {
    STOPPED,
    RUNNING
}
