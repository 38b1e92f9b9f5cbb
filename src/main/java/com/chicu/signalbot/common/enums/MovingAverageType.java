package com.chicu.signalbot.common.enums;

public enum MovingAverageType {
    EMA,
    SMA
}
