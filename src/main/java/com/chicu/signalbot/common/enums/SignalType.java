package com.chicu.signalbot.common.enums;

public enum SignalType {
    BUY,
    SELL
}
