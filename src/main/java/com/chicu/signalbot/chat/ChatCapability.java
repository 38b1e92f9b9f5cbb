package com.chicu.signalbot.chat;

/** Права бота в канале, которые проверяются перед действиями. */
public enum ChatCapability {
    SEND_MESSAGES,
    MANAGE_MESSAGES,
    READ_HISTORY,
    ADD_REACTIONS
}
