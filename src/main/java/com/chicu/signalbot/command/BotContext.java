package com.chicu.signalbot.command;

import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.debrid.AllDebridClient;
import com.chicu.signalbot.engine.WorkerRegistry;
import com.chicu.signalbot.engine.confirm.ConfirmationGate;
import com.chicu.signalbot.scan.StrategyCatalog;
import lombok.Builder;
import lombok.Getter;

import java.time.ZoneOffset;

/**
 * Всё, что нужно обработчикам команд. Собирается один раз на старте.
 */
@Getter
@Builder
public class BotContext {

    private final WorkerRegistry registry;
    private final ConfirmationGate gate;
    private final StrategyCatalog catalog;
    private final AllDebridClient debrid;
    private final ChatGateway chat;
    private final ZoneOffset referenceOffset;
    private final String prefix;
}
