package com.chicu.signalbot.config;

import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.command.BotContext;
import com.chicu.signalbot.command.CommandRouter;
import com.chicu.signalbot.command.CryptoCommand;
import com.chicu.signalbot.command.DebridCommand;
import com.chicu.signalbot.command.PurgeCommand;
import com.chicu.signalbot.debrid.AllDebridClient;
import com.chicu.signalbot.engine.WorkerRegistry;
import com.chicu.signalbot.engine.confirm.ConfirmationGate;
import com.chicu.signalbot.scan.StrategyCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneOffset;
import java.util.List;

@Configuration
public class CommandConfig {

    @Bean
    public BotContext botContext(WorkerRegistry workerRegistry,
                                 ConfirmationGate confirmationGate,
                                 StrategyCatalog strategyCatalog,
                                 AllDebridClient allDebridClient,
                                 ChatGateway chatGateway,
                                 ZoneOffset referenceOffset,
                                 BotProperties props) {
        return BotContext.builder()
                .registry(workerRegistry)
                .gate(confirmationGate)
                .catalog(strategyCatalog)
                .debrid(allDebridClient)
                .chat(chatGateway)
                .referenceOffset(referenceOffset)
                .prefix(props.getDiscord().getPrefix())
                .build();
    }

    @Bean
    public CommandRouter commandRouter(BotContext botContext) {
        return new CommandRouter(botContext, List.of(
                new PurgeCommand(botContext),
                new CryptoCommand(botContext),
                new DebridCommand(botContext)
        ));
    }
}
