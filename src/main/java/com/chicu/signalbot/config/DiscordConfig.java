package com.chicu.signalbot.config;

import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.chat.ConfirmationPrompts;
import com.chicu.signalbot.chat.OfflineChatGateway;
import com.chicu.signalbot.chat.discord.DiscordCommandListener;
import com.chicu.signalbot.chat.discord.JdaChatGateway;
import com.chicu.signalbot.command.CommandRouter;
import com.chicu.signalbot.engine.SchedulerService;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Discord поднимается только при заданном токене. Без него бот работает
 * в офлайн-режиме: REST API и воркеры живы, сообщения уходят в лог.
 */
@Slf4j
@Configuration
public class DiscordConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnExpression("!'${bot.discord.token:}'.isBlank()")
    public JDA jda(BotProperties props) {
        try {
            JDA jda = JDABuilder.createDefault(props.getDiscord().getToken())
                    .enableIntents(
                            GatewayIntent.GUILD_MESSAGES,
                            GatewayIntent.GUILD_MESSAGE_REACTIONS,
                            GatewayIntent.DIRECT_MESSAGES,
                            GatewayIntent.MESSAGE_CONTENT)
                    .build()
                    .awaitReady();
            log.info("🤖 Logged in as {}", jda.getSelfUser().getName());
            return jda;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while connecting to Discord", e);
        }
    }

    @Bean
    public ChatGateway chatGateway(ObjectProvider<JDA> jda) {
        JDA client = jda.getIfAvailable();
        if (client == null) {
            log.warn("⚠ DISCORD_TOKEN is not set, chat is offline");
            return new OfflineChatGateway();
        }
        return new JdaChatGateway(client);
    }

    @Bean
    public ConfirmationPrompts confirmationPrompts(Clock clock, BotProperties props) {
        return new ConfirmationPrompts(clock, props.getSchedule().getConfirmationWindow());
    }

    @Bean
    public DiscordCommandListener discordCommandListener(ObjectProvider<JDA> jda,
                                                         CommandRouter commandRouter,
                                                         ConfirmationPrompts confirmationPrompts,
                                                         SchedulerService schedulerService) {
        DiscordCommandListener listener =
                new DiscordCommandListener(commandRouter, confirmationPrompts, schedulerService);
        jda.ifAvailable(client -> client.addEventListener(listener));
        return listener;
    }
}
