package com.chicu.signalbot.config;

import com.chicu.signalbot.chat.ChatGateway;
import com.chicu.signalbot.engine.IntervalPolicy;
import com.chicu.signalbot.engine.IntervalSpec;
import com.chicu.signalbot.engine.InvalidIntervalException;
import com.chicu.signalbot.engine.ReminderLadder;
import com.chicu.signalbot.engine.WorkerRegistry;
import com.chicu.signalbot.market.CandleProvider;
import com.chicu.signalbot.purge.PurgeAction;
import com.chicu.signalbot.purge.PurgeReminderNotifier;
import com.chicu.signalbot.command.PurgeCommand;
import com.chicu.signalbot.scan.ScanAction;
import com.chicu.signalbot.scan.ScanStrategy;
import com.chicu.signalbot.scan.StrategyCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;

/**
 * Регистрация воркеров из конфига, затем seal() и запуск.
 *
 * Ошибка конфигурации одного воркера (кривой интервал) не роняет процесс:
 * воркер регистрируется в ручном режиме.
 */
@Slf4j
@Component
public class WorkerBootstrap {

    private final WorkerRegistry registry;
    private final IntervalPolicy purgePolicy;
    private final IntervalPolicy scanPolicy;
    private final ReminderLadder ladder;
    private final StrategyCatalog catalog;
    private final CandleProvider candles;
    private final ChatGateway chat;
    private final BotProperties props;
    private final ZoneOffset referenceOffset;

    public WorkerBootstrap(WorkerRegistry registry,
                           @Qualifier("purgeIntervalPolicy") IntervalPolicy purgePolicy,
                           @Qualifier("scanIntervalPolicy") IntervalPolicy scanPolicy,
                           ReminderLadder ladder,
                           StrategyCatalog catalog,
                           CandleProvider candles,
                           ChatGateway chat,
                           BotProperties props,
                           ZoneOffset referenceOffset) {
        this.registry = registry;
        this.purgePolicy = purgePolicy;
        this.scanPolicy = scanPolicy;
        this.ladder = ladder;
        this.catalog = catalog;
        this.candles = candles;
        this.chat = chat;
        this.props = props;
        this.referenceOffset = referenceOffset;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        registerAll();
        registry.startAll();
        log.info("🚀 Workers started: {}", registry.names());
    }

    void registerAll() {
        registerPurge();
        for (ScanStrategy strategy : catalog.all()) {
            registerScan(strategy);
        }
        registry.seal();
    }

    // ================================================================
    // PURGE
    // ================================================================
    private void registerPurge() {
        String channel = props.getPurge().getChannelName();
        IntervalSpec interval = validated(PurgeCommand.WORKER, purgePolicy, props.getPurge().getIntervalHours());

        registry.register(
                PurgeCommand.WORKER,
                channel,
                purgePolicy,
                interval,
                new PurgeAction(channel, chat),
                ladder,
                new PurgeReminderNotifier(channel, chat, referenceOffset));
    }

    // ================================================================
    // SCAN
    // ================================================================
    private void registerScan(ScanStrategy strategy) {
        IntervalSpec interval;
        try {
            interval = scanPolicy.validate(strategy.getInterval().period());
        } catch (InvalidIntervalException e) {
            log.warn("⚠ Worker '{}': {}. Auto schedule disabled, manual only", strategy.getId(), e.getMessage());
            interval = IntervalSpec.DISABLED;
        }

        registry.register(
                strategy.getId(),
                strategy.getChannelName(),
                scanPolicy,
                interval,
                new ScanAction(strategy, candles, chat, props.getDiscord().getOwnerId()));
    }

    private static IntervalSpec validated(String worker, IntervalPolicy policy, String raw) {
        try {
            return policy.validate(raw);
        } catch (InvalidIntervalException e) {
            log.warn("⚠ Worker '{}': {}. Auto schedule disabled, manual only", worker, e.getMessage());
            return IntervalSpec.DISABLED;
        }
    }
}
