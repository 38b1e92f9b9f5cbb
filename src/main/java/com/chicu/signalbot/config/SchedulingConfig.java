package com.chicu.signalbot.config;

import com.chicu.signalbot.engine.IntervalPolicy;
import com.chicu.signalbot.engine.ReminderLadder;
import com.chicu.signalbot.engine.SchedulerService;
import com.chicu.signalbot.engine.SchedulerServiceImpl;
import com.chicu.signalbot.engine.WorkerRegistry;
import com.chicu.signalbot.engine.confirm.ConfirmationGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

@Slf4j
@Configuration
public class SchedulingConfig {

    /** Шаги сканеров: все делят сутки. */
    static final Duration[] SCAN_PERIODS = {
            Duration.ZERO,
            Duration.ofMinutes(5), Duration.ofMinutes(15), Duration.ofMinutes(30),
            Duration.ofHours(1), Duration.ofHours(2), Duration.ofHours(4),
            Duration.ofHours(6), Duration.ofHours(12), Duration.ofHours(24)
    };

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneOffset referenceOffset(BotProperties props) {
        ZoneOffset offset = ZoneOffset.of(props.getSchedule().getReferenceOffset());
        log.info("🕒 Reference offset {}", offset.getId());
        return offset;
    }

    @Bean
    public SchedulerService schedulerService(BotProperties props, Clock clock) {
        return new SchedulerServiceImpl(props.getSchedule().getPoolSize(), clock);
    }

    @Bean
    public WorkerRegistry workerRegistry(SchedulerService schedulerService, Clock clock) {
        return new WorkerRegistry(schedulerService, clock);
    }

    @Bean
    public ConfirmationGate confirmationGate(SchedulerService schedulerService, Clock clock, BotProperties props) {
        return new ConfirmationGate(schedulerService, clock, props.getSchedule().getConfirmationWindow());
    }

    @Bean
    public ReminderLadder reminderLadder(BotProperties props) {
        return new ReminderLadder(props.getSchedule().getReminderTolerance());
    }

    @Bean
    public IntervalPolicy purgeIntervalPolicy(ZoneOffset referenceOffset) {
        return IntervalPolicy.hourly(referenceOffset);
    }

    @Bean
    public IntervalPolicy scanIntervalPolicy(ZoneOffset referenceOffset) {
        return IntervalPolicy.of(referenceOffset, SCAN_PERIODS);
    }
}
