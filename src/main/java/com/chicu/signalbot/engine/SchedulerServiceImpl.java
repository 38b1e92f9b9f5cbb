package com.chicu.signalbot.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
public class SchedulerServiceImpl implements SchedulerService {

    /**
     * Пул потоков для воркеров и дедлайнов подтверждений.
     * daemon=true, чтобы не блокировать завершение приложения.
     */
    private final ScheduledExecutorService executor;

    private final Clock clock;

    /** key → текущее ожидание; запись снимается, когда задача отработала или отменена */
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    /** Одно ожидание: future + когда поставлено. */
    private static final class Slot {
        private final Instant scheduledAt;
        private volatile ScheduledFuture<?> future;

        private Slot(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
        }
    }

    public SchedulerServiceImpl(int poolSize, Clock clock) {
        this.clock = clock;
        this.executor = Executors.newScheduledThreadPool(
                Math.max(1, poolSize),
                r -> {
                    Thread t = new Thread(r);
                    t.setDaemon(true);
                    t.setName("WorkerScheduler-" + t.getId());
                    return t;
                }
        );
    }

    // ==============================================================
    // ▶️ SCHEDULE
    // ==============================================================
    @Override
    public synchronized ScheduledFuture<?> scheduleOnce(String key, Runnable task, Duration delay) {
        long delayMs = delay == null || delay.isNegative() ? 0 : delay.toMillis();

        Slot slot = new Slot(clock.instant());
        Slot previous = slots.put(key, slot);
        if (previous != null && previous.future != null) {
            previous.future.cancel(false);
        }

        slot.future = executor.schedule(() -> {
            try {
                task.run();
            } catch (Throwable t) {
                // исключение внутри executor иначе тихо умрёт вместе с future
                log.error("❌ Scheduler: task '{}' failed: {}", key, t.getMessage(), t);
            } finally {
                // только своя запись: задача могла уже поставить себе замену
                slots.remove(key, slot);
            }
        }, delayMs, TimeUnit.MILLISECONDS);

        log.debug("⏱ Scheduler: '{}' wakes in {} ms", key, delayMs);
        return slot.future;
    }

    // ==============================================================
    // ⏹ CANCEL
    // ==============================================================
    @Override
    public synchronized void cancel(String key) {
        Slot slot = slots.remove(key);

        if (slot != null && slot.future != null) {
            slot.future.cancel(false);
            log.debug("🛑 Scheduler: cancelled '{}'", key);
        }
    }

    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    @Override
    public boolean isPending(String key) {
        Slot slot = slots.get(key);
        return slot != null && slot.future != null && !slot.future.isCancelled() && !slot.future.isDone();
    }

    @Override
    public Optional<Instant> getScheduledAt(String key) {
        Slot slot = slots.get(key);
        return slot == null ? Optional.empty() : Optional.of(slot.scheduledAt);
    }

    /** Сколько ключей сейчас отслеживается. */
    public int size() {
        return slots.size();
    }

    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        log.info("💤 SchedulerServiceImpl shutting down…");
        executor.shutdownNow();
    }
}
