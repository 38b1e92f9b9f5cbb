package com.chicu.signalbot.engine;

import com.chicu.signalbot.common.enums.WorkerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Один именованный периодический воркер.
 *
 * Цикл: вычислить границу через {@link IntervalPolicy} → уснуть до неё
 * (с промежуточными пробуждениями на границах {@link ReminderLadder}) →
 * выполнить действие ровно один раз → только после этого вычислить следующую границу.
 *
 * stop() отменяет текущее ожидание сразу, но не прерывает уже идущее действие:
 * оно доработает, а цикл увидит STOPPED и не перепланирует себя.
 */
@Slf4j
public class ScheduledWorker {

    private final String name;
    private final String target;
    private final IntervalPolicy policy;
    private final IntervalSpec interval;
    private final WorkerAction action;
    private final ReminderLadder ladder;          // null → без напоминаний
    private final ReminderListener reminderListener;
    private final SchedulerService scheduler;
    private final Clock clock;

    /** Действия одного воркера никогда не пересекаются: таймер и triggerNow() идут через него. */
    private final ReentrantLock actionLock = new ReentrantLock();

    private final Object stateLock = new Object();

    // guarded by stateLock
    private WorkerState state = WorkerState.STOPPED;
    private long generation;
    private Instant nextTrigger;
    private Instant lastTrigger;
    private Duration lastRemindedAt;

    private volatile Instant lastRunAt;
    private volatile ActionResult lastResult;

    public ScheduledWorker(String name,
                           String target,
                           IntervalPolicy policy,
                           IntervalSpec interval,
                           WorkerAction action,
                           ReminderLadder ladder,
                           ReminderListener reminderListener,
                           SchedulerService scheduler,
                           Clock clock) {
        this.name = name;
        this.target = target;
        this.policy = policy;
        this.interval = interval;
        this.action = action;
        this.ladder = ladder;
        this.reminderListener = reminderListener != null ? reminderListener : ReminderListener.NONE;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public String getTarget() {
        return target;
    }

    public IntervalSpec getInterval() {
        return interval;
    }

    public boolean isRunning() {
        synchronized (stateLock) {
            return state == WorkerState.RUNNING;
        }
    }

    // ================================================================
    // START / STOP
    // ================================================================

    /**
     * STOPPED → RUNNING.
     *
     * @return false, если уже запущен или интервал выключен (только ручной режим)
     */
    public boolean start() {
        synchronized (stateLock) {
            if (interval.isDisabled()) {
                log.info("⏸ Worker '{}' is manual-only, start ignored", name);
                return false;
            }
            if (state == WorkerState.RUNNING) {
                return false;
            }
            state = WorkerState.RUNNING;
            long gen = ++generation;
            nextTrigger = null;
            scheduleNextWake(gen);
            log.info("▶ Worker '{}' started, interval={}, next={}", name, interval.label(), nextTrigger);
            return true;
        }
    }

    /**
     * RUNNING → STOPPED. Ожидание отменяется немедленно.
     *
     * @return false, если уже остановлен
     */
    public boolean stop() {
        synchronized (stateLock) {
            if (state == WorkerState.STOPPED) {
                return false;
            }
            state = WorkerState.STOPPED;
            generation++;
            nextTrigger = null;
            lastRemindedAt = null;
            scheduler.cancel(name);
        }
        log.info("🛑 Worker '{}' stopped", name);
        return true;
    }

    // ================================================================
    // STATUS
    // ================================================================
    public WorkerStatus status() {
        synchronized (stateLock) {
            Instant next = state == WorkerState.RUNNING ? nextTrigger : null;
            Duration remaining = null;
            if (next != null) {
                remaining = Duration.between(clock.instant(), next);
                if (remaining.isNegative()) remaining = Duration.ZERO;
            }
            return new WorkerStatus(name, target, state, interval, next, remaining, lastRunAt, lastResult);
        }
    }

    // ================================================================
    // MANUAL
    // ================================================================

    /**
     * Выполняет действие прямо сейчас, расписание не трогает.
     */
    public ActionResult triggerNow() {
        log.info("⚡ Worker '{}' manual trigger", name);
        actionLock.lock();
        try {
            return execute("manual");
        } finally {
            actionLock.unlock();
        }
    }

    // ================================================================
    // LOOP
    // ================================================================

    /** Вызывается под stateLock. */
    private void scheduleNextWake(long gen) {
        Instant now = clock.instant();

        if (nextTrigger == null) {
            // никогда не раньше уже отработанной границы: защищает от двойного запуска при раннем пробуждении
            Instant base = lastTrigger != null && lastTrigger.isAfter(now) ? lastTrigger : now;
            nextTrigger = policy.nextTrigger(interval, base);
            lastRemindedAt = null;
        }

        Instant trigger = nextTrigger;
        Instant wakeAt = trigger;
        boolean triggerWake = true;

        if (ladder != null) {
            Optional<Duration> boundary = ladder.nextBoundary(Duration.between(now, trigger));
            if (boundary.isPresent()) {
                wakeAt = trigger.minus(boundary.get());
                triggerWake = false;
            }
        }

        boolean fire = triggerWake;
        scheduler.scheduleOnce(name, () -> onWake(gen, trigger, fire), Duration.between(now, wakeAt));
    }

    private void onWake(long gen, Instant trigger, boolean triggerWake) {
        if (triggerWake) {
            fire(gen, trigger);
        } else {
            remind(gen, trigger);
        }
    }

    private void fire(long gen, Instant trigger) {
        actionLock.lock();
        try {
            if (!isCurrent(gen)) {
                return;
            }
            execute("timer");
        } finally {
            actionLock.unlock();
        }

        synchronized (stateLock) {
            if (lastTrigger == null || trigger.isAfter(lastTrigger)) {
                lastTrigger = trigger;
            }
            if (state != WorkerState.RUNNING || gen != generation) {
                // остановили, пока шло действие
                return;
            }
            nextTrigger = null;
            scheduleNextWake(gen);
        }
    }

    private void remind(long gen, Instant trigger) {
        Optional<ReminderLadder.Reminder> reminder;
        synchronized (stateLock) {
            if (state != WorkerState.RUNNING || gen != generation) {
                return;
            }
            Duration remaining = Duration.between(clock.instant(), trigger);
            reminder = ladder.shouldRemind(remaining, lastRemindedAt);
            if (reminder.isPresent()) {
                lastRemindedAt = remaining;
            }
        }

        reminder.ifPresent(r -> {
            log.info("🔔 Worker '{}' reminder: {} left until {}", name, r.describe(), trigger);
            try {
                reminderListener.onReminder(name, r, trigger);
            } catch (Exception e) {
                log.warn("⚠ Worker '{}' reminder delivery failed: {}", name, e.getMessage(), e);
            }
        });

        synchronized (stateLock) {
            if (state == WorkerState.RUNNING && gen == generation) {
                scheduleNextWake(gen);
            }
        }
    }

    private boolean isCurrent(long gen) {
        synchronized (stateLock) {
            return state == WorkerState.RUNNING && gen == generation;
        }
    }

    /** Вызывается под actionLock. Ошибка действия не останавливает воркер. */
    private ActionResult execute(String source) {
        ActionResult result;
        try {
            result = action.run();
            if (result == null) {
                result = ActionResult.ok("done");
            }
            log.info("✅ Worker '{}' {} run: {} {}", name, source, result.status(), result.message());
        } catch (Exception e) {
            log.error("❌ Worker '{}' {} run failed: {}", name, source, e.getMessage(), e);
            result = ActionResult.failed(e);
        }
        lastRunAt = clock.instant();
        lastResult = result;
        return result;
    }
}
