package com.chicu.signalbot.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Все воркеры процесса по имени (purge, day, swing, long).
 *
 * Регистрация: только на старте, до {@link #seal()}. После этого карта
 * только читается, поэтому блокировки не нужны.
 * Воркер с пустой целью (каналом) не регистрируется вовсе: "не настроен" ≠ "остановлен".
 */
@Slf4j
public class WorkerRegistry {

    private final SchedulerService scheduler;
    private final Clock clock;

    private final Map<String, ScheduledWorker> workers = new LinkedHashMap<>();

    private volatile boolean sealed;

    public WorkerRegistry(SchedulerService scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // ================================================================
    // REGISTER
    // ================================================================

    public Optional<ScheduledWorker> register(String name,
                                              String target,
                                              IntervalPolicy policy,
                                              IntervalSpec interval,
                                              WorkerAction action) {
        return register(name, target, policy, interval, action, null, ReminderListener.NONE);
    }

    /**
     * @param target канал/ресурс воркера; пустой → воркер не настроен
     * @return пусто, если воркер не настроен
     */
    public synchronized Optional<ScheduledWorker> register(String name,
                                                           String target,
                                                           IntervalPolicy policy,
                                                           IntervalSpec interval,
                                                           WorkerAction action,
                                                           ReminderLadder ladder,
                                                           ReminderListener reminderListener) {
        if (sealed) {
            throw new IllegalStateException("registry is sealed, restart to add worker '" + name + "'");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("worker name is required");
        }
        if (target == null || target.isBlank()) {
            log.info("⏭ Worker '{}' skipped: no target configured", name);
            return Optional.empty();
        }

        String key = key(name);
        if (workers.containsKey(key)) {
            throw new IllegalStateException("worker '" + name + "' is already registered");
        }

        ScheduledWorker worker = new ScheduledWorker(
                key, target.trim(), policy, interval, action, ladder, reminderListener, scheduler, clock);
        workers.put(key, worker);

        log.info("✅ Registered worker '{}' → '{}' (interval={})", key, target, interval.label());
        return Optional.of(worker);
    }

    /** Конец регистрации. */
    public synchronized void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    // ================================================================
    // QUERY
    // ================================================================

    public ScheduledWorker get(String name) {
        return find(name).orElseThrow(() -> new WorkerNotConfiguredException(name));
    }

    public Optional<ScheduledWorker> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(workers.get(key(name)));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /** Статусы в порядке регистрации. */
    public List<WorkerStatus> all() {
        List<WorkerStatus> out = new ArrayList<>(workers.size());
        for (ScheduledWorker w : workers.values()) {
            out.add(w.status());
        }
        return Collections.unmodifiableList(out);
    }

    public List<String> names() {
        return List.copyOf(workers.keySet());
    }

    // ================================================================
    // LIFECYCLE
    // ================================================================

    /** Запускает всех, у кого есть авто-интервал. */
    public void startAll() {
        for (ScheduledWorker w : workers.values()) {
            w.start();
        }
    }

    @PreDestroy
    public void shutdown() {
        for (ScheduledWorker w : workers.values()) {
            w.stop();
        }
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
