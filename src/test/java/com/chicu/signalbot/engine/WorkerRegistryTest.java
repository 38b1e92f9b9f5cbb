package com.chicu.signalbot.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {

    private final IntervalPolicy policy = IntervalPolicy.hourly(IntervalPolicy.PDT);
    private final WorkerAction noop = () -> ActionResult.ok("noop");

    private ManualScheduler scheduler;
    private WorkerRegistry registry;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        registry = new WorkerRegistry(scheduler, new MutableClock(Instant.parse("2026-10-18T08:00:00Z")));
    }

    @Test
    void blankTarget_shouldNotRegister_andLookupFailsAsNotConfigured() {
        assertTrue(registry.register("day", "", policy, IntervalSpec.ofHours(1), noop).isEmpty());
        assertTrue(registry.register("swing", null, policy, IntervalSpec.ofHours(1), noop).isEmpty());

        WorkerNotConfiguredException e = assertThrows(WorkerNotConfiguredException.class, () -> registry.get("day"));
        assertEquals("day", e.getWorkerName());
        assertTrue(registry.all().isEmpty(), "не настроенный воркер не попадает в all()");
    }

    @Test
    void all_shouldKeepRegistrationOrder() {
        registry.register("purge", "requests", policy, IntervalSpec.ofHours(6), noop);
        registry.register("long", "long-term-trade", policy, IntervalSpec.ofHours(12), noop);
        registry.register("day", "day-trade", policy, IntervalSpec.ofHours(1), noop);

        List<String> names = registry.all().stream().map(WorkerStatus::name).toList();
        assertEquals(List.of("purge", "long", "day"), names);
        assertEquals(names, registry.names());
    }

    @Test
    void get_shouldBeCaseInsensitive() {
        registry.register("Swing", "swing-trade", policy, IntervalSpec.ofHours(4), noop);

        assertEquals("swing", registry.get("SWING").getName());
        assertTrue(registry.contains(" swing "));
        assertEquals("swing-trade", registry.get("swing").getTarget());
    }

    @Test
    void duplicateName_shouldBeRejected() {
        registry.register("day", "day-trade", policy, IntervalSpec.ofHours(1), noop);
        assertThrows(IllegalStateException.class,
                () -> registry.register("DAY", "other", policy, IntervalSpec.ofHours(1), noop));
    }

    @Test
    void afterSeal_registrationShouldFail() {
        registry.seal();
        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class,
                () -> registry.register("day", "day-trade", policy, IntervalSpec.ofHours(1), noop));
    }

    @Test
    void startAll_shouldSkipManualOnlyWorkers() {
        registry.register("purge", "requests", policy, IntervalSpec.DISABLED, noop);
        registry.register("day", "day-trade", policy, IntervalSpec.ofHours(1), noop);

        registry.startAll();

        assertFalse(registry.get("purge").isRunning());
        assertTrue(registry.get("day").isRunning());
        assertFalse(scheduler.isPending("purge"));
        assertTrue(scheduler.isPending("day"));
    }

    @Test
    void shutdown_shouldStopEverything() {
        registry.register("day", "day-trade", policy, IntervalSpec.ofHours(1), noop);
        registry.register("swing", "swing-trade", policy, IntervalSpec.ofHours(4), noop);
        registry.startAll();

        registry.shutdown();

        assertTrue(registry.all().stream().noneMatch(WorkerStatus::isRunning));
        assertFalse(scheduler.isPending("day"));
        assertFalse(scheduler.isPending("swing"));
    }

    @Test
    void find_unknownOrBlank_shouldBeEmpty() {
        assertTrue(registry.find("nope").isEmpty());
        assertTrue(registry.find(" ").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }
}
