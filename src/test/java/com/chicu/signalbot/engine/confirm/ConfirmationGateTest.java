package com.chicu.signalbot.engine.confirm;

import com.chicu.signalbot.engine.ActionResult;
import com.chicu.signalbot.engine.ManualScheduler;
import com.chicu.signalbot.engine.MutableClock;
import com.chicu.signalbot.engine.SchedulerServiceImpl;
import com.chicu.signalbot.engine.WorkerAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConfirmationGateTest {

    private static final Duration WINDOW = Duration.ofSeconds(15);

    private MutableClock clock;
    private ManualScheduler scheduler;
    private ConfirmationGate gate;
    private AtomicInteger runs;
    private WorkerAction action;
    private List<PendingConfirmation> cancelled;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-18T12:00:00Z"));
        scheduler = new ManualScheduler();
        gate = new ConfirmationGate(scheduler, clock, WINDOW);
        runs = new AtomicInteger();
        action = () -> {
            runs.incrementAndGet();
            return ActionResult.ok("purged");
        };
        cancelled = new ArrayList<>();
    }

    private PendingConfirmation request(String initiator) {
        return gate.request("purge", initiator, action, cancelled::add);
    }

    @Test
    void request_shouldIssueTicketWithDeadline() {
        PendingConfirmation t = request("alice");

        assertEquals("purge", t.getKey());
        assertEquals("alice", t.getInitiator());
        assertEquals(clock.instant().plus(WINDOW), t.getDeadline());
        assertTrue(t.isPending());
        assertTrue(scheduler.isPending("confirm:" + t.getId()), "дедлайн стартует сразу");
        assertEquals(WINDOW, scheduler.delayOf("confirm:" + t.getId()));
    }

    @Test
    void acknowledge_byInitiatorInWindow_shouldExecuteOnce() {
        PendingConfirmation t = request("alice");
        clock.advance(Duration.ofSeconds(5));

        ConfirmationResult r = gate.acknowledge(t.getId(), "alice");

        assertEquals(ConfirmationOutcome.EXECUTED, r.outcome());
        assertEquals("purged", r.actionResult().message());
        assertEquals(1, runs.get());
        assertTrue(t.isAcknowledged());
    }

    @Test
    void secondAcknowledge_shouldBeAlreadyConsumed() {
        PendingConfirmation t = request("alice");
        gate.acknowledge(t.getId(), "alice");

        ConfirmationResult again = gate.acknowledge(t.getId(), "alice");

        assertEquals(ConfirmationOutcome.ALREADY_CONSUMED, again.outcome());
        assertTrue(again.outcome().isIgnored());
        assertEquals(1, runs.get());
    }

    @Test
    void wrongResponder_shouldBeIgnored_andTicketStaysPending() {
        PendingConfirmation t = request("alice");

        assertEquals(ConfirmationOutcome.WRONG_RESPONDER, gate.acknowledge(t.getId(), "mallory").outcome());
        assertEquals(0, runs.get());
        assertTrue(t.isPending());

        assertEquals(ConfirmationOutcome.EXECUTED, gate.acknowledge(t.getId(), "alice").outcome());
    }

    @Test
    void acknowledgeAfterFifteenSeconds_shouldExpire_andNeverRunAction() {
        PendingConfirmation t = request("alice");
        clock.advance(Duration.ofSeconds(15));

        ConfirmationResult r = gate.acknowledge(t.getId(), "alice");

        assertEquals(ConfirmationOutcome.EXPIRED, r.outcome());
        assertEquals(0, runs.get());
        assertEquals(1, cancelled.size(), "инициатор получает уведомление об отмене");
        assertFalse(scheduler.isPending("confirm:" + t.getId()));
    }

    @Test
    void deadlineTask_shouldCancelAndNotify() {
        PendingConfirmation t = request("alice");

        clock.advance(WINDOW);
        scheduler.runPending("confirm:" + t.getId());

        assertEquals(List.of(t), cancelled);
        assertEquals(ConfirmationOutcome.EXPIRED, gate.acknowledge(t.getId(), "alice").outcome());
        assertEquals(0, runs.get());
        assertTrue(gate.findPending("purge", "alice").isEmpty());
    }

    @Test
    void deadlineAfterAcknowledge_shouldNotNotify() {
        PendingConfirmation t = request("alice");
        gate.acknowledge(t.getId(), "alice");

        scheduler.runPending("confirm:" + t.getId());

        assertTrue(cancelled.isEmpty());
        assertEquals(1, runs.get());
    }

    @Test
    void unknownTicket_shouldBeExpired() {
        assertEquals(ConfirmationOutcome.EXPIRED, gate.acknowledge("nope", "alice").outcome());
        assertEquals(ConfirmationOutcome.EXPIRED, gate.acknowledge(null, "alice").outcome());
    }

    @Test
    void secondRequestWhilePending_shouldBeRejected() {
        PendingConfirmation first = request("alice");

        ConfirmationAlreadyPendingException e =
                assertThrows(ConfirmationAlreadyPendingException.class, () -> request("alice"));
        assertSame(first, e.getPending());

        // другой инициатор: своя пара
        assertNotNull(request("bob"));
    }

    @Test
    void requestAfterPreviousExpired_shouldIssueNewTicket() {
        PendingConfirmation first = request("alice");
        clock.advance(WINDOW.plusSeconds(1));

        PendingConfirmation second = request("alice");

        assertNotEquals(first.getId(), second.getId());
        assertEquals(1, cancelled.size(), "просроченный билет закрыт с уведомлением");
        assertEquals(ConfirmationOutcome.EXECUTED, gate.acknowledge(second.getId(), "alice").outcome());
    }

    @Test
    void failingAction_shouldStillBeExecutedOutcome_withFailedResult() {
        PendingConfirmation t = gate.request("purge", "alice", () -> {
            throw new IllegalStateException("no permission");
        }, null);

        ConfirmationResult r = gate.acknowledge(t.getId(), "alice");

        assertEquals(ConfirmationOutcome.EXECUTED, r.outcome());
        assertTrue(r.actionResult().isFailed());
        assertEquals("no permission", r.actionResult().message());
    }

    @Test
    void concurrentAcknowledges_shouldExecuteExactlyOnce() throws Exception {
        for (int round = 0; round < 50; round++) {
            runs.set(0);
            PendingConfirmation t = gate.request("purge:" + round, "alice", action, null);

            CyclicBarrier barrier = new CyclicBarrier(2);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<ConfirmationOutcome> a = pool.submit(() -> {
                    barrier.await();
                    return gate.acknowledge(t.getId(), "alice").outcome();
                });
                Future<ConfirmationOutcome> b = pool.submit(() -> {
                    barrier.await();
                    return gate.acknowledge(t.getId(), "alice").outcome();
                });

                List<ConfirmationOutcome> outcomes = List.of(a.get(5, TimeUnit.SECONDS), b.get(5, TimeUnit.SECONDS));
                assertEquals(1, outcomes.stream().filter(o -> o == ConfirmationOutcome.EXECUTED).count());
                assertEquals(1, outcomes.stream().filter(o -> o == ConfirmationOutcome.ALREADY_CONSUMED).count());
                assertEquals(1, runs.get());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    void realScheduler_shouldNotifyOnTimeout() throws Exception {
        SchedulerServiceImpl real = new SchedulerServiceImpl(1, Clock.systemUTC());
        try {
            ConfirmationGate fast = new ConfirmationGate(real, Clock.systemUTC(), Duration.ofMillis(100));
            CountDownLatch notified = new CountDownLatch(1);

            PendingConfirmation t = fast.request("purge", "alice", action, ticket -> notified.countDown());

            assertTrue(notified.await(5, TimeUnit.SECONDS), "отмена по дедлайну должна прийти");
            assertEquals(ConfirmationOutcome.EXPIRED, fast.acknowledge(t.getId(), "alice").outcome());
            assertEquals(0, runs.get());
        } finally {
            real.shutdown();
        }
    }

    @Test
    void realScheduler_shouldForgetDeadlineAfterConfirmation() throws Exception {
        SchedulerServiceImpl real = new SchedulerServiceImpl(1, Clock.systemUTC());
        try {
            ConfirmationGate fast = new ConfirmationGate(real, Clock.systemUTC(), Duration.ofMillis(100));

            PendingConfirmation t = fast.request("purge", "alice", action, null);
            assertEquals(ConfirmationOutcome.EXECUTED, fast.acknowledge(t.getId(), "alice").outcome());

            long until = System.currentTimeMillis() + 5_000;
            while (real.size() > 0 && System.currentTimeMillis() < until) {
                Thread.sleep(20);
            }

            assertEquals(0, real.size(), "после дедлайна планировщик ничего не держит");
            assertTrue(real.getScheduledAt("confirm:" + t.getId()).isEmpty());
            assertTrue(fast.findPending("purge", "alice").isEmpty());
            assertEquals(1, runs.get());
        } finally {
            real.shutdown();
        }
    }

    @Test
    void constructor_shouldRejectEmptyWindow() {
        assertThrows(IllegalArgumentException.class, () -> new ConfirmationGate(scheduler, clock, Duration.ZERO));
    }
}
