package com.ace.eval;

import com.ace.eval.execution.ExecutionCoordinator;
import com.ace.eval.execution.ExecutionModels.LaneStatus;
import com.ace.eval.execution.RetrySweeper;
import com.ace.eval.execution.TaskDispatcher;
import com.ace.eval.ledger.FaultLedger;
import com.ace.eval.repository.TaskOutcomeJdbcRepository;
import com.ace.eval.repository.TaskStateJdbcRepository;
import com.ace.eval.routing.EvaluatorRouter;
import com.ace.eval.task.TaskModels.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class TaskDispatcherTest {
    @Autowired
    private TaskDispatcher dispatcher;
    @Autowired
    private EvaluatorRouter router;
    @Autowired
    private TaskOutcomeJdbcRepository outcomeRepository;
    @Autowired
    private RetrySweeper sweeper;
    @Autowired
    private ExecutionCoordinator coordinator;
    @Autowired
    private TaskStateJdbcRepository stateRepository;
    @Autowired
    private FaultLedger faultLedger;

    @Test
    void failedAttemptsAreRequeuedWithBackoffUntilSuccess() throws Exception {
        String kind = id("FLAKY");
        var evaluator = StubEvaluators.Scripted.failsFirst(kind, 3);
        router.register(evaluator);
        Task task = new Task(id("t"), "learner-1", id("asg"), kind, Map.of(), "written-ace");

        dispatcher.submit(task);

        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(10)));
        TaskOutcome outcome = outcomeRepository.find(task.taskId()).orElseThrow();
        assertEquals(OutcomeStatus.SUCCEEDED, outcome.status());
        assertEquals(4, outcome.attemptCount());
        assertEquals(4, evaluator.calls());
    }

    @Test
    void blockedAudioLaneDoesNotDelayMcqTasks() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        var slowAudio = new StubEvaluators.Blocking("SLOW-AUDIO", release);
        router.register(slowAudio);
        String assignmentId = id("asg");
        try {
            dispatcher.submit(new Task(id("audio"), "learner-1", assignmentId, "SLOW-AUDIO", Map.of(), "oral-ace"));
            waitUntil(() -> slowAudio.calls() == 1);

            List<Task> mcqs = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                Task mcq = new Task(id("mcq"), "learner-1", assignmentId, "MCQ", Map.of("selected", "A", "key", "A"), "mcq-analysis");
                mcqs.add(mcq);
                dispatcher.submit(mcq);
            }

            waitUntil(() -> mcqs.stream().allMatch(t -> outcomeRepository.find(t.taskId()).isPresent()));
            assertTrue(mcqs.stream().allMatch(t -> outcomeRepository.find(t.taskId()).orElseThrow().status() == OutcomeStatus.SUCCEEDED));
            assertEquals(1, slowAudio.calls());
        } finally {
            release.countDown();
        }
        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(10)));
    }

    @Test
    void fullLaneRejectsNewWork() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        var slowAudio = new StubEvaluators.Blocking("SLOW-AUDIO", release);
        router.register(slowAudio);
        String assignmentId = id("asg");
        try {
            dispatcher.submit(new Task(id("audio"), "learner-1", assignmentId, "SLOW-AUDIO", Map.of(), "oral-ace"));
            waitUntil(() -> slowAudio.calls() == 1);
            LaneStatus audio = dispatcher.status().stream().filter(l -> l.lane().equals("audio")).findFirst().orElseThrow();

            for (int i = 0; i < audio.capacity(); i++) {
                dispatcher.submit(new Task(id("audio"), "learner-1", assignmentId, "SLOW-AUDIO", Map.of(), "oral-ace"));
            }
            Task overflow = new Task(id("audio"), "learner-1", assignmentId, "SLOW-AUDIO", Map.of(), "oral-ace");
            assertThrows(IllegalStateException.class, () -> dispatcher.submit(overflow));
        } finally {
            release.countDown();
        }
        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(20)));
    }

    @Test
    void sweepRequeuesRetryThatNoQueueHolds() throws Exception {
        String kind = id("ONCE");
        var evaluator = StubEvaluators.Scripted.failsFirst(kind, 1);
        router.register(evaluator);
        Task task = new Task(id("t"), "learner-1", id("asg"), kind, Map.of(), "written-ace");
        assertEquals(OutcomeStatus.FAILED, coordinator.process(task).orElseThrow().status());

        Thread.sleep(150);
        assertTrue(sweeper.sweep() >= 1);

        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(10)));
        TaskOutcome outcome = outcomeRepository.find(task.taskId()).orElseThrow();
        assertEquals(OutcomeStatus.SUCCEEDED, outcome.status());
        assertEquals(2, outcome.attemptCount());
    }

    @Test
    void repeatedSweepsKeepOneQueuedCopyOfARetry() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        var slowAudio = new StubEvaluators.Blocking("SLOW-AUDIO", release);
        router.register(slowAudio);
        router.register(StubEvaluators.Scripted.failsFirst("FLAKY-AUDIO", 1));
        String assignmentId = id("asg");
        Task task = new Task(id("t"), "learner-1", assignmentId, "FLAKY-AUDIO", Map.of(), "oral-ace");
        try {
            dispatcher.submit(new Task(id("audio"), "learner-1", assignmentId, "SLOW-AUDIO", Map.of(), "oral-ace"));
            waitUntil(() -> slowAudio.calls() == 1);
            assertEquals(OutcomeStatus.FAILED, coordinator.process(task).orElseThrow().status());

            Thread.sleep(150);
            sweeper.sweep();
            int queuedAfterFirstSweep = audioLane().queued();
            assertTrue(queuedAfterFirstSweep >= 1);
            for (int i = 0; i < 3; i++) {
                sweeper.sweep();
            }

            assertEquals(queuedAfterFirstSweep, audioLane().queued());
        } finally {
            release.countDown();
        }
        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(10)));
        TaskOutcome outcome = outcomeRepository.find(task.taskId()).orElseThrow();
        assertEquals(OutcomeStatus.SUCCEEDED, outcome.status());
        assertEquals(2, outcome.attemptCount());
    }

    @Test
    void sweepExpiresClaimOfVanishedWorker() throws Exception {
        router.register(StubEvaluators.Scripted.alwaysSucceeds("SLOW"));
        Task task = new Task(id("t"), "learner-1", id("asg"), "SLOW", Map.of(), "written-ace");
        stateRepository.insertPending(task, Instant.now());
        assertTrue(stateRepository.claim(task.taskId(), Instant.now()));

        Thread.sleep(400);
        assertTrue(sweeper.sweep() >= 1);

        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(10)));
        TaskOutcome outcome = outcomeRepository.find(task.taskId()).orElseThrow();
        assertEquals(OutcomeStatus.SUCCEEDED, outcome.status());
        assertEquals(2, outcome.attemptCount());
        var history = faultLedger.history(task.taskId());
        assertEquals(1, history.size());
        assertEquals(FailureType.UPSTREAM_TIMEOUT, history.get(0).failure().type());
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 10s");
            }
            Thread.sleep(20);
        }
    }

    private LaneStatus audioLane() {
        return dispatcher.status().stream().filter(l -> l.lane().equals("audio")).findFirst().orElseThrow();
    }

    private static String id(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
