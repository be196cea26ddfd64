package com.ace.eval.execution;

import com.ace.eval.config.AceProperties;
import com.ace.eval.execution.ExecutionModels.LaneStatus;
import com.ace.eval.metrics.EvaluationMetrics;
import com.ace.eval.task.TaskModels.OutcomeStatus;
import com.ace.eval.task.TaskModels.Task;
import com.ace.eval.task.TaskModels.TaskOutcome;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Work queue in front of the coordinator. Each lane owns a delay queue and a fixed set of workers;
 * a retry is re-queued on its own lane and becomes visible when its backoff expires.
 */
@Service
public class TaskDispatcher {
    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);
    private static final long POLL_MILLIS = 200;

    private final ExecutionCoordinator coordinator;
    private final AceProperties properties;
    private final EvaluationMetrics metrics;
    private final Clock clock;
    private final Map<String, Lane> lanes = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean running;

    public TaskDispatcher(ExecutionCoordinator coordinator, AceProperties properties, EvaluationMetrics metrics, Clock clock) {
        this.coordinator = coordinator;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        running = true;
        properties.lanes().forEach((name, config) -> {
            Lane lane = new Lane(name, config.getWorkers(), config.getCapacity());
            for (int i = 0; i < config.getWorkers(); i++) {
                lane.workers.submit(() -> runWorker(lane));
            }
            lanes.put(name, lane);
            log.info("Lane {} started with {} worker(s), capacity {}, kinds {}", name, config.getWorkers(),
                    config.getCapacity(), config.getKinds());
        });
    }

    /**
     * Accepts a task for evaluation.
     *
     * @throws IllegalStateException when the task's lane is at capacity
     */
    public void submit(Task task) {
        Lane lane = laneFor(task);
        if (!lane.permits.tryAcquire()) {
            metrics.recordRejected(lane.name);
            throw new IllegalStateException("Lane " + lane.name + " is full (" + lane.capacity + " queued)");
        }
        try {
            coordinator.accept(task);
        } catch (RuntimeException e) {
            lane.permits.release();
            throw e;
        }
        if (!lane.queued.add(task.taskId())) {
            lane.permits.release();
            log.debug("Task {} is already queued on lane {}", task.taskId(), lane.name);
            return;
        }
        lane.queue.add(new QueuedTask(task, clock.millis(), sequence.incrementAndGet(), true));
    }

    /**
     * Re-queues an accepted task; it bypasses the capacity check because it already holds a place in the system.
     *
     * @return false when the task already waits in its lane's queue
     */
    public boolean schedule(Task task, Instant visibleAt) {
        Lane lane = laneFor(task);
        if (!lane.queued.add(task.taskId())) {
            return false;
        }
        long at = visibleAt == null ? clock.millis() : visibleAt.toEpochMilli();
        lane.queue.add(new QueuedTask(task, at, sequence.incrementAndGet(), false));
        return true;
    }

    public List<LaneStatus> status() {
        return lanes.values().stream()
                .map(l -> new LaneStatus(l.name, l.workerCount, l.capacity, l.queue.size(), l.inFlight.get()))
                .toList();
    }

    /**
     * Waits until every lane has no queued (including delayed) and no in-flight work.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            boolean idle = lanes.values().stream().allMatch(l -> l.queue.isEmpty() && l.inFlight.get() == 0);
            if (idle) return true;
            Thread.sleep(20);
        }
        return false;
    }

    @PreDestroy
    public void stop() throws InterruptedException {
        running = false;
        for (Lane lane : lanes.values()) {
            lane.workers.shutdownNow();
        }
        for (Lane lane : lanes.values()) {
            if (!lane.workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Lane {} workers did not stop in time", lane.name);
            }
        }
    }

    private Lane laneFor(Task task) {
        String name = properties.laneFor(task.kind());
        Lane lane = lanes.get(name);
        if (lane == null) {
            throw new IllegalStateException("No lane named " + name + " for kind " + task.kind());
        }
        return lane;
    }

    private void runWorker(Lane lane) {
        while (running && !Thread.currentThread().isInterrupted()) {
            QueuedTask next;
            try {
                next = lane.queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next == null) continue;
            lane.queued.remove(next.task.taskId());
            lane.inFlight.incrementAndGet();
            if (next.counted) lane.permits.release();
            try {
                Optional<TaskOutcome> outcome = coordinator.process(next.task);
                outcome.filter(o -> o.status() == OutcomeStatus.FAILED)
                        .ifPresent(o -> schedule(next.task, o.nextAttemptAt()));
            } catch (RuntimeException e) {
                // the task row stays claimed; the retry sweeper recovers it once the lease runs out
                log.error("Worker on lane {} failed processing task {}", lane.name, next.task.taskId(), e);
            } finally {
                lane.inFlight.decrementAndGet();
            }
        }
        log.debug("Worker on lane {} stopped", lane.name);
    }

    private static final class Lane {
        private final String name;
        private final int workerCount;
        private final int capacity;
        private final DelayQueue<QueuedTask> queue = new DelayQueue<>();
        private final Set<String> queued = ConcurrentHashMap.newKeySet();
        private final Semaphore permits;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final ExecutorService workers;

        private Lane(String name, int workerCount, int capacity) {
            if (workerCount < 1 || capacity < 1) {
                throw new IllegalArgumentException("Lane " + name + " needs at least one worker and a positive capacity");
            }
            this.name = name;
            this.workerCount = workerCount;
            this.capacity = capacity;
            this.permits = new Semaphore(capacity);
            AtomicInteger counter = new AtomicInteger();
            this.workers = Executors.newFixedThreadPool(workerCount, r -> {
                Thread t = new Thread(r, "ace-" + name + "-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
    }

    private final class QueuedTask implements Delayed {
        private final Task task;
        private final long visibleAtMillis;
        private final long seq;
        private final boolean counted;

        private QueuedTask(Task task, long visibleAtMillis, long seq, boolean counted) {
            this.task = task;
            this.visibleAtMillis = visibleAtMillis;
            this.seq = seq;
            this.counted = counted;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(visibleAtMillis - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            QueuedTask o = (QueuedTask) other;
            int byTime = Long.compare(visibleAtMillis, o.visibleAtMillis);
            return byTime != 0 ? byTime : Long.compare(seq, o.seq);
        }
    }
}
