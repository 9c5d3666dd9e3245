package taskgrid.engine.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskgrid.engine.config.Dependencies;
import taskgrid.engine.config.EngineConfig;
import taskgrid.engine.event.TaskEvents;
import taskgrid.engine.model.Task;
import taskgrid.engine.model.TaskStatus;
import taskgrid.engine.model.Worker;
import taskgrid.engine.service.TaskOrchestrator;
import taskgrid.engine.support.MutableClock;
import taskgrid.engine.support.RecordingEventNotifier;
import taskgrid.engine.worker.InMemoryWorkerPool;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskTimeoutReaper, driven by a clock the test moves by hand.
 */
class TaskTimeoutReaperTest {

    private MutableClock clock;
    private RecordingEventNotifier events;
    private InMemoryWorkerPool workers;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        events = new RecordingEventNotifier();
        workers = new InMemoryWorkerPool();
        workers.register(Worker.of("w1"));
        workers.register(Worker.of("w2"));
    }

    private Dependencies engine(EngineConfig config) {
        return Dependencies.create(config, workers, events, clock);
    }

    private static void start(TaskOrchestrator orchestrator, String taskId) {
        assertTrue(orchestrator.assignNext().isAssigned());
        orchestrator.startTask(taskId);
    }

    @Test
    void failsTaskThatOverranItsEstimate() {
        Dependencies deps = engine(EngineConfig.defaults());
        TaskOrchestrator orchestrator = deps.orchestrator();
        orchestrator.addTask(Task.builder().id("slow").title("slow").estimatedDuration(Duration.ofMinutes(5)).build());
        start(orchestrator, "slow");

        clock.advance(Duration.ofMinutes(6));
        TaskTimeoutReaper reaper = deps.supervisor().reaper();
        int reaped = reaper.reapTimedOutTasks();

        assertEquals(1, reaped);
        assertEquals(TaskStatus.FAILED, orchestrator.getState("slow"));
        assertEquals(List.of(new TaskEvents.Failed("slow", "timeout")),
                events.payloads(TaskEvents.TASK_FAILED, TaskEvents.Failed.class));
    }

    @Test
    void doesNotReapTasksWithinTheirTime() {
        Dependencies deps = engine(EngineConfig.defaults());
        TaskOrchestrator orchestrator = deps.orchestrator();
        orchestrator.addTask(Task.builder().id("t1").title("t1").estimatedDuration(Duration.ofMinutes(5)).build());
        start(orchestrator, "t1");

        clock.advance(Duration.ofMinutes(5));

        assertEquals(0, new TaskTimeoutReaper(orchestrator, deps.config(), clock).reapTimedOutTasks());
        assertEquals(TaskStatus.IN_PROGRESS, orchestrator.getState("t1"));
    }

    @Test
    void tasksWithoutEstimateUseDefaultTimeout() {
        Dependencies deps = engine(EngineConfig.defaults().withDefaultTaskTimeout(Duration.ofMinutes(1)));
        TaskOrchestrator orchestrator = deps.orchestrator();
        orchestrator.addTask(Task.builder().id("t1").title("t1").build());
        start(orchestrator, "t1");

        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, new TaskTimeoutReaper(orchestrator, deps.config(), clock).reapTimedOutTasks());
    }

    @Test
    void zeroDefaultTimeoutDisablesTheCheck() {
        Dependencies deps = engine(EngineConfig.defaults());
        TaskOrchestrator orchestrator = deps.orchestrator();
        orchestrator.addTask(Task.builder().id("t1").title("t1").build());
        start(orchestrator, "t1");

        clock.advance(Duration.ofDays(1));

        assertEquals(0, new TaskTimeoutReaper(orchestrator, deps.config(), clock).reapTimedOutTasks());
    }

    @Test
    void assignedButNotStartedTasksAreLeftAlone() {
        Dependencies deps = engine(EngineConfig.defaults().withDefaultTaskTimeout(Duration.ofSeconds(1)));
        TaskOrchestrator orchestrator = deps.orchestrator();
        orchestrator.addTask(Task.builder().id("t1").title("t1").build());
        orchestrator.assignNext();

        clock.advance(Duration.ofMinutes(10));

        assertEquals(0, new TaskTimeoutReaper(orchestrator, deps.config(), clock).reapTimedOutTasks());
        assertEquals(TaskStatus.ASSIGNED, orchestrator.getState("t1"));
    }

    @Test
    void timedOutTaskIsRetriedWhenPolicyAllows() {
        EngineConfig config = EngineConfig.defaults()
                .withAutoRetry(true)
                .withDefaultTaskTimeout(Duration.ofMinutes(1));
        Dependencies deps = engine(config);
        TaskOrchestrator orchestrator = deps.orchestrator();
        orchestrator.addTask(Task.builder().id("t1").title("t1").build());
        start(orchestrator, "t1");

        clock.advance(Duration.ofMinutes(2));
        new TaskTimeoutReaper(orchestrator, config, clock).run();

        assertEquals(TaskStatus.PENDING, orchestrator.getState("t1"));
        assertEquals(1, orchestrator.getTask("t1").attempts());
    }

    @Test
    void runningTimeIsMeasuredFromLatestStart() {
        EngineConfig config = EngineConfig.defaults()
                .withAutoRetry(true)
                .withDefaultTaskTimeout(Duration.ofMinutes(1));
        Dependencies deps = engine(config);
        TaskOrchestrator orchestrator = deps.orchestrator();
        orchestrator.addTask(Task.builder().id("t1").title("t1").build());
        start(orchestrator, "t1");
        clock.advance(Duration.ofMinutes(2));
        TaskTimeoutReaper reaper = new TaskTimeoutReaper(orchestrator, config, clock);
        reaper.reapTimedOutTasks();

        // second attempt starts now, the first start must not count
        start(orchestrator, "t1");
        clock.advance(Duration.ofSeconds(30));

        assertEquals(0, reaper.reapTimedOutTasks());
        assertEquals(TaskStatus.IN_PROGRESS, orchestrator.getState("t1"));
    }
}
