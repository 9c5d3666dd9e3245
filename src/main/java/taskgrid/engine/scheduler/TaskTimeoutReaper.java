package taskgrid.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.config.EngineConfig;
import taskgrid.engine.model.HistoryEntry;
import taskgrid.engine.model.Task;
import taskgrid.engine.model.TaskStatus;
import taskgrid.engine.service.TaskOrchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that fails IN_PROGRESS tasks which overran their time.
 *
 * The limit is the task's estimatedDuration, or the configured default
 * timeout when the task has none. A zero default disables the check for
 * such tasks. Running time is measured from the last time the task entered
 * IN_PROGRESS.
 *
 * Timed-out tasks go through {@link TaskOrchestrator#onTaskFailed}, so the
 * configured retry policy applies.
 */
public class TaskTimeoutReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskTimeoutReaper.class);

    static final String TIMEOUT_REASON = "timeout";

    private final TaskOrchestrator orchestrator;
    private final EngineConfig config;
    private final Clock clock;

    public TaskTimeoutReaper(TaskOrchestrator orchestrator, EngineConfig config, Clock clock) {
        this.orchestrator = orchestrator;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapTimedOutTasks();
        } catch (Exception e) {
            log.error("Task timeout reaper error", e);
        }
    }

    /**
     * Fail every in-progress task that has overrun.
     *
     * @return number of tasks failed
     */
    public int reapTimedOutTasks() {
        List<Task> running = orchestrator.getTasksByStatus(TaskStatus.IN_PROGRESS);
        if (running.isEmpty()) {
            log.debug("No running tasks");
            return 0;
        }

        Instant now = clock.instant();
        int failed = 0;
        int retried = 0;

        for (Task task : running) {
            Duration limit = timeoutFor(task);
            if (limit.isZero() || limit.isNegative()) {
                continue;
            }
            Instant startedAt = startedAt(task);
            if (startedAt == null || !startedAt.plus(limit).isBefore(now)) {
                continue;
            }

            try {
                boolean willRetry = orchestrator.onTaskFailed(task.id(), TIMEOUT_REASON);
                failed++;
                if (willRetry) {
                    retried++;
                    log.info("Timed out task {} re-queued (attempt {} of {})",
                            task.id(), task.attempts(), config.maxAttempts());
                } else {
                    log.warn("Task {} failed: running since {} exceeded {}", task.id(), startedAt, limit);
                }
            } catch (Exception e) {
                // the task may have completed or been removed since the snapshot
                log.error("Failed to time out task {}", task.id(), e);
            }
        }

        if (failed > 0) {
            log.info("Timeout reaper: {} failed, {} re-queued, {} running", failed, retried, running.size());
        }
        return failed;
    }

    private Duration timeoutFor(Task task) {
        return task.estimatedDuration() != null ? task.estimatedDuration() : config.defaultTaskTimeout();
    }

    private static Instant startedAt(Task task) {
        List<HistoryEntry> history = task.history();
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).state() == TaskStatus.IN_PROGRESS) {
                return history.get(i).timestamp();
            }
        }
        return null;
    }
}
