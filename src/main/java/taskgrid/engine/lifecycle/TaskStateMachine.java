package taskgrid.engine.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.event.EventNotifier;
import taskgrid.engine.event.TaskEvents;
import taskgrid.engine.exception.DuplicateTaskException;
import taskgrid.engine.exception.InvalidTransitionException;
import taskgrid.engine.exception.UnknownTaskException;
import taskgrid.engine.model.HistoryEntry;
import taskgrid.engine.model.TaskStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Enforces the task lifecycle and keeps an append-only history per task.
 *
 * <pre>
 * PENDING -> ASSIGNED -> IN_PROGRESS -> COMPLETED
 *                                   \-> FAILED -> PENDING (retry)
 * </pre>
 *
 * The assignee is recorded when a task enters ASSIGNED, carried into
 * IN_PROGRESS, and cleared whenever the task leaves those two states.
 */
public class TaskStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(TaskStatus.PENDING, EnumSet.of(TaskStatus.ASSIGNED));
        TRANSITIONS.put(TaskStatus.ASSIGNED, EnumSet.of(TaskStatus.IN_PROGRESS));
        TRANSITIONS.put(TaskStatus.IN_PROGRESS, EnumSet.of(TaskStatus.COMPLETED, TaskStatus.FAILED));
        TRANSITIONS.put(TaskStatus.COMPLETED, EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(TaskStatus.FAILED, EnumSet.of(TaskStatus.PENDING));
    }

    private static final class Lifecycle {
        TaskStatus state = TaskStatus.PENDING;
        String assignee;
        int attempts;
        Instant completedAt;
        final List<HistoryEntry> history = new ArrayList<>();
    }

    private final Map<String, Lifecycle> tasks = new LinkedHashMap<>();
    private final EventNotifier notifier;
    private final Clock clock;

    public TaskStateMachine(EventNotifier notifier, Clock clock) {
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Start tracking a task in PENDING.
     *
     * @throws DuplicateTaskException if the ID is already tracked
     */
    public void addTask(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (tasks.containsKey(taskId)) {
            throw new DuplicateTaskException(taskId);
        }
        Lifecycle lc = new Lifecycle();
        lc.history.add(new HistoryEntry(TaskStatus.PENDING, clock.instant()));
        tasks.put(taskId, lc);
        log.debug("Tracking task {} in {}", taskId, TaskStatus.PENDING);
    }

    public TaskStatus transition(String taskId, TaskStatus target) {
        return transition(taskId, target, null);
    }

    /**
     * Move a task along a valid edge.
     *
     * @param assignee worker recorded when entering ASSIGNED, ignored otherwise
     * @return the previous state
     * @throws UnknownTaskException       if the task is not tracked
     * @throws InvalidTransitionException if the edge is not allowed; state is unchanged
     */
    public TaskStatus transition(String taskId, TaskStatus target, String assignee) {
        Lifecycle lc = require(taskId);
        TaskStatus previous = lc.state;
        if (target == null || !canTransition(previous, target)) {
            throw new InvalidTransitionException(taskId, previous, target);
        }

        Instant now = clock.instant();
        lc.state = target;
        if (target == TaskStatus.ASSIGNED) {
            lc.assignee = assignee;
        } else if (!target.isAssignedState()) {
            lc.assignee = null;
        }
        if (target == TaskStatus.IN_PROGRESS) {
            lc.attempts++;
        }
        if (target == TaskStatus.COMPLETED) {
            lc.completedAt = now;
        }
        lc.history.add(new HistoryEntry(target, now));

        log.info("Task {} transitioned from {} to {}", taskId, previous, target);
        publish(TaskEvents.TASK_STATE_CHANGED, new TaskEvents.StateChanged(taskId, previous, target));
        return previous;
    }

    public TaskStatus getState(String taskId) {
        return require(taskId).state;
    }

    /** Snapshot of the task's history, oldest first */
    public List<HistoryEntry> getHistory(String taskId) {
        return Collections.unmodifiableList(new ArrayList<>(require(taskId).history));
    }

    public Optional<String> getAssignee(String taskId) {
        return Optional.ofNullable(require(taskId).assignee);
    }

    /** Number of times the task has entered IN_PROGRESS */
    public int getAttempts(String taskId) {
        return require(taskId).attempts;
    }

    public Optional<Instant> getCompletedAt(String taskId) {
        return Optional.ofNullable(require(taskId).completedAt);
    }

    public boolean contains(String taskId) {
        return tasks.containsKey(taskId);
    }

    /**
     * Stop tracking a task.
     *
     * @return true if the task was tracked
     */
    public boolean remove(String taskId) {
        return tasks.remove(taskId) != null;
    }

    public boolean canTransition(TaskStatus from, TaskStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.get(from).contains(to);
    }

    public Set<TaskStatus> getValidTransitions(TaskStatus state) {
        Set<TaskStatus> targets = TRANSITIONS.get(state);
        return targets == null ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(targets));
    }

    public boolean isTerminalState(TaskStatus state) {
        return getValidTransitions(state).isEmpty();
    }

    public TaskStatus initialState() {
        return TaskStatus.PENDING;
    }

    private Lifecycle require(String taskId) {
        Lifecycle lc = tasks.get(taskId);
        if (lc == null) {
            throw new UnknownTaskException(taskId);
        }
        return lc;
    }

    private void publish(String eventName, Object payload) {
        try {
            notifier.publish(eventName, payload);
        } catch (RuntimeException e) {
            log.warn("Event {} could not be published: {}", eventName, e.getMessage());
        }
    }
}
