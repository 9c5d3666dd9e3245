package taskgrid.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.exception.DuplicateTaskException;
import taskgrid.engine.exception.UnknownTaskException;
import taskgrid.engine.model.Task;
import taskgrid.engine.model.TaskPriority;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Orders tasks by priority (CRITICAL first), FIFO by insertion within a
 * priority. Holds task IDs only.
 */
public class PriorityScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriorityScheduler.class);

    private static final TaskPriority[] HIGHEST_FIRST = {
            TaskPriority.CRITICAL, TaskPriority.HIGH, TaskPriority.NORMAL, TaskPriority.LOW
    };

    private final Map<TaskPriority, LinkedHashSet<String>> buckets = new EnumMap<>(TaskPriority.class);
    private final Map<String, TaskPriority> index = new HashMap<>();

    public PriorityScheduler() {
        for (TaskPriority p : TaskPriority.values()) {
            buckets.put(p, new LinkedHashSet<>());
        }
    }

    public void addTask(Task task) {
        addTask(task.id(), task.priority());
    }

    /**
     * Append a task to the tail of its priority bucket.
     *
     * @throws DuplicateTaskException if the task is already queued
     */
    public void addTask(String taskId, TaskPriority priority) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority is required");
        }
        if (index.containsKey(taskId)) {
            throw new DuplicateTaskException(taskId);
        }
        buckets.get(priority).add(taskId);
        index.put(taskId, priority);
        log.debug("Task {} queued at {}", taskId, priority);
    }

    /**
     * Head of the highest non-empty bucket, without removing it.
     */
    public Optional<String> getNextTask() {
        return getNextTask(id -> true);
    }

    /**
     * First task in scheduling order that satisfies the filter.
     */
    public Optional<String> getNextTask(Predicate<String> filter) {
        for (TaskPriority p : HIGHEST_FIRST) {
            for (String taskId : buckets.get(p)) {
                if (filter.test(taskId)) {
                    return Optional.of(taskId);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Remove a task; no-op if it is not queued.
     *
     * @return true if the task was queued
     */
    public boolean removeTask(String taskId) {
        TaskPriority priority = index.remove(taskId);
        if (priority == null) {
            return false;
        }
        buckets.get(priority).remove(taskId);
        log.debug("Task {} removed from {} bucket", taskId, priority);
        return true;
    }

    /**
     * Move a task to the tail of the bucket for {@code newPriority}. Its
     * original position is not preserved, even if the priority is unchanged.
     *
     * @return the previous priority
     * @throws UnknownTaskException if the task is not queued
     */
    public TaskPriority updateTaskPriority(String taskId, TaskPriority newPriority) {
        if (newPriority == null) {
            throw new IllegalArgumentException("priority is required");
        }
        TaskPriority old = index.get(taskId);
        if (old == null) {
            throw new UnknownTaskException(taskId);
        }
        buckets.get(old).remove(taskId);
        buckets.get(newPriority).add(taskId);
        index.put(taskId, newPriority);
        log.debug("Task {} moved from {} to {}", taskId, old, newPriority);
        return old;
    }

    public boolean contains(String taskId) {
        return index.containsKey(taskId);
    }

    public Optional<TaskPriority> getPriority(String taskId) {
        return Optional.ofNullable(index.get(taskId));
    }

    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    /** Full scheduling order, highest priority first */
    public List<String> snapshot() {
        List<String> order = new ArrayList<>(index.size());
        for (TaskPriority p : HIGHEST_FIRST) {
            order.addAll(buckets.get(p));
        }
        return order;
    }
}
