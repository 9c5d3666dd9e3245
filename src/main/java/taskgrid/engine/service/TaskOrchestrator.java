package taskgrid.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.config.EngineConfig;
import taskgrid.engine.dependency.TaskDependencyManager;
import taskgrid.engine.event.EventNotifier;
import taskgrid.engine.event.EventQueue;
import taskgrid.engine.event.TaskEvents;
import taskgrid.engine.exception.DuplicateTaskException;
import taskgrid.engine.exception.InvalidTaskException;
import taskgrid.engine.exception.UnknownTaskException;
import taskgrid.engine.lifecycle.TaskStateMachine;
import taskgrid.engine.matching.CapabilityMatcher;
import taskgrid.engine.model.AssignmentResult;
import taskgrid.engine.model.HistoryEntry;
import taskgrid.engine.model.Task;
import taskgrid.engine.model.TaskPriority;
import taskgrid.engine.model.TaskStats;
import taskgrid.engine.model.TaskStatus;
import taskgrid.engine.model.Worker;
import taskgrid.engine.scheduler.PriorityScheduler;
import taskgrid.engine.worker.WorkerPool;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point of the engine. Owns the task table together with the state
 * machine, dependency graph and priority scheduler, and keeps them in step.
 *
 * Every mutating call applies all of its state changes under the engine lock
 * and only then delivers the events it raised, in the order they were raised.
 * A subscriber that calls back into the orchestrator therefore always sees the
 * finished result of the call that notified it. {@link #assignNext()} queries
 * the worker pool without holding the lock, so a slow pool does not block
 * {@link #addTask(Task)}.
 */
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final Object lock = new Object();

    private final Map<String, Task> tasks = new LinkedHashMap<>(); // definitions, insertion order
    private final Set<String> retiredIds = new HashSet<>();

    private final EventQueue pending = new EventQueue();
    private int depth; // nesting of mutating calls on the lock holder
    private final ThreadLocal<Deque<EventQueue.Event>> delivering = new ThreadLocal<>();

    private final TaskStateMachine stateMachine;
    private final TaskDependencyManager dependencyManager;
    private final CapabilityMatcher matcher;
    private final PriorityScheduler scheduler;
    private final WorkerPool workerPool;
    private final EventNotifier notifier;
    private final EngineConfig config;
    private final Clock clock;

    public TaskOrchestrator(EngineConfig config, WorkerPool workerPool, EventNotifier notifier, Clock clock) {
        this.config = config;
        this.workerPool = workerPool;
        this.notifier = notifier;
        this.clock = clock;

        this.stateMachine = new TaskStateMachine(pending, clock);
        this.dependencyManager = new TaskDependencyManager(pending, config.danglingDependencyPolicy());
        this.matcher = CapabilityMatcher.fromConfig(config);
        this.scheduler = new PriorityScheduler();
    }

    // ---- TASKS ----

    /**
     * Register a task in PENDING. Lifecycle fields on the given task are ignored.
     *
     * @return snapshot of the registered task
     * @throws InvalidTaskException   if a required field is missing
     * @throws DuplicateTaskException if the ID is in use or was used before
     */
    public Task addTask(Task task) {
        validate(task);
        return mutate(() -> {
            if (tasks.containsKey(task.id()) || retiredIds.contains(task.id())) {
                throw new DuplicateTaskException(task.id());
            }

            Task definition = task.toBuilder()
                    .status(TaskStatus.PENDING)
                    .assignedTo(null)
                    .attempts(0)
                    .completedAt(null)
                    .history(List.of())
                    .createdAt(task.createdAt() != null ? task.createdAt() : clock.instant())
                    .build();

            dependencyManager.addTask(definition);
            scheduler.addTask(definition);
            stateMachine.addTask(definition.id());
            tasks.put(definition.id(), definition);

            log.info("Task {} added (priority={}, dependsOn={})",
                    definition.id(), definition.priority(), definition.dependsOn());
            Task snapshot = view(definition.id());
            pending.publish(TaskEvents.TASK_ADDED, new TaskEvents.Added(snapshot));
            return snapshot;
        });
    }

    private static void validate(Task task) {
        if (task == null) {
            throw new InvalidTaskException("task is required");
        }
        if (task.id().isBlank()) {
            throw new InvalidTaskException("id is required");
        }
        if (task.title() == null || task.title().isBlank()) {
            throw new InvalidTaskException("title is required for task " + task.id());
        }
        for (String depId : task.dependsOn()) {
            if (depId.isBlank()) {
                throw new InvalidTaskException("dependsOn contains a blank ID for task " + task.id());
            }
        }
    }

    /**
     * Remove a task from every substructure. Dependents are left as they are.
     *
     * @throws UnknownTaskException if the task is not tracked
     */
    public void removeTask(String taskId) {
        mutate(() -> {
            require(taskId);
            log.info("Task {} removed", taskId);
            pending.publish(TaskEvents.TASK_REMOVED, new TaskEvents.Removed(taskId));

            dependencyManager.removeTask(taskId);
            scheduler.removeTask(taskId);
            stateMachine.remove(taskId);
            tasks.remove(taskId);
            retiredIds.add(taskId);
            return null;
        });
    }

    public Task getTask(String taskId) {
        synchronized (lock) {
            require(taskId);
            return view(taskId);
        }
    }

    public Optional<Task> findTask(String taskId) {
        synchronized (lock) {
            return tasks.containsKey(taskId) ? Optional.of(view(taskId)) : Optional.empty();
        }
    }

    /** Snapshots of all tasks in insertion order */
    public List<Task> getTasks() {
        synchronized (lock) {
            List<Task> result = new ArrayList<>(tasks.size());
            for (String id : tasks.keySet()) {
                result.add(view(id));
            }
            return result;
        }
    }

    public List<Task> getTasksByStatus(TaskStatus status) {
        synchronized (lock) {
            List<Task> result = new ArrayList<>();
            for (String id : tasks.keySet()) {
                if (stateMachine.getState(id) == status) {
                    result.add(view(id));
                }
            }
            return result;
        }
    }

    public TaskStats getStats() {
        return TaskStats.of(getTasks());
    }

    /**
     * Change a task's priority. A queued task moves to the tail of its new bucket.
     */
    public Task updateTaskPriority(String taskId, TaskPriority newPriority) {
        if (newPriority == null) {
            throw new IllegalArgumentException("priority is required");
        }
        return mutate(() -> {
            Task definition = require(taskId);
            TaskPriority old = definition.priority();
            if (scheduler.contains(taskId)) {
                scheduler.updateTaskPriority(taskId, newPriority);
            }
            tasks.put(taskId, definition.toBuilder().priority(newPriority).build());

            log.info("Task {} priority changed from {} to {}", taskId, old, newPriority);
            pending.publish(TaskEvents.TASK_PRIORITY_UPDATED, new TaskEvents.PriorityUpdated(taskId, old, newPriority));
            return view(taskId);
        });
    }

    // ---- DEPENDENCIES ----

    /** Tasks whose hard dependencies are complete and that are not complete themselves */
    public List<Task> getReadyTasks() {
        synchronized (lock) {
            List<Task> result = new ArrayList<>();
            for (String id : dependencyManager.getReadyTasks()) {
                result.add(view(id));
            }
            return result;
        }
    }

    public List<String> getDependencies(String taskId) {
        synchronized (lock) {
            return dependencyManager.getDependencies(taskId);
        }
    }

    public List<String> getDependents(String taskId) {
        synchronized (lock) {
            require(taskId);
            return dependencyManager.getDependents(taskId);
        }
    }

    public boolean hasCircularDependency(String taskId) {
        synchronized (lock) {
            return dependencyManager.hasCircularDependency(taskId);
        }
    }

    public List<List<String>> detectCycles() {
        synchronized (lock) {
            return dependencyManager.detectCycles();
        }
    }

    /** @see TaskDependencyManager#getTopologicalOrder() */
    public List<String> getExecutionOrder() {
        synchronized (lock) {
            return dependencyManager.getTopologicalOrder();
        }
    }

    // ---- MATCHING ----

    public double matchScore(Collection<String> required, Collection<String> available) {
        return matcher.matchScore(required, available);
    }

    public Optional<Worker> findBestMatch(Collection<String> required, List<Worker> candidates) {
        return matcher.findBestMatch(required, candidates);
    }

    // ---- LIFECYCLE ----

    public Task transition(String taskId, TaskStatus target) {
        return transition(taskId, target, null);
    }

    /**
     * Move a task along a lifecycle edge and keep the other structures in step:
     * completing releases dependents, re-entering PENDING re-queues the task.
     *
     * @param workerId worker taking the task; required for ASSIGNED, ignored otherwise
     * @throws IllegalArgumentException if the target is ASSIGNED and no worker is given
     */
    public Task transition(String taskId, TaskStatus target, String workerId) {
        return mutate(() -> {
            require(taskId);
            if (target == TaskStatus.ASSIGNED && (workerId == null || workerId.isBlank())) {
                throw new IllegalArgumentException("workerId is required to assign task " + taskId);
            }
            applyTransition(taskId, target, target == TaskStatus.ASSIGNED ? workerId : null, null);
            return view(taskId);
        });
    }

    public TaskStatus getState(String taskId) {
        synchronized (lock) {
            return stateMachine.getState(taskId);
        }
    }

    public List<HistoryEntry> getHistory(String taskId) {
        synchronized (lock) {
            return stateMachine.getHistory(taskId);
        }
    }

    /**
     * Hand the highest-priority ready pending task to the best idle worker.
     * If that task has no viable worker, the next ready task in scheduling
     * order is tried. Unplaced tasks stay PENDING for the next call.
     */
    public AssignmentResult assignNext() {
        List<String> candidates;
        synchronized (lock) {
            candidates = assignableTasks();
        }
        if (candidates.isEmpty()) {
            log.debug("No ready task to assign");
            return AssignmentResult.noReadyTask();
        }

        List<Worker> idle = workerPool.getIdleWorkers();

        return mutate(() -> {
            Set<String> engaged = engagedWorkers();
            List<Worker> free = new ArrayList<>();
            for (Worker w : idle) {
                if (!engaged.contains(w.id())) free.add(w);
            }

            Set<String> stillAssignable = new HashSet<>(assignableTasks());
            String firstUnplaced = null;
            for (String taskId : candidates) {
                if (!stillAssignable.contains(taskId)) {
                    continue;
                }
                if (free.isEmpty()) {
                    log.debug("No idle worker for task {}", taskId);
                    return AssignmentResult.noIdleWorker(taskId);
                }
                Optional<Worker> best = matcher.findBestMatch(tasks.get(taskId).requiredCapabilities(), free);
                if (best.isPresent()) {
                    String workerId = best.get().id();
                    applyTransition(taskId, TaskStatus.ASSIGNED, workerId, null);
                    return AssignmentResult.assigned(taskId, workerId);
                }
                if (firstUnplaced == null) {
                    firstUnplaced = taskId;
                }
                log.warn("No viable worker for task {} (requires {})", taskId, tasks.get(taskId).requiredCapabilities());
            }
            return firstUnplaced == null ? AssignmentResult.noReadyTask() : AssignmentResult.noViableWorker(firstUnplaced);
        });
    }

    /** The assigned worker has begun executing the task */
    public Task startTask(String taskId) {
        return transition(taskId, TaskStatus.IN_PROGRESS);
    }

    public Task onTaskCompleted(String taskId) {
        return transition(taskId, TaskStatus.COMPLETED);
    }

    /**
     * Record a failure of an in-progress task. With auto-retry enabled and
     * attempts left, the task goes straight back to PENDING.
     *
     * @return true if the task will be retried
     */
    public boolean onTaskFailed(String taskId, String reason) {
        return mutate(() -> {
            require(taskId);
            applyTransition(taskId, TaskStatus.FAILED, null, reason);

            int attempts = stateMachine.getAttempts(taskId);
            if (config.autoRetryFailed() && attempts < config.maxAttempts()) {
                log.info("Task {} will be retried (attempt {} of {})", taskId, attempts, config.maxAttempts());
                applyTransition(taskId, TaskStatus.PENDING, null, null);
                return true;
            }
            return false;
        });
    }

    /** Explicitly move a failed task back to PENDING */
    public Task retryTask(String taskId) {
        return transition(taskId, TaskStatus.PENDING);
    }

    /**
     * Cancel a task: an in-progress task is failed first, then the task is removed.
     */
    public void cancelTask(String taskId, String reason) {
        mutate(() -> {
            require(taskId);
            if (stateMachine.getState(taskId) == TaskStatus.IN_PROGRESS) {
                applyTransition(taskId, TaskStatus.FAILED, null, reason);
            }
            removeTask(taskId);
            return null;
        });
    }

    // ---- internals ----

    /**
     * Run a state change under the lock, then deliver the events it queued.
     * Nested calls leave delivery to the outermost one.
     */
    private <T> T mutate(Supplier<T> action) {
        List<EventQueue.Event> batch = List.of();
        try {
            synchronized (lock) {
                depth++;
                try {
                    return action.get();
                } finally {
                    if (--depth == 0) {
                        batch = pending.drain();
                    }
                }
            }
        } finally {
            deliver(batch);
        }
    }

    /**
     * Deliver events outside the lock. Events raised by a subscriber that
     * calls back in are appended to the batch being delivered on this thread,
     * so observers see them after the events that caused them.
     */
    private void deliver(List<EventQueue.Event> batch) {
        if (batch.isEmpty()) {
            return;
        }
        Deque<EventQueue.Event> inFlight = delivering.get();
        if (inFlight != null) {
            inFlight.addAll(batch);
            return;
        }
        inFlight = new ArrayDeque<>(batch);
        delivering.set(inFlight);
        try {
            EventQueue.Event event;
            while ((event = inFlight.poll()) != null) {
                try {
                    notifier.publish(event.name(), event.payload());
                } catch (RuntimeException e) {
                    log.warn("Event {} could not be published: {}", event.name(), e.getMessage());
                }
            }
        } finally {
            delivering.remove();
        }
    }

    // caller holds the lock
    private void applyTransition(String taskId, TaskStatus target, String workerId, String reason) {
        TaskStatus previous = stateMachine.transition(taskId, target, workerId);

        switch (target) {
            case ASSIGNED -> {
                log.info("Task {} assigned to worker {}", taskId, workerId);
                pending.publish(TaskEvents.TASK_ASSIGNED, new TaskEvents.Assigned(taskId, workerId));
            }
            case IN_PROGRESS -> pending.publish(TaskEvents.TASK_STARTED,
                    new TaskEvents.Started(taskId, stateMachine.getAssignee(taskId).orElse(null)));
            case COMPLETED -> {
                scheduler.removeTask(taskId);
                log.info("Task {} completed", taskId);
                // queued ahead of the task.ready events raised by the cascade
                pending.publish(TaskEvents.TASK_COMPLETED, new TaskEvents.Completed(taskId));
                dependencyManager.markTaskComplete(taskId);
            }
            case FAILED -> {
                log.info("Task {} failed: {}", taskId, reason);
                pending.publish(TaskEvents.TASK_FAILED, new TaskEvents.Failed(taskId, reason));
            }
            case PENDING -> {
                // back of the queue at its current priority
                TaskPriority priority = tasks.get(taskId).priority();
                if (scheduler.contains(taskId)) {
                    scheduler.updateTaskPriority(taskId, priority);
                } else {
                    scheduler.addTask(taskId, priority);
                }
                log.info("Task {} re-queued from {}", taskId, previous);
            }
        }
    }

    private List<String> assignableTasks() {
        Set<String> ready = new HashSet<>(dependencyManager.getReadyTasks());
        List<String> result = new ArrayList<>();
        for (String id : scheduler.snapshot()) {
            if (ready.contains(id) && stateMachine.getState(id) == TaskStatus.PENDING) {
                result.add(id);
            }
        }
        return result;
    }

    private Set<String> engagedWorkers() {
        Set<String> engaged = new HashSet<>();
        for (String id : tasks.keySet()) {
            stateMachine.getAssignee(id).ifPresent(engaged::add);
        }
        return engaged;
    }

    private Task require(String taskId) {
        Task definition = tasks.get(taskId);
        if (definition == null) {
            throw new UnknownTaskException(taskId);
        }
        return definition;
    }

    private Task view(String taskId) {
        return tasks.get(taskId).toBuilder()
                .status(stateMachine.getState(taskId))
                .assignedTo(stateMachine.getAssignee(taskId).orElse(null))
                .attempts(stateMachine.getAttempts(taskId))
                .completedAt(stateMachine.getCompletedAt(taskId).orElse(null))
                .history(stateMachine.getHistory(taskId))
                .build();
    }
}
