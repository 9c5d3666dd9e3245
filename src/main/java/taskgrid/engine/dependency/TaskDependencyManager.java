package taskgrid.engine.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.event.EventNotifier;
import taskgrid.engine.event.TaskEvents;
import taskgrid.engine.exception.CircularDependencyException;
import taskgrid.engine.exception.DuplicateTaskException;
import taskgrid.engine.exception.UnknownTaskException;
import taskgrid.engine.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks hard (dependsOn) and soft (prefers) edges between tasks and computes
 * which tasks are currently executable.
 *
 * Only hard edges block. Cycles are never rejected on insert; they are
 * reported through {@link #hasCircularDependency(String)} and
 * {@link #detectCycles()}.
 */
public class TaskDependencyManager {

    private static final Logger log = LoggerFactory.getLogger(TaskDependencyManager.class);

    // task ID -> its hard dependencies, in declaration order; key order = insertion order
    private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, List<String>> preferences = new LinkedHashMap<>();
    private final Map<String, List<String>> conflicts = new LinkedHashMap<>();
    private final Set<String> completed = new HashSet<>();
    private final Set<String> removed = new HashSet<>(); // once tracked, no longer tracked

    private final EventNotifier notifier;
    private final DanglingDependencyPolicy danglingPolicy;

    public TaskDependencyManager(EventNotifier notifier, DanglingDependencyPolicy danglingPolicy) {
        this.notifier = notifier;
        this.danglingPolicy = danglingPolicy;
    }

    public void addTask(Task task) {
        addTask(task.id(), task.dependsOn(), task.prefers(), task.conflictsWith());
    }

    /**
     * Register a task and its edges.
     *
     * @throws DuplicateTaskException if the ID is already tracked
     */
    public void addTask(String taskId, List<String> dependsOn, List<String> prefers, List<String> conflictsWith) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (dependencies.containsKey(taskId)) {
            throw new DuplicateTaskException(taskId);
        }
        dependencies.put(taskId, List.copyOf(dependsOn == null ? List.of() : dependsOn));
        preferences.put(taskId, List.copyOf(prefers == null ? List.of() : prefers));
        conflicts.put(taskId, List.copyOf(conflictsWith == null ? List.of() : conflictsWith));
        removed.remove(taskId);

        for (String depId : dependencies.get(taskId)) {
            if (!dependencies.containsKey(depId)) {
                log.debug("Task {} depends on {} which is not tracked yet", taskId, depId);
            }
        }
        log.debug("Added task {} with {} hard and {} soft dependencies",
                taskId, dependencies.get(taskId).size(), preferences.get(taskId).size());
    }

    /**
     * Stop tracking a task. Dependents keep their edge to it; if the task
     * never completed, that edge is handled by the {@link DanglingDependencyPolicy}.
     * Under {@link DanglingDependencyPolicy#SATISFIED} every dependent this
     * unblocks gets a {@code task.ready} event, as on completion.
     *
     * @return true if the task was tracked
     */
    public boolean removeTask(String taskId) {
        if (dependencies.remove(taskId) == null) {
            return false;
        }
        preferences.remove(taskId);
        conflicts.remove(taskId);
        removed.add(taskId);
        // a completion mark outlives removal: IDs are never reused

        List<String> dependents = getDependents(taskId);
        if (dependents.isEmpty() || completed.contains(taskId)) {
            return true;
        }
        if (danglingPolicy == DanglingDependencyPolicy.BLOCK) {
            log.warn("Removed task {} is still a dependency of {} (policy {})", taskId, dependents, danglingPolicy);
            return true;
        }

        for (String id : dependents) {
            if (!completed.contains(id) && dependenciesSatisfied(id)) {
                log.info("Task {} is ready (dependency {} removed)", id, taskId);
                publish(TaskEvents.TASK_READY, new TaskEvents.Ready(id));
            }
        }
        return true;
    }

    public List<String> getDependencies(String taskId) {
        return require(taskId, dependencies);
    }

    public List<String> getPreferences(String taskId) {
        return require(taskId, preferences);
    }

    public List<String> getConflicts(String taskId) {
        return require(taskId, conflicts);
    }

    public boolean contains(String taskId) {
        return dependencies.containsKey(taskId);
    }

    public boolean isComplete(String taskId) {
        return completed.contains(taskId);
    }

    /**
     * Every tracked, not yet complete task whose hard dependencies are all
     * complete, in insertion order.
     */
    public List<String> getReadyTasks() {
        List<String> ready = new ArrayList<>();
        for (String taskId : dependencies.keySet()) {
            if (!completed.contains(taskId) && dependenciesSatisfied(taskId)) {
                ready.add(taskId);
            }
        }
        return ready;
    }

    public boolean isReady(String taskId) {
        require(taskId, dependencies);
        return !completed.contains(taskId) && dependenciesSatisfied(taskId);
    }

    /**
     * Mark a task complete and publish {@code task.ready} for every dependent
     * this unblocks. Marking an already complete task is a no-op.
     *
     * @return IDs of the dependents that became ready, in insertion order
     */
    public List<String> markTaskComplete(String taskId) {
        require(taskId, dependencies);
        if (!completed.add(taskId)) {
            log.debug("Task {} already complete", taskId);
            return List.of();
        }

        List<String> unblocked = new ArrayList<>();
        for (var entry : dependencies.entrySet()) {
            String candidate = entry.getKey();
            if (entry.getValue().contains(taskId)
                    && !completed.contains(candidate)
                    && dependenciesSatisfied(candidate)) {
                unblocked.add(candidate);
            }
        }

        for (String id : unblocked) {
            log.info("Task {} is ready (dependency {} completed)", id, taskId);
            publish(TaskEvents.TASK_READY, new TaskEvents.Ready(id));
        }
        return unblocked;
    }

    /**
     * Whether the task can reach itself over hard edges.
     */
    public boolean hasCircularDependency(String taskId) {
        require(taskId, dependencies);

        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>(dependencies.get(taskId));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(taskId)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            List<String> next = dependencies.get(current);
            if (next != null) {
                next.forEach(stack::push);
            }
        }
        return false;
    }

    /**
     * Find cycles across all tracked tasks. Each cycle is a closed path
     * (first and last element are the same task).
     */
    public List<List<String>> detectCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String taskId : dependencies.keySet()) {
            if (!visited.contains(taskId)) {
                findCycles(taskId, visited, cycles);
            }
        }
        return cycles;
    }

    // depth-first with an explicit stack; path holds the IDs on the stack
    private void findCycles(String root, Set<String> visited, List<List<String>> cycles) {
        LinkedHashSet<String> path = new LinkedHashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        visited.add(root);
        path.add(root);
        stack.push(new Frame(root, dependencies.get(root).iterator()));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.deps().hasNext()) {
                stack.pop();
                path.remove(top.id());
                continue;
            }
            String depId = top.deps().next();
            if (path.contains(depId)) {
                cycles.add(closedPath(depId, path));
            } else if (!visited.contains(depId) && dependencies.containsKey(depId)) {
                visited.add(depId);
                path.add(depId);
                stack.push(new Frame(depId, dependencies.get(depId).iterator()));
            }
        }
    }

    private static List<String> closedPath(String start, LinkedHashSet<String> path) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String id : path) {
            if (id.equals(start)) inCycle = true;
            if (inCycle) cycle.add(id);
        }
        cycle.add(start);
        return cycle;
    }

    /**
     * Execution order over all tracked tasks: every task appears after its
     * tracked hard dependencies.
     *
     * @throws CircularDependencyException if the graph has a cycle
     */
    public List<String> getTopologicalOrder() {
        List<String> order = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (String taskId : dependencies.keySet()) {
            if (!done.contains(taskId)) {
                visitInOrder(taskId, done, order);
            }
        }
        return order;
    }

    // postorder: a task is emitted once all of its tracked dependencies are
    private void visitInOrder(String root, Set<String> done, List<String> order) {
        LinkedHashSet<String> path = new LinkedHashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        path.add(root);
        stack.push(new Frame(root, dependencies.get(root).iterator()));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.deps().hasNext()) {
                stack.pop();
                path.remove(top.id());
                done.add(top.id());
                order.add(top.id());
                continue;
            }
            String depId = top.deps().next();
            if (!dependencies.containsKey(depId) || done.contains(depId)) {
                continue;
            }
            if (path.contains(depId)) {
                throw new CircularDependencyException(closedPath(depId, path));
            }
            path.add(depId);
            stack.push(new Frame(depId, dependencies.get(depId).iterator()));
        }
    }

    /**
     * The task followed by all of its transitive hard dependencies (preorder).
     */
    public List<String> getDependencyChain(String taskId) {
        require(taskId, dependencies);
        List<String> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(taskId);

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            chain.add(current);
            List<String> deps = dependencies.getOrDefault(current, List.of());
            // pushed last-first so the first declared dependency is expanded next
            for (int i = deps.size() - 1; i >= 0; i--) {
                stack.push(deps.get(i));
            }
        }
        return chain;
    }

    /** Tasks with a hard edge to the given task */
    public List<String> getDependents(String taskId) {
        return reverseEdges(taskId, dependencies);
    }

    /** Tasks that prefer to run after the given task */
    public List<String> getSoftDependents(String taskId) {
        return reverseEdges(taskId, preferences);
    }

    private static List<String> reverseEdges(String taskId, Map<String, List<String>> graph) {
        List<String> result = new ArrayList<>();
        for (var entry : graph.entrySet()) {
            if (entry.getValue().contains(taskId)) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public int size() {
        return dependencies.size();
    }

    private boolean dependenciesSatisfied(String taskId) {
        for (String depId : dependencies.get(taskId)) {
            if (completed.contains(depId)) {
                continue;
            }
            if (removed.contains(depId) && danglingPolicy == DanglingDependencyPolicy.SATISFIED) {
                continue;
            }
            return false;
        }
        return true;
    }

    private record Frame(String id, Iterator<String> deps) {
    }

    private static List<String> require(String taskId, Map<String, List<String>> graph) {
        List<String> edges = graph.get(taskId);
        if (edges == null) {
            throw new UnknownTaskException(taskId);
        }
        return edges;
    }

    private void publish(String eventName, Object payload) {
        try {
            notifier.publish(eventName, payload);
        } catch (RuntimeException e) {
            log.warn("Event {} could not be published: {}", eventName, e.getMessage());
        }
    }
}
