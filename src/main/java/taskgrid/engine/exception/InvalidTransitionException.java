package taskgrid.engine.exception;

import taskgrid.engine.model.TaskStatus;

/**
 * Illegal lifecycle edge. The task keeps its current state.
 */
public class InvalidTransitionException extends TaskEngineException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Invalid transition for task " + taskId + " from " + from + " to " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }
}
