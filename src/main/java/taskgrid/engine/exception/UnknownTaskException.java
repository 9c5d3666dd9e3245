package taskgrid.engine.exception;

/**
 * The task ID is not tracked.
 */
public class UnknownTaskException extends TaskEngineException {

    private final String taskId;

    public UnknownTaskException(String taskId) {
        super("Task not found with ID: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
