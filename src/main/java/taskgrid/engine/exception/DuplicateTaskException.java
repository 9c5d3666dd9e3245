package taskgrid.engine.exception;

/**
 * A task with the same ID is (or once was) registered.
 */
public class DuplicateTaskException extends TaskEngineException {

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task already exists: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
