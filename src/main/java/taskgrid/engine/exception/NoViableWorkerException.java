package taskgrid.engine.exception;

/**
 * Ready work exists but no idle worker shares any capability with it.
 * Not fatal: the task stays pending and is retried on the next tick.
 */
public class NoViableWorkerException extends TaskEngineException {

    private final String taskId;

    public NoViableWorkerException(String taskId) {
        super("No viable worker for task " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
