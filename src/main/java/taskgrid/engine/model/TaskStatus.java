package taskgrid.engine.model;

/**
 * Task lifecycle status.
 */
public enum TaskStatus {
    /** Task registered, waiting for its dependencies and a worker */
    PENDING,
    /** Task handed to a worker that has not started it yet */
    ASSIGNED,
    /** Worker is executing the task */
    IN_PROGRESS,
    /** Task finished successfully (terminal) */
    COMPLETED,
    /** Task failed; may re-enter PENDING through an explicit retry */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /** States in which a task carries an assignee */
    public boolean isAssignedState() {
        return this == ASSIGNED || this == IN_PROGRESS;
    }
}
