package taskgrid.engine.model;

/**
 * Result of one assignment tick.
 */
public enum AssignmentOutcome {
    /** A task was handed to a worker */
    ASSIGNED,

    /** No pending task has all of its dependencies complete */
    NO_READY_TASK,

    /** Ready work exists but the pool reported no free worker */
    NO_IDLE_WORKER,

    /** Free workers exist but none shares a capability with any ready task */
    NO_VIABLE_WORKER
}
