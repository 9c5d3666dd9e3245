package taskgrid.engine.model;

/**
 * Worker availability as reported by the worker pool.
 */
public enum WorkerStatus {
    /** Worker can accept a task */
    IDLE,
    /** Worker is executing a task */
    BUSY,
    /** Worker is not reachable */
    OFFLINE
}
