package taskgrid.engine.dependency;

/**
 * How a hard dependency on a removed task is treated when the removed task
 * never completed. A dependency on an ID that was never added always blocks:
 * the prerequisite may simply not have been added yet.
 */
public enum DanglingDependencyPolicy {
    /** Dependents stay blocked; the edge can no longer be satisfied */
    BLOCK,
    /** The removed task counts as complete and its dependents are released */
    SATISFIED
}
