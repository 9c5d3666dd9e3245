package taskgrid.engine.model;

import taskgrid.engine.exception.NoViableWorkerException;

import java.util.Objects;

/**
 * What an assignment tick did.
 *
 * @param outcome  what happened
 * @param taskId   the assigned task, or the task that could not be placed; null for NO_READY_TASK
 * @param workerId the chosen worker; set only for ASSIGNED
 */
public record AssignmentResult(AssignmentOutcome outcome, String taskId, String workerId) {

    public AssignmentResult {
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public static AssignmentResult assigned(String taskId, String workerId) {
        return new AssignmentResult(AssignmentOutcome.ASSIGNED, taskId, workerId);
    }

    public static AssignmentResult noReadyTask() {
        return new AssignmentResult(AssignmentOutcome.NO_READY_TASK, null, null);
    }

    public static AssignmentResult noIdleWorker(String taskId) {
        return new AssignmentResult(AssignmentOutcome.NO_IDLE_WORKER, taskId, null);
    }

    public static AssignmentResult noViableWorker(String taskId) {
        return new AssignmentResult(AssignmentOutcome.NO_VIABLE_WORKER, taskId, null);
    }

    public boolean isAssigned() {
        return outcome == AssignmentOutcome.ASSIGNED;
    }

    /**
     * For callers that treat a missing capability match as an error.
     *
     * @throws NoViableWorkerException if the outcome is NO_VIABLE_WORKER
     */
    public AssignmentResult throwIfNoViableWorker() {
        if (outcome == AssignmentOutcome.NO_VIABLE_WORKER) {
            throw new NoViableWorkerException(taskId);
        }
        return this;
    }
}
