package taskgrid.engine.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskgrid.engine.model.Task;
import taskgrid.engine.model.TaskPriority;
import taskgrid.engine.model.TaskStatus;

/**
 * Event names and payloads emitted by the engine.
 */
public final class TaskEvents {
    private TaskEvents() {
    }

    public static final String TASK_ADDED = "task.added";
    public static final String TASK_READY = "task.ready";
    public static final String TASK_ASSIGNED = "task.assigned";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_STATE_CHANGED = "task.stateChanged";
    public static final String TASK_PRIORITY_UPDATED = "task.priorityUpdated";
    public static final String TASK_REMOVED = "task.removed";

    public record Added(@JsonProperty("task") Task task) {
    }

    public record Ready(@JsonProperty("taskId") String taskId) {
    }

    public record Assigned(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("workerId") String workerId) {
    }

    public record Started(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("workerId") String workerId) {
    }

    public record Completed(@JsonProperty("taskId") String taskId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Failed(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("reason") String reason) {
    }

    public record StateChanged(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("oldState") TaskStatus oldState,
            @JsonProperty("newState") TaskStatus newState) {
    }

    public record PriorityUpdated(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("oldPriority") TaskPriority oldPriority,
            @JsonProperty("newPriority") TaskPriority newPriority) {
    }

    public record Removed(@JsonProperty("taskId") String taskId) {
    }
}
