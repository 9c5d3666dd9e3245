package taskgrid.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Task counts per lifecycle status.
 */
public record TaskStats(
        @JsonProperty("total") int total,
        @JsonProperty("pending") int pending,
        @JsonProperty("assigned") int assigned,
        @JsonProperty("inProgress") int inProgress,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed) {

    public static TaskStats of(Collection<Task> tasks) {
        int pending = 0, assigned = 0, inProgress = 0, completed = 0, failed = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case PENDING -> pending++;
                case ASSIGNED -> assigned++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new TaskStats(tasks.size(), pending, assigned, inProgress, completed, failed);
    }
}
