package taskgrid.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One audit record in a task's lifecycle history.
 */
public record HistoryEntry(
        @JsonProperty("state") TaskStatus state,
        @JsonProperty("timestamp") Instant timestamp) {

    public HistoryEntry {
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
