package taskgrid.engine.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of an external worker. The engine only reads workers,
 * it never changes their availability.
 */
public final class Worker {
    private final String id;
    private final Set<String> capabilities;
    private final WorkerStatus status;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.capabilities));
        this.status = Objects.requireNonNull(builder.status, "status is required");
    }

    /** Shortcut for an idle worker with the given capabilities */
    public static Worker of(String id, String... capabilities) {
        return builder().id(id).capabilities(List.of(capabilities)).build();
    }

    public String id() {
        return id;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public WorkerStatus status() {
        return status;
    }

    public boolean isIdle() {
        return status == WorkerStatus.IDLE;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .capabilities(capabilities)
                .status(status);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Collection<String> capabilities = List.of();
        private WorkerStatus status = WorkerStatus.IDLE;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder capabilities(Collection<String> capabilities) {
            this.capabilities = capabilities == null ? List.of() : capabilities;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', status=" + status + ", capabilities=" + capabilities + "}";
    }
}
