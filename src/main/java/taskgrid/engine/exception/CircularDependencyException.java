package taskgrid.engine.exception;

import java.util.List;

/**
 * Raised when an execution order is requested over a cyclic graph.
 * Adding a cyclic edge is never rejected by itself.
 */
public class CircularDependencyException extends TaskEngineException {

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
