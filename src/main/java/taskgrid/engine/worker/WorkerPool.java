package taskgrid.engine.worker;

import taskgrid.engine.model.Worker;

import java.util.List;

/**
 * Source of workers the orchestrator may assign to. Read-only from the
 * engine's side: the engine never changes a worker's availability.
 */
@FunctionalInterface
public interface WorkerPool {

    /**
     * Workers currently able to accept a task, in a stable order.
     * The order is used to break ties between equally good matches.
     */
    List<Worker> getIdleWorkers();
}
