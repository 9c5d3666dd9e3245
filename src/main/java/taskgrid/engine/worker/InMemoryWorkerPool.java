package taskgrid.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.model.Worker;
import taskgrid.engine.model.WorkerStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of workers kept by the host application, in registration order.
 * Thread-safe; the host updates availability as workers pick up and finish tasks.
 */
public class InMemoryWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkerPool.class);

    private final Map<String, Worker> workers = new LinkedHashMap<>();

    /**
     * Add or replace a worker.
     */
    public synchronized void register(Worker worker) {
        Worker previous = workers.put(worker.id(), worker);
        if (previous == null) {
            log.info("Registered worker {} with capabilities {}", worker.id(), worker.capabilities());
        } else {
            log.debug("Updated worker {}", worker.id());
        }
    }

    public boolean markIdle(String workerId) {
        return setStatus(workerId, WorkerStatus.IDLE);
    }

    public boolean markBusy(String workerId) {
        return setStatus(workerId, WorkerStatus.BUSY);
    }

    public boolean markOffline(String workerId) {
        return setStatus(workerId, WorkerStatus.OFFLINE);
    }

    private synchronized boolean setStatus(String workerId, WorkerStatus status) {
        Worker w = workers.get(workerId);
        if (w == null) {
            log.warn("Unknown worker {}", workerId);
            return false;
        }
        workers.put(workerId, w.toBuilder().status(status).build());
        return true;
    }

    public synchronized boolean remove(String workerId) {
        return workers.remove(workerId) != null;
    }

    public synchronized Optional<Worker> findById(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    @Override
    public synchronized List<Worker> getIdleWorkers() {
        List<Worker> idle = new ArrayList<>();
        for (Worker w : workers.values()) {
            if (w.isIdle()) idle.add(w);
        }
        return idle;
    }

    public synchronized List<Worker> snapshot() {
        return new ArrayList<>(workers.values());
    }

    public synchronized int size() {
        return workers.size();
    }

    public synchronized void clear() {
        workers.clear();
    }
}
