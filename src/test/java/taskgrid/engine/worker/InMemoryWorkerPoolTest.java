package taskgrid.engine.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskgrid.engine.model.Worker;
import taskgrid.engine.model.WorkerStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkerPoolTest {

    private InMemoryWorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new InMemoryWorkerPool();
        pool.register(Worker.of("w1", "java"));
        pool.register(Worker.of("w2", "go"));
        pool.register(Worker.of("w3", "python"));
    }

    private List<String> idleIds() {
        return pool.getIdleWorkers().stream().map(Worker::id).toList();
    }

    @Test
    void idleWorkersInRegistrationOrder() {
        assertEquals(List.of("w1", "w2", "w3"), idleIds());
        assertEquals(3, pool.size());
    }

    @Test
    void busyAndOfflineWorkersAreNotIdle() {
        assertTrue(pool.markBusy("w1"));
        assertTrue(pool.markOffline("w3"));

        assertEquals(List.of("w2"), idleIds());
        assertEquals(WorkerStatus.BUSY, pool.findById("w1").orElseThrow().status());

        pool.markIdle("w1");
        assertEquals(List.of("w1", "w2"), idleIds());
    }

    @Test
    void unknownWorkerIsReported() {
        assertFalse(pool.markBusy("ghost"));
        assertTrue(pool.findById("ghost").isEmpty());
    }

    @Test
    void registerReplacesExistingWorker() {
        pool.register(Worker.of("w2", "go", "rust"));

        assertEquals(3, pool.size());
        assertTrue(pool.findById("w2").orElseThrow().capabilities().contains("rust"));
    }

    @Test
    void removeAndClear() {
        assertTrue(pool.remove("w2"));
        assertFalse(pool.remove("w2"));
        assertEquals(List.of("w1", "w3"), pool.snapshot().stream().map(Worker::id).toList());

        pool.clear();
        assertTrue(pool.getIdleWorkers().isEmpty());
    }
}
