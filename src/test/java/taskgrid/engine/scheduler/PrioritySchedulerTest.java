package taskgrid.engine.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskgrid.engine.exception.DuplicateTaskException;
import taskgrid.engine.exception.UnknownTaskException;
import taskgrid.engine.model.TaskPriority;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PrioritySchedulerTest {

    private PriorityScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new PriorityScheduler();
    }

    private List<String> drain() {
        List<String> order = new ArrayList<>();
        Optional<String> next;
        while ((next = scheduler.getNextTask()).isPresent()) {
            order.add(next.get());
            scheduler.removeTask(next.get());
        }
        return order;
    }

    @Test
    void emptySchedulerHasNoNextTask() {
        assertTrue(scheduler.getNextTask().isEmpty());
        assertTrue(scheduler.isEmpty());
    }

    @Test
    @DisplayName("Higher priority always comes first")
    void drainsByPriority() {
        scheduler.addTask("L1", TaskPriority.LOW);
        scheduler.addTask("C1", TaskPriority.CRITICAL);
        scheduler.addTask("N1", TaskPriority.NORMAL);
        scheduler.addTask("H1", TaskPriority.HIGH);

        assertEquals(List.of("C1", "H1", "N1", "L1"), drain());
    }

    @Test
    void fifoWithinPriority() {
        scheduler.addTask("N1", TaskPriority.NORMAL);
        scheduler.addTask("N2", TaskPriority.NORMAL);
        scheduler.addTask("N3", TaskPriority.NORMAL);

        assertEquals("N1", scheduler.getNextTask().orElseThrow());
        assertEquals(List.of("N1", "N2", "N3"), drain());
    }

    @Test
    void getNextTaskDoesNotRemove() {
        scheduler.addTask("N1", TaskPriority.NORMAL);

        assertEquals("N1", scheduler.getNextTask().orElseThrow());
        assertEquals("N1", scheduler.getNextTask().orElseThrow());
        assertEquals(1, scheduler.size());
    }

    @Test
    @DisplayName("Promoted task jumps ahead of its former peers")
    void promotionMovesTaskToNewBucket() {
        scheduler.addTask("N1", TaskPriority.NORMAL);
        scheduler.addTask("N2", TaskPriority.NORMAL);

        assertEquals(TaskPriority.NORMAL, scheduler.updateTaskPriority("N1", TaskPriority.CRITICAL));

        assertEquals("N1", scheduler.getNextTask().orElseThrow());
        assertEquals(TaskPriority.CRITICAL, scheduler.getPriority("N1").orElseThrow());
    }

    @Test
    void priorityChangeGoesToTailOfBucket() {
        scheduler.addTask("H1", TaskPriority.HIGH);
        scheduler.addTask("N1", TaskPriority.NORMAL);
        scheduler.addTask("N2", TaskPriority.NORMAL);

        scheduler.updateTaskPriority("N1", TaskPriority.HIGH);
        scheduler.updateTaskPriority("N2", TaskPriority.NORMAL);

        assertEquals(List.of("H1", "N1", "N2"), scheduler.snapshot());
    }

    @Test
    void removeIsNoOpWhenAbsent() {
        assertFalse(scheduler.removeTask("missing"));

        scheduler.addTask("N1", TaskPriority.NORMAL);
        assertTrue(scheduler.removeTask("N1"));
        assertFalse(scheduler.contains("N1"));
    }

    @Test
    void duplicateAndUnknownTasks() {
        scheduler.addTask("N1", TaskPriority.NORMAL);

        assertThrows(DuplicateTaskException.class, () -> scheduler.addTask("N1", TaskPriority.HIGH));
        assertThrows(UnknownTaskException.class, () -> scheduler.updateTaskPriority("missing", TaskPriority.LOW));
    }

    @Test
    void filteredNextTaskFollowsSchedulingOrder() {
        scheduler.addTask("C1", TaskPriority.CRITICAL);
        scheduler.addTask("H1", TaskPriority.HIGH);
        scheduler.addTask("H2", TaskPriority.HIGH);

        assertEquals("H2", scheduler.getNextTask(id -> id.endsWith("2")).orElseThrow());
        assertTrue(scheduler.getNextTask(id -> false).isEmpty());
    }
}
