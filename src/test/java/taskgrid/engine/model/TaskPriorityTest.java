package taskgrid.engine.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskPriorityTest {

    @Test
    void rankOrdersLowToCritical() {
        assertTrue(TaskPriority.CRITICAL.rank() > TaskPriority.HIGH.rank());
        assertTrue(TaskPriority.HIGH.rank() > TaskPriority.NORMAL.rank());
        assertTrue(TaskPriority.NORMAL.rank() > TaskPriority.LOW.rank());
    }

    @Test
    void parseIsCaseInsensitive() {
        assertEquals(TaskPriority.CRITICAL, TaskPriority.parse("critical"));
        assertEquals(TaskPriority.HIGH, TaskPriority.parse(" High "));
        assertEquals(TaskPriority.LOW, TaskPriority.parse("LOW"));
    }

    @Test
    void mediumIsAnAliasOfNormal() {
        assertEquals(TaskPriority.NORMAL, TaskPriority.parse("medium"));
        assertEquals(TaskPriority.NORMAL, TaskPriority.parse("normal"));
    }

    @Test
    void unknownPriorityIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TaskPriority.parse("urgent"));
        assertTrue(e.getMessage().contains("urgent"));
        assertThrows(IllegalArgumentException.class, () -> TaskPriority.parse(" "));
    }
}
