package taskgrid.engine.event;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventQueueTest {

    @Test
    void drainReturnsEventsInPublishedOrderAndEmptiesTheQueue() {
        EventQueue queue = new EventQueue();
        queue.publish(TaskEvents.TASK_COMPLETED, new TaskEvents.Completed("A"));
        queue.publish(TaskEvents.TASK_READY, new TaskEvents.Ready("B"));

        List<EventQueue.Event> batch = queue.drain();

        assertEquals(List.of(
                new EventQueue.Event(TaskEvents.TASK_COMPLETED, new TaskEvents.Completed("A")),
                new EventQueue.Event(TaskEvents.TASK_READY, new TaskEvents.Ready("B"))), batch);
        assertTrue(queue.drain().isEmpty());
    }

    @Test
    void drainedBatchIsDetachedFromTheQueue() {
        EventQueue queue = new EventQueue();
        queue.publish(TaskEvents.TASK_READY, new TaskEvents.Ready("A"));
        List<EventQueue.Event> batch = queue.drain();

        queue.publish(TaskEvents.TASK_READY, new TaskEvents.Ready("B"));

        assertEquals(1, batch.size());
        assertEquals(1, queue.drain().size());
    }
}
