package taskgrid.engine.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskgrid.engine.support.RecordingEventNotifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    @Test
    void catchAllSubscriberReceivesEverything() {
        RecordingEventNotifier all = new RecordingEventNotifier();
        bus.subscribe(all);

        bus.publish(TaskEvents.TASK_READY, new TaskEvents.Ready("t1"));
        bus.publish(TaskEvents.TASK_COMPLETED, new TaskEvents.Completed("t1"));

        assertEquals(List.of(TaskEvents.TASK_READY, TaskEvents.TASK_COMPLETED), all.names());
    }

    @Test
    void namedSubscriberOnlyReceivesItsEvent() {
        RecordingEventNotifier ready = new RecordingEventNotifier();
        bus.subscribe(TaskEvents.TASK_READY, ready);

        bus.publish(TaskEvents.TASK_ADDED, "ignored");
        bus.publish(TaskEvents.TASK_READY, new TaskEvents.Ready("t1"));

        assertEquals(List.of(new TaskEvents.Ready("t1")), ready.payloads(TaskEvents.TASK_READY, TaskEvents.Ready.class));
        assertEquals(1, ready.events().size());
    }

    @Test
    void failingSubscriberDoesNotStopDelivery() {
        List<String> order = new ArrayList<>();
        bus.subscribe((name, payload) -> order.add("first"));
        bus.subscribe((name, payload) -> {
            throw new IllegalStateException("subscriber down");
        });
        bus.subscribe((name, payload) -> order.add("third"));

        assertDoesNotThrow(() -> bus.publish(TaskEvents.TASK_READY, new TaskEvents.Ready("t1")));
        assertEquals(List.of("first", "third"), order);
    }

    @Test
    void unsubscribeStopsDelivery() {
        RecordingEventNotifier sub = new RecordingEventNotifier();
        bus.subscribe(sub);
        bus.subscribe(TaskEvents.TASK_READY, sub);

        bus.unsubscribe(sub);
        bus.publish(TaskEvents.TASK_READY, new TaskEvents.Ready("t1"));

        assertTrue(sub.events().isEmpty());
    }

    @Test
    void noopNotifierAcceptsAnything() {
        assertDoesNotThrow(() -> EventNotifier.noop().publish("anything", null));
    }
}
