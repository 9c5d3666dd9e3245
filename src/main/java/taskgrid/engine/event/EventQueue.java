package taskgrid.engine.event;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects events raised during one engine operation so they can be
 * delivered after the operation has finished mutating state.
 * Not thread-safe; confined to the orchestrator's lock.
 */
public final class EventQueue implements EventNotifier {

    public record Event(String name, Object payload) {
    }

    private final List<Event> pending = new ArrayList<>();

    @Override
    public void publish(String eventName, Object payload) {
        pending.add(new Event(eventName, payload));
    }

    /** Remove and return everything queued so far, oldest first */
    public List<Event> drain() {
        if (pending.isEmpty()) {
            return List.of();
        }
        List<Event> batch = new ArrayList<>(pending);
        pending.clear();
        return batch;
    }
}
