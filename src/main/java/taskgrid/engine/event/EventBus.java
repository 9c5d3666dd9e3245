package taskgrid.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of engine events to subscribers.
 * Subscribers run on the publishing thread in subscription order; one that
 * throws is logged and skipped, the rest still receive the event.
 */
public final class EventBus implements EventNotifier {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<EventNotifier> all = new CopyOnWriteArrayList<>();
    private final Map<String, CopyOnWriteArrayList<EventNotifier>> byName = new ConcurrentHashMap<>();

    /** Receive every event */
    public void subscribe(EventNotifier subscriber) {
        all.add(subscriber);
    }

    /** Receive only events with the given name */
    public void subscribe(String eventName, EventNotifier subscriber) {
        byName.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(subscriber);
    }

    public void unsubscribe(EventNotifier subscriber) {
        all.remove(subscriber);
        for (var list : byName.values()) {
            list.remove(subscriber);
        }
    }

    @Override
    public void publish(String eventName, Object payload) {
        var named = byName.get(eventName);
        if (named != null) {
            for (var s : named) deliver(s, eventName, payload);
        }
        for (var s : all) deliver(s, eventName, payload);
    }

    private void deliver(EventNotifier subscriber, String eventName, Object payload) {
        try {
            subscriber.publish(eventName, payload);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {}: {}", eventName, e.getMessage(), e);
        }
    }
}
