package taskgrid.engine.event;

/**
 * Outbound channel for domain events.
 * Publishing is fire-and-forget: implementations must not block the caller
 * and callers never let a publishing failure affect engine state.
 */
@FunctionalInterface
public interface EventNotifier {

    /**
     * Publish an event.
     *
     * @param eventName one of the {@link TaskEvents} names
     * @param payload   the matching payload record
     */
    void publish(String eventName, Object payload);

    /** Notifier that drops every event */
    static EventNotifier noop() {
        return (eventName, payload) -> {
        };
    }
}
