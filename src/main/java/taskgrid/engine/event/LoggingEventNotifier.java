package taskgrid.engine.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each event as a single JSON line to the {@code taskgrid.events} logger.
 */
public final class LoggingEventNotifier implements EventNotifier {

    private static final Logger log = LoggerFactory.getLogger("taskgrid.events");

    private final ObjectMapper mapper;

    public LoggingEventNotifier() {
        this(defaultMapper());
    }

    public LoggingEventNotifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void publish(String eventName, Object payload) {
        if (!log.isInfoEnabled()) {
            return;
        }
        try {
            log.info(toJson(eventName, payload));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} payload: {}", eventName, e.getMessage());
        }
    }

    /**
     * Render an event as {"event": name, "payload": {...}}.
     */
    public String toJson(String eventName, Object payload) throws JsonProcessingException {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", eventName);
        envelope.put("payload", payload);
        return mapper.writeValueAsString(envelope);
    }
}
