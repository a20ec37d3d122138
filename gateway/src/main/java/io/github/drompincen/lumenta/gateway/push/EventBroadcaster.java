package io.github.drompincen.lumenta.gateway.push;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens {@link BroadcasterSession}s for SSE and WebSocket clients and closes whatever is still
 * open on shutdown.
 */
@Component
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final ResourceStore store;
    private final TaskScheduler taskScheduler;
    private final ObjectMapper objectMapper;
    private final LumentaProperties properties;
    private final Map<String, BroadcasterSession> sessions = new ConcurrentHashMap<>();

    public EventBroadcaster(ResourceStore store, TaskScheduler taskScheduler,
                            ObjectMapper objectMapper, LumentaProperties properties) {
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public BroadcasterSession open(PushChannel channel) {
        BroadcasterSession session = new BroadcasterSession(UUID.randomUUID().toString(), channel, store,
                taskScheduler, objectMapper, properties.getPush().getHeartbeatInterval(),
                this::forget);
        sessions.put(session.id(), session);
        session.open();
        log.info("Push clients: {} connected, {} store subscribers", sessionCount(), store.subscriberCount());
        return session;
    }

    public int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        if (!sessions.isEmpty()) {
            log.info("Closing {} push sessions", sessionCount());
        }
        List.copyOf(sessions.values()).forEach(BroadcasterSession::close);
    }

    private void forget(BroadcasterSession session) {
        if (sessions.remove(session.id(), session)) {
            log.debug("Push clients: {} connected, {} store subscribers", sessionCount(), store.subscriberCount());
        }
    }
}
