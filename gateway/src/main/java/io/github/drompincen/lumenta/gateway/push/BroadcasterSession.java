package io.github.drompincen.lumenta.gateway.push;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.push.PushEnvelope;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import io.github.drompincen.lumenta.runtime.store.StoreEvent;
import io.github.drompincen.lumenta.runtime.store.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One connected client: the connected frame, then every store event, plus a heartbeat.
 *
 * <p>The first failed send closes the session. {@link #close()} runs its teardown exactly once,
 * whichever of a send failure, a client disconnect or shutdown gets there first, and nothing is
 * sent after it.
 */
public class BroadcasterSession {

    private static final Logger log = LoggerFactory.getLogger(BroadcasterSession.class);

    static final String CONNECTED_MESSAGE = "Connected to Lumenta MCP event stream";

    private final String id;
    private final PushChannel channel;
    private final ResourceStore store;
    private final TaskScheduler taskScheduler;
    private final ObjectMapper objectMapper;
    private final Duration heartbeatInterval;
    private final Consumer<BroadcasterSession> onClose;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Subscription subscription;
    private volatile ScheduledFuture<?> heartbeat;

    BroadcasterSession(String id, PushChannel channel, ResourceStore store, TaskScheduler taskScheduler,
                       ObjectMapper objectMapper, Duration heartbeatInterval,
                       Consumer<BroadcasterSession> onClose) {
        this.id = id;
        this.channel = channel;
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.objectMapper = objectMapper;
        this.heartbeatInterval = heartbeatInterval;
        this.onClose = onClose;
    }

    public String id() {
        return id;
    }

    public boolean isClosed() {
        return closed.get();
    }

    void open() {
        if (!send(PushEnvelope.connected(CONNECTED_MESSAGE))) {
            return;
        }
        subscription = store.subscribe(this::onStoreEvent);
        heartbeat = taskScheduler.scheduleAtFixedRate(this::sendHeartbeat,
                Instant.now().plus(heartbeatInterval), heartbeatInterval);
        // close() may have run between the assignments above
        if (closed.get()) {
            release();
        }
        log.info("Push session {} opened", id);
    }

    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        release();
        try {
            channel.close();
        } catch (RuntimeException e) {
            log.debug("Push session {} channel close failed: {}", id, e.getMessage());
        }
        onClose.accept(this);
        log.info("Push session {} closed", id);
    }

    private void release() {
        ScheduledFuture<?> hb = heartbeat;
        if (hb != null) {
            hb.cancel(false);
        }
        Subscription sub = subscription;
        if (sub != null) {
            sub.unsubscribe();
        }
    }

    private void onStoreEvent(StoreEvent event) {
        send(PushEnvelope.event(event.type(), event.data()));
    }

    private void sendHeartbeat() {
        send(PushEnvelope.heartbeat());
    }

    private boolean send(PushEnvelope envelope) {
        if (closed.get()) {
            return false;
        }
        try {
            channel.send(objectMapper.writeValueAsString(envelope));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Push session {} send of {} failed, closing: {}", id, envelope.type(), e.getMessage());
            close();
            return false;
        }
    }
}
