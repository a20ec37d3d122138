package io.github.drompincen.lumenta.gateway.websocket;

import io.github.drompincen.lumenta.gateway.push.BroadcasterSession;
import io.github.drompincen.lumenta.gateway.push.EventBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams the same envelopes as the SSE endpoint, one text frame each. Inbound frames are ignored.
 */
@Component
public class EventWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(EventWebSocketHandler.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final EventBroadcaster broadcaster;
    private final Map<String, BroadcasterSession> sessions = new ConcurrentHashMap<>();

    public EventWebSocketHandler(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // store events and heartbeats arrive on different threads
        var concurrent = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        sessions.put(session.getId(), broadcaster.open(new WebSocketPushChannel(concurrent)));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        BroadcasterSession push = sessions.remove(session.getId());
        if (push != null) {
            push.close();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket {} transport error: {}", session.getId(), exception.getMessage());
        afterConnectionClosed(session, CloseStatus.SERVER_ERROR);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring inbound frame on WebSocket {}", session.getId());
    }

    int sessionCount() {
        return sessions.size();
    }
}
