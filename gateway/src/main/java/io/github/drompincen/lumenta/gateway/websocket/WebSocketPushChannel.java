package io.github.drompincen.lumenta.gateway.websocket;

import io.github.drompincen.lumenta.gateway.push.PushChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

class WebSocketPushChannel implements PushChannel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketPushChannel.class);

    private final WebSocketSession session;

    WebSocketPushChannel(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void send(String json) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(json));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("Closing WebSocket {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
