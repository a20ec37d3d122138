package io.github.drompincen.lumenta.gateway.push;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * SSE transport: each frame is a single {@code data:} line.
 */
public class EmitterPushChannel implements PushChannel {

    private final SseEmitter emitter;

    public EmitterPushChannel(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(String json) throws IOException {
        emitter.send(SseEmitter.event().data(json));
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
