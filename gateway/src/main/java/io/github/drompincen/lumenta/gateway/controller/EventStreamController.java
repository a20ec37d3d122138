package io.github.drompincen.lumenta.gateway.controller;

import io.github.drompincen.lumenta.gateway.push.BroadcasterSession;
import io.github.drompincen.lumenta.gateway.push.EmitterPushChannel;
import io.github.drompincen.lumenta.gateway.push.EventBroadcaster;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-sent event stream of store changes. The emitter never times out; the session ends on
 * client disconnect or the first failed write.
 */
@RestController
@RequestMapping("/api/mcp/events")
public class EventStreamController {

    private final EventBroadcaster broadcaster;

    public EventStreamController(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream() {
        SseEmitter emitter = new SseEmitter(0L);
        BroadcasterSession session = broadcaster.open(new EmitterPushChannel(emitter));
        emitter.onCompletion(session::close);
        emitter.onTimeout(session::close);
        emitter.onError(e -> session.close());

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header("Connection", "keep-alive")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }
}
