package io.github.drompincen.lumenta.gateway.controller;

import io.github.drompincen.lumenta.gateway.push.BroadcasterSession;
import io.github.drompincen.lumenta.gateway.push.EmitterPushChannel;
import io.github.drompincen.lumenta.gateway.push.EventBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventStreamControllerTest {

    @Mock
    private EventBroadcaster broadcaster;
    @Mock
    private BroadcasterSession session;

    private EventStreamController controller;

    @BeforeEach
    void setUp() {
        controller = new EventStreamController(broadcaster);
    }

    @Test
    void streamOpensSessionWithSseHeaders() {
        when(broadcaster.open(any(EmitterPushChannel.class))).thenReturn(session);

        ResponseEntity<SseEmitter> response = controller.stream();

        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.TEXT_EVENT_STREAM);
        assertThat(response.getHeaders().getCacheControl()).isEqualTo("no-cache");
        assertThat(response.getHeaders().getFirst("Connection")).isEqualTo("keep-alive");
        assertThat(response.getHeaders().getFirst("X-Accel-Buffering")).isEqualTo("no");
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getTimeout()).isEqualTo(0L);
        verify(broadcaster).open(any(EmitterPushChannel.class));
        verifyNoInteractions(session);
    }
}
