package io.github.drompincen.lumenta.gateway.push;

import java.io.IOException;

/**
 * Transport for one real-time client. Frames are JSON-serialized {@code PushEnvelope}s.
 */
public interface PushChannel {

    /**
     * @throws IOException when the client can no longer be reached
     */
    void send(String json) throws IOException;

    /** Ends the transport; called at most once per session. */
    void close();
}
