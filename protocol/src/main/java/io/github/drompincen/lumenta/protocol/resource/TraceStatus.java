package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum TraceStatus {
    STARTED("started"),
    FINISHED("finished"),
    ERROR("error");

    private final String wire;

    TraceStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<TraceStatus> fromWire(String value) {
        return Arrays.stream(values()).filter(v -> v.wire.equals(value)).findFirst();
    }
}
