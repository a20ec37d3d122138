package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum WorkflowStatus {
    RUNNING("running"),
    PAUSED("paused"),
    STOPPED("stopped");

    private final String wire;

    WorkflowStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<WorkflowStatus> fromWire(String value) {
        return Arrays.stream(values()).filter(v -> v.wire.equals(value)).findFirst();
    }
}
