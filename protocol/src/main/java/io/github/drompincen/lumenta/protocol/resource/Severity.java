package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wire;

    Severity(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<Severity> fromWire(String value) {
        return Arrays.stream(values()).filter(v -> v.wire.equals(value)).findFirst();
    }
}
