package io.github.drompincen.lumenta.protocol.integration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum IntegrationStatus {
    ACTIVE("active"),
    STANDBY("standby"),
    ERROR("error");

    private final String wire;

    IntegrationStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static IntegrationStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wire.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown integration status: " + value));
    }
}
