package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum DetectionType {
    PERSON("person"),
    VEHICLE("vehicle"),
    MOTION("motion"),
    OBJECT("object"),
    ALERT("alert");

    private final String wire;

    DetectionType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<DetectionType> fromWire(String value) {
        return Arrays.stream(values()).filter(v -> v.wire.equals(value)).findFirst();
    }
}
