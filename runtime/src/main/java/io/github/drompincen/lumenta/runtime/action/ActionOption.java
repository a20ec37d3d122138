package io.github.drompincen.lumenta.runtime.action;

import java.util.Arrays;
import java.util.Optional;

public enum ActionOption {
    CALL,
    EMAIL,
    TEXT;

    public String wire() {
        return name().toLowerCase();
    }

    public static Optional<ActionOption> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(o -> o.wire().equals(value)).findFirst();
    }
}
