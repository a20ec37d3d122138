package io.github.drompincen.lumenta.runtime.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum GraphOperation {
    ADD_NODE("add_node"),
    REMOVE_NODE("remove_node"),
    UPDATE_NODE("update_node"),
    ADD_EDGE("add_edge"),
    REMOVE_EDGE("remove_edge"),
    UPDATE_EDGE("update_edge");

    private final String wire;

    GraphOperation(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<GraphOperation> fromWire(String value) {
        return Arrays.stream(values()).filter(op -> op.wire.equals(value)).findFirst();
    }
}
