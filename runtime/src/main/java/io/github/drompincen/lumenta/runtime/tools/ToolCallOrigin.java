package io.github.drompincen.lumenta.runtime.tools;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolCallOrigin {
    JSON_RPC("jsonrpc"),
    ORCHESTRATOR("orchestrator"),
    ACTION_NODE("action_node"),
    INTEGRATION("integration"),
    REST("rest");

    private final String wire;

    ToolCallOrigin(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
