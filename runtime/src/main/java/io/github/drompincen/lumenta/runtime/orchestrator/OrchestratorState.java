package io.github.drompincen.lumenta.runtime.orchestrator;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrchestratorState {
    STOPPED,
    RUNNING;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
