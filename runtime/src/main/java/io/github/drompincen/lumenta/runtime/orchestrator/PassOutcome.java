package io.github.drompincen.lumenta.runtime.orchestrator;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of one orchestration pass.
 */
public enum PassOutcome {
    /** Model answered and every tool call was attempted. */
    COMPLETED,
    /** Another pass was in flight. */
    SKIPPED,
    /** Model output could not be parsed; no tool was called. */
    ABORTED,
    /** The model call or the snapshot failed. */
    FAILED;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
