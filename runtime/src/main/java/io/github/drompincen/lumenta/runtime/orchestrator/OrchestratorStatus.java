package io.github.drompincen.lumenta.runtime.orchestrator;

import java.time.Instant;

/**
 * {@code interval} is in milliseconds; {@code lastPassAt} and {@code lastOutcome} are null until
 * the first pass.
 */
public record OrchestratorStatus(
        OrchestratorState state,
        long interval,
        long passes,
        long skipped,
        Instant lastPassAt,
        PassOutcome lastOutcome
) {}
