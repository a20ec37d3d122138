package io.github.drompincen.lumenta.runtime.orchestrator;

import io.github.drompincen.lumenta.protocol.integration.Integration;
import io.github.drompincen.lumenta.protocol.resource.ActiveWorkflowResource;
import io.github.drompincen.lumenta.protocol.resource.AudioTranscriptResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionResource;
import io.github.drompincen.lumenta.protocol.resource.NodeExecutionTrace;
import io.github.drompincen.lumenta.protocol.resource.VideoSummaryResource;

import java.time.Instant;
import java.util.List;

/**
 * The state shown to the model on one pass.
 */
public record OrchestrationSnapshot(
        List<DetectionResource> detections,
        List<ActiveWorkflowResource> workflows,
        List<NodeExecutionTrace> recentTraces,
        List<AudioTranscriptResource> transcripts,
        List<VideoSummaryResource> summaries,
        List<Integration> integrations,
        Instant timestamp
) {}
