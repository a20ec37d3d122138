package io.github.drompincen.lumenta.runtime.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.resource.DetectionResource;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import io.github.drompincen.lumenta.runtime.integration.IntegrationStore;
import io.github.drompincen.lumenta.runtime.llm.LlmException;
import io.github.drompincen.lumenta.runtime.llm.LlmRequest;
import io.github.drompincen.lumenta.runtime.llm.LlmService;
import io.github.drompincen.lumenta.runtime.llm.ModelResponseParseException;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import io.github.drompincen.lumenta.runtime.tools.ToolCallOrigin;
import io.github.drompincen.lumenta.runtime.tools.ToolCallService;
import io.github.drompincen.lumenta.runtime.tools.ToolRegistry;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically shows the model a snapshot of the store and runs the tool calls it asks for.
 * One pass at a time: a tick or trigger that finds a pass in flight is skipped, never queued.
 */
@Service
public class OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);

    static final int DETECTION_WINDOW = 10;
    static final int TRACE_WINDOW = 20;
    static final int TRANSCRIPT_WINDOW = 5;
    static final int SUMMARY_WINDOW = 3;

    private final ResourceStore store;
    private final IntegrationStore integrationStore;
    private final ToolRegistry toolRegistry;
    private final ToolCallService toolCallService;
    private final LlmService llmService;
    private final DecisionPromptBuilder promptBuilder;
    private final TaskScheduler taskScheduler;
    private final LumentaProperties properties;
    private final ObjectMapper objectMapper;

    private static final long ANY_GENERATION = -1L;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong passes = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();

    private ScheduledFuture<?> schedule;
    private volatile OrchestratorState state = OrchestratorState.STOPPED;
    private volatile Duration interval;
    private volatile String apiKey;
    private volatile Instant lastPassAt;
    private volatile PassOutcome lastOutcome;

    public OrchestrationLoop(ResourceStore store, IntegrationStore integrationStore,
                             ToolRegistry toolRegistry, ToolCallService toolCallService,
                             LlmService llmService, DecisionPromptBuilder promptBuilder,
                             TaskScheduler taskScheduler, LumentaProperties properties,
                             ObjectMapper objectMapper) {
        this.store = store;
        this.integrationStore = integrationStore;
        this.toolRegistry = toolRegistry;
        this.toolCallService = toolCallService;
        this.llmService = llmService;
        this.promptBuilder = promptBuilder;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.interval = properties.getOrchestrator().getDefaultInterval();
    }

    /**
     * Starts the loop, or restarts it with the new interval and key when already running.
     * The first pass runs immediately on the scheduler.
     *
     * @param requestedInterval null for the configured default
     * @param requestApiKey null or blank for the configured Gemini key
     */
    public synchronized OrchestratorStatus start(Duration requestedInterval, String requestApiKey) {
        Duration effective = requestedInterval != null
                ? requestedInterval
                : properties.getOrchestrator().getDefaultInterval();
        Duration min = properties.getOrchestrator().getMinInterval();
        if (effective.compareTo(min) < 0) {
            throw new IllegalArgumentException("Interval must be at least " + min.toMillis() + " ms");
        }
        String key = hasText(requestApiKey) ? requestApiKey : properties.getGemini().getApiKey();
        if (!hasText(key)) {
            throw new IllegalStateException("Gemini API key is required to start the orchestrator");
        }

        cancelSchedule();
        long gen = generation.incrementAndGet();
        this.interval = effective;
        this.apiKey = key;
        this.state = OrchestratorState.RUNNING;
        Instant firstTick = Instant.now();
        schedule = taskScheduler.scheduleAtFixedRate(new Ticker(gen, firstTick, effective), firstTick, effective);
        log.info("Orchestrator started (interval {} ms)", effective.toMillis());
        return status();
    }

    public synchronized OrchestratorStatus stop() {
        generation.incrementAndGet();
        cancelSchedule();
        if (state == OrchestratorState.RUNNING) {
            state = OrchestratorState.STOPPED;
            log.info("Orchestrator stopped after {} passes", passes.get());
        }
        return status();
    }

    /**
     * Runs one pass on the calling thread.
     *
     * @throws IllegalStateException when the loop is stopped
     */
    public PassOutcome trigger() {
        if (state != OrchestratorState.RUNNING) {
            throw new IllegalStateException("Orchestrator is not running");
        }
        return runPass();
    }

    public OrchestratorStatus status() {
        return new OrchestratorStatus(state, interval.toMillis(), passes.get(), skipped.get(),
                lastPassAt, lastOutcome);
    }

    public boolean isRunning() {
        return state == OrchestratorState.RUNNING;
    }

    @PreDestroy
    public void dispose() {
        stop();
    }

    PassOutcome runPass() {
        return runPass(ANY_GENERATION);
    }

    /**
     * Runs a pass unless one is in flight. A scheduled pass also re-checks its generation once it
     * holds the guard, so a {@link #stop()} that lands after the tick fired still wins.
     */
    private PassOutcome runPass(long gen) {
        if (!inFlight.compareAndSet(false, true)) {
            skipped.incrementAndGet();
            log.debug("Orchestration pass skipped, previous pass still running");
            return PassOutcome.SKIPPED;
        }
        if (gen != ANY_GENERATION && gen != generation.get()) {
            inFlight.set(false);
            return PassOutcome.SKIPPED;
        }
        PassOutcome outcome = PassOutcome.FAILED;
        try {
            outcome = doPass();
            return outcome;
        } finally {
            passes.incrementAndGet();
            lastPassAt = Instant.now();
            lastOutcome = outcome;
            inFlight.set(false);
        }
    }

    private PassOutcome doPass() {
        String prompt;
        try {
            prompt = promptBuilder.build(snapshot(), toolRegistry.descriptors());
        } catch (RuntimeException e) {
            log.error("Could not build orchestration snapshot", e);
            return PassOutcome.FAILED;
        }

        String text;
        try {
            LumentaProperties.Gemini gemini = properties.getGemini();
            text = llmService.blockingResponse(
                    new LlmRequest(apiKey, prompt, gemini.getTemperature(), gemini.getMaxTokens(), false));
        } catch (LlmException e) {
            log.error("Orchestration model call failed: {}", e.getMessage());
            return PassOutcome.FAILED;
        }

        ModelDecision decision;
        try {
            decision = ModelDecision.parse(objectMapper, text);
        } catch (ModelResponseParseException e) {
            log.warn("Orchestration pass aborted, unparsable model output: {}", e.getMessage());
            return PassOutcome.ABORTED;
        }

        if (decision.reasoning() != null) {
            log.info("Orchestrator reasoning: {}", decision.reasoning());
        }
        for (ModelDecision.ToolCallRequest call : decision.toolCalls()) {
            invoke(call);
        }
        return PassOutcome.COMPLETED;
    }

    private void invoke(ModelDecision.ToolCallRequest call) {
        try {
            ToolResult result = toolCallService.call(call.name(), call.arguments(), ToolCallOrigin.ORCHESTRATOR);
            if (result.error()) {
                log.warn("Orchestrator tool {} reported an error: {}", call.name(), result.payload());
            } else {
                log.info("Orchestrator called {}", call.name());
            }
        } catch (RuntimeException e) {
            log.warn("Orchestrator tool call {} failed: {}", call.name(), e.getMessage());
        }
    }

    OrchestrationSnapshot snapshot() {
        List<DetectionResource> detections = store.listDetections(DETECTION_WINDOW).stream()
                .map(DetectionResource::withClampedConfidences)
                .toList();
        return new OrchestrationSnapshot(
                detections,
                store.listWorkflows(),
                store.listTraces(null, TRACE_WINDOW),
                store.listTranscripts(TRANSCRIPT_WINDOW),
                store.listSummaries(SUMMARY_WINDOW),
                integrationStore.active(),
                Instant.now());
    }

    private void cancelSchedule() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Fixed-rate tick of one generation. A fixed-rate task never overlaps itself: ticks that fell
     * due during a slow pass fire back to back once it ends. Such a tick, late by a whole interval
     * or more, counts as skipped instead of running another pass.
     */
    private final class Ticker implements Runnable {

        private final long gen;
        private final Instant firstTick;
        private final Duration period;
        private final AtomicLong fired = new AtomicLong();

        Ticker(long gen, Instant firstTick, Duration period) {
            this.gen = gen;
            this.firstTick = firstTick;
            this.period = period;
        }

        @Override
        public void run() {
            Instant due = firstTick.plus(period.multipliedBy(fired.getAndIncrement()));
            Duration late = Duration.between(due, Instant.now());
            if (late.compareTo(period) >= 0) {
                if (gen == generation.get()) {
                    skipped.incrementAndGet();
                    log.debug("Orchestration tick skipped, {} ms behind schedule", late.toMillis());
                }
                return;
            }
            try {
                runPass(gen);
            } catch (RuntimeException e) {
                log.error("Orchestration tick failed", e);
            }
        }
    }
}
