package io.github.drompincen.lumenta.runtime.config;

import io.github.drompincen.lumenta.protocol.resource.ResourceKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code lumenta.*}. Provider credentials are optional at startup;
 * a missing key surfaces as a tool or action failure when the provider is first used.
 */
@ConfigurationProperties(prefix = "lumenta")
public class LumentaProperties {

    private final Gemini gemini = new Gemini();
    private final Resend resend = new Resend();
    private final Vonage vonage = new Vonage();
    private final Vapi vapi = new Vapi();
    private final Orchestrator orchestrator = new Orchestrator();
    private final Push push = new Push();
    private final Store store = new Store();

    public Gemini getGemini() { return gemini; }
    public Resend getResend() { return resend; }
    public Vonage getVonage() { return vonage; }
    public Vapi getVapi() { return vapi; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public Push getPush() { return push; }
    public Store getStore() { return store; }

    public static class Gemini {
        private String apiKey;
        // OpenAI-compatible surface of the Generative Language API
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai";
        private String completionsPath = "/chat/completions";
        private String model = "gemini-2.0-flash-exp";
        private double temperature = 0.7;
        private int maxTokens = 8192;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getCompletionsPath() { return completionsPath; }
        public void setCompletionsPath(String completionsPath) { this.completionsPath = completionsPath; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }

    public static class Resend {
        private String apiKey;
        private String fromEmail;
        private String baseUrl = "https://api.resend.com";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getFromEmail() { return fromEmail; }
        public void setFromEmail(String fromEmail) { this.fromEmail = fromEmail; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class Vonage {
        private String apiKey;
        private String apiSecret;
        private String fromNumber = "Lumenta";
        private String baseUrl = "https://rest.nexmo.com";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getApiSecret() { return apiSecret; }
        public void setApiSecret(String apiSecret) { this.apiSecret = apiSecret; }
        public String getFromNumber() { return fromNumber; }
        public void setFromNumber(String fromNumber) { this.fromNumber = fromNumber; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class Vapi {
        private String apiKey;
        private String phoneNumberId;
        private String assistantId;
        private String baseUrl = "https://api.vapi.ai";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getPhoneNumberId() { return phoneNumberId; }
        public void setPhoneNumberId(String phoneNumberId) { this.phoneNumberId = phoneNumberId; }
        public String getAssistantId() { return assistantId; }
        public void setAssistantId(String assistantId) { this.assistantId = assistantId; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class Orchestrator {
        private Duration defaultInterval = Duration.ofSeconds(10);
        private Duration minInterval = Duration.ofSeconds(1);

        public Duration getDefaultInterval() { return defaultInterval; }
        public void setDefaultInterval(Duration defaultInterval) { this.defaultInterval = defaultInterval; }
        public Duration getMinInterval() { return minInterval; }
        public void setMinInterval(Duration minInterval) { this.minInterval = minInterval; }
    }

    public static class Push {
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
    }

    public static class Store {
        private final Retention retention = new Retention();

        public Retention getRetention() { return retention; }
    }

    /** Per-kind capacities; 0 means unbounded. */
    public static class Retention {
        private int detections = 1000;
        private int identityMatches = 1000;
        private int transcripts = 1000;
        private int summaries = 100;
        private int traces = 10000;
        private int workflows = 0;

        public int capacity(ResourceKind kind) {
            return switch (kind) {
                case DETECTION -> detections;
                case IDENTITY_MATCH -> identityMatches;
                case TRANSCRIPT -> transcripts;
                case SUMMARY -> summaries;
                case TRACE -> traces;
                case WORKFLOW -> workflows;
            };
        }

        public int getDetections() { return detections; }
        public void setDetections(int detections) { this.detections = detections; }
        public int getIdentityMatches() { return identityMatches; }
        public void setIdentityMatches(int identityMatches) { this.identityMatches = identityMatches; }
        public int getTranscripts() { return transcripts; }
        public void setTranscripts(int transcripts) { this.transcripts = transcripts; }
        public int getSummaries() { return summaries; }
        public void setSummaries(int summaries) { this.summaries = summaries; }
        public int getTraces() { return traces; }
        public void setTraces(int traces) { this.traces = traces; }
        public int getWorkflows() { return workflows; }
        public void setWorkflows(int workflows) { this.workflows = workflows; }
    }
}
