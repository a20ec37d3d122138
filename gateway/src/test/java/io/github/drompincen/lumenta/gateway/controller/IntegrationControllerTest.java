package io.github.drompincen.lumenta.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.Json;
import io.github.drompincen.lumenta.protocol.api.IntegrationsRequest;
import io.github.drompincen.lumenta.protocol.integration.Integration;
import io.github.drompincen.lumenta.protocol.integration.IntegrationStatus;
import io.github.drompincen.lumenta.runtime.integration.IntegrationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntegrationControllerTest {

    private final ObjectMapper mapper = Json.newMapper();
    private IntegrationStore integrationStore;
    private IntegrationController controller;

    @BeforeEach
    void setUp() {
        integrationStore = new IntegrationStore();
        controller = new IntegrationController(integrationStore, mapper);
    }

    @Test
    void syncReplacesIntegrations() throws Exception {
        ResponseEntity<?> response = controller.handle(new IntegrationsRequest("sync", List.of(
                json("{\"id\":\"slack-1\",\"name\":\"Slack\",\"status\":\"active\","
                        + "\"config\":{\"webhookUrl\":\"https://hooks.slack.test/x\"},\"toolName\":\"send_notification\"}"),
                json("{\"id\":\"sms-1\",\"name\":\"SMS\",\"status\":\"standby\"}"))));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(body(response)).containsEntry("success", true).containsEntry("message", "Synced 2 integrations");
        assertThat(integrationStore.all()).extracting(Integration::id).containsExactly("slack-1", "sms-1");
        assertThat(integrationStore.activeFor("send_notification")).hasSize(1);
        assertThat(integrationStore.get("sms-1")).get()
                .extracting(Integration::status).isEqualTo(IntegrationStatus.STANDBY);
    }

    @Test
    void syncWithoutListClearsIntegrations() throws Exception {
        controller.handle(new IntegrationsRequest("sync", List.of(json("{\"id\":\"a\",\"status\":\"active\"}"))));

        ResponseEntity<?> response = controller.handle(new IntegrationsRequest("sync", null));

        assertThat(body(response)).containsEntry("message", "Synced 0 integrations");
        assertThat(integrationStore.all()).isEmpty();
    }

    @Test
    void malformedIntegrationRejectsWholeBatch() throws Exception {
        controller.handle(new IntegrationsRequest("sync", List.of(json("{\"id\":\"keep\",\"status\":\"active\"}"))));

        ResponseEntity<?> response = controller.handle(new IntegrationsRequest("sync", List.of(
                json("{\"id\":\"ok\",\"status\":\"active\"}"),
                json("{\"id\":\"bad\",\"status\":\"exploded\"}"))));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat((String) body(response).get("error")).startsWith("Invalid integration at index 1");
        assertThat(integrationStore.all()).extracting(Integration::id).containsExactly("keep");
    }

    @Test
    void integrationWithoutIdIsRejected() throws Exception {
        ResponseEntity<?> response = controller.handle(new IntegrationsRequest("sync",
                List.of(json("{\"name\":\"Nameless\",\"status\":\"active\"}"))));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat((String) body(response).get("error")).contains("id is required");
    }

    @Test
    void getListsIntegrations() throws Exception {
        controller.handle(new IntegrationsRequest("sync", List.of(json("{\"id\":\"a\",\"status\":\"error\"}"))));

        ResponseEntity<?> response = controller.handle(new IntegrationsRequest("get", null));

        assertThat(body(response)).containsEntry("success", true);
        assertThat(controller.list().get("integrations")).isEqualTo(integrationStore.all());
    }

    @Test
    void unknownActionIsBadRequest() {
        ResponseEntity<?> response = controller.handle(new IntegrationsRequest("delete", null));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(body(response)).containsEntry("error", "Unknown action: delete");
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(ResponseEntity<?> response) {
        return (Map<String, Object>) response.getBody();
    }
}
