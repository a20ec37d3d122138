package io.github.drompincen.lumenta.protocol.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.lumenta.protocol.Json;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRpcResponseTest {

    private final ObjectMapper mapper = Json.newMapper();

    @Test
    void successEchoesStringId() throws Exception {
        JsonRpcResponse response = JsonRpcResponse.success(TextNode.valueOf("abc"), Map.of("ok", true));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(response));
        assertThat(json.get("jsonrpc").asText()).isEqualTo("2.0");
        assertThat(json.get("id").asText()).isEqualTo("abc");
        assertThat(json.get("result").get("ok").asBoolean()).isTrue();
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void failureWithMissingIdWritesNullId() throws Exception {
        JsonRpcResponse response = JsonRpcResponse.failure(MissingNode.getInstance(),
                JsonRpcError.of(JsonRpcError.PARSE_ERROR, "Parse error"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(response));
        assertThat(json.has("id")).isTrue();
        assertThat(json.get("id").isNull()).isTrue();
        assertThat(json.get("error").get("code").asInt()).isEqualTo(-32700);
        assertThat(json.get("error").has("data")).isFalse();
        assertThat(json.has("result")).isFalse();
        assertThat(response.hasError()).isTrue();
    }

    @Test
    void requestFactoryKeepsNumericId() {
        JsonRpcRequest request = JsonRpcRequest.of(7, "ping", null);

        assertThat(request.id().isNumber()).isTrue();
        assertThat(request.id().asLong()).isEqualTo(7L);
        assertThat(request.jsonrpc()).isEqualTo("2.0");
    }

    @Test
    void requestDecodesNullIdAsNullNode() throws Exception {
        JsonRpcRequest request = mapper.readValue(
                "{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"ping\"}", JsonRpcRequest.class);

        JsonRpcResponse response = JsonRpcResponse.success(request.id(), Map.of());
        assertThat(response.id().isNull()).isTrue();
    }
}
