package io.github.drompincen.lumenta.runtime.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.Json;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolSchemaValidatorTest {

    private final ObjectMapper mapper = Json.newMapper();
    private final ToolSchemaValidator validator = new ToolSchemaValidator(mapper);

    private StubTool notificationLike() {
        ObjectNode schema = mapper.createObjectNode();
        ObjectNode props = schema.putObject("properties");
        props.putObject("title").put("type", "string");
        props.putObject("severity").put("type", "string").putArray("enum").add("low").add("high");
        ObjectNode channels = props.putObject("channels").put("type", "array");
        channels.putObject("items").put("type", "string").putArray("enum").add("email").add("sms");
        props.putObject("metadata").put("type", "object");
        schema.putArray("required").add("title").add("message");
        return new StubTool("notify", schema);
    }

    @Test
    void missingArgumentsAreListed() {
        assertThatThrownBy(() -> validator.validate(notificationLike(), null))
                .isInstanceOfSatisfying(InvalidToolArgumentsException.class, e -> {
                    assertThat(e.data().path("missing")).hasSize(2);
                    assertThat(e.data().path("missing").get(0).asText()).isEqualTo("title");
                });
    }

    @Test
    void nullCountsAsMissing() {
        ObjectNode args = mapper.createObjectNode().put("title", "t");
        args.putNull("message");

        assertThatThrownBy(() -> validator.validate(notificationLike(), args))
                .isInstanceOfSatisfying(InvalidToolArgumentsException.class,
                        e -> assertThat(e.data().path("missing").get(0).asText()).isEqualTo("message"));
    }

    @Test
    void wrongTypeNamesTheField() {
        ObjectNode args = mapper.createObjectNode().put("title", 42).put("message", "m");

        assertThatThrownBy(() -> validator.validate(notificationLike(), args))
                .isInstanceOfSatisfying(InvalidToolArgumentsException.class,
                        e -> assertThat(e.data().path("field").asText()).isEqualTo("title"));
    }

    @Test
    void enumAndItemEnumAreEnforced() {
        ObjectNode badSeverity = mapper.createObjectNode().put("title", "t").put("message", "m").put("severity", "urgent");
        ObjectNode badChannel = mapper.createObjectNode().put("title", "t").put("message", "m");
        badChannel.putArray("channels").add("email").add("pager");

        assertThatThrownBy(() -> validator.validate(notificationLike(), badSeverity))
                .isInstanceOfSatisfying(InvalidToolArgumentsException.class,
                        e -> assertThat(e.data().path("field").asText()).isEqualTo("severity"));
        assertThatThrownBy(() -> validator.validate(notificationLike(), badChannel))
                .isInstanceOfSatisfying(InvalidToolArgumentsException.class,
                        e -> assertThat(e.data().path("reason").asText()).contains("pager"));
    }

    @Test
    void validArgumentsPassThroughWithExtras() {
        ObjectNode args = mapper.createObjectNode().put("title", "t").put("message", "m").put("extra", true);
        args.putArray("channels").add("sms");

        ObjectNode validated = validator.validate(notificationLike(), args);

        assertThat(validated.path("extra").asBoolean()).isTrue();
    }

    @Test
    void nonObjectArgumentsAreRejected() {
        assertThatThrownBy(() -> validator.validate(StubTool.requiring("x"), mapper.createArrayNode()))
                .isInstanceOf(InvalidToolArgumentsException.class);
        assertThat(validator.validate(StubTool.requiring("x"), null)).isEmpty();
    }
}
