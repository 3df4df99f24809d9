package com.javacpi.shared.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.javacpi.shared.error.FailureKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionResultTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void successCarriesPayload() {
        var result = ActionResult.ok(objectMapper.createObjectNode().put("success", true));

        assertThat(result.isError()).isFalse();
        assertThat(result.failure()).isNull();
        assertThat(result.payload().path("success").asBoolean()).isTrue();
    }

    @Test
    void failureCarriesKindAndMessage() {
        var result = ActionResult.failure(FailureKind.TIMEOUT, "too slow");

        assertThat(result.isError()).isTrue();
        assertThat(result.payload()).isNull();
        assertThat(result.failure()).isEqualTo(new ActionFailure(FailureKind.TIMEOUT, "too slow"));
    }

    @Test
    void exactlyOneSideIsSet() {
        assertThatThrownBy(() -> new ActionResult(null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ActionResult(objectMapper.createObjectNode(),
                new ActionFailure(FailureKind.INTERNAL_ERROR, "x"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failureSerializesAsJson() throws Exception {
        var json = objectMapper.writeValueAsString(new ActionFailure(FailureKind.RESOURCE_CONFLICT, "exists"));

        assertThat(objectMapper.readTree(json).path("kind").asText()).isEqualTo("RESOURCE_CONFLICT");
        assertThat(objectMapper.readTree(json).path("message").asText()).isEqualTo("exists");
    }
}
