package com.umitunal.cronq.serialization;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JsonDocumentCodecTest {

    private final JsonDocumentCodec codec = new JsonDocumentCodec();

    @Test
    @DisplayName("Should keep nested fields and numeric timestamps")
    void testNestedDocument() {
        // Given
        ObjectNode original = codec.getMapper().createObjectNode();
        original.put("_id", "nightly-report");
        original.putObject("schedule")
                .put("wakeAt", 1_790_000_000_000L)
                .put("cron", "0 0 2 * * *");
        original.putArray("recipients").add("ops@example.com");

        // When
        ObjectNode decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded).isEqualTo(original);
        assertThat(decoded.at("/schedule/wakeAt").isIntegralNumber()).isTrue();
    }

    @Test
    @DisplayName("Should reject bytes that are not a JSON object")
    void testRejectsNonObjects() {
        assertThatThrownBy(() -> codec.decode("[1,2,3]".getBytes(UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("{broken".getBytes(UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
