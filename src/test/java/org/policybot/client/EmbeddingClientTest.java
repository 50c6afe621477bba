package org.policybot.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingClientTest {

    private final EmbeddingClient client = new EmbeddingClient(null, new ObjectMapper());

    @Test
    void vectorsAreOrderedByIndex() throws Exception {
        String response = "{\"data\":["
                + "{\"index\":1,\"embedding\":[0.3,0.4]},"
                + "{\"index\":0,\"embedding\":[0.1,0.2]}]}";

        List<float[]> vectors = client.parseVectors(response);

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(0.1f, 0.2f);
        assertThat(vectors.get(1)).containsExactly(0.3f, 0.4f);
    }

    @Test
    void missingDataIsRejected() {
        assertThatThrownBy(() -> client.parseVectors("{\"error\":\"quota\"}"))
                .isInstanceOf(IllegalStateException.class);
    }
}
