package com.venturescout.vector;

import com.venturescout.data.http.HttpClientEx;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaEmbeddingClientTest {

    @Test
    void encode_shouldUseLegacyEndpointFirst() {
        ScriptedHttp http = new ScriptedHttp("{\"embedding\": [0.1, 0.2, 0.3]}", null);
        OllamaEmbeddingClient client = new OllamaEmbeddingClient(http, "http://localhost:11434/", "nomic", 30);

        float[] vec = client.encode("fintech payments");

        assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, vec);
        assertEquals(List.of("http://localhost:11434/api/embeddings"), http.urls);
        assertTrue(http.bodies.get(0).contains("\"prompt\":\"fintech payments\""));
        assertEquals("ollama-nomic", client.name());
    }

    @Test
    void encode_shouldFallBackToEmbedEndpoint() {
        ScriptedHttp http = new ScriptedHttp(null, "{\"embeddings\": [[1.0, 2.0]]}");
        OllamaEmbeddingClient client = new OllamaEmbeddingClient(http, "http://localhost:11434", "nomic", 30);

        float[] vec = client.encode("fintech payments");

        assertArrayEquals(new float[]{1.0f, 2.0f}, vec);
        assertEquals(2, http.urls.size());
        assertEquals("http://localhost:11434/api/embed", http.urls.get(1));
        assertTrue(http.bodies.get(1).contains("\"input\":\"fintech payments\""));
    }

    @Test
    void encode_shouldThrowWhenBothEndpointsFail() {
        ScriptedHttp http = new ScriptedHttp(null, null);
        OllamaEmbeddingClient client = new OllamaEmbeddingClient(http, "http://localhost:11434", "nomic", 30);

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> client.encode("anything"));

        assertEquals(1, error.getSuppressed().length);
        assertTrue(error.getMessage().contains("HTTP 503"));
    }

    @Test
    void parseEmbedding_shouldHandleEmptyAndInvalidBodies() {
        assertEquals(0, OllamaEmbeddingClient.parseEmbedding("").length);
        assertEquals(0, OllamaEmbeddingClient.parseEmbedding("{\"embedding\": []}").length);
        assertThrows(EmbeddingException.class, () -> OllamaEmbeddingClient.parseEmbedding("<html>"));
    }

    private static final class ScriptedHttp extends HttpClientEx {
        private final String legacyBody;
        private final String embedBody;
        private final List<String> urls = new ArrayList<>();
        private final List<String> bodies = new ArrayList<>();

        private ScriptedHttp(String legacyBody, String embedBody) {
            super(null);
            this.legacyBody = legacyBody;
            this.embedBody = embedBody;
        }

        @Override
        public String postJson(String url, String json, int timeoutSeconds) throws IOException {
            urls.add(url);
            bodies.add(json);
            String body = url.endsWith("/api/embeddings") ? legacyBody : embedBody;
            if (body == null) {
                throw new IOException("HTTP 503 for " + url);
            }
            return body;
        }
    }
}
