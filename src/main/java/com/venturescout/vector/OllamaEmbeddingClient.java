package com.venturescout.vector;

import com.venturescout.config.Config;
import com.venturescout.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Embeddings from an Ollama server. Tries {@code /api/embeddings} first and falls back to
 * {@code /api/embed} for newer servers.
 */
public final class OllamaEmbeddingClient implements EmbeddingClient {
    private final HttpClientEx http;
    private final String baseUrl;
    private final String model;
    private final int timeoutSeconds;

    public OllamaEmbeddingClient(HttpClientEx http, String baseUrl, String model, int timeoutSeconds) {
        if (http == null) {
            throw new IllegalArgumentException("http client is required");
        }
        this.http = http;
        String url = baseUrl == null ? "" : baseUrl.trim();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = model == null || model.isBlank() ? "nomic-embed-text" : model.trim();
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    public static OllamaEmbeddingClient fromConfig(Config config, HttpClientEx http) {
        return new OllamaEmbeddingClient(
                http,
                config.getString("ollama.base_url", "http://127.0.0.1:11434"),
                config.getString("ollama.model", "nomic-embed-text"),
                Math.max(5, config.getInt("ollama.timeout_sec", 60))
        );
    }

    @Override
    public float[] encode(String text) {
        String input = text == null ? "" : text.trim();
        if (input.isEmpty()) {
            return new float[0];
        }

        JSONObject req = new JSONObject();
        req.put("model", model);
        req.put("prompt", input);
        Exception legacyFailure;
        try {
            float[] vec = parseEmbedding(http.postJson(baseUrl + "/api/embeddings", req.toString(), timeoutSeconds));
            if (vec.length > 0) {
                return vec;
            }
            legacyFailure = new EmbeddingException("empty embedding from /api/embeddings");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("interrupted calling ollama", e);
        } catch (Exception e) {
            legacyFailure = e;
        }

        JSONObject reqEmbed = new JSONObject();
        reqEmbed.put("model", model);
        reqEmbed.put("input", input);
        try {
            float[] vec = parseEmbedding(http.postJson(baseUrl + "/api/embed", reqEmbed.toString(), timeoutSeconds));
            if (vec.length == 0) {
                throw new EmbeddingException("empty embedding from " + baseUrl + " model=" + model);
            }
            return vec;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("interrupted calling ollama", e);
        } catch (EmbeddingException e) {
            e.addSuppressed(legacyFailure);
            throw e;
        } catch (Exception e) {
            EmbeddingException failure = new EmbeddingException("ollama embedding failed: " + e.getMessage(), e);
            failure.addSuppressed(legacyFailure);
            throw failure;
        }
    }

    @Override
    public String name() {
        return "ollama-" + model;
    }

    static float[] parseEmbedding(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return new float[0];
        }
        JSONObject root;
        try {
            root = new JSONObject(raw);
        } catch (JSONException e) {
            throw new EmbeddingException("embedding response is not JSON", e);
        }

        JSONArray arr = root.optJSONArray("embedding");
        if (arr == null) {
            JSONArray arrs = root.optJSONArray("embeddings");
            if (arrs != null && arrs.length() > 0) {
                arr = arrs.optJSONArray(0);
            }
        }
        if (arr == null || arr.length() == 0) {
            return new float[0];
        }

        float[] out = new float[arr.length()];
        for (int i = 0; i < arr.length(); i++) {
            double d = arr.optDouble(i, Double.NaN);
            out[i] = Double.isFinite(d) ? (float) d : 0.0f;
        }
        return out;
    }
}
