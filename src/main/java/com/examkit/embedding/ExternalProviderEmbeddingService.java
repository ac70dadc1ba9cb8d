package com.examkit.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Calls an HTTP embedding endpoint. Accepts {@code {"embedding": [...]}},
 * {@code {"embeddings": [[...], ...]}} and OpenAI-style {@code {"data": [{"embedding": [...]}]}}
 * responses. Any transport or shape problem surfaces as {@link EmbeddingException}.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        JsonNode root = post(Map.of("input", texts));
        List<float[]> vectors = new ArrayList<>();
        if (root.path("embeddings").isArray()) {
            root.get("embeddings").forEach(node -> vectors.add(toVector(node)));
        } else if (root.path("data").isArray()) {
            root.get("data").forEach(node -> vectors.add(toVector(node.path("embedding"))));
        } else if (root.path("embedding").isArray()) {
            vectors.add(toVector(root.get("embedding")));
        }
        if (vectors.size() != texts.size()) {
            throw new EmbeddingException("Provider " + provider + " returned " + vectors.size()
                    + " vectors for " + texts.size() + " inputs");
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + provider + "-v1";
    }

    private JsonNode post(Map<String, Object> body) {
        try {
            String payload = mapper.writeValueAsString(body);
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    throw new EmbeddingException("Provider " + provider + " answered HTTP " + response.code());
                }
                return mapper.readTree(responseBody.string());
            }
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request to " + endpoint + " failed", e);
        }
    }

    private float[] toVector(JsonNode node) {
        if (!node.isArray()) {
            throw new EmbeddingException("Provider " + provider + " returned a non-array embedding");
        }
        float[] out = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            out[i] = (float) node.get(i).asDouble();
        }
        if (out.length != dimension) {
            throw new EmbeddingException("Expected dimension " + dimension + " but provider returned " + out.length);
        }
        return out;
    }
}
