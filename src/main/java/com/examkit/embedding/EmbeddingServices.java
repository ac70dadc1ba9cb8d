package com.examkit.embedding;

import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.runtime.EngineSettings;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingServices.class);

    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(EngineSettings.Embedding settings) {
        return fromEnvironment(settings, System.getenv());
    }

    static EmbeddingService fromEnvironment(EngineSettings.Embedding settings, Map<String, String> env) {
        String endpoint = env.get("EXAMKIT_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            log.debug("Using local embedding model dimension={}", settings.dimension());
            return new LocalModelEmbeddingService(settings.dimension());
        }
        String provider = env.getOrDefault("EXAMKIT_EMBEDDING_PROVIDER", "custom");
        String apiKey = env.get("EXAMKIT_EMBEDDING_API_KEY");
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(settings.timeoutMs()))
                .build();
        log.info("Using external embedding provider={} endpoint={}", provider, endpoint);
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey, settings.dimension());
    }
}
