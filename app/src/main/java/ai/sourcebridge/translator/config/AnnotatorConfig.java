package ai.sourcebridge.translator.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the annotation model provider and its retry policy.
 */
public record AnnotatorConfig(LlmProvider provider,
                              String modelName,
                              Optional<String> baseUrl,
                              Duration timeout,
                              int maxRetryAttempts,
                              int initialBackoffSeconds,
                              int maxBackoffSeconds,
                              double retryJitterFactor) {

    public AnnotatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1 || maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("backoff must satisfy 1 <= initial <= max");
        }
        if (retryJitterFactor < 0.0 || retryJitterFactor > 1.0) {
            throw new IllegalArgumentException("retryJitterFactor must be between 0.0 and 1.0");
        }
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
