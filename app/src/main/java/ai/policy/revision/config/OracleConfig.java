package ai.policy.revision.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Chat model settings for the LLM grammar oracle.
 */
public record OracleConfig(LlmProvider provider, String modelName, Optional<String> baseUrl) {

    public OracleConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
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
