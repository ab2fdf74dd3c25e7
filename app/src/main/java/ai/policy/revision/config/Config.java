package ai.policy.revision.config;

import ai.policy.revision.grammar.GrammarMode;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Path input,
        Path operations,
        Path output,
        Path manifest,
        GrammarMode grammarMode,
        LogFormat logFormat,
        OracleConfig oracleConfig,
        Secrets secrets,
        String revisionAuthor,
        double logoWidthMm,
        double logoHeightMm,
        boolean cleanHighlighting,
        long patternStepBudget,
        int llmMaxRetryAttempts,
        int llmInitialBackoffSeconds,
        int llmMaxBackoffSeconds,
        double llmRetryJitterFactor,
        boolean strict
) {

    public Config {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(operations, "operations");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(manifest, "manifest");
        grammarMode = Objects.requireNonNull(grammarMode, "grammarMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        oracleConfig = Objects.requireNonNull(oracleConfig, "oracleConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
        revisionAuthor = requireNonBlank(revisionAuthor, "revisionAuthor");
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("output must differ from input");
        }
        if (logoWidthMm < 0 || logoHeightMm < 0) {
            throw new IllegalArgumentException("logo size must not be negative");
        }
        if (logoWidthMm == 0 && logoHeightMm == 0) {
            throw new IllegalArgumentException("logo width and height must not both be zero");
        }
        if (patternStepBudget <= 0) {
            throw new IllegalArgumentException("patternStepBudget must be positive");
        }
        if (llmMaxBackoffSeconds < llmInitialBackoffSeconds) {
            throw new IllegalArgumentException("llmMaxBackoffSeconds must not be lower than llmInitialBackoffSeconds");
        }
        if (llmRetryJitterFactor < 0 || llmRetryJitterFactor > 1) {
            throw new IllegalArgumentException("llmRetryJitterFactor must be between 0 and 1");
        }
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
