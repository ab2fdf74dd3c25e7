package ai.policy.revision.config;

import java.util.Locale;

/**
 * Chat model back ends available to the grammar oracle.
 */
public enum LlmProvider {
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini" -> GEMINI;
            case "ollama", "" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
