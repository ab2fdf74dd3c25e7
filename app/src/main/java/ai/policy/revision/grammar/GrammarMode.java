package ai.policy.revision.grammar;

import java.util.Locale;

/**
 * Which grammar oracle backs placeholder replacements.
 */
public enum GrammarMode {
    RULES,
    LLM,
    OFF;

    public static GrammarMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return RULES;
        }
        for (GrammarMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported grammar mode: " + raw.toLowerCase(Locale.ROOT));
    }
}
