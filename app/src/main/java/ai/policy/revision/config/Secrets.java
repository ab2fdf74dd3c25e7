package ai.policy.revision.config;

import java.util.Optional;

/**
 * Credentials for hosted model providers.
 */
public record Secrets(Optional<String> geminiApiKey) {

    public Secrets {
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    @Override
    public String toString() {
        return "Secrets[geminiApiKey=" + (geminiApiKey.isPresent() ? "***" : "<unset>") + "]";
    }
}
