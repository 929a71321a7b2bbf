package ai.sourcebridge.translator.config;

import java.util.Optional;

/**
 * Holds credentials needed for the annotation model. Never printed.
 */
public record Secrets(Optional<String> geminiApiKey) {

    public Secrets {
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    @Override
    public String toString() {
        return "Secrets[geminiApiKey=" + (geminiApiKey.isPresent() ? "****" : "<unset>") + "]";
    }
}
