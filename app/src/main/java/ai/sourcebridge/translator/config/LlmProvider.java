package ai.sourcebridge.translator.config;

import java.util.Locale;

/**
 * Supported large language model providers for AI annotation.
 */
public enum LlmProvider {
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return GEMINI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini", "" -> GEMINI;
            case "ollama" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }

    public String defaultModel() {
        return switch (this) {
            case GEMINI -> "gemini-2.0-flash";
            case OLLAMA -> "llama3.1";
        };
    }
}
