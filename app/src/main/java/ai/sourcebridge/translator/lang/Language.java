package ai.sourcebridge.translator.lang;

import java.util.Locale;

/**
 * Source and target languages understood by the translator.
 */
public enum Language {
    CPP("C++"),
    PYTHON("Python");

    private final String displayName;

    Language(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static Language from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Language must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "cpp", "c++", "cxx", "a" -> CPP;
            case "python", "py", "b" -> PYTHON;
            default -> throw new IllegalArgumentException("Unsupported language: " + raw);
        };
    }
}
