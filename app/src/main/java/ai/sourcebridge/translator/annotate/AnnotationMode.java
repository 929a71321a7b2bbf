package ai.sourcebridge.translator.annotate;

/**
 * How comments are added to a finished translation.
 */
public enum AnnotationMode {
    AI,
    NONE,
    MOCK;

    public static AnnotationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        for (AnnotationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported annotation mode: " + raw);
    }
}
