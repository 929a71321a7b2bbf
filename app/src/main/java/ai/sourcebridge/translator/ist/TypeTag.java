package ai.sourcebridge.translator.ist;

/**
 * Value types of the shared model. {@link #INFERRED} marks a type that is not resolved yet.
 */
public enum TypeTag {
    INT("whole-number"),
    FLOAT("decimal"),
    STRING("text"),
    BOOL("true/false"),
    INFERRED("unknown");

    private final String description;

    TypeTag(String description) {
        this.description = description;
    }

    /** Plain-language name used in messages. */
    public String description() {
        return description;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    /**
     * Whether a value of type {@code actual} may be stored in a variable of this type. Whole numbers widen to decimals;
     * unresolved types never produce a second error.
     */
    public boolean accepts(TypeTag actual) {
        if (this == INFERRED || actual == INFERRED || this == actual) {
            return true;
        }
        return this == FLOAT && actual == INT;
    }
}
