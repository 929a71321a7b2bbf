package ai.sourcebridge.translator.diag;

import java.util.Locale;

/**
 * Stable error kinds reported by the translator, each with a plain-language message template.
 */
public enum ErrorKind {
    LEX_ERROR(Stage.LEX, "the text cannot be read here: %s"),
    SYNTAX_ERROR(Stage.PARSE, "this line is not written the way the translator expects: %s"),
    UNSUPPORTED_CONSTRUCT(Stage.PARSE, "%s is not supported by the translator"),
    UNDECLARED_IDENTIFIER(Stage.SEMANTIC, "variable '%s' is used before it is declared"),
    REDECLARED_IDENTIFIER(Stage.SEMANTIC, "variable '%s' is declared twice in the same block"),
    TYPE_MISMATCH(Stage.SEMANTIC, "variable '%s' holds %s values but is given a %s value"),
    UNSUPPORTED_LOOP_STEP(Stage.SEMANTIC, "the loop over '%s' needs a step that is a whole number other than zero");

    /** Pipeline stage that produces the error; earlier stages rank first on ties. */
    public enum Stage {
        LEX,
        PARSE,
        SEMANTIC
    }

    private final Stage stage;
    private final String template;

    ErrorKind(Stage stage, String template) {
        this.stage = stage;
        this.template = template;
    }

    public Stage stage() {
        return stage;
    }

    public String template() {
        return template;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
