package ai.sourcebridge.translator.diag;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.List;

/**
 * Raised for well-tokenized input that is malformed or uses a construct outside the supported subset.
 */
public class ParseException extends TranslationException {

    private ParseException(Diagnostic diagnostic) {
        super(List.of(diagnostic));
    }

    public static ParseException unsupported(SourcePosition position, String constructName) {
        return new ParseException(Diagnostic.of(ErrorKind.UNSUPPORTED_CONSTRUCT, position, constructName));
    }

    public static ParseException syntax(SourcePosition position, String detail) {
        return new ParseException(Diagnostic.of(ErrorKind.SYNTAX_ERROR, position, detail));
    }

    /** Name of the rejected construct, or empty for plain syntax errors. */
    public String constructName() {
        Diagnostic diagnostic = primary();
        return diagnostic.kind() == ErrorKind.UNSUPPORTED_CONSTRUCT ? diagnostic.arguments().get(0) : "";
    }
}
