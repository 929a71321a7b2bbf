package ai.sourcebridge.translator.diag;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.List;

/**
 * Raised when the source text cannot be split into tokens.
 */
public class LexException extends TranslationException {

    private final String unexpectedCharacter;

    public LexException(SourcePosition position, String unexpectedCharacter, String problem) {
        super(List.of(Diagnostic.of(ErrorKind.LEX_ERROR, position, problem)));
        this.unexpectedCharacter = unexpectedCharacter;
    }

    public static LexException unexpected(SourcePosition position, char character) {
        return new LexException(position, String.valueOf(character), "unexpected character '" + character + "'");
    }

    public String unexpectedCharacter() {
        return unexpectedCharacter;
    }
}
