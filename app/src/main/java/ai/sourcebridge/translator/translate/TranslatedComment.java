package ai.sourcebridge.translator.translate;

import ai.sourcebridge.translator.lex.CommentPlacement;
import java.util.Objects;

/**
 * A comment carried into the translation, with the 1-based line of the output where it starts.
 */
public record TranslatedComment(String text, CommentPlacement placement, int line) {

    public TranslatedComment {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(placement, "placement");
        if (line < 1) {
            throw new IllegalArgumentException("line must be positive");
        }
    }
}
