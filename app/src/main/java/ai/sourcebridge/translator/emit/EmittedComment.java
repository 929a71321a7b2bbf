package ai.sourcebridge.translator.emit;

import ai.sourcebridge.translator.lex.CommentPlacement;
import java.util.Objects;

/**
 * A comment as placed in generated code; {@code line} is 1-based and points at the first line of the comment.
 */
public record EmittedComment(String text, CommentPlacement placement, int line) {

    public EmittedComment {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(placement, "placement");
    }
}
