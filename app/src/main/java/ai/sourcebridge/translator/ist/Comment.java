package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.List;
import java.util.Objects;

/**
 * A source comment. Consecutive comment lines form one comment whose lines are joined by {@code \n}.
 *
 * @param anchor index of the statement in the owning block, or {@link #END_OF_BLOCK}
 */
public record Comment(String text, CommentPlacement placement, int anchor, SourcePosition position) {

    public static final int END_OF_BLOCK = -1;

    public Comment {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(position, "position");
        if (placement != CommentPlacement.LEADING && placement != CommentPlacement.TRAILING) {
            throw new IllegalArgumentException("comments are either leading or trailing");
        }
    }

    public boolean atEndOfBlock() {
        return anchor == END_OF_BLOCK;
    }

    public Comment withAnchor(int newAnchor) {
        return new Comment(text, placement, newAnchor, position);
    }

    public List<String> lines() {
        return text.isEmpty() ? List.of("") : text.lines().toList();
    }
}
