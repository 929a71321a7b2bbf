package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.List;
import java.util.Objects;

/**
 * Ordered statements plus the comments anchored to them by index.
 */
public record Block(List<Statement> statements, List<Comment> comments, SourcePosition position) {

    public Block {
        statements = List.copyOf(Objects.requireNonNull(statements, "statements"));
        comments = List.copyOf(Objects.requireNonNull(comments, "comments"));
        Objects.requireNonNull(position, "position");
        for (Comment comment : comments) {
            if (comment.anchor() != Comment.END_OF_BLOCK
                    && (comment.anchor() < 0 || comment.anchor() >= statements.size())) {
                throw new IllegalArgumentException("comment anchor " + comment.anchor() + " is outside the block");
            }
        }
    }

    public static Block empty(SourcePosition position) {
        return new Block(List.of(), List.of(), position);
    }

    public boolean isEmpty() {
        return statements.isEmpty() && comments.isEmpty();
    }

    public List<Comment> commentsAt(int anchor, CommentPlacement placement) {
        return comments.stream()
                .filter(comment -> comment.anchor() == anchor && comment.placement() == placement)
                .toList();
    }

    public List<Comment> endComments() {
        return comments.stream().filter(Comment::atEndOfBlock).toList();
    }
}
