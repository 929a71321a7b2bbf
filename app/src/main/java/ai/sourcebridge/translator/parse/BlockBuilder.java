package ai.sourcebridge.translator.parse;

import ai.sourcebridge.translator.ist.Block;
import ai.sourcebridge.translator.ist.Comment;
import ai.sourcebridge.translator.ist.Statement;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.SourcePosition;
import ai.sourcebridge.translator.lex.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the statements of one block and anchors comments to them as they arrive.
 */
final class BlockBuilder {

    private final SourcePosition position;
    private final List<Statement> statements = new ArrayList<>();
    private final List<Comment> comments = new ArrayList<>();
    private final List<Token> pendingLeading = new ArrayList<>();

    BlockBuilder(SourcePosition position) {
        this.position = position;
    }

    /** Comments seen before the next statement. Their token placement does not matter any more. */
    void leading(List<Token> tokens) {
        pendingLeading.addAll(tokens);
    }

    void add(ParsedStatement parsed) {
        if (parsed.statements().isEmpty()) {
            pendingLeading.addAll(parsed.trailingComments());
            return;
        }
        comments.addAll(leadingComments(pendingLeading, statements.size()));
        pendingLeading.clear();
        statements.addAll(parsed.statements());
        int last = statements.size() - 1;
        for (Token token : parsed.trailingComments()) {
            comments.add(new Comment(token.text(), CommentPlacement.TRAILING, last, token.position()));
        }
    }

    Block build() {
        comments.addAll(leadingComments(pendingLeading, Comment.END_OF_BLOCK));
        pendingLeading.clear();
        return new Block(statements, comments, position);
    }

    // Comment lines on consecutive source lines form one comment.
    static List<Comment> leadingComments(List<Token> tokens, int anchor) {
        List<Comment> merged = new ArrayList<>();
        StringBuilder text = null;
        SourcePosition start = null;
        int lastLine = 0;
        for (Token token : tokens) {
            int line = token.position().line();
            if (text != null && line == lastLine + 1) {
                text.append('\n').append(token.text());
            } else {
                if (text != null) {
                    merged.add(new Comment(text.toString(), CommentPlacement.LEADING, anchor, start));
                }
                text = new StringBuilder(token.text());
                start = token.position();
            }
            lastLine = line + (int) token.text().chars().filter(c -> c == '\n').count();
        }
        if (text != null) {
            merged.add(new Comment(text.toString(), CommentPlacement.LEADING, anchor, start));
        }
        return merged;
    }
}
