package ai.sourcebridge.translator.emit;

import ai.sourcebridge.translator.ist.Comment;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented output buffer with four-space indentation.
 */
final class CodeWriter {

    private static final String INDENT = "    ";

    private final StringBuilder code = new StringBuilder();
    private final List<EmittedComment> comments = new ArrayList<>();
    private int depth;
    private int lines;

    void indent() {
        depth++;
    }

    void dedent() {
        if (depth == 0) {
            throw new IllegalStateException("dedent below the top level");
        }
        depth--;
    }

    /** Writes one line at the current depth and returns its 1-based number. */
    int line(String text) {
        if (!text.isEmpty()) {
            code.append(INDENT.repeat(depth)).append(text);
        }
        code.append('\n');
        return ++lines;
    }

    void blankLine() {
        line("");
    }

    void record(Comment comment, int line) {
        comments.add(new EmittedComment(comment.text(), comment.placement(), line));
    }

    EmittedCode finish() {
        return new EmittedCode(code.toString(), comments);
    }
}
