package ai.sourcebridge.translator.emit;

import ai.sourcebridge.translator.ist.Binding;
import ai.sourcebridge.translator.ist.Block;
import ai.sourcebridge.translator.ist.Comment;
import ai.sourcebridge.translator.ist.IfStatement;
import ai.sourcebridge.translator.ist.RangeLoop;
import ai.sourcebridge.translator.ist.Statement;
import ai.sourcebridge.translator.ist.StatementVisitor;
import ai.sourcebridge.translator.lex.CommentPlacement;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One rendering run: walks blocks, writes statements through the language visitor and places comments around them.
 * Leading comments go on their own lines above the statement, separated by a blank line when more than one; trailing
 * comments go at the end of the statement's first line.
 */
abstract class SourceRenderer implements StatementVisitor<Void> {

    protected final CodeWriter writer = new CodeWriter();
    private final String commentMarker;
    private List<Comment> pendingTrailing = List.of();

    protected SourceRenderer(String commentMarker) {
        this.commentMarker = commentMarker;
    }

    protected void statements(Block block) {
        int index = 0;
        while (index < block.statements().size()) {
            index = statementAt(block, index);
        }
        comments(block.endComments());
    }

    /** Writes the statement at {@code index} and returns the index of the next one to write. */
    protected int statementAt(Block block, int index) {
        comments(block.commentsAt(index, CommentPlacement.LEADING));
        write(block.statements().get(index), block.commentsAt(index, CommentPlacement.TRAILING));
        return index + 1;
    }

    protected void write(Statement statement, List<Comment> trailing) {
        pendingTrailing = trailing;
        statement.accept(this);
        if (!pendingTrailing.isEmpty()) {
            comments(pendingTrailing);
            pendingTrailing = List.of();
        }
    }

    /** Writes comments on lines of their own. */
    protected void comments(List<Comment> comments) {
        boolean first = true;
        for (Comment comment : comments) {
            if (!first) {
                writer.blankLine();
            }
            first = false;
            int line = -1;
            for (String text : comment.lines()) {
                int written = writer.line(marker(text));
                if (line < 0) {
                    line = written;
                }
            }
            writer.record(comment, line);
        }
    }

    /** Writes a statement line, appending the trailing comments of the statement being written if still pending. */
    protected int line(String text) {
        if (pendingTrailing.isEmpty()) {
            return writer.line(text);
        }
        String note = pendingTrailing.stream()
                .flatMap(comment -> comment.lines().stream())
                .collect(Collectors.joining(" "));
        int line = writer.line(text + "  " + marker(note).stripTrailing());
        pendingTrailing.forEach(comment -> writer.record(comment, line));
        pendingTrailing = List.of();
        return line;
    }

    /** Hands the trailing comments of the current statement to a nested header, such as an else-if. */
    protected List<Comment> takePendingTrailing() {
        List<Comment> taken = pendingTrailing;
        pendingTrailing = List.of();
        return taken;
    }

    protected void addPendingTrailing(List<Comment> extra) {
        if (extra.isEmpty()) {
            return;
        }
        pendingTrailing = Stream.concat(pendingTrailing.stream(), extra.stream()).toList();
    }

    /** An else branch holding only another if, with at most comments trailing its header. */
    protected static boolean isElseIf(Block elseBlock) {
        return elseBlock.statements().size() == 1 && elseBlock.statements().get(0) instanceof IfStatement
                && elseBlock.comments().stream()
                        .allMatch(comment -> comment.placement() == CommentPlacement.TRAILING && comment.anchor() == 0);
    }

    private String marker(String text) {
        return text.isEmpty() ? commentMarker : commentMarker + " " + text;
    }

    @Override
    public Void visitRangeLoop(RangeLoop statement) {
        throw new IllegalStateException("range loops are rewritten into counting loops before emission");
    }

    @Override
    public Void visitBinding(Binding statement) {
        throw new IllegalStateException("bindings are resolved into declarations or assignments before emission");
    }

    EmittedCode finish() {
        return writer.finish();
    }
}
