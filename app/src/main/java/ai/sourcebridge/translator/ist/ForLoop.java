package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * Canonical counting loop. {@code init} and {@code update} may be null.
 */
public record ForLoop(Statement init, Expression condition, Statement update, Block body, SourcePosition position)
        implements Statement {

    public ForLoop {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForLoop(this);
    }
}
