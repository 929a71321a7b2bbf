package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * Conditional. An {@code else if} chain is an {@code elseBlock} holding a single nested {@link IfStatement}.
 */
public record IfStatement(Expression condition, Block thenBlock, Block elseBlock, SourcePosition position)
        implements Statement {

    public IfStatement {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBlock, "thenBlock");
        Objects.requireNonNull(position, "position");
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
