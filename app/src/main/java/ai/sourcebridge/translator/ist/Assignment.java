package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

public record Assignment(String target, Expression value, SourcePosition position) implements Statement {

    public Assignment {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
