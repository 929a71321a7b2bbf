package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * Python {@code target = value}: a declaration or an assignment depending on what is in scope.
 */
public record Binding(String target, Expression value, SourcePosition position) implements Statement {

    public Binding {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBinding(this);
    }
}
