package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * Declares {@code name}; {@code initializer} is null when the source gives no initial value.
 */
public record VariableDecl(String name, TypeTag type, Expression initializer, SourcePosition position)
        implements Statement {

    public VariableDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(position, "position");
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariableDecl(this);
    }
}
