package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * A variable use. The type stays {@link TypeTag#INFERRED} until the normalizer resolves the declaration.
 */
public record Identifier(String name, TypeTag type, SourcePosition position) implements Expression {

    public Identifier {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(position, "position");
    }

    public static Identifier unresolved(String name, SourcePosition position) {
        return new Identifier(name, TypeTag.INFERRED, position);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
