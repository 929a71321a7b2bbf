package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

public record BinaryExpr(BinaryOperator operator, Expression left, Expression right, SourcePosition position)
        implements Expression {

    public BinaryExpr {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
