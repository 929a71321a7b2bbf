package ai.sourcebridge.translator.normalize;

import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Expression;
import ai.sourcebridge.translator.ist.ExpressionVisitor;
import ai.sourcebridge.translator.ist.Identifier;
import ai.sourcebridge.translator.ist.Literal;
import ai.sourcebridge.translator.ist.TypeTag;
import ai.sourcebridge.translator.ist.UnaryExpr;
import ai.sourcebridge.translator.ist.UnaryOperator;

/**
 * Static type of an expression whose identifiers are resolved. Unresolved parts make the result
 * {@link TypeTag#INFERRED}.
 */
public final class ExpressionTypes implements ExpressionVisitor<TypeTag> {

    private static final ExpressionTypes INSTANCE = new ExpressionTypes();

    private ExpressionTypes() {
    }

    public static TypeTag of(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public TypeTag visitBinary(BinaryExpr expression) {
        BinaryOperator operator = expression.operator();
        if (operator.isComparison() || operator.isLogical()) {
            return TypeTag.BOOL;
        }
        TypeTag left = expression.left().accept(this);
        TypeTag right = expression.right().accept(this);
        if (left == TypeTag.INFERRED || right == TypeTag.INFERRED) {
            return TypeTag.INFERRED;
        }
        if (operator == BinaryOperator.ADD && (left == TypeTag.STRING || right == TypeTag.STRING)) {
            return TypeTag.STRING;
        }
        if (operator == BinaryOperator.TRUE_DIVIDE || left == TypeTag.FLOAT || right == TypeTag.FLOAT) {
            return TypeTag.FLOAT;
        }
        return TypeTag.INT;
    }

    @Override
    public TypeTag visitUnary(UnaryExpr expression) {
        if (expression.operator() == UnaryOperator.NOT) {
            return TypeTag.BOOL;
        }
        TypeTag operand = expression.operand().accept(this);
        return operand == TypeTag.BOOL ? TypeTag.INT : operand;
    }

    @Override
    public TypeTag visitLiteral(Literal expression) {
        return expression.type();
    }

    @Override
    public TypeTag visitIdentifier(Identifier expression) {
        return expression.type();
    }
}
