package ai.sourcebridge.translator.emit;

import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Expression;
import ai.sourcebridge.translator.ist.ExpressionVisitor;
import ai.sourcebridge.translator.ist.Identifier;
import ai.sourcebridge.translator.ist.Literal;
import ai.sourcebridge.translator.ist.UnaryExpr;
import ai.sourcebridge.translator.ist.UnaryOperator;

/**
 * Renders expressions with the fewest parentheses the target language's precedence table allows. A higher level binds
 * tighter; binary operators are left-associative.
 */
abstract class ExpressionRenderer implements ExpressionVisitor<String> {

    static final int PRIMARY = 100;

    abstract int precedence(BinaryOperator operator);

    abstract int precedence(UnaryOperator operator);

    abstract String symbol(BinaryExpr expression);

    abstract String prefix(UnaryOperator operator);

    abstract String literal(Literal literal);

    /** Operators whose operands of the same level need parentheses on both sides. */
    boolean nonAssociative(BinaryOperator operator) {
        return false;
    }

    String render(Expression expression) {
        return expression.accept(this);
    }

    /** Renders {@code expression} as an operand that must bind at least as tightly as {@code level}. */
    String operand(Expression expression, int level) {
        String text = render(expression);
        return precedence(expression) < level ? "(" + text + ")" : text;
    }

    int precedence(Expression expression) {
        if (expression instanceof BinaryExpr binary) {
            return precedence(binary.operator());
        }
        if (expression instanceof UnaryExpr unary) {
            return precedence(unary.operator());
        }
        return PRIMARY;
    }

    @Override
    public String visitBinary(BinaryExpr expression) {
        int level = precedence(expression.operator());
        int leftLevel = nonAssociative(expression.operator()) ? level + 1 : level;
        return operand(expression.left(), leftLevel) + " " + symbol(expression) + " "
                + operand(expression.right(), level + 1);
    }

    @Override
    public String visitUnary(UnaryExpr expression) {
        int level = precedence(expression.operator());
        String inner = expression.operand() instanceof UnaryExpr nested && nested.operator() == expression.operator()
                ? "(" + render(nested) + ")"
                : operand(expression.operand(), level);
        return prefix(expression.operator()) + inner;
    }

    @Override
    public String visitLiteral(Literal literal) {
        return literal(literal);
    }

    @Override
    public String visitIdentifier(Identifier identifier) {
        return identifier.name();
    }
}
