package ai.sourcebridge.translator.ist;

public interface ExpressionVisitor<R> {

    R visitBinary(BinaryExpr expression);

    R visitUnary(UnaryExpr expression);

    R visitLiteral(Literal expression);

    R visitIdentifier(Identifier expression);
}
