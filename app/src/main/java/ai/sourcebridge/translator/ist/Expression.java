package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;

public sealed interface Expression permits BinaryExpr, UnaryExpr, Literal, Identifier {

    SourcePosition position();

    <R> R accept(ExpressionVisitor<R> visitor);
}
