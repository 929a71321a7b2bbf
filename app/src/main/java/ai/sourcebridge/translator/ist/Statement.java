package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;

/**
 * A statement of the shared model. {@link RangeLoop} and {@link Binding} only exist between parsing and
 * normalization.
 */
public sealed interface Statement
        permits VariableDecl, Assignment, PrintStatement, ReadStatement, ForLoop, WhileLoop, IfStatement, RangeLoop,
        Binding {

    SourcePosition position();

    <R> R accept(StatementVisitor<R> visitor);
}
