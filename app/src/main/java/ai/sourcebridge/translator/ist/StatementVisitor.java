package ai.sourcebridge.translator.ist;

public interface StatementVisitor<R> {

    R visitVariableDecl(VariableDecl statement);

    R visitAssignment(Assignment statement);

    R visitPrint(PrintStatement statement);

    R visitRead(ReadStatement statement);

    R visitForLoop(ForLoop statement);

    R visitWhileLoop(WhileLoop statement);

    R visitIf(IfStatement statement);

    R visitRangeLoop(RangeLoop statement);

    R visitBinding(Binding statement);
}
