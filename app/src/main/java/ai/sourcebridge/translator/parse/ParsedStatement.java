package ai.sourcebridge.translator.parse;

import ai.sourcebridge.translator.ist.Statement;
import ai.sourcebridge.translator.lex.Token;
import java.util.List;

/**
 * Statements produced from one source statement (none for {@code pass}, several for {@code int a, b;}) and the
 * comments that trail it.
 */
record ParsedStatement(List<Statement> statements, List<Token> trailingComments) {

    ParsedStatement {
        statements = List.copyOf(statements);
        trailingComments = List.copyOf(trailingComments);
    }

    static ParsedStatement of(Statement statement, List<Token> trailingComments) {
        return new ParsedStatement(List.of(statement), trailingComments);
    }
}
