package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.List;
import java.util.Objects;

/**
 * Writes {@code items} back to back, followed by a line break when {@code newline} is set.
 */
public record PrintStatement(List<Expression> items, boolean newline, SourcePosition position) implements Statement {

    public PrintStatement {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }
}
