package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * Python {@code for variable in range(start, stop, step)} as written; {@code step} is null when omitted.
 */
public record RangeLoop(String variable, Expression start, Expression stop, Expression step, Block body,
                        SourcePosition position) implements Statement {

    public RangeLoop {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(stop, "stop");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRangeLoop(this);
    }
}
