package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * Reads one value into {@code target}, showing {@code prompt} first when it is not null.
 */
public record ReadStatement(String target, TypeTag type, String prompt, SourcePosition position) implements Statement {

    public ReadStatement {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(position, "position");
    }

    public boolean hasPrompt() {
        return prompt != null;
    }

    public ReadStatement withPrompt(String newPrompt) {
        return new ReadStatement(target, type, newPrompt, position);
    }

    public ReadStatement withType(TypeTag newType) {
        return new ReadStatement(target, newType, prompt, position);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRead(this);
    }
}
