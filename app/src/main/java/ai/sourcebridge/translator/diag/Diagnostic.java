package ai.sourcebridge.translator.diag;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.List;
import java.util.Objects;

/**
 * A positioned error: the kind, where it happened, and the values filled into the kind's template.
 */
public record Diagnostic(ErrorKind kind, SourcePosition position, List<String> arguments) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(position, "position");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }

    public static Diagnostic of(ErrorKind kind, SourcePosition position, String... arguments) {
        return new Diagnostic(kind, position, List.of(arguments));
    }

    public String template() {
        return kind.template();
    }

    public String message() {
        return String.format(kind.template(), arguments.toArray());
    }

    @Override
    public String toString() {
        return position + ": " + kind.label() + ": " + message();
    }
}
