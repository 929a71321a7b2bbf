package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.Objects;

/**
 * A constant. Numbers keep a canonical spelling both languages accept ({@code 0.5}, {@code 1.0}); strings hold their
 * decoded text; booleans are {@code true} or {@code false}.
 */
public record Literal(TypeTag type, String value, SourcePosition position) implements Expression {

    public Literal {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
        if (type == TypeTag.INFERRED) {
            throw new IllegalArgumentException("literals always have a known type");
        }
    }

    public static Literal integer(String digits, SourcePosition position) {
        return new Literal(TypeTag.INT, digits, position);
    }

    public static Literal integer(long value, SourcePosition position) {
        if (value < 0) {
            throw new IllegalArgumentException("negative constants are negated literals");
        }
        return new Literal(TypeTag.INT, Long.toString(value), position);
    }

    public static Literal floating(String raw, SourcePosition position) {
        String text = raw.startsWith(".") ? "0" + raw : raw;
        int dot = text.indexOf('.');
        if (dot >= 0 && (dot == text.length() - 1 || !Character.isDigit(text.charAt(dot + 1)))) {
            text = text.substring(0, dot + 1) + "0" + text.substring(dot + 1);
        }
        return new Literal(TypeTag.FLOAT, text, position);
    }

    public static Literal string(String value, SourcePosition position) {
        return new Literal(TypeTag.STRING, value, position);
    }

    public static Literal bool(boolean value, SourcePosition position) {
        return new Literal(TypeTag.BOOL, Boolean.toString(value), position);
    }

    public boolean isString() {
        return type == TypeTag.STRING;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
