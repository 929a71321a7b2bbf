package ai.sourcebridge.translator.lex;

import java.util.Objects;

/**
 * Immutable lexical token. String literal tokens carry their decoded value in {@code text}.
 */
public record Token(TokenKind kind, String text, SourcePosition position, CommentPlacement placement) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(position, "position");
        placement = placement == null ? CommentPlacement.NONE : placement;
        if (kind == TokenKind.COMMENT && placement == CommentPlacement.NONE) {
            throw new IllegalArgumentException("comment tokens need a placement");
        }
    }

    public Token(TokenKind kind, String text, SourcePosition position) {
        this(kind, text, position, CommentPlacement.NONE);
    }

    public boolean is(TokenKind expectedKind, String expectedText) {
        return kind == expectedKind && text.equals(expectedText);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    public boolean isOperator(String operator) {
        return is(TokenKind.OPERATOR, operator);
    }

    public boolean isPunctuation(String punctuation) {
        return is(TokenKind.PUNCTUATION, punctuation);
    }

    /** Short human-readable description used in diagnostics. */
    public String describe() {
        return switch (kind) {
            case NEWLINE -> "end of line";
            case BLOCK_START -> "start of an indented block";
            case BLOCK_END -> "end of an indented block";
            case END_OF_INPUT -> "end of input";
            case STRING_LITERAL, FORMAT_STRING -> "text \"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}
