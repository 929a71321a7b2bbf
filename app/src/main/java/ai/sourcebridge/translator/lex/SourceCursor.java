package ai.sourcebridge.translator.lex;

import ai.sourcebridge.translator.diag.LexException;
import java.util.List;

/**
 * Character cursor over one source text with line/column tracking and the lexical routines both languages share.
 */
final class SourceCursor {

    private final String source;
    private int index;
    private int line = 1;
    private int column = 1;

    SourceCursor(String source) {
        this.source = source == null ? "" : source;
    }

    boolean atEnd() {
        return index >= source.length();
    }

    char peek() {
        return peek(0);
    }

    char peek(int offset) {
        int target = index + offset;
        return target < source.length() ? source.charAt(target) : '\0';
    }

    boolean lookingAt(String text) {
        return source.startsWith(text, index);
    }

    char advance() {
        char current = source.charAt(index++);
        if (current == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return current;
    }

    void skip(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    SourcePosition position() {
        return new SourcePosition(line, column);
    }

    int line() {
        return line;
    }

    String restOfLine() {
        StringBuilder text = new StringBuilder();
        while (!atEnd() && peek() != '\n') {
            text.append(advance());
        }
        return text.toString();
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    boolean atNumberStart() {
        return isDigit(peek()) || (peek() == '.' && isDigit(peek(1)));
    }

    String readIdentifier() {
        StringBuilder text = new StringBuilder();
        while (!atEnd() && isIdentifierPart(peek())) {
            text.append(advance());
        }
        return text.toString();
    }

    /**
     * Reads an integer or floating literal: {@code 12}, {@code 1.5}, {@code 1.}, {@code .5}, {@code 2e-3}.
     */
    Token readNumber() {
        SourcePosition start = position();
        StringBuilder text = new StringBuilder();
        boolean floating = false;
        while (isDigit(peek())) {
            text.append(advance());
        }
        if (peek() == '.' && !isIdentifierStart(peek(1))) {
            floating = true;
            text.append(advance());
            while (isDigit(peek())) {
                text.append(advance());
            }
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && isDigit(peek(2))))) {
            floating = true;
            text.append(advance());
            if (peek() == '+' || peek() == '-') {
                text.append(advance());
            }
            while (isDigit(peek())) {
                text.append(advance());
            }
        }
        if (isIdentifierStart(peek())) {
            throw LexException.unexpected(position(), peek());
        }
        if (!floating && text.length() > 1 && text.charAt(0) == '0') {
            throw new LexException(start, "0", "whole numbers cannot start with 0");
        }
        return new Token(floating ? TokenKind.FLOAT_LITERAL : TokenKind.INTEGER_LITERAL, text.toString(), start);
    }

    /**
     * Reads a quoted literal starting at the opening quote. When {@code decode} is false the escapes are kept verbatim.
     */
    String readQuoted(boolean decode) {
        SourcePosition start = position();
        char quote = advance();
        StringBuilder value = new StringBuilder();
        while (true) {
            if (atEnd() || peek() == '\n') {
                throw new LexException(start, String.valueOf(quote), "text starting here is never closed");
            }
            char c = advance();
            if (c == quote) {
                return value.toString();
            }
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (atEnd()) {
                throw new LexException(start, String.valueOf(quote), "text starting here is never closed");
            }
            char escaped = advance();
            if (!decode) {
                value.append('\\').append(escaped);
                continue;
            }
            value.append(StringEscapes.decodeEscape(escaped, start));
        }
    }

    /**
     * Longest-match lookup; {@code candidates} must be ordered longest first.
     */
    String matchAny(List<String> candidates) {
        for (String candidate : candidates) {
            if (lookingAt(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
