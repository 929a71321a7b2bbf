package ai.sourcebridge.translator.lex;

import ai.sourcebridge.translator.diag.LexException;

/**
 * Escape handling shared by both languages: {@code \n \t \r \0 \\ \" \'}.
 */
public final class StringEscapes {

    private StringEscapes() {
    }

    static char decodeEscape(char escaped, SourcePosition position) {
        return switch (escaped) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            case '\\' -> '\\';
            case '"' -> '"';
            case '\'' -> '\'';
            default -> throw new LexException(position, "\\" + escaped, "unknown escape sequence '\\" + escaped + "'");
        };
    }

    /**
     * Decodes escapes kept verbatim by the tokenizer, as in the literal parts of a format string.
     */
    public static String decode(String raw, SourcePosition position) {
        StringBuilder value = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\') {
                value.append(c);
            } else if (i + 1 < raw.length()) {
                value.append(decodeEscape(raw.charAt(++i), position));
            } else {
                throw new LexException(position, "\\", "a text literal ends with a lone backslash");
            }
        }
        return value.toString();
    }

    /**
     * Renders {@code value} as a double-quoted literal valid in both languages.
     */
    public static String quote(String value) {
        StringBuilder text = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> text.append("\\n");
                case '\t' -> text.append("\\t");
                case '\r' -> text.append("\\r");
                case '\0' -> text.append("\\0");
                case '\\' -> text.append("\\\\");
                case '"' -> text.append("\\\"");
                default -> text.append(c);
            }
        }
        return text.append('"').toString();
    }
}
