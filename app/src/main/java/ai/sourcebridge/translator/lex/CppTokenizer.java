package ai.sourcebridge.translator.lex;

import ai.sourcebridge.translator.diag.LexException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for the C++ subset. Whitespace, including line breaks, is insignificant; {@code #} lines become
 * {@link TokenKind#DIRECTIVE} tokens.
 */
public class CppTokenizer implements Tokenizer {

    static final Set<String> KEYWORDS = Set.of(
            "int", "float", "double", "bool", "char", "void", "long", "short", "unsigned", "signed", "auto", "const",
            "if", "else", "while", "for", "do", "switch", "case", "default", "break", "continue", "return",
            "class", "struct", "namespace", "using", "template", "typename", "new", "delete",
            "try", "catch", "throw", "true", "false");

    private static final List<String> OPERATORS = List.of(
            "::", "<<", ">>", "++", "--", "+=", "-=", "*=", "/=", "%=", "==", "!=", "<=", ">=", "&&", "||", "->",
            "+", "-", "*", "/", "%", "=", "<", ">", "!", "&", "|", "^", "~", "?", ":", ".");

    private static final String PUNCTUATION = "(){}[];,";

    @Override
    public List<Token> tokenize(String source) {
        SourceCursor cursor = new SourceCursor(source);
        List<Token> tokens = new ArrayList<>();
        int lastCodeLine = 0;
        boolean lineStart = true;
        while (!cursor.atEnd()) {
            char c = cursor.peek();
            if (c == '\n') {
                cursor.advance();
                lineStart = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                cursor.advance();
                continue;
            }
            SourcePosition start = cursor.position();
            if (c == '#' && lineStart) {
                cursor.advance();
                tokens.add(new Token(TokenKind.DIRECTIVE, cursor.restOfLine().trim(), start));
                continue;
            }
            lineStart = false;
            if (cursor.lookingAt("//")) {
                cursor.skip(2);
                tokens.add(comment(cursor.restOfLine().trim(), start, lastCodeLine));
                continue;
            }
            if (cursor.lookingAt("/*")) {
                tokens.add(comment(readBlockComment(cursor, start), start, lastCodeLine));
                continue;
            }
            tokens.add(readToken(cursor, start));
            lastCodeLine = cursor.line();
        }
        tokens.add(new Token(TokenKind.END_OF_INPUT, "", cursor.position()));
        return List.copyOf(tokens);
    }

    private Token readToken(SourceCursor cursor, SourcePosition start) {
        char c = cursor.peek();
        if (SourceCursor.isIdentifierStart(c)) {
            String word = cursor.readIdentifier();
            return new Token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, word, start);
        }
        if (cursor.atNumberStart()) {
            return cursor.readNumber();
        }
        if (c == '"' || c == '\'') {
            return new Token(TokenKind.STRING_LITERAL, cursor.readQuoted(true), start);
        }
        if (PUNCTUATION.indexOf(c) >= 0) {
            cursor.advance();
            return new Token(TokenKind.PUNCTUATION, String.valueOf(c), start);
        }
        String operator = cursor.matchAny(OPERATORS);
        if (operator != null) {
            cursor.skip(operator.length());
            return new Token(TokenKind.OPERATOR, operator, start);
        }
        throw LexException.unexpected(start, c);
    }

    private static Token comment(String text, SourcePosition start, int lastCodeLine) {
        CommentPlacement placement = lastCodeLine == start.line() ? CommentPlacement.TRAILING : CommentPlacement.LEADING;
        return new Token(TokenKind.COMMENT, text, start, placement);
    }

    private static String readBlockComment(SourceCursor cursor, SourcePosition start) {
        cursor.skip(2);
        StringBuilder raw = new StringBuilder();
        while (!cursor.lookingAt("*/")) {
            if (cursor.atEnd()) {
                throw new LexException(start, "/*", "comment starting here is never closed");
            }
            raw.append(cursor.advance());
        }
        cursor.skip(2);
        List<String> lines = new ArrayList<>();
        for (String line : raw.toString().split("\\R", -1)) {
            String cleaned = line.strip();
            if (cleaned.startsWith("*")) {
                cleaned = cleaned.substring(1).strip();
            }
            lines.add(cleaned);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }
}
