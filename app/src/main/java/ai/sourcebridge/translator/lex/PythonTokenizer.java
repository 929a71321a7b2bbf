package ai.sourcebridge.translator.lex;

import ai.sourcebridge.translator.diag.LexException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for the Python subset. Emits {@link TokenKind#NEWLINE} at the end of every logical line and synthetic
 * {@link TokenKind#BLOCK_START}/{@link TokenKind#BLOCK_END} tokens from indentation changes.
 */
public class PythonTokenizer implements Tokenizer {

    static final Set<String> KEYWORDS = Set.of(
            "if", "elif", "else", "while", "for", "in", "and", "or", "not", "True", "False", "None", "pass",
            "def", "class", "return", "import", "from", "as", "lambda", "try", "except", "finally", "raise", "with",
            "break", "continue", "global", "nonlocal", "yield", "del", "assert", "is", "async", "await");

    private static final List<String> OPERATORS = List.of(
            "//=", "**", "//", "<<", ">>", "+=", "-=", "*=", "/=", "%=", "==", "!=", "<=", ">=", "->",
            "+", "-", "*", "/", "%", "=", "<", ">", "&", "|", "^", "~", "@");

    private static final String PUNCTUATION = "()[]{},:;.";
    private static final int TAB_WIDTH = 8;

    @Override
    public List<Token> tokenize(String source) {
        return new Run(source).tokenize();
    }

    private record PendingComment(Token token, int indent) {
    }

    /**
     * Mutable state of one tokenization.
     */
    private static final class Run {

        private final SourceCursor cursor;
        private final List<Token> tokens = new ArrayList<>();
        private final Deque<Integer> indents = new ArrayDeque<>();
        private final List<PendingComment> pendingComments = new ArrayList<>();
        private int bracketDepth;
        private boolean atLineStart = true;
        private boolean lineHasCode;

        Run(String source) {
            this.cursor = new SourceCursor(source);
            indents.push(0);
        }

        List<Token> tokenize() {
            while (!cursor.atEnd()) {
                if (atLineStart && bracketDepth == 0) {
                    startLine();
                    continue;
                }
                char c = cursor.peek();
                if (c == '\n') {
                    cursor.advance();
                    if (bracketDepth == 0) {
                        endLogicalLine();
                        atLineStart = true;
                    }
                    continue;
                }
                if (c == '\\' && (cursor.peek(1) == '\n' || (cursor.peek(1) == '\r' && cursor.peek(2) == '\n'))) {
                    // the joined line continues the logical line, so no NEWLINE and no indentation check
                    cursor.advance();
                    if (cursor.peek() == '\r') {
                        cursor.advance();
                    }
                    cursor.advance();
                    continue;
                }
                if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                    cursor.advance();
                    continue;
                }
                SourcePosition start = cursor.position();
                if (c == '#') {
                    cursor.advance();
                    CommentPlacement placement = lineHasCode ? CommentPlacement.TRAILING : CommentPlacement.LEADING;
                    tokens.add(new Token(TokenKind.COMMENT, cursor.restOfLine().trim(), start, placement));
                    continue;
                }
                tokens.add(readToken(start));
                lineHasCode = true;
            }
            endLogicalLine();
            applyIndentation(0, cursor.position());
            flushPending(Integer.MIN_VALUE);
            tokens.add(new Token(TokenKind.END_OF_INPUT, "", cursor.position()));
            return List.copyOf(tokens);
        }

        private void startLine() {
            int indent = 0;
            while (cursor.peek() == ' ' || cursor.peek() == '\t' || cursor.peek() == '\f') {
                char c = cursor.advance();
                if (c == '\t') {
                    indent = (indent / TAB_WIDTH + 1) * TAB_WIDTH;
                } else if (c == ' ') {
                    indent++;
                }
            }
            if (cursor.peek() == '\r') {
                cursor.advance();
            }
            if (cursor.atEnd()) {
                atLineStart = false;
                return;
            }
            if (cursor.peek() == '\n') {
                cursor.advance();
                return;
            }
            if (cursor.peek() == '#') {
                SourcePosition start = cursor.position();
                cursor.advance();
                Token comment = new Token(TokenKind.COMMENT, cursor.restOfLine().trim(), start, CommentPlacement.LEADING);
                pendingComments.add(new PendingComment(comment, indent));
                return;
            }
            applyIndentation(indent, cursor.position());
            flushPending(Integer.MIN_VALUE);
            atLineStart = false;
        }

        private void applyIndentation(int indent, SourcePosition position) {
            int current = indents.peek();
            if (indent > current) {
                indents.push(indent);
                tokens.add(new Token(TokenKind.BLOCK_START, "", position));
                return;
            }
            while (indent < indents.peek()) {
                int closing = indents.pop();
                flushPending(closing);
                tokens.add(new Token(TokenKind.BLOCK_END, "", position));
            }
            if (indent != indents.peek()) {
                throw new LexException(position, " ", "indentation does not line up with any enclosing block");
            }
        }

        // Emits pending comment lines, in order, while they are indented at least minIndent deep.
        private void flushPending(int minIndent) {
            while (!pendingComments.isEmpty() && pendingComments.get(0).indent() >= minIndent) {
                tokens.add(pendingComments.remove(0).token());
            }
        }

        private void endLogicalLine() {
            if (lineHasCode) {
                tokens.add(new Token(TokenKind.NEWLINE, "", cursor.position()));
                lineHasCode = false;
            }
        }

        private Token readToken(SourcePosition start) {
            char c = cursor.peek();
            if ((c == 'f' || c == 'F') && (cursor.peek(1) == '"' || cursor.peek(1) == '\'')) {
                cursor.advance();
                rejectTripleQuote(start);
                return new Token(TokenKind.FORMAT_STRING, cursor.readQuoted(false), start);
            }
            if (SourceCursor.isIdentifierStart(c)) {
                String word = cursor.readIdentifier();
                return new Token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, word, start);
            }
            if (cursor.atNumberStart()) {
                return cursor.readNumber();
            }
            if (c == '"' || c == '\'') {
                rejectTripleQuote(start);
                return new Token(TokenKind.STRING_LITERAL, cursor.readQuoted(true), start);
            }
            if (PUNCTUATION.indexOf(c) >= 0) {
                cursor.advance();
                trackBrackets(c);
                return new Token(TokenKind.PUNCTUATION, String.valueOf(c), start);
            }
            String operator = cursor.matchAny(OPERATORS);
            if (operator != null) {
                cursor.skip(operator.length());
                return new Token(TokenKind.OPERATOR, operator, start);
            }
            throw LexException.unexpected(start, c);
        }

        private void trackBrackets(char c) {
            if (c == '(' || c == '[' || c == '{') {
                bracketDepth++;
            } else if ((c == ')' || c == ']' || c == '}') && bracketDepth > 0) {
                bracketDepth--;
            }
        }

        private void rejectTripleQuote(SourcePosition start) {
            char quote = cursor.peek();
            if (cursor.peek(1) == quote && cursor.peek(2) == quote) {
                throw new LexException(start, String.valueOf(quote), "multi-line text literals cannot be translated");
            }
        }
    }
}
