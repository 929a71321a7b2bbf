package ai.sourcebridge.translator.parse;

import ai.sourcebridge.translator.diag.ParseException;
import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Expression;
import ai.sourcebridge.translator.ist.Program;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.Token;
import ai.sourcebridge.translator.lex.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Token navigation shared by both grammars. Comment tokens never reach the grammar rules: they are moved into a
 * buffer as the parser passes them and handed out as leading or trailing comments between statements.
 */
abstract class RecursiveDescentParser {

    private final List<Token> tokens;
    private final List<Token> commentBuffer = new ArrayList<>();
    private int index;

    protected RecursiveDescentParser(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.END_OF_INPUT) {
            throw new IllegalArgumentException("token list must end with END_OF_INPUT");
        }
        this.tokens = tokens;
    }

    abstract Program program();

    protected Token peek() {
        while (tokens.get(index).kind() == TokenKind.COMMENT) {
            commentBuffer.add(tokens.get(index++));
        }
        return tokens.get(index);
    }

    /** The non-comment token {@code ahead} positions after the current one, without buffering anything. */
    protected Token peek(int ahead) {
        int cursor = index;
        int remaining = ahead;
        while (true) {
            Token token = tokens.get(cursor);
            if (token.kind() == TokenKind.END_OF_INPUT) {
                return token;
            }
            if (token.kind() != TokenKind.COMMENT) {
                if (remaining == 0) {
                    return token;
                }
                remaining--;
            }
            cursor++;
        }
    }

    protected Token advance() {
        Token token = peek();
        if (token.kind() != TokenKind.END_OF_INPUT) {
            index++;
        }
        return token;
    }

    protected boolean check(TokenKind kind) {
        return peek().kind() == kind;
    }

    protected boolean check(TokenKind kind, String text) {
        return peek().is(kind, text);
    }

    protected boolean match(TokenKind kind, String text) {
        if (check(kind, text)) {
            advance();
            return true;
        }
        return false;
    }

    protected Token expect(TokenKind kind, String text) {
        if (!check(kind, text)) {
            throw unexpected("'" + text + "'");
        }
        return advance();
    }

    protected Token expect(TokenKind kind, String text, String description) {
        if (!check(kind, text)) {
            throw unexpected(description);
        }
        return advance();
    }

    protected Token expectKind(TokenKind kind, String description) {
        if (!check(kind)) {
            throw unexpected(description);
        }
        return advance();
    }

    protected ParseException unexpected(String expectation) {
        Token found = peek();
        return ParseException.syntax(found.position(), "expected " + expectation + " but found " + found.describe());
    }

    protected ParseException unsupported(Token at, String constructName) {
        return ParseException.unsupported(at.position(), constructName);
    }

    /** Comments directly after the statement just parsed that sit on its last line. */
    protected List<Token> takeTrailingComments() {
        peek();
        List<Token> trailing = new ArrayList<>();
        while (!commentBuffer.isEmpty() && commentBuffer.get(0).placement() == CommentPlacement.TRAILING) {
            trailing.add(commentBuffer.remove(0));
        }
        return trailing;
    }

    protected List<Token> takeBufferedComments() {
        peek();
        List<Token> buffered = List.copyOf(commentBuffer);
        commentBuffer.clear();
        return buffered;
    }

    /**
     * Parses {@code operand (op operand)*} into a left-leaning tree. {@code operators} maps the current token to its
     * operator, or to null when the token does not continue the chain.
     */
    protected Expression leftAssociative(Supplier<Expression> operand, Function<Token, BinaryOperator> operators) {
        Expression left = operand.get();
        BinaryOperator operator;
        while ((operator = operators.apply(peek())) != null) {
            advance();
            Expression right = operand.get();
            left = new BinaryExpr(operator, left, right, left.position());
        }
        return left;
    }
}
