package ai.sourcebridge.translator.parse;

import ai.sourcebridge.translator.diag.ParseException;
import ai.sourcebridge.translator.ist.Assignment;
import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Block;
import ai.sourcebridge.translator.ist.Comment;
import ai.sourcebridge.translator.ist.Expression;
import ai.sourcebridge.translator.ist.ForLoop;
import ai.sourcebridge.translator.ist.Identifier;
import ai.sourcebridge.translator.ist.IfStatement;
import ai.sourcebridge.translator.ist.Literal;
import ai.sourcebridge.translator.ist.PrintStatement;
import ai.sourcebridge.translator.ist.Program;
import ai.sourcebridge.translator.ist.ReadStatement;
import ai.sourcebridge.translator.ist.Statement;
import ai.sourcebridge.translator.ist.TypeTag;
import ai.sourcebridge.translator.ist.UnaryExpr;
import ai.sourcebridge.translator.ist.UnaryOperator;
import ai.sourcebridge.translator.ist.VariableDecl;
import ai.sourcebridge.translator.ist.WhileLoop;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.Token;
import ai.sourcebridge.translator.lex.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Recursive-descent grammar for the C++ subset. Accepts either bare statements or a whole program made of
 * {@code #include} lines, {@code using namespace std;} and {@code int main() { ... }}; the frame is dropped.
 */
final class CppParser extends RecursiveDescentParser {

    private static final Set<String> SUPPORTED_TYPES = Set.of("int", "float", "double", "bool");

    private static final Set<String> UNSUPPORTED_TYPES =
            Set.of("char", "void", "auto", "long", "short", "unsigned", "signed");

    private static final Map<String, String> REJECTED_KEYWORDS = Map.ofEntries(
            Map.entry("do", "do-while loop"),
            Map.entry("switch", "switch statement"),
            Map.entry("case", "switch statement"),
            Map.entry("default", "switch statement"),
            Map.entry("break", "break statement"),
            Map.entry("continue", "continue statement"),
            Map.entry("return", "return statement"),
            Map.entry("class", "class definition"),
            Map.entry("struct", "struct definition"),
            Map.entry("namespace", "namespace definition"),
            Map.entry("using", "using declaration"),
            Map.entry("template", "template"),
            Map.entry("typename", "template"),
            Map.entry("new", "dynamic memory"),
            Map.entry("delete", "dynamic memory"),
            Map.entry("try", "exception handling"),
            Map.entry("catch", "exception handling"),
            Map.entry("throw", "exception handling"),
            Map.entry("const", "constant declaration"));

    private static final Map<String, BinaryOperator> COMPOUND_ASSIGNMENTS = Map.of(
            "+=", BinaryOperator.ADD,
            "-=", BinaryOperator.SUBTRACT,
            "*=", BinaryOperator.MULTIPLY,
            "/=", BinaryOperator.DIVIDE,
            "%=", BinaryOperator.MODULO);

    CppParser(List<Token> tokens) {
        super(tokens);
    }

    @Override
    Program program() {
        BlockBuilder body = new BlockBuilder(peek().position());
        skipPrologue();
        if (atMainFrame()) {
            mainFrame(body);
        } else {
            statements(body, token -> false);
        }
        body.leading(takeBufferedComments());
        if (!check(TokenKind.END_OF_INPUT)) {
            throw unexpected("a statement");
        }
        return new Program(body.build());
    }

    private void skipPrologue() {
        while (true) {
            Token token = peek();
            if (token.kind() == TokenKind.DIRECTIVE) {
                if (!token.text().startsWith("include")) {
                    throw unsupported(token, "preprocessor directive '#" + firstWord(token.text()) + "'");
                }
                advance();
            } else if (token.isKeyword("using")) {
                if (!peek(1).isKeyword("namespace") || !peek(2).is(TokenKind.IDENTIFIER, "std")) {
                    throw unsupported(token, "using declaration");
                }
                advance();
                advance();
                advance();
                expect(TokenKind.PUNCTUATION, ";");
            } else {
                return;
            }
        }
    }

    private static String firstWord(String text) {
        String trimmed = text.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }

    private boolean atMainFrame() {
        return peek().isKeyword("int") && peek(1).is(TokenKind.IDENTIFIER, "main") && peek(2).isPunctuation("(");
    }

    private void mainFrame(BlockBuilder body) {
        advance();
        advance();
        advance();
        if (!check(TokenKind.PUNCTUATION, ")")) {
            throw unsupported(peek(), "parameters of main");
        }
        advance();
        expect(TokenKind.PUNCTUATION, "{");
        statements(body, token -> token.isPunctuation("}") || token.isKeyword("return"));
        if (check(TokenKind.KEYWORD, "return")) {
            Token returnToken = advance();
            if (!peek().is(TokenKind.INTEGER_LITERAL, "0")) {
                throw unsupported(returnToken, "return value other than 0");
            }
            advance();
            expect(TokenKind.PUNCTUATION, ";");
        }
        body.leading(takeBufferedComments());
        expect(TokenKind.PUNCTUATION, "}", "'}' closing main");
        body.leading(takeBufferedComments());
        if (!check(TokenKind.END_OF_INPUT)) {
            throw unsupported(peek(), "code after the main function");
        }
    }

    private void statements(BlockBuilder block, Predicate<Token> stop) {
        while (true) {
            block.leading(takeBufferedComments());
            Token next = peek();
            if (next.kind() == TokenKind.END_OF_INPUT || stop.test(next)) {
                return;
            }
            block.add(statement());
        }
    }

    private ParsedStatement statement() {
        Token token = peek();
        switch (token.kind()) {
            case KEYWORD -> {
                return keywordStatement(token);
            }
            case IDENTIFIER -> {
                return identifierStatement(token);
            }
            case OPERATOR -> {
                if (token.isOperator("++") || token.isOperator("--")) {
                    Statement statement = prefixIncrement();
                    expect(TokenKind.PUNCTUATION, ";");
                    return ParsedStatement.of(statement, takeTrailingComments());
                }
                if (token.isOperator("*")) {
                    throw unsupported(token, "pointer");
                }
                throw unexpected("a statement");
            }
            case PUNCTUATION -> {
                if (token.isPunctuation(";")) {
                    advance();
                    return new ParsedStatement(List.of(), takeTrailingComments());
                }
                if (token.isPunctuation("{")) {
                    throw unsupported(token, "block without a loop or condition");
                }
                throw unexpected("a statement");
            }
            case DIRECTIVE -> throw unsupported(token, "preprocessor directive inside code");
            default -> throw unexpected("a statement");
        }
    }

    private ParsedStatement keywordStatement(Token token) {
        String word = token.text();
        if (SUPPORTED_TYPES.contains(word)) {
            return declaration();
        }
        if (UNSUPPORTED_TYPES.contains(word)) {
            if (peek(1).kind() == TokenKind.IDENTIFIER && peek(2).isPunctuation("(")) {
                throw unsupported(token, "function definition");
            }
            throw unsupported(token, "'" + word + "' variables");
        }
        switch (word) {
            case "if" -> {
                return ifStatement();
            }
            case "while" -> {
                return whileLoop();
            }
            case "for" -> {
                return forLoop();
            }
            case "else" -> throw ParseException.syntax(token.position(), "'else' without a matching 'if'");
            default -> {
                String construct = REJECTED_KEYWORDS.get(word);
                if (construct != null) {
                    throw unsupported(token, construct);
                }
                throw unexpected("a statement");
            }
        }
    }

    private ParsedStatement identifierStatement(Token token) {
        String name = standardName();
        if (name != null) {
            switch (name) {
                case "cout" -> {
                    return print();
                }
                case "cin" -> {
                    return read();
                }
                case "string" -> {
                    return declaration();
                }
                default -> throw unsupported(token, "standard library name 'std::" + name + "'");
            }
        }
        switch (token.text()) {
            case "cout" -> {
                return print();
            }
            case "cin" -> {
                return read();
            }
            case "string" -> {
                return declaration();
            }
            default -> {
                Token next = peek(1);
                if (next.kind() == TokenKind.IDENTIFIER) {
                    throw unsupported(token, "'" + token.text() + "' variables");
                }
                if (next.isOperator("::")) {
                    throw unsupported(token, "scope resolution");
                }
                Statement statement = assignment();
                expect(TokenKind.PUNCTUATION, ";");
                return ParsedStatement.of(statement, takeTrailingComments());
            }
        }
    }

    // Returns the name after a leading "std::", leaving the cursor on it, or null when there is no such prefix.
    private String standardName() {
        if (!check(TokenKind.IDENTIFIER, "std") || !peek(1).isOperator("::")) {
            return null;
        }
        advance();
        advance();
        Token name = peek();
        if (name.kind() != TokenKind.IDENTIFIER) {
            throw unexpected("a name after 'std::'");
        }
        return name.text();
    }

    private TypeTag type() {
        standardName();
        Token token = advance();
        return switch (token.text()) {
            case "int" -> TypeTag.INT;
            case "float", "double" -> TypeTag.FLOAT;
            case "bool" -> TypeTag.BOOL;
            case "string" -> TypeTag.STRING;
            default -> throw UNSUPPORTED_TYPES.contains(token.text())
                    ? unsupported(token, "'" + token.text() + "' variables")
                    : ParseException.syntax(token.position(), "expected a type but found " + token.describe());
        };
    }

    // string("...") around a literal, as written before a comparison of two literals
    private boolean atStringConversion() {
        return peek().is(TokenKind.IDENTIFIER, "string") && peek(1).isPunctuation("(")
                && peek(2).kind() == TokenKind.STRING_LITERAL && peek(3).isPunctuation(")");
    }

    private boolean atType() {
        Token token = peek();
        if (token.kind() == TokenKind.KEYWORD) {
            return SUPPORTED_TYPES.contains(token.text()) || UNSUPPORTED_TYPES.contains(token.text());
        }
        if (token.is(TokenKind.IDENTIFIER, "std")) {
            return peek(1).isOperator("::") && peek(2).is(TokenKind.IDENTIFIER, "string");
        }
        return token.is(TokenKind.IDENTIFIER, "string");
    }

    private ParsedStatement declaration() {
        Token start = peek();
        List<Statement> declarations = new ArrayList<>();
        declarations.add(declarator(start, type()));
        TypeTag type = ((VariableDecl) declarations.get(0)).type();
        while (match(TokenKind.PUNCTUATION, ",")) {
            declarations.add(declarator(peek(), type));
        }
        expect(TokenKind.PUNCTUATION, ";");
        return new ParsedStatement(declarations, takeTrailingComments());
    }

    private VariableDecl declarator(Token start, TypeTag type) {
        if (check(TokenKind.OPERATOR, "*") || check(TokenKind.OPERATOR, "&") || check(TokenKind.OPERATOR, "&&")) {
            throw unsupported(peek(), "pointer or reference variables");
        }
        Token name = expectKind(TokenKind.IDENTIFIER, "a variable name");
        if (check(TokenKind.PUNCTUATION, "(")) {
            throw unsupported(start, "function definition");
        }
        if (check(TokenKind.PUNCTUATION, "[")) {
            throw unsupported(name, "array variables");
        }
        if (check(TokenKind.PUNCTUATION, "{")) {
            throw unsupported(name, "brace initialization");
        }
        if (check(TokenKind.OPERATOR, ":")) {
            throw unsupported(start, "range-based for loop");
        }
        Expression initializer = null;
        if (match(TokenKind.OPERATOR, "=")) {
            initializer = expression();
        }
        return new VariableDecl(name.text(), type, initializer, start.position());
    }

    private Statement assignment() {
        Token name = expectKind(TokenKind.IDENTIFIER, "a variable name");
        Token operator = peek();
        Identifier target = Identifier.unresolved(name.text(), name.position());
        if (operator.isPunctuation("(")) {
            throw unsupported(name, "function call");
        }
        if (operator.isPunctuation("[")) {
            throw unsupported(name, "array indexing");
        }
        if (operator.isOperator(".") || operator.isOperator("->")) {
            throw unsupported(name, "member access");
        }
        if (operator.isOperator("=")) {
            advance();
            return new Assignment(name.text(), expression(), name.position());
        }
        if (operator.isOperator("++") || operator.isOperator("--")) {
            advance();
            return step(target, operator);
        }
        BinaryOperator compound = operator.kind() == TokenKind.OPERATOR
                ? COMPOUND_ASSIGNMENTS.get(operator.text()) : null;
        if (compound == null) {
            throw unexpected("'=' after '" + name.text() + "'");
        }
        advance();
        Expression value = expression();
        return new Assignment(name.text(), new BinaryExpr(compound, target, value, name.position()), name.position());
    }

    private Statement prefixIncrement() {
        Token operator = advance();
        Token name = expectKind(TokenKind.IDENTIFIER, "a variable name");
        return step(Identifier.unresolved(name.text(), name.position()), operator);
    }

    private static Statement step(Identifier target, Token operator) {
        BinaryOperator binary = operator.isOperator("++") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
        Expression value = new BinaryExpr(binary, target, Literal.integer(1, operator.position()), target.position());
        return new Assignment(target.name(), value, target.position());
    }

    private ParsedStatement print() {
        Token start = advance();
        List<Expression> items = new ArrayList<>();
        boolean newline = false;
        if (!check(TokenKind.OPERATOR, "<<")) {
            throw unexpected("'<<' after 'cout'");
        }
        while (match(TokenKind.OPERATOR, "<<")) {
            if (atEndl()) {
                Token endl = peek();
                if (check(TokenKind.IDENTIFIER, "std")) {
                    advance();
                    advance();
                }
                advance();
                if (check(TokenKind.OPERATOR, "<<")) {
                    items.add(Literal.string("\n", endl.position()));
                } else {
                    newline = true;
                }
            } else {
                items.add(additive());
            }
        }
        expect(TokenKind.PUNCTUATION, ";");
        return ParsedStatement.of(new PrintStatement(items, newline, start.position()), takeTrailingComments());
    }

    private boolean atEndl() {
        if (check(TokenKind.IDENTIFIER, "endl")) {
            return true;
        }
        return check(TokenKind.IDENTIFIER, "std") && peek(1).isOperator("::")
                && peek(2).is(TokenKind.IDENTIFIER, "endl");
    }

    private ParsedStatement read() {
        Token start = advance();
        if (!check(TokenKind.OPERATOR, ">>")) {
            throw unexpected("'>>' after 'cin'");
        }
        List<Statement> reads = new ArrayList<>();
        while (match(TokenKind.OPERATOR, ">>")) {
            Token target = expectKind(TokenKind.IDENTIFIER, "a variable to read into");
            if (check(TokenKind.PUNCTUATION, "[")) {
                throw unsupported(target, "array indexing");
            }
            Token at = reads.isEmpty() ? start : target;
            reads.add(new ReadStatement(target.text(), TypeTag.INFERRED, null, at.position()));
        }
        expect(TokenKind.PUNCTUATION, ";");
        return new ParsedStatement(reads, takeTrailingComments());
    }

    private ParsedStatement ifStatement() {
        Token start = advance();
        expect(TokenKind.PUNCTUATION, "(");
        Expression condition = expression();
        expect(TokenKind.PUNCTUATION, ")");
        Body then = body(false);
        Block elseBlock = null;
        if (match(TokenKind.KEYWORD, "else")) {
            if (check(TokenKind.KEYWORD, "if")) {
                Token nestedStart = peek();
                ParsedStatement nested = ifStatement();
                List<Comment> comments = new ArrayList<>();
                for (Token comment : nested.trailingComments()) {
                    comments.add(new Comment(comment.text(), CommentPlacement.TRAILING, 0, comment.position()));
                }
                elseBlock = new Block(nested.statements(), comments, nestedStart.position());
            } else {
                elseBlock = body(true).block();
            }
        }
        return ParsedStatement.of(new IfStatement(condition, then.block(), elseBlock, start.position()),
                then.headerComments());
    }

    private ParsedStatement whileLoop() {
        Token start = advance();
        expect(TokenKind.PUNCTUATION, "(");
        Expression condition = expression();
        expect(TokenKind.PUNCTUATION, ")");
        Body body = body(false);
        return ParsedStatement.of(new WhileLoop(condition, body.block(), start.position()), body.headerComments());
    }

    private ParsedStatement forLoop() {
        Token start = advance();
        expect(TokenKind.PUNCTUATION, "(");
        Statement init = null;
        if (!check(TokenKind.PUNCTUATION, ";")) {
            init = atType() ? declarator(peek(), type()) : loopStep();
        }
        rejectComma();
        expect(TokenKind.PUNCTUATION, ";");
        if (check(TokenKind.PUNCTUATION, ";")) {
            throw unsupported(start, "loop without a condition");
        }
        Expression condition = expression();
        expect(TokenKind.PUNCTUATION, ";");
        Statement update = null;
        if (!check(TokenKind.PUNCTUATION, ")")) {
            update = loopStep();
        }
        rejectComma();
        expect(TokenKind.PUNCTUATION, ")");
        Body body = body(false);
        return ParsedStatement.of(new ForLoop(init, condition, update, body.block(), start.position()),
                body.headerComments());
    }

    private Statement loopStep() {
        if (check(TokenKind.OPERATOR, "++") || check(TokenKind.OPERATOR, "--")) {
            return prefixIncrement();
        }
        return assignment();
    }

    private void rejectComma() {
        if (check(TokenKind.PUNCTUATION, ",")) {
            throw unsupported(peek(), "comma in a loop header");
        }
    }

    private record Body(Block block, List<Token> headerComments) {
    }

    /**
     * Parses a braced block or a single statement. Comments trailing the opening brace belong to the statement that
     * owns the block, or, with {@code headerCommentsInside}, lead the block's first statement.
     */
    private Body body(boolean headerCommentsInside) {
        Token start = peek();
        BlockBuilder block = new BlockBuilder(start.position());
        if (!match(TokenKind.PUNCTUATION, "{")) {
            block.add(statement());
            return new Body(block.build(), List.of());
        }
        List<Token> header = takeTrailingComments();
        if (headerCommentsInside) {
            block.leading(header);
            header = List.of();
        }
        statements(block, token -> token.isPunctuation("}"));
        expect(TokenKind.PUNCTUATION, "}");
        return new Body(block.build(), header);
    }

    private Expression expression() {
        Expression expression = leftAssociative(this::logicalAnd,
                token -> token.isOperator("||") ? BinaryOperator.OR : null);
        Token next = peek();
        if (next.isOperator("?")) {
            throw unsupported(next, "conditional expression (?:)");
        }
        if (next.isOperator("&") || next.isOperator("|") || next.isOperator("^")) {
            throw unsupported(next, "bitwise operator");
        }
        if (next.isOperator("<<") || next.isOperator(">>")) {
            throw unsupported(next, "bit shift");
        }
        if (next.isOperator("=") || COMPOUND_ASSIGNMENTS.containsKey(next.text()) && next.kind() == TokenKind.OPERATOR) {
            throw unsupported(next, "assignment inside an expression");
        }
        return expression;
    }

    private Expression logicalAnd() {
        return leftAssociative(this::equality, token -> token.isOperator("&&") ? BinaryOperator.AND : null);
    }

    private Expression equality() {
        return leftAssociative(this::relational, token -> {
            if (token.isOperator("==")) {
                return BinaryOperator.EQUAL;
            }
            return token.isOperator("!=") ? BinaryOperator.NOT_EQUAL : null;
        });
    }

    private Expression relational() {
        return leftAssociative(this::additive, token -> {
            if (token.kind() != TokenKind.OPERATOR) {
                return null;
            }
            return switch (token.text()) {
                case "<" -> BinaryOperator.LESS;
                case "<=" -> BinaryOperator.LESS_EQUAL;
                case ">" -> BinaryOperator.GREATER;
                case ">=" -> BinaryOperator.GREATER_EQUAL;
                default -> null;
            };
        });
    }

    private Expression additive() {
        return leftAssociative(this::multiplicative, token -> {
            if (token.isOperator("+")) {
                return BinaryOperator.ADD;
            }
            return token.isOperator("-") ? BinaryOperator.SUBTRACT : null;
        });
    }

    private Expression multiplicative() {
        return leftAssociative(this::unary, token -> {
            if (token.kind() != TokenKind.OPERATOR) {
                return null;
            }
            return switch (token.text()) {
                case "*" -> BinaryOperator.MULTIPLY;
                case "/" -> BinaryOperator.DIVIDE;
                case "%" -> BinaryOperator.MODULO;
                default -> null;
            };
        });
    }

    private Expression unary() {
        Token token = peek();
        if (token.isOperator("-")) {
            advance();
            return new UnaryExpr(UnaryOperator.NEGATE, unary(), token.position());
        }
        if (token.isOperator("!")) {
            advance();
            return new UnaryExpr(UnaryOperator.NOT, unary(), token.position());
        }
        if (token.isOperator("++") || token.isOperator("--")) {
            throw unsupported(token, "increment inside an expression");
        }
        if (token.isOperator("*") || token.isOperator("&")) {
            throw unsupported(token, "pointer");
        }
        if (token.isOperator("~")) {
            throw unsupported(token, "bitwise operator");
        }
        return primary();
    }

    private Expression primary() {
        Token token = peek();
        switch (token.kind()) {
            case INTEGER_LITERAL -> {
                advance();
                return Literal.integer(token.text(), token.position());
            }
            case FLOAT_LITERAL -> {
                advance();
                return Literal.floating(token.text(), token.position());
            }
            case STRING_LITERAL -> {
                advance();
                return Literal.string(token.text(), token.position());
            }
            case IDENTIFIER -> {
                return variable(token);
            }
            case KEYWORD -> {
                if (token.isKeyword("true") || token.isKeyword("false")) {
                    advance();
                    return Literal.bool(token.isKeyword("true"), token.position());
                }
                if (REJECTED_KEYWORDS.containsKey(token.text())) {
                    throw unsupported(token, REJECTED_KEYWORDS.get(token.text()));
                }
                throw unexpected("a value");
            }
            case PUNCTUATION -> {
                if (token.isPunctuation("(")) {
                    advance();
                    if (atType() && !atStringConversion()) {
                        throw unsupported(token, "type cast");
                    }
                    Expression inner = expression();
                    expect(TokenKind.PUNCTUATION, ")");
                    return inner;
                }
                if (token.isPunctuation("{")) {
                    throw unsupported(token, "brace initialization");
                }
                throw unexpected("a value");
            }
            default -> throw unexpected("a value");
        }
    }

    private Expression variable(Token token) {
        if (atStringConversion()) {
            advance();
            advance();
            Token text = advance();
            advance();
            return Literal.string(text.text(), token.position());
        }
        if (token.is(TokenKind.IDENTIFIER, "std") && peek(1).isOperator("::")) {
            throw unsupported(token, "standard library name 'std::" + peek(2).text() + "'");
        }
        advance();
        Token next = peek();
        if (next.isPunctuation("(")) {
            throw unsupported(token, "function call");
        }
        if (next.isPunctuation("[")) {
            throw unsupported(token, "array indexing");
        }
        if (next.isOperator(".") || next.isOperator("->")) {
            throw unsupported(token, "member access");
        }
        if (next.isOperator("::")) {
            throw unsupported(token, "scope resolution");
        }
        if (next.isOperator("++") || next.isOperator("--")) {
            throw unsupported(next, "increment inside an expression");
        }
        return Identifier.unresolved(token.text(), token.position());
    }
}
