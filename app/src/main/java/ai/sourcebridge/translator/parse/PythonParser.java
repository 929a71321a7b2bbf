package ai.sourcebridge.translator.parse;

import ai.sourcebridge.translator.diag.ParseException;
import ai.sourcebridge.translator.diag.TranslationException;
import ai.sourcebridge.translator.ist.Assignment;
import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Binding;
import ai.sourcebridge.translator.ist.Block;
import ai.sourcebridge.translator.ist.Comment;
import ai.sourcebridge.translator.ist.Expression;
import ai.sourcebridge.translator.ist.Identifier;
import ai.sourcebridge.translator.ist.IfStatement;
import ai.sourcebridge.translator.ist.Literal;
import ai.sourcebridge.translator.ist.PrintStatement;
import ai.sourcebridge.translator.ist.Program;
import ai.sourcebridge.translator.ist.RangeLoop;
import ai.sourcebridge.translator.ist.ReadStatement;
import ai.sourcebridge.translator.ist.Statement;
import ai.sourcebridge.translator.ist.TypeTag;
import ai.sourcebridge.translator.ist.UnaryExpr;
import ai.sourcebridge.translator.ist.UnaryOperator;
import ai.sourcebridge.translator.ist.VariableDecl;
import ai.sourcebridge.translator.ist.WhileLoop;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.PythonTokenizer;
import ai.sourcebridge.translator.lex.SourcePosition;
import ai.sourcebridge.translator.lex.StringEscapes;
import ai.sourcebridge.translator.lex.Token;
import ai.sourcebridge.translator.lex.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent grammar for the Python subset. Keeps Python's own shapes where they differ from the shared model:
 * {@code for ... in range(...)} becomes a {@link RangeLoop}, and an unannotated {@code name = value} becomes a
 * {@link Binding}.
 */
final class PythonParser extends RecursiveDescentParser {

    private static final Map<String, String> REJECTED_KEYWORDS = Map.ofEntries(
            Map.entry("def", "function definition"),
            Map.entry("class", "class definition"),
            Map.entry("import", "import statement"),
            Map.entry("from", "import statement"),
            Map.entry("return", "return statement"),
            Map.entry("lambda", "lambda expression"),
            Map.entry("try", "exception handling"),
            Map.entry("except", "exception handling"),
            Map.entry("finally", "exception handling"),
            Map.entry("raise", "exception handling"),
            Map.entry("with", "with statement"),
            Map.entry("break", "break statement"),
            Map.entry("continue", "continue statement"),
            Map.entry("global", "global declaration"),
            Map.entry("nonlocal", "global declaration"),
            Map.entry("yield", "generator"),
            Map.entry("del", "del statement"),
            Map.entry("assert", "assert statement"),
            Map.entry("async", "asynchronous code"),
            Map.entry("await", "asynchronous code"),
            Map.entry("None", "None value"),
            Map.entry("is", "identity comparison"),
            Map.entry("in", "membership test"));

    private static final Map<String, BinaryOperator> COMPOUND_ASSIGNMENTS = Map.of(
            "+=", BinaryOperator.ADD,
            "-=", BinaryOperator.SUBTRACT,
            "*=", BinaryOperator.MULTIPLY,
            "/=", BinaryOperator.TRUE_DIVIDE,
            "//=", BinaryOperator.FLOOR_DIVIDE,
            "%=", BinaryOperator.MODULO);

    private static final Map<String, TypeTag> ANNOTATION_TYPES = Map.of(
            "int", TypeTag.INT,
            "float", TypeTag.FLOAT,
            "str", TypeTag.STRING,
            "bool", TypeTag.BOOL);

    private static final Set<String> CONVERSIONS = Set.of("int", "float", "str", "bool");

    PythonParser(List<Token> tokens) {
        super(tokens);
    }

    @Override
    Program program() {
        BlockBuilder body = new BlockBuilder(peek().position());
        statements(body);
        body.leading(takeBufferedComments());
        if (!check(TokenKind.END_OF_INPUT)) {
            throw unexpected("a statement");
        }
        return new Program(body.build());
    }

    private void statements(BlockBuilder block) {
        while (true) {
            block.leading(takeBufferedComments());
            TokenKind next = peek().kind();
            if (next == TokenKind.END_OF_INPUT || next == TokenKind.BLOCK_END) {
                return;
            }
            if (next == TokenKind.BLOCK_START) {
                throw ParseException.syntax(peek().position(), "this line is indented more than the line before it");
            }
            block.add(statement());
        }
    }

    private ParsedStatement statement() {
        Token token = peek();
        if (token.kind() == TokenKind.KEYWORD) {
            return keywordStatement(token);
        }
        if (token.kind() == TokenKind.IDENTIFIER) {
            return identifierStatement(token);
        }
        if (token.isOperator("@")) {
            throw unsupported(token, "decorator");
        }
        throw unexpected("a statement");
    }

    private ParsedStatement keywordStatement(Token token) {
        switch (token.text()) {
            case "if" -> {
                return ifStatement();
            }
            case "while" -> {
                return whileLoop();
            }
            case "for" -> {
                return forLoop();
            }
            case "pass" -> {
                advance();
                return new ParsedStatement(List.of(), endOfSimpleStatement());
            }
            case "elif", "else" -> throw ParseException.syntax(token.position(),
                    "'" + token.text() + "' without a matching 'if'");
            default -> {
                String construct = REJECTED_KEYWORDS.get(token.text());
                if (construct != null) {
                    throw unsupported(token, construct);
                }
                throw unexpected("a statement");
            }
        }
    }

    private ParsedStatement identifierStatement(Token name) {
        Token next = peek(1);
        if (name.text().equals("print") && next.isPunctuation("(")) {
            return print();
        }
        if (next.isOperator("=")) {
            return binding();
        }
        if (next.isPunctuation(":")) {
            return annotatedDeclaration();
        }
        if (next.kind() == TokenKind.OPERATOR && COMPOUND_ASSIGNMENTS.containsKey(next.text())) {
            advance();
            BinaryOperator operator = COMPOUND_ASSIGNMENTS.get(advance().text());
            Expression value = expression();
            Identifier target = Identifier.unresolved(name.text(), name.position());
            Statement statement = new Assignment(name.text(),
                    new BinaryExpr(operator, target, value, name.position()), name.position());
            return ParsedStatement.of(statement, endOfSimpleStatement());
        }
        if (next.isPunctuation("(")) {
            throw unsupported(name, "function call '" + name.text() + "()'");
        }
        if (next.isPunctuation(",")) {
            throw unsupported(name, "multiple assignment");
        }
        if (next.isPunctuation("[")) {
            throw unsupported(name, "indexing");
        }
        if (next.isPunctuation(".")) {
            throw unsupported(name, "method or attribute access");
        }
        advance();
        throw unexpected("'=' after '" + name.text() + "'");
    }

    private ParsedStatement binding() {
        Token name = advance();
        advance();
        if (atRead()) {
            ReadStatement read = read(name);
            return ParsedStatement.of(read, endOfSimpleStatement());
        }
        Expression value = expression();
        if (check(TokenKind.OPERATOR, "=")) {
            throw unsupported(name, "chained assignment");
        }
        if (check(TokenKind.PUNCTUATION, ",")) {
            throw unsupported(peek(), "tuple");
        }
        return ParsedStatement.of(new Binding(name.text(), value, name.position()), endOfSimpleStatement());
    }

    private ParsedStatement annotatedDeclaration() {
        Token name = advance();
        advance();
        Token typeToken = expectKind(TokenKind.IDENTIFIER, "a type name");
        TypeTag type = ANNOTATION_TYPES.get(typeToken.text());
        if (type == null) {
            throw unsupported(typeToken, "type annotation '" + typeToken.text() + "'");
        }
        if (!match(TokenKind.OPERATOR, "=")) {
            return ParsedStatement.of(new VariableDecl(name.text(), type, null, name.position()),
                    endOfSimpleStatement());
        }
        if (atRead()) {
            ReadStatement read = read(name);
            List<Statement> statements = List.of(new VariableDecl(name.text(), type, null, name.position()), read);
            return new ParsedStatement(statements, endOfSimpleStatement());
        }
        Expression value = expression();
        return ParsedStatement.of(new VariableDecl(name.text(), type, value, name.position()), endOfSimpleStatement());
    }

    /** Consumes the end of a one-line statement and returns the comments that trail it. */
    private List<Token> endOfSimpleStatement() {
        if (match(TokenKind.PUNCTUATION, ";") && !check(TokenKind.NEWLINE) && !check(TokenKind.END_OF_INPUT)) {
            throw unsupported(peek(), "several statements on one line");
        }
        if (!match(TokenKind.NEWLINE, "") && !check(TokenKind.END_OF_INPUT)) {
            if (check(TokenKind.KEYWORD, "if")) {
                throw unsupported(peek(), "conditional expression");
            }
            throw unexpected("the end of the line");
        }
        return takeTrailingComments();
    }

    // input(...), str/int/float(input(...)) or bool(int(input(...)))
    private boolean atRead() {
        if (readCall(0)) {
            return true;
        }
        Token conversion = peek();
        if (conversion.kind() != TokenKind.IDENTIFIER || !peek(1).isPunctuation("(")) {
            return false;
        }
        if (CONVERSIONS.contains(conversion.text()) && readCall(2)) {
            return true;
        }
        return conversion.text().equals("bool") && peek(2).is(TokenKind.IDENTIFIER, "int")
                && peek(3).isPunctuation("(") && readCall(4);
    }

    private boolean readCall(int ahead) {
        return peek(ahead).is(TokenKind.IDENTIFIER, "input") && peek(ahead + 1).isPunctuation("(");
    }

    private ReadStatement read(Token target) {
        List<String> conversions = new ArrayList<>();
        while (!check(TokenKind.IDENTIFIER, "input")) {
            conversions.add(advance().text());
            expect(TokenKind.PUNCTUATION, "(");
        }
        Token input = advance();
        expect(TokenKind.PUNCTUATION, "(");
        String prompt = null;
        if (!check(TokenKind.PUNCTUATION, ")")) {
            Token promptToken = peek();
            if (promptToken.kind() != TokenKind.STRING_LITERAL) {
                throw unsupported(promptToken, "prompt that is not plain text");
            }
            advance();
            prompt = promptToken.text();
        }
        expect(TokenKind.PUNCTUATION, ")");
        for (int i = 0; i < conversions.size(); i++) {
            expect(TokenKind.PUNCTUATION, ")");
        }
        TypeTag type = conversions.isEmpty() ? TypeTag.STRING : switch (conversions.get(0)) {
            case "int" -> TypeTag.INT;
            case "float" -> TypeTag.FLOAT;
            case "bool" -> TypeTag.BOOL;
            default -> TypeTag.STRING;
        };
        if (!check(TokenKind.NEWLINE) && !check(TokenKind.END_OF_INPUT) && !check(TokenKind.PUNCTUATION, ";")) {
            throw unsupported(input, "input inside an expression");
        }
        return new ReadStatement(target.text(), type, prompt, target.position());
    }

    private ParsedStatement print() {
        Token start = advance();
        expect(TokenKind.PUNCTUATION, "(");
        List<List<Expression>> arguments = new ArrayList<>();
        String separator = " ";
        String end = "\n";
        boolean keywordSeen = false;
        while (!check(TokenKind.PUNCTUATION, ")")) {
            Token token = peek();
            if (token.kind() == TokenKind.IDENTIFIER && peek(1).isOperator("=")) {
                keywordSeen = true;
                advance();
                advance();
                String value = printOption(token);
                if (token.text().equals("sep")) {
                    separator = value;
                } else {
                    end = value;
                }
            } else {
                if (keywordSeen) {
                    throw ParseException.syntax(token.position(), "a value is listed after a named print option");
                }
                arguments.add(printArgument());
            }
            if (!match(TokenKind.PUNCTUATION, ",")) {
                break;
            }
        }
        expect(TokenKind.PUNCTUATION, ")");
        List<Expression> items = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0 && !separator.isEmpty()) {
                items.add(Literal.string(separator, start.position()));
            }
            items.addAll(arguments.get(i));
        }
        boolean newline = end.endsWith("\n");
        String endText = newline ? end.substring(0, end.length() - 1) : end;
        if (!endText.isEmpty()) {
            items.add(Literal.string(endText, start.position()));
        }
        return ParsedStatement.of(new PrintStatement(items, newline, start.position()), endOfSimpleStatement());
    }

    private String printOption(Token name) {
        if (!name.text().equals("sep") && !name.text().equals("end")) {
            throw unsupported(name, "print option '" + name.text() + "'");
        }
        Token value = peek();
        if (value.kind() != TokenKind.STRING_LITERAL) {
            throw unsupported(value, "print option that is not plain text");
        }
        advance();
        return value.text();
    }

    private List<Expression> printArgument() {
        if (check(TokenKind.FORMAT_STRING)) {
            return formattedText(advance());
        }
        return List.of(expression());
    }

    /**
     * Splits an f-string into its text parts and the values between braces. Each value is parsed as an expression
     * of its own; its tokens report the position of the whole f-string.
     */
    private List<Expression> formattedText(Token token) {
        String raw = token.text();
        SourcePosition position = token.position();
        List<Expression> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                text.append(c).append(raw.charAt(i + 1));
                i += 2;
            } else if (c == '{' && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < raw.length() && raw.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
            } else if (c == '}') {
                throw ParseException.syntax(position, "a single '}' in formatted text must be written as '}}'");
            } else if (c == '{') {
                int close = raw.indexOf('}', i);
                if (close < 0) {
                    throw ParseException.syntax(position, "a '{' in formatted text is never closed");
                }
                if (text.length() > 0) {
                    parts.add(Literal.string(StringEscapes.decode(text.toString(), position), position));
                    text.setLength(0);
                }
                parts.add(formattedValue(raw.substring(i + 1, close), position));
                i = close + 1;
            } else {
                text.append(c);
                i++;
            }
        }
        if (text.length() > 0) {
            parts.add(Literal.string(StringEscapes.decode(text.toString(), position), position));
        }
        return parts;
    }

    private Expression formattedValue(String source, SourcePosition position) {
        if (source.indexOf('{') >= 0) {
            throw ParseException.unsupported(position, "nested braces in formatted text");
        }
        if (source.replace("!=", "").indexOf('!') >= 0) {
            throw ParseException.unsupported(position, "conversion in formatted text");
        }
        if (source.indexOf(':') >= 0) {
            throw ParseException.unsupported(position, "format specification in formatted text");
        }
        if (source.stripTrailing().endsWith("=")) {
            throw ParseException.unsupported(position, "self-documenting formatted value");
        }
        List<Token> tokens;
        try {
            tokens = new PythonTokenizer().tokenize(source.strip());
        } catch (TranslationException e) {
            throw ParseException.syntax(position, "the value {" + source + "} in formatted text cannot be read");
        }
        List<Token> relocated = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.kind() == TokenKind.COMMENT) {
                throw ParseException.syntax(position, "formatted text cannot contain '#'");
            }
            relocated.add(new Token(token.kind(), token.text(), position));
        }
        return new PythonParser(relocated).standaloneExpression();
    }

    private Expression standaloneExpression() {
        Expression expression = expression();
        match(TokenKind.NEWLINE, "");
        if (!check(TokenKind.END_OF_INPUT)) {
            throw unexpected("the end of the formatted value");
        }
        return expression;
    }

    private ParsedStatement ifStatement() {
        Token start = advance();
        Expression condition = expression();
        expect(TokenKind.PUNCTUATION, ":");
        Suite then = suite(false);
        Block elseBlock = null;
        if (check(TokenKind.KEYWORD, "elif")) {
            Token nestedStart = peek();
            ParsedStatement nested = ifStatement();
            List<Comment> comments = new ArrayList<>();
            for (Token comment : nested.trailingComments()) {
                comments.add(new Comment(comment.text(), CommentPlacement.TRAILING, 0, comment.position()));
            }
            elseBlock = new Block(nested.statements(), comments, nestedStart.position());
        } else if (match(TokenKind.KEYWORD, "else")) {
            expect(TokenKind.PUNCTUATION, ":");
            elseBlock = suite(true).block();
        }
        return ParsedStatement.of(new IfStatement(condition, then.block(), elseBlock, start.position()),
                then.headerComments());
    }

    private ParsedStatement whileLoop() {
        Token start = advance();
        Expression condition = expression();
        expect(TokenKind.PUNCTUATION, ":");
        Suite body = suite(false);
        rejectLoopElse();
        return ParsedStatement.of(new WhileLoop(condition, body.block(), start.position()), body.headerComments());
    }

    private ParsedStatement forLoop() {
        Token start = advance();
        Token variable = peek();
        if (variable.kind() != TokenKind.IDENTIFIER) {
            throw unexpected("a loop variable");
        }
        advance();
        if (check(TokenKind.PUNCTUATION, ",")) {
            throw unsupported(variable, "unpacking in a for loop");
        }
        expect(TokenKind.KEYWORD, "in");
        Token range = peek();
        if (!range.is(TokenKind.IDENTIFIER, "range") || !peek(1).isPunctuation("(")) {
            throw unsupported(range, "for loop over something other than range()");
        }
        advance();
        advance();
        List<Expression> arguments = new ArrayList<>();
        while (!check(TokenKind.PUNCTUATION, ")")) {
            arguments.add(expression());
            if (!match(TokenKind.PUNCTUATION, ",")) {
                break;
            }
        }
        expect(TokenKind.PUNCTUATION, ")");
        if (arguments.isEmpty() || arguments.size() > 3) {
            throw unsupported(range, "range() with " + arguments.size() + " arguments");
        }
        Expression rangeStart = arguments.size() == 1 ? Literal.integer(0, range.position()) : arguments.get(0);
        Expression stop = arguments.size() == 1 ? arguments.get(0) : arguments.get(1);
        Expression step = arguments.size() == 3 ? arguments.get(2) : null;
        expect(TokenKind.PUNCTUATION, ":");
        Suite body = suite(false);
        rejectLoopElse();
        RangeLoop loop = new RangeLoop(variable.text(), rangeStart, stop, step, body.block(), start.position());
        return ParsedStatement.of(loop, body.headerComments());
    }

    private void rejectLoopElse() {
        if (check(TokenKind.KEYWORD, "else")) {
            throw unsupported(peek(), "loop else clause");
        }
    }

    private record Suite(Block block, List<Token> headerComments) {
    }

    /**
     * Parses the body after a {@code :}, either an indented block or statements on the same line. Comments trailing
     * the header line belong to the owning statement, or, with {@code headerCommentsInside}, lead the first statement.
     */
    private Suite suite(boolean headerCommentsInside) {
        Token start = peek();
        BlockBuilder block = new BlockBuilder(start.position());
        if (!match(TokenKind.NEWLINE, "")) {
            if (check(TokenKind.END_OF_INPUT)) {
                throw unexpected("an indented block");
            }
            block.add(statement());
            return new Suite(block.build(), List.of());
        }
        List<Token> header = takeTrailingComments();
        if (headerCommentsInside) {
            block.leading(header);
            header = List.of();
        }
        expectKind(TokenKind.BLOCK_START, "an indented block");
        statements(block);
        if (!check(TokenKind.END_OF_INPUT)) {
            expectKind(TokenKind.BLOCK_END, "the end of the indented block");
        }
        return new Suite(block.build(), header);
    }

    private Expression expression() {
        Expression expression = leftAssociative(this::logicalAnd,
                token -> token.isKeyword("or") ? BinaryOperator.OR : null);
        Token next = peek();
        if (next.isKeyword("if")) {
            throw unsupported(next, "conditional expression");
        }
        if (next.isOperator("&") || next.isOperator("|") || next.isOperator("^")) {
            throw unsupported(next, "bitwise operator");
        }
        if (next.isOperator("<<") || next.isOperator(">>")) {
            throw unsupported(next, "bit shift");
        }
        return expression;
    }

    private Expression logicalAnd() {
        return leftAssociative(this::logicalNot, token -> token.isKeyword("and") ? BinaryOperator.AND : null);
    }

    private Expression logicalNot() {
        Token token = peek();
        if (token.isKeyword("not")) {
            advance();
            return new UnaryExpr(UnaryOperator.NOT, logicalNot(), token.position());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = additive();
        BinaryOperator operator = comparisonOperator();
        if (operator == null) {
            return left;
        }
        advance();
        Expression right = additive();
        if (comparisonOperator() != null) {
            throw unsupported(peek(), "chained comparison");
        }
        return new BinaryExpr(operator, left, right, left.position());
    }

    private BinaryOperator comparisonOperator() {
        Token token = peek();
        if (token.isKeyword("in") || token.isKeyword("not") && peek(1).isKeyword("in")) {
            throw unsupported(token, "membership test");
        }
        if (token.isKeyword("is")) {
            throw unsupported(token, "identity comparison");
        }
        if (token.kind() != TokenKind.OPERATOR) {
            return null;
        }
        return switch (token.text()) {
            case "==" -> BinaryOperator.EQUAL;
            case "!=" -> BinaryOperator.NOT_EQUAL;
            case "<" -> BinaryOperator.LESS;
            case "<=" -> BinaryOperator.LESS_EQUAL;
            case ">" -> BinaryOperator.GREATER;
            case ">=" -> BinaryOperator.GREATER_EQUAL;
            default -> null;
        };
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
                case "/" -> BinaryOperator.TRUE_DIVIDE;
                case "//" -> BinaryOperator.FLOOR_DIVIDE;
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
        if (token.isOperator("~")) {
            throw unsupported(token, "bitwise operator");
        }
        Expression operand = primary();
        if (check(TokenKind.OPERATOR, "**")) {
            throw unsupported(peek(), "exponent operator");
        }
        if (check(TokenKind.OPERATOR, "@")) {
            throw unsupported(peek(), "matrix multiplication");
        }
        return operand;
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
            case FORMAT_STRING -> throw unsupported(token, "formatted text outside print");
            case IDENTIFIER -> {
                return variable(token);
            }
            case KEYWORD -> {
                if (token.isKeyword("True") || token.isKeyword("False")) {
                    advance();
                    return Literal.bool(token.isKeyword("True"), token.position());
                }
                String construct = REJECTED_KEYWORDS.get(token.text());
                if (construct != null) {
                    throw unsupported(token, construct);
                }
                throw unexpected("a value");
            }
            case PUNCTUATION -> {
                if (token.isPunctuation("(")) {
                    advance();
                    Expression inner = expression();
                    if (check(TokenKind.PUNCTUATION, ",")) {
                        throw unsupported(token, "tuple");
                    }
                    expect(TokenKind.PUNCTUATION, ")");
                    return inner;
                }
                if (token.isPunctuation("[")) {
                    throw unsupported(token, "list");
                }
                if (token.isPunctuation("{")) {
                    throw unsupported(token, "dictionary or set");
                }
                throw unexpected("a value");
            }
            default -> throw unexpected("a value");
        }
    }

    private Expression variable(Token token) {
        if (atRead()) {
            throw unsupported(token, "input inside an expression");
        }
        advance();
        Token next = peek();
        if (next.isPunctuation("(")) {
            if (CONVERSIONS.contains(token.text())) {
                throw unsupported(token, "type conversion '" + token.text() + "()'");
            }
            throw unsupported(token, "function call '" + token.text() + "()'");
        }
        if (next.isPunctuation("[")) {
            throw unsupported(token, "indexing");
        }
        if (next.isPunctuation(".")) {
            throw unsupported(token, "method or attribute access");
        }
        return Identifier.unresolved(token.text(), token.position());
    }
}
