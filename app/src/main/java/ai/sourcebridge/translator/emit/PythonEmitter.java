package ai.sourcebridge.translator.emit;

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
import ai.sourcebridge.translator.lex.StringEscapes;
import ai.sourcebridge.translator.normalize.ExpressionTypes;
import ai.sourcebridge.translator.normalize.LoopShapes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Writes a Python script. Declarations become plain bindings where Python would infer the same type and the name
 * is new; everything else gets an annotation so the block structure survives a translation back.
 */
public class PythonEmitter implements Emitter {

    private static final Map<BinaryOperator, String> COMPOUND = Map.of(
            BinaryOperator.ADD, "+=",
            BinaryOperator.SUBTRACT, "-=",
            BinaryOperator.MULTIPLY, "*=",
            BinaryOperator.MODULO, "%=");

    private static final Expressions EXPRESSIONS = new Expressions();

    @Override
    public EmittedCode render(Program program) {
        Objects.requireNonNull(program, "program");
        Renderer renderer = new Renderer();
        renderer.statements(program.body());
        return renderer.finish();
    }

    static String typeName(TypeTag type) {
        return switch (type) {
            case INT -> "int";
            case FLOAT -> "float";
            case STRING -> "str";
            case BOOL -> "bool";
            case INFERRED -> throw new IllegalStateException("a variable of unknown type has no Python annotation");
        };
    }

    private static String expression(Expression expression) {
        return EXPRESSIONS.render(expression);
    }

    private static boolean wholeNumbers(Expression left, Expression right) {
        return isWhole(ExpressionTypes.of(left)) && isWhole(ExpressionTypes.of(right));
    }

    private static boolean isWhole(TypeTag type) {
        return type == TypeTag.INT || type == TypeTag.BOOL;
    }

    private static final class Renderer extends SourceRenderer {

        Renderer() {
            super("#");
        }

        private void suite(Block block, Statement last) {
            writer.indent();
            try {
                statements(block);
                if (last != null) {
                    write(last, List.of());
                } else if (block.statements().isEmpty()) {
                    writer.line("pass");
                }
            } finally {
                writer.dedent();
            }
        }

        @Override
        protected int statementAt(Block block, int index) {
            List<Statement> statements = block.statements();
            if (index + 1 < statements.size() && statements.get(index) instanceof VariableDecl decl
                    && !decl.hasInitializer() && statements.get(index + 1) instanceof ReadStatement read
                    && read.target().equals(decl.name()) && read.type() == decl.type()) {
                comments(block.commentsAt(index, CommentPlacement.LEADING));
                comments(block.commentsAt(index + 1, CommentPlacement.LEADING));
                List<Comment> trailing = Stream.concat(block.commentsAt(index, CommentPlacement.TRAILING).stream(),
                        block.commentsAt(index + 1, CommentPlacement.TRAILING).stream()).toList();
                write(read, trailing);
                return index + 2;
            }
            return super.statementAt(block, index);
        }

        @Override
        public Void visitVariableDecl(VariableDecl statement) {
            String name = statement.name();
            if (!statement.hasInitializer()) {
                line(name + ": " + typeName(statement.type()));
            } else if (statement.type() != TypeTag.INFERRED
                    && ExpressionTypes.of(statement.initializer()) != statement.type()) {
                line(name + ": " + typeName(statement.type()) + " = " + expression(statement.initializer()));
            } else {
                line(name + " = " + expression(statement.initializer()));
            }
            return null;
        }

        @Override
        public Void visitAssignment(Assignment statement) {
            if (statement.value() instanceof BinaryExpr binary && binary.left() instanceof Identifier identifier
                    && identifier.name().equals(statement.target())) {
                String operator = binary.operator() == BinaryOperator.DIVIDE
                        ? (wholeNumbers(binary.left(), binary.right()) ? "//=" : "/=")
                        : COMPOUND.get(binary.operator());
                if (operator != null) {
                    line(statement.target() + " " + operator + " " + expression(binary.right()));
                    return null;
                }
            }
            line(statement.target() + " = " + expression(statement.value()));
            return null;
        }

        @Override
        public Void visitPrint(PrintStatement statement) {
            List<String> arguments = new ArrayList<>();
            List<Expression> items = statement.items();
            if (items.size() == 1 || spaceSeparated(items)) {
                for (int i = 0; i < items.size(); i += 2) {
                    arguments.add(expression(items.get(i)));
                }
            } else if (!items.isEmpty() && items.stream().noneMatch(Expressions::hasTextOperand)) {
                arguments.add(formatString(items));
            } else if (!items.isEmpty()) {
                items.forEach(item -> arguments.add(expression(item)));
                arguments.add("sep=\"\"");
            }
            if (!statement.newline()) {
                arguments.add("end=\"\"");
            }
            line("print(" + String.join(", ", arguments) + ")");
            return null;
        }

        // a, " ", b, " ", c: what print(a, b, c) writes with its default separator.
        private static boolean spaceSeparated(List<Expression> items) {
            if (items.size() < 3 || items.size() % 2 == 0) {
                return false;
            }
            for (int i = 0; i < items.size(); i++) {
                boolean separator = items.get(i) instanceof Literal literal && literal.isString()
                        && literal.value().equals(" ");
                if (separator != (i % 2 == 1)) {
                    return false;
                }
            }
            return true;
        }

        private static String formatString(List<Expression> items) {
            StringBuilder text = new StringBuilder("f\"");
            for (Expression item : items) {
                if (item instanceof Literal literal && literal.isString()) {
                    String quoted = StringEscapes.quote(literal.value());
                    text.append(quoted.substring(1, quoted.length() - 1).replace("{", "{{").replace("}", "}}"));
                } else {
                    text.append('{').append(expression(item)).append('}');
                }
            }
            return text.append('"').toString();
        }

        @Override
        public Void visitRead(ReadStatement statement) {
            String prompt = statement.hasPrompt() ? StringEscapes.quote(statement.prompt()) : "";
            String input = "input(" + prompt + ")";
            String value = switch (statement.type()) {
                case INT -> "int(" + input + ")";
                case FLOAT -> "float(" + input + ")";
                case BOOL -> "bool(int(" + input + "))";
                case STRING, INFERRED -> input;
            };
            line(statement.target() + " = " + value);
            return null;
        }

        @Override
        public Void visitForLoop(ForLoop statement) {
            Optional<LoopShapes.RangeForm> range = LoopShapes.rangeForm(statement);
            if (range.isPresent()) {
                rangeLoop(statement, range.get());
                return null;
            }
            List<Comment> header = takePendingTrailing();
            if (statement.init() != null) {
                write(statement.init(), List.of());
            }
            addPendingTrailing(header);
            line("while " + expression(statement.condition()) + ":");
            suite(statement.body(), statement.update());
            return null;
        }

        private void rangeLoop(ForLoop statement, LoopShapes.RangeForm range) {
            List<String> arguments = new ArrayList<>();
            arguments.add(expression(range.start()));
            arguments.add(expression(range.stop()));
            if (range.step() != 1) {
                arguments.add(expression(LoopShapes.constant(range.step(), statement.position())));
            }
            line("for " + range.variable() + " in range(" + String.join(", ", arguments) + "):");
            suite(statement.body(), null);
        }

        @Override
        public Void visitWhileLoop(WhileLoop statement) {
            line("while " + expression(statement.condition()) + ":");
            suite(statement.body(), null);
            return null;
        }

        @Override
        public Void visitIf(IfStatement statement) {
            line("if " + expression(statement.condition()) + ":");
            suite(statement.thenBlock(), null);
            elseBranch(statement);
            return null;
        }

        private void elseBranch(IfStatement statement) {
            if (!statement.hasElse()) {
                return;
            }
            Block elseBlock = statement.elseBlock();
            if (isElseIf(elseBlock)) {
                IfStatement nested = (IfStatement) elseBlock.statements().get(0);
                addPendingTrailing(elseBlock.comments());
                line("elif " + expression(nested.condition()) + ":");
                suite(nested.thenBlock(), null);
                elseBranch(nested);
                return;
            }
            writer.line("else:");
            suite(elseBlock, null);
        }
    }

    static final class Expressions extends ExpressionRenderer {

        static final int DISJUNCTION = 1;
        static final int CONJUNCTION = 2;
        static final int NEGATION = 3;
        static final int COMPARISON = 4;
        static final int ADDITIVE = 5;
        static final int MULTIPLICATIVE = 6;
        static final int SIGN = 7;

        @Override
        int precedence(BinaryOperator operator) {
            return switch (operator) {
                case OR -> DISJUNCTION;
                case AND -> CONJUNCTION;
                case EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> COMPARISON;
                case ADD, SUBTRACT -> ADDITIVE;
                case MULTIPLY, DIVIDE, MODULO, TRUE_DIVIDE, FLOOR_DIVIDE -> MULTIPLICATIVE;
            };
        }

        @Override
        int precedence(UnaryOperator operator) {
            return operator == UnaryOperator.NOT ? NEGATION : SIGN;
        }

        // Python chains a < b < c, so nested comparisons keep their parentheses on either side.
        @Override
        boolean nonAssociative(BinaryOperator operator) {
            return operator.isComparison();
        }

        @Override
        String symbol(BinaryExpr expression) {
            return switch (expression.operator()) {
                case AND -> "and";
                case OR -> "or";
                case DIVIDE -> wholeNumbers(expression.left(), expression.right()) ? "//" : "/";
                case TRUE_DIVIDE -> "/";
                default -> expression.operator().symbol();
            };
        }

        @Override
        String prefix(UnaryOperator operator) {
            return operator == UnaryOperator.NOT ? "not " : "-";
        }

        @Override
        String literal(Literal literal) {
            return switch (literal.type()) {
                case STRING -> StringEscapes.quote(literal.value());
                case BOOL -> Boolean.parseBoolean(literal.value()) ? "True" : "False";
                default -> literal.value();
            };
        }

        /** Whether a text literal appears anywhere inside a non-literal item. */
        static boolean hasTextOperand(Expression item) {
            if (item instanceof Literal) {
                return false;
            }
            return Stream.of(item).flatMap(Expressions::literals).anyMatch(Literal::isString);
        }

        private static Stream<Literal> literals(Expression expression) {
            if (expression instanceof Literal literal) {
                return Stream.of(literal);
            }
            if (expression instanceof BinaryExpr binary) {
                return Stream.concat(literals(binary.left()), literals(binary.right()));
            }
            if (expression instanceof UnaryExpr unary) {
                return literals(unary.operand());
            }
            return Stream.empty();
        }
    }
}
