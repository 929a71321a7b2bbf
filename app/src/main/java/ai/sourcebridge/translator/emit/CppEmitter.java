package ai.sourcebridge.translator.emit;

import ai.sourcebridge.translator.ist.Assignment;
import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Block;
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
import ai.sourcebridge.translator.ist.UnaryOperator;
import ai.sourcebridge.translator.ist.VariableDecl;
import ai.sourcebridge.translator.ist.WhileLoop;
import ai.sourcebridge.translator.lex.StringEscapes;
import ai.sourcebridge.translator.normalize.LoopShapes;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes a complete C++ program: the iostream prologue, then every statement inside {@code int main()}.
 */
public class CppEmitter implements Emitter {

    private static final List<String> PROLOGUE = List.of(
            "#include <iostream>",
            "#include <string>",
            "using namespace std;",
            "");

    private static final Map<BinaryOperator, String> COMPOUND = Map.of(
            BinaryOperator.ADD, "+=",
            BinaryOperator.SUBTRACT, "-=",
            BinaryOperator.MULTIPLY, "*=",
            BinaryOperator.DIVIDE, "/=",
            BinaryOperator.MODULO, "%=");

    private static final Expressions EXPRESSIONS = new Expressions();

    @Override
    public EmittedCode render(Program program) {
        Objects.requireNonNull(program, "program");
        Renderer renderer = new Renderer();
        PROLOGUE.forEach(renderer.writer::line);
        renderer.writer.line("int main() {");
        renderer.block(program.body());
        renderer.writer.indent();
        renderer.writer.line("return 0;");
        renderer.writer.dedent();
        renderer.writer.line("}");
        return renderer.finish();
    }

    static String typeName(TypeTag type) {
        return switch (type) {
            case INT -> "int";
            case FLOAT -> "double";
            case STRING -> "string";
            case BOOL -> "bool";
            case INFERRED -> "auto";
        };
    }

    private static String expression(Expression expression) {
        return EXPRESSIONS.render(expression);
    }

    private static final class Renderer extends SourceRenderer {

        Renderer() {
            super("//");
        }

        void block(Block block) {
            writer.indent();
            statements(block);
            writer.dedent();
        }

        @Override
        public Void visitVariableDecl(VariableDecl statement) {
            line(declaration(statement) + ";");
            return null;
        }

        private static String declaration(VariableDecl statement) {
            String head = typeName(statement.type()) + " " + statement.name();
            return statement.hasInitializer() ? head + " = " + expression(statement.initializer()) : head;
        }

        @Override
        public Void visitAssignment(Assignment statement) {
            line(assignment(statement) + ";");
            return null;
        }

        private static String assignment(Assignment statement) {
            if (statement.value() instanceof BinaryExpr binary && COMPOUND.containsKey(binary.operator())
                    && binary.left() instanceof Identifier identifier
                    && identifier.name().equals(statement.target())) {
                return statement.target() + " " + COMPOUND.get(binary.operator()) + " " + expression(binary.right());
            }
            return statement.target() + " = " + expression(statement.value());
        }

        @Override
        public Void visitPrint(PrintStatement statement) {
            StringBuilder text = new StringBuilder("cout");
            for (Expression item : statement.items()) {
                text.append(" << ").append(EXPRESSIONS.operand(item, Expressions.ADDITIVE));
            }
            if (statement.newline()) {
                text.append(" << endl");
            } else if (statement.items().isEmpty()) {
                text.append(" << \"\"");
            }
            line(text.append(';').toString());
            return null;
        }

        @Override
        public Void visitRead(ReadStatement statement) {
            if (statement.hasPrompt()) {
                line("cout << " + StringEscapes.quote(statement.prompt()) + ";");
            }
            line("cin >> " + statement.target() + ";");
            return null;
        }

        @Override
        public Void visitForLoop(ForLoop statement) {
            String init = statement.init() == null ? "" : header(statement.init());
            String update = statement.update() == null ? "" : update(statement.update());
            line("for (" + init + "; " + expression(statement.condition()) + "; " + update + ") {");
            block(statement.body());
            writer.line("}");
            return null;
        }

        private static String header(Statement init) {
            if (init instanceof VariableDecl decl) {
                return declaration(decl);
            }
            if (init instanceof Assignment assignment) {
                return assignment(assignment);
            }
            throw new IllegalStateException("a loop starts with a declaration or an assignment, not " + init);
        }

        private static String update(Statement update) {
            Optional<LoopShapes.Step> step = LoopShapes.step(update);
            if (step.isPresent() && Math.abs(step.get().amount()) == 1) {
                return step.get().variable() + (step.get().amount() > 0 ? "++" : "--");
            }
            return header(update);
        }

        @Override
        public Void visitWhileLoop(WhileLoop statement) {
            line("while (" + expression(statement.condition()) + ") {");
            block(statement.body());
            writer.line("}");
            return null;
        }

        @Override
        public Void visitIf(IfStatement statement) {
            line("if (" + expression(statement.condition()) + ") {");
            block(statement.thenBlock());
            elseBranch(statement);
            return null;
        }

        private void elseBranch(IfStatement statement) {
            if (!statement.hasElse()) {
                writer.line("}");
                return;
            }
            Block elseBlock = statement.elseBlock();
            if (isElseIf(elseBlock)) {
                IfStatement nested = (IfStatement) elseBlock.statements().get(0);
                addPendingTrailing(elseBlock.comments());
                line("} else if (" + expression(nested.condition()) + ") {");
                block(nested.thenBlock());
                elseBranch(nested);
                return;
            }
            writer.line("} else {");
            block(elseBlock);
            writer.line("}");
        }
    }

    static final class Expressions extends ExpressionRenderer {

        static final int DISJUNCTION = 1;
        static final int CONJUNCTION = 2;
        static final int EQUALITY = 3;
        static final int RELATIONAL = 4;
        static final int ADDITIVE = 5;
        static final int MULTIPLICATIVE = 6;
        static final int UNARY = 7;

        @Override
        int precedence(BinaryOperator operator) {
            return switch (operator) {
                case OR -> DISJUNCTION;
                case AND -> CONJUNCTION;
                case EQUAL, NOT_EQUAL -> EQUALITY;
                case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> RELATIONAL;
                case ADD, SUBTRACT -> ADDITIVE;
                case MULTIPLY, DIVIDE, MODULO, TRUE_DIVIDE, FLOOR_DIVIDE -> MULTIPLICATIVE;
            };
        }

        @Override
        int precedence(UnaryOperator operator) {
            return UNARY;
        }

        @Override
        String symbol(BinaryExpr expression) {
            return switch (expression.operator()) {
                case TRUE_DIVIDE, FLOOR_DIVIDE -> "/";
                default -> expression.operator().symbol();
            };
        }

        @Override
        String prefix(UnaryOperator operator) {
            return operator.symbol();
        }

        // Two string literals would be added or compared as pointers.
        @Override
        public String visitBinary(BinaryExpr expression) {
            if (expression.left() instanceof Literal left && left.isString()
                    && expression.right() instanceof Literal right && right.isString()) {
                return "string(" + literal(left) + ") " + symbol(expression) + " " + literal(right);
            }
            return super.visitBinary(expression);
        }

        @Override
        String literal(Literal literal) {
            return switch (literal.type()) {
                case STRING -> StringEscapes.quote(literal.value());
                default -> literal.value();
            };
        }
    }
}
