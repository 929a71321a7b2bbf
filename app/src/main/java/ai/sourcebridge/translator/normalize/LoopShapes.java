package ai.sourcebridge.translator.normalize;

import ai.sourcebridge.translator.ist.Assignment;
import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Binding;
import ai.sourcebridge.translator.ist.Block;
import ai.sourcebridge.translator.ist.Expression;
import ai.sourcebridge.translator.ist.ExpressionVisitor;
import ai.sourcebridge.translator.ist.ForLoop;
import ai.sourcebridge.translator.ist.Identifier;
import ai.sourcebridge.translator.ist.IfStatement;
import ai.sourcebridge.translator.ist.Literal;
import ai.sourcebridge.translator.ist.PrintStatement;
import ai.sourcebridge.translator.ist.RangeLoop;
import ai.sourcebridge.translator.ist.ReadStatement;
import ai.sourcebridge.translator.ist.Statement;
import ai.sourcebridge.translator.ist.StatementVisitor;
import ai.sourcebridge.translator.ist.TypeTag;
import ai.sourcebridge.translator.ist.UnaryExpr;
import ai.sourcebridge.translator.ist.UnaryOperator;
import ai.sourcebridge.translator.ist.VariableDecl;
import ai.sourcebridge.translator.ist.WhileLoop;
import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Recognizes counting loops: a whole-number variable stepped by a constant each iteration.
 */
public final class LoopShapes {

    private LoopShapes() {
    }

    /** {@code variable += amount} per iteration; {@code amount} is negative for a count down. */
    public record Step(String variable, long amount) {
    }

    /** A loop that Python's {@code range(start, stop, step)} expresses exactly. */
    public record RangeForm(String variable, Expression start, Expression stop, long step) {
    }

    /** Value of a whole-number constant, written either as a literal or as a negated literal. */
    public static OptionalLong integerConstant(Expression expression) {
        if (expression instanceof Literal literal && literal.type() == TypeTag.INT) {
            try {
                return OptionalLong.of(Long.parseLong(literal.value()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        if (expression instanceof UnaryExpr unary && unary.operator() == UnaryOperator.NEGATE) {
            OptionalLong operand = integerConstant(unary.operand());
            return operand.isPresent() ? OptionalLong.of(-operand.getAsLong()) : OptionalLong.empty();
        }
        return OptionalLong.empty();
    }

    public static Expression constant(long value, SourcePosition position) {
        if (value < 0) {
            return new UnaryExpr(UnaryOperator.NEGATE, Literal.integer(-value, position), position);
        }
        return Literal.integer(value, position);
    }

    /**
     * {@code expression + delta}, folded into a constant or into an existing {@code x + c} / {@code x - c}.
     */
    public static Expression offset(Expression expression, long delta) {
        SourcePosition position = expression.position();
        OptionalLong value = integerConstant(expression);
        if (value.isPresent()) {
            return constant(value.getAsLong() + delta, position);
        }
        if (expression instanceof BinaryExpr binary
                && (binary.operator() == BinaryOperator.ADD || binary.operator() == BinaryOperator.SUBTRACT)) {
            OptionalLong right = integerConstant(binary.right());
            if (right.isPresent()) {
                long current = binary.operator() == BinaryOperator.ADD ? right.getAsLong() : -right.getAsLong();
                return plus(binary.left(), current + delta, position);
            }
        }
        return plus(expression, delta, position);
    }

    private static Expression plus(Expression base, long delta, SourcePosition position) {
        if (delta == 0) {
            return base;
        }
        BinaryOperator operator = delta > 0 ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
        return new BinaryExpr(operator, base, Literal.integer(Math.abs(delta), position), position);
    }

    /** Matches {@code v = v + c} and {@code v = v - c} with a constant {@code c}. */
    public static Optional<Step> step(Statement update) {
        if (!(update instanceof Assignment assignment) || !(assignment.value() instanceof BinaryExpr binary)) {
            return Optional.empty();
        }
        boolean adds = binary.operator() == BinaryOperator.ADD;
        if (!adds && binary.operator() != BinaryOperator.SUBTRACT) {
            return Optional.empty();
        }
        if (!(binary.left() instanceof Identifier identifier) || !identifier.name().equals(assignment.target())) {
            return Optional.empty();
        }
        OptionalLong amount = integerConstant(binary.right());
        if (amount.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Step(assignment.target(), adds ? amount.getAsLong() : -amount.getAsLong()));
    }

    /** The canonical update {@code v = v + |amount|} or {@code v = v - |amount|}. */
    public static Assignment stepUpdate(String variable, long amount, SourcePosition position) {
        Identifier target = new Identifier(variable, TypeTag.INT, position);
        BinaryOperator operator = amount < 0 ? BinaryOperator.SUBTRACT : BinaryOperator.ADD;
        Expression value = new BinaryExpr(operator, target, Literal.integer(Math.abs(amount), position), position);
        return new Assignment(variable, value, position);
    }

    /**
     * Returns the range form of a normalized loop when {@code range()} runs exactly the same iterations: a whole-number
     * variable counting up while {@code < stop} or down while {@code > stop}, a body that writes neither the variable
     * nor anything the stop value reads.
     */
    public static Optional<RangeForm> rangeForm(ForLoop loop) {
        Optional<Step> step = step(loop.update());
        if (step.isEmpty() || step.get().amount() == 0) {
            return Optional.empty();
        }
        String variable = step.get().variable();
        Expression start = initialValue(loop.init(), variable);
        if (start == null || !(loop.condition() instanceof BinaryExpr condition)) {
            return Optional.empty();
        }
        BinaryOperator expected = step.get().amount() > 0 ? BinaryOperator.LESS : BinaryOperator.GREATER;
        if (condition.operator() != expected || !(condition.left() instanceof Identifier counter)
                || !counter.name().equals(variable) || counter.type() != TypeTag.INT) {
            return Optional.empty();
        }
        Set<String> guarded = variablesIn(condition.right());
        if (guarded.contains(variable)) {
            return Optional.empty();
        }
        guarded.add(variable);
        if (writesAny(loop.body(), guarded)) {
            return Optional.empty();
        }
        return Optional.of(new RangeForm(variable, start, condition.right(), step.get().amount()));
    }

    private static Expression initialValue(Statement init, String variable) {
        if (init instanceof VariableDecl decl && decl.name().equals(variable) && decl.hasInitializer()
                && decl.type() == TypeTag.INT) {
            return decl.initializer();
        }
        if (init instanceof Assignment assignment && assignment.target().equals(variable)) {
            return assignment.value();
        }
        return null;
    }

    public static Set<String> variablesIn(Expression expression) {
        Set<String> names = new HashSet<>();
        expression.accept(new ExpressionVisitor<Void>() {
            @Override
            public Void visitBinary(BinaryExpr binary) {
                binary.left().accept(this);
                binary.right().accept(this);
                return null;
            }

            @Override
            public Void visitUnary(UnaryExpr unary) {
                unary.operand().accept(this);
                return null;
            }

            @Override
            public Void visitLiteral(Literal literal) {
                return null;
            }

            @Override
            public Void visitIdentifier(Identifier identifier) {
                names.add(identifier.name());
                return null;
            }
        });
        return names;
    }

    /** Whether any statement in {@code block}, at any depth, stores into or declares one of {@code names}. */
    public static boolean writesAny(Block block, Set<String> names) {
        StatementVisitor<Boolean> writes = new StatementVisitor<>() {
            @Override
            public Boolean visitVariableDecl(VariableDecl statement) {
                return names.contains(statement.name());
            }

            @Override
            public Boolean visitAssignment(Assignment statement) {
                return names.contains(statement.target());
            }

            @Override
            public Boolean visitPrint(PrintStatement statement) {
                return false;
            }

            @Override
            public Boolean visitRead(ReadStatement statement) {
                return names.contains(statement.target());
            }

            @Override
            public Boolean visitForLoop(ForLoop statement) {
                return (statement.init() != null && statement.init().accept(this))
                        || (statement.update() != null && statement.update().accept(this))
                        || writesAny(statement.body(), names);
            }

            @Override
            public Boolean visitWhileLoop(WhileLoop statement) {
                return writesAny(statement.body(), names);
            }

            @Override
            public Boolean visitIf(IfStatement statement) {
                return writesAny(statement.thenBlock(), names)
                        || (statement.hasElse() && writesAny(statement.elseBlock(), names));
            }

            @Override
            public Boolean visitRangeLoop(RangeLoop statement) {
                return names.contains(statement.variable()) || writesAny(statement.body(), names);
            }

            @Override
            public Boolean visitBinding(Binding statement) {
                return names.contains(statement.target());
            }
        };
        return block.statements().stream().anyMatch(statement -> statement.accept(writes));
    }
}
