package ai.sourcebridge.translator.normalize;

import ai.sourcebridge.translator.diag.Diagnostic;
import ai.sourcebridge.translator.diag.DiagnosticsReporter;
import ai.sourcebridge.translator.diag.ErrorKind;
import ai.sourcebridge.translator.diag.SemanticException;
import ai.sourcebridge.translator.ist.Assignment;
import ai.sourcebridge.translator.ist.BinaryExpr;
import ai.sourcebridge.translator.ist.BinaryOperator;
import ai.sourcebridge.translator.ist.Binding;
import ai.sourcebridge.translator.ist.Block;
import ai.sourcebridge.translator.ist.Comment;
import ai.sourcebridge.translator.ist.Expression;
import ai.sourcebridge.translator.ist.ExpressionVisitor;
import ai.sourcebridge.translator.ist.ForLoop;
import ai.sourcebridge.translator.ist.Identifier;
import ai.sourcebridge.translator.ist.IfStatement;
import ai.sourcebridge.translator.ist.Literal;
import ai.sourcebridge.translator.ist.PrintStatement;
import ai.sourcebridge.translator.ist.Program;
import ai.sourcebridge.translator.ist.RangeLoop;
import ai.sourcebridge.translator.ist.ReadStatement;
import ai.sourcebridge.translator.ist.Statement;
import ai.sourcebridge.translator.ist.StatementVisitor;
import ai.sourcebridge.translator.ist.TypeTag;
import ai.sourcebridge.translator.ist.UnaryExpr;
import ai.sourcebridge.translator.ist.VariableDecl;
import ai.sourcebridge.translator.ist.WhileLoop;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.SourcePosition;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rewrites a parsed tree into the canonical shape both emitters consume, in one pass over block-scoped declarations:
 * <ul>
 *   <li>every variable use is resolved to its declaration and typed;</li>
 *   <li>Python range loops and bindings become counting loops, declarations and assignments;</li>
 *   <li>counting loops get one condition form ({@code v < e} counting up, {@code v > e} counting down);</li>
 *   <li>prints are merged into canonical items and a bare prompt print is folded into the read after it.</li>
 * </ul>
 * All semantic errors are collected before the pass fails.
 */
public class Normalizer {

    public Program normalize(Program program) {
        Pass pass = new Pass();
        Block body = pass.block(program.body(), Scope.root());
        if (pass.reporter.hasErrors()) {
            throw new SemanticException(pass.reporter.ranked());
        }
        return new Program(body);
    }

    /**
     * State of one normalization run.
     */
    private static final class Pass implements StatementVisitor<List<Statement>>, ExpressionVisitor<Expression> {

        private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

        private final DiagnosticsReporter reporter = new DiagnosticsReporter();
        private Scope scope;

        Block block(Block block, Scope enclosing) {
            Scope saved = scope;
            scope = enclosing == null ? Scope.root() : enclosing.child();
            try {
                return rewriteBlock(block);
            } finally {
                scope = saved;
            }
        }

        private Block rewriteBlock(Block block) {
            List<Statement> source = block.statements();
            List<Statement> rewritten = new ArrayList<>();
            int[] first = new int[source.size()];
            int[] last = new int[source.size()];
            int index = 0;
            while (index < source.size()) {
                Statement statement = source.get(index);
                Optional<String> prompt = index + 1 < source.size() ? prompt(statement, source.get(index + 1))
                        : Optional.empty();
                int start = rewritten.size();
                if (prompt.isPresent()) {
                    ReadStatement read = ((ReadStatement) source.get(index + 1)).withPrompt(prompt.get());
                    rewritten.addAll(read.accept(this));
                    first[index] = start;
                    last[index] = rewritten.size() - 1;
                    first[index + 1] = start;
                    last[index + 1] = rewritten.size() - 1;
                    index += 2;
                } else {
                    rewritten.addAll(statement.accept(this));
                    first[index] = start;
                    last[index] = rewritten.size() - 1;
                    index++;
                }
            }
            List<Comment> comments = new ArrayList<>();
            for (Comment comment : block.comments()) {
                if (comment.atEndOfBlock()) {
                    comments.add(comment);
                } else if (comment.placement() == CommentPlacement.LEADING) {
                    comments.add(comment.withAnchor(first[comment.anchor()]));
                } else {
                    comments.add(comment.withAnchor(last[comment.anchor()]));
                }
            }
            return new Block(rewritten, comments, block.position());
        }

        // A print of plain text right before a read without prompt is that read's prompt.
        private static Optional<String> prompt(Statement statement, Statement next) {
            if (!(statement instanceof PrintStatement print) || !(next instanceof ReadStatement read)
                    || read.hasPrompt()) {
                return Optional.empty();
            }
            StringBuilder text = new StringBuilder();
            for (Expression item : print.items()) {
                if (!(item instanceof Literal literal) || !literal.isString()) {
                    return Optional.empty();
                }
                text.append(literal.value());
            }
            if (print.newline()) {
                text.append('\n');
            }
            return text.length() == 0 ? Optional.empty() : Optional.of(text.toString());
        }

        private void report(ErrorKind kind, SourcePosition position, String... arguments) {
            reporter.report(Diagnostic.of(kind, position, arguments));
        }

        private void declare(String name, TypeTag type, SourcePosition position) {
            if (ReservedNames.isReserved(name)) {
                unsupported(position, "a variable named '" + name + "'");
            }
            if (scope.resolveLocally(name).isPresent()) {
                report(ErrorKind.REDECLARED_IDENTIFIER, position, name);
                return;
            }
            if (scope.resolve(name).isPresent()) {
                // Python has no block scope, so the inner variable would overwrite the outer one
                unsupported(position, "declaring '" + name + "' again inside a nested block");
                return;
            }
            scope.define(name, type);
        }

        private void checkAssignable(String name, TypeTag declared, Expression value, SourcePosition position) {
            TypeTag actual = ExpressionTypes.of(value);
            if (!declared.accepts(actual)) {
                report(ErrorKind.TYPE_MISMATCH, position, name, declared.description(), actual.description());
            }
        }

        private Expression expression(Expression expression) {
            return expression.accept(this);
        }

        @Override
        public List<Statement> visitVariableDecl(VariableDecl statement) {
            Expression initializer = statement.hasInitializer() ? expression(statement.initializer()) : null;
            TypeTag type = statement.type();
            if (type == TypeTag.INFERRED && initializer != null) {
                type = ExpressionTypes.of(initializer);
            }
            if (initializer != null) {
                checkAssignable(statement.name(), type, initializer, statement.position());
            }
            declare(statement.name(), type, statement.position());
            return List.of(new VariableDecl(statement.name(), type, initializer, statement.position()));
        }

        @Override
        public List<Statement> visitAssignment(Assignment statement) {
            Expression value = expression(statement.value());
            assign(statement.target(), value, statement.position());
            return List.of(new Assignment(statement.target(), value, statement.position()));
        }

        private void assign(String target, Expression value, SourcePosition position) {
            Optional<TypeTag> declared = scope.resolve(target);
            if (declared.isEmpty()) {
                report(ErrorKind.UNDECLARED_IDENTIFIER, position, target);
                return;
            }
            checkAssignable(target, declared.get(), value, position);
        }

        @Override
        public List<Statement> visitBinding(Binding statement) {
            Expression value = expression(statement.value());
            if (scope.resolve(statement.target()).isPresent()) {
                assign(statement.target(), value, statement.position());
                return List.of(new Assignment(statement.target(), value, statement.position()));
            }
            TypeTag type = ExpressionTypes.of(value);
            declare(statement.target(), type, statement.position());
            return List.of(new VariableDecl(statement.target(), type, value, statement.position()));
        }

        @Override
        public List<Statement> visitPrint(PrintStatement statement) {
            List<Expression> items = new ArrayList<>();
            for (Expression item : statement.items()) {
                Expression resolved = expression(item);
                int lastIndex = items.size() - 1;
                if (resolved instanceof Literal literal && literal.isString() && lastIndex >= 0
                        && items.get(lastIndex) instanceof Literal previous && previous.isString()) {
                    items.set(lastIndex, Literal.string(previous.value() + literal.value(), previous.position()));
                } else {
                    items.add(resolved);
                }
            }
            boolean newline = statement.newline();
            int lastIndex = items.size() - 1;
            if (!newline && lastIndex >= 0 && items.get(lastIndex) instanceof Literal tail && tail.isString()
                    && tail.value().endsWith("\n")) {
                newline = true;
                items.set(lastIndex, Literal.string(tail.value().substring(0, tail.value().length() - 1),
                        tail.position()));
            }
            items.removeIf(item -> item instanceof Literal literal && literal.isString() && literal.value().isEmpty());
            return List.of(new PrintStatement(items, newline, statement.position()));
        }

        @Override
        public List<Statement> visitRead(ReadStatement statement) {
            Optional<TypeTag> declared = scope.resolve(statement.target());
            if (declared.isEmpty()) {
                if (statement.type() == TypeTag.INFERRED) {
                    report(ErrorKind.UNDECLARED_IDENTIFIER, statement.position(), statement.target());
                    return List.of(statement);
                }
                declare(statement.target(), statement.type(), statement.position());
                VariableDecl decl = new VariableDecl(statement.target(), statement.type(), null, statement.position());
                return List.of(decl, statement);
            }
            if (statement.type() != TypeTag.INFERRED && statement.type() != declared.get()) {
                report(ErrorKind.TYPE_MISMATCH, statement.position(), statement.target(),
                        declared.get().description(), statement.type().description());
            }
            return List.of(statement.withType(declared.get()));
        }

        @Override
        public List<Statement> visitForLoop(ForLoop statement) {
            Scope saved = scope;
            scope = scope.child();
            try {
                Statement init = statement.init() == null ? null : single(statement.init());
                Expression condition = expression(statement.condition());
                Statement update = statement.update() == null ? null : single(statement.update());
                Block body = block(statement.body(), scope);
                Optional<LoopShapes.Step> step = LoopShapes.step(update);
                if (step.isPresent() && step.get().amount() != 0
                        && scope.resolve(step.get().variable()).orElse(TypeTag.INFERRED) == TypeTag.INT) {
                    String variable = step.get().variable();
                    update = LoopShapes.stepUpdate(variable, step.get().amount(), update.position());
                    condition = countingCondition(condition, variable);
                }
                return List.of(new ForLoop(init, condition, update, body, statement.position()));
            } finally {
                scope = saved;
            }
        }

        private Statement single(Statement statement) {
            List<Statement> rewritten = statement.accept(this);
            return rewritten.get(rewritten.size() - 1);
        }

        // Puts the loop variable on the left and turns <= / >= on whole numbers into < / >.
        private static Expression countingCondition(Expression condition, String variable) {
            if (!(condition instanceof BinaryExpr comparison) || !comparison.operator().isComparison()) {
                return condition;
            }
            BinaryOperator operator = comparison.operator();
            Expression left = comparison.left();
            Expression right = comparison.right();
            if (!isVariable(left, variable) && isVariable(right, variable)) {
                operator = operator.mirrored();
                Expression swapped = left;
                left = right;
                right = swapped;
            }
            if (!isVariable(left, variable) || ExpressionTypes.of(right) != TypeTag.INT) {
                return new BinaryExpr(operator, left, right, comparison.position());
            }
            if (operator == BinaryOperator.LESS_EQUAL) {
                return new BinaryExpr(BinaryOperator.LESS, left, LoopShapes.offset(right, 1), left.position());
            }
            if (operator == BinaryOperator.GREATER_EQUAL) {
                return new BinaryExpr(BinaryOperator.GREATER, left, LoopShapes.offset(right, -1), left.position());
            }
            return new BinaryExpr(operator, left, right, left.position());
        }

        private static boolean isVariable(Expression expression, String variable) {
            return expression instanceof Identifier identifier && identifier.name().equals(variable);
        }

        @Override
        public List<Statement> visitRangeLoop(RangeLoop statement) {
            SourcePosition position = statement.position();
            Expression start = expression(statement.start());
            Expression stop = expression(statement.stop());
            requireWholeNumber(statement.variable(), start);
            requireWholeNumber(statement.variable(), stop);
            long step = 1;
            if (statement.step() != null) {
                Expression stepExpression = expression(statement.step());
                OptionalLong constant = LoopShapes.integerConstant(stepExpression);
                if (constant.isEmpty() || constant.getAsLong() == 0) {
                    report(ErrorKind.UNSUPPORTED_LOOP_STEP, statement.step().position(), statement.variable());
                } else {
                    step = constant.getAsLong();
                }
            }
            Scope saved = scope;
            scope = scope.child();
            try {
                Statement init;
                Optional<TypeTag> existing = scope.resolve(statement.variable());
                if (existing.isPresent()) {
                    if (existing.get() != TypeTag.INT) {
                        report(ErrorKind.TYPE_MISMATCH, position, statement.variable(),
                                existing.get().description(), TypeTag.INT.description());
                    }
                    init = new Assignment(statement.variable(), start, position);
                } else {
                    declare(statement.variable(), TypeTag.INT, position);
                    init = new VariableDecl(statement.variable(), TypeTag.INT, start, position);
                }
                Identifier counter = new Identifier(statement.variable(), TypeTag.INT, position);
                BinaryOperator test = step > 0 ? BinaryOperator.LESS : BinaryOperator.GREATER;
                Expression condition = new BinaryExpr(test, counter, stop, position);
                Statement update = LoopShapes.stepUpdate(statement.variable(), step, position);
                Block body = block(statement.body(), scope);
                requireFixedRange(statement.variable(), stop, body, position);
                return List.of(new ForLoop(init, condition, update, body, position));
            } finally {
                scope = saved;
            }
        }

        // range() evaluates its bound once and resets the counter each pass; a counting loop does neither.
        private void requireFixedRange(String variable, Expression stop, Block body, SourcePosition position) {
            Set<String> guarded = new TreeSet<>(LoopShapes.variablesIn(stop));
            guarded.add(variable);
            for (String name : guarded) {
                if (LoopShapes.writesAny(body, Set.of(name))) {
                    unsupported(position, "changing '" + name + "' inside 'for " + variable + " in range(...)'");
                }
            }
        }

        private void requireWholeNumber(String variable, Expression bound) {
            TypeTag type = ExpressionTypes.of(bound);
            if (type != TypeTag.INT && type != TypeTag.INFERRED) {
                report(ErrorKind.TYPE_MISMATCH, bound.position(), variable, TypeTag.INT.description(),
                        type.description());
            }
        }

        @Override
        public List<Statement> visitWhileLoop(WhileLoop statement) {
            Expression condition = expression(statement.condition());
            Block body = block(statement.body(), scope);
            return List.of(new WhileLoop(condition, body, statement.position()));
        }

        @Override
        public List<Statement> visitIf(IfStatement statement) {
            Expression condition = expression(statement.condition());
            Block thenBlock = block(statement.thenBlock(), scope);
            Block elseBlock = statement.hasElse() ? block(statement.elseBlock(), scope) : null;
            return List.of(new IfStatement(condition, thenBlock, elseBlock, statement.position()));
        }

        @Override
        public Expression visitBinary(BinaryExpr expression) {
            Expression left = expression(expression.left());
            Expression right = expression(expression.right());
            TypeTag leftType = ExpressionTypes.of(left);
            TypeTag rightType = ExpressionTypes.of(right);
            SourcePosition position = expression.position();
            BinaryOperator operator = expression.operator();
            if (operator.isArithmetic() && (leftType == TypeTag.STRING || rightType == TypeTag.STRING)) {
                if (operator != BinaryOperator.ADD) {
                    unsupported(position, "arithmetic on text");
                } else if (leftType != rightType && leftType != TypeTag.INFERRED && rightType != TypeTag.INFERRED) {
                    unsupported(position, "joining text and a non-text value with '+'");
                }
            }
            if (operator == BinaryOperator.ADD && left instanceof Literal first && first.isString()
                    && right instanceof Literal second && second.isString()) {
                return Literal.string(first.value() + second.value(), first.position());
            }
            boolean wholeNumbers = isWhole(leftType) && isWhole(rightType);
            switch (operator) {
                case TRUE_DIVIDE -> {
                    if (wholeNumbers) {
                        left = new BinaryExpr(BinaryOperator.MULTIPLY, left, Literal.floating("1.0", position), position);
                    }
                    operator = BinaryOperator.DIVIDE;
                }
                case FLOOR_DIVIDE -> {
                    if (!wholeNumbers && leftType != TypeTag.INFERRED && rightType != TypeTag.INFERRED) {
                        unsupported(position, "whole-number division of decimal values");
                    }
                    operator = BinaryOperator.DIVIDE;
                }
                case MODULO -> {
                    if (leftType == TypeTag.FLOAT || rightType == TypeTag.FLOAT) {
                        unsupported(position, "remainder of decimal values");
                    }
                }
                default -> {
                }
            }
            return new BinaryExpr(operator, left, right, position);
        }

        private static boolean fitsInt(String digits) {
            try {
                return new BigInteger(digits).compareTo(INT_MAX) <= 0;
            } catch (NumberFormatException e) {
                return true;
            }
        }

        private static boolean isWhole(TypeTag type) {
            return type == TypeTag.INT || type == TypeTag.BOOL;
        }

        private void unsupported(SourcePosition position, String construct) {
            report(ErrorKind.UNSUPPORTED_CONSTRUCT, position, construct);
        }

        @Override
        public Expression visitUnary(UnaryExpr expression) {
            return new UnaryExpr(expression.operator(), expression(expression.operand()), expression.position());
        }

        @Override
        public Expression visitLiteral(Literal expression) {
            if (expression.type() == TypeTag.INT && !fitsInt(expression.value())) {
                unsupported(expression.position(), "the whole number " + expression.value()
                        + " (outside the 32-bit int range)");
            }
            return expression;
        }

        @Override
        public Expression visitIdentifier(Identifier expression) {
            Optional<TypeTag> declared = scope.resolve(expression.name());
            if (declared.isEmpty()) {
                report(ErrorKind.UNDECLARED_IDENTIFIER, expression.position(), expression.name());
                return expression;
            }
            return new Identifier(expression.name(), declared.get(), expression.position());
        }
    }
}
