package ai.sourcebridge.translator.ist;

import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.lex.StringEscapes;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Canonical text dump of a tree. Source positions and comment text are left out, so two trees print the same when
 * they describe the same program with the same comment anchoring.
 */
public final class IstPrinter implements StatementVisitor<Void>, ExpressionVisitor<String> {

    private final StringBuilder out = new StringBuilder();
    private final boolean withComments;
    private int depth;

    private IstPrinter(boolean withComments) {
        this.withComments = withComments;
    }

    public static String print(Program program) {
        return print(program, true);
    }

    /** Dump without any comment lines: equal for programs that differ only in their comments. */
    public static String printCode(Program program) {
        return print(program, false);
    }

    private static String print(Program program, boolean withComments) {
        IstPrinter printer = new IstPrinter(withComments);
        printer.line("program");
        printer.block(program.body());
        return printer.out.toString();
    }

    public static String print(Expression expression) {
        return expression.accept(new IstPrinter(false));
    }

    private void block(Block block) {
        depth++;
        for (int index = 0; index < block.statements().size(); index++) {
            comments(block, index, CommentPlacement.LEADING);
            block.statements().get(index).accept(this);
            comments(block, index, CommentPlacement.TRAILING);
        }
        if (withComments) {
            for (Comment comment : block.endComments()) {
                line("comment " + placement(comment) + " @end");
            }
        }
        depth--;
    }

    private void comments(Block block, int index, CommentPlacement placement) {
        if (!withComments) {
            return;
        }
        for (Comment comment : block.commentsAt(index, placement)) {
            line("comment " + placement(comment) + " @" + index);
        }
    }

    private static String placement(Comment comment) {
        return comment.placement().name().toLowerCase(Locale.ROOT);
    }

    private void nested(String label, Statement statement) {
        if (statement == null) {
            line(label + " none");
            return;
        }
        line(label);
        depth++;
        statement.accept(this);
        depth--;
    }

    private void line(String text) {
        out.append("  ".repeat(depth)).append(text).append('\n');
    }

    private static String type(TypeTag type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public Void visitVariableDecl(VariableDecl statement) {
        String initializer = statement.hasInitializer() ? " = " + statement.initializer().accept(this) : "";
        line("decl " + statement.name() + " " + type(statement.type()) + initializer);
        return null;
    }

    @Override
    public Void visitAssignment(Assignment statement) {
        line("assign " + statement.target() + " = " + statement.value().accept(this));
        return null;
    }

    @Override
    public Void visitPrint(PrintStatement statement) {
        String items = statement.items().stream().map(item -> item.accept(this)).collect(Collectors.joining(" "));
        line("print [" + items + "]" + (statement.newline() ? " newline" : ""));
        return null;
    }

    @Override
    public Void visitRead(ReadStatement statement) {
        String prompt = statement.hasPrompt() ? " prompt " + StringEscapes.quote(statement.prompt()) : "";
        line("read " + statement.target() + " " + type(statement.type()) + prompt);
        return null;
    }

    @Override
    public Void visitForLoop(ForLoop statement) {
        line("for " + statement.condition().accept(this));
        depth++;
        nested("init", statement.init());
        nested("update", statement.update());
        depth--;
        block(statement.body());
        return null;
    }

    @Override
    public Void visitWhileLoop(WhileLoop statement) {
        line("while " + statement.condition().accept(this));
        block(statement.body());
        return null;
    }

    @Override
    public Void visitIf(IfStatement statement) {
        line("if " + statement.condition().accept(this));
        block(statement.thenBlock());
        if (statement.hasElse()) {
            line("else");
            block(statement.elseBlock());
        }
        return null;
    }

    @Override
    public Void visitRangeLoop(RangeLoop statement) {
        String step = statement.step() == null ? "" : " " + statement.step().accept(this);
        line("range " + statement.variable() + " " + statement.start().accept(this) + " "
                + statement.stop().accept(this) + step);
        block(statement.body());
        return null;
    }

    @Override
    public Void visitBinding(Binding statement) {
        line("bind " + statement.target() + " = " + statement.value().accept(this));
        return null;
    }

    @Override
    public String visitBinary(BinaryExpr expression) {
        return "(" + expression.operator().symbol() + " " + expression.left().accept(this) + " "
                + expression.right().accept(this) + ")";
    }

    @Override
    public String visitUnary(UnaryExpr expression) {
        return "(" + expression.operator().symbol() + " " + expression.operand().accept(this) + ")";
    }

    @Override
    public String visitLiteral(Literal expression) {
        String value = expression.isString() ? StringEscapes.quote(expression.value()) : expression.value();
        return type(expression.type()) + ":" + value;
    }

    @Override
    public String visitIdentifier(Identifier expression) {
        return expression.name() + ":" + type(expression.type());
    }
}
