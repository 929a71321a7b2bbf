package ai.sourcebridge.translator.ist;

/**
 * Binary operators. {@link #TRUE_DIVIDE} and {@link #FLOOR_DIVIDE} come from Python's {@code /} and {@code //}; the
 * normalizer rewrites both into {@link #DIVIDE}, which divides whole numbers without a remainder.
 */
public enum BinaryOperator {
    ADD("+", Kind.ARITHMETIC),
    SUBTRACT("-", Kind.ARITHMETIC),
    MULTIPLY("*", Kind.ARITHMETIC),
    DIVIDE("/", Kind.ARITHMETIC),
    MODULO("%", Kind.ARITHMETIC),
    TRUE_DIVIDE("/.", Kind.ARITHMETIC),
    FLOOR_DIVIDE("//", Kind.ARITHMETIC),
    EQUAL("==", Kind.COMPARISON),
    NOT_EQUAL("!=", Kind.COMPARISON),
    LESS("<", Kind.COMPARISON),
    LESS_EQUAL("<=", Kind.COMPARISON),
    GREATER(">", Kind.COMPARISON),
    GREATER_EQUAL(">=", Kind.COMPARISON),
    AND("&&", Kind.LOGICAL),
    OR("||", Kind.LOGICAL);

    private enum Kind {
        ARITHMETIC,
        COMPARISON,
        LOGICAL
    }

    private final String symbol;
    private final Kind kind;

    BinaryOperator(String symbol, Kind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }

    /** Language-neutral symbol used by {@link IstPrinter}. */
    public String symbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return kind == Kind.ARITHMETIC;
    }

    public boolean isComparison() {
        return kind == Kind.COMPARISON;
    }

    public boolean isLogical() {
        return kind == Kind.LOGICAL;
    }

    /** The operator that gives the same result with the operands swapped. */
    public BinaryOperator mirrored() {
        return switch (this) {
            case LESS -> GREATER;
            case GREATER -> LESS;
            case LESS_EQUAL -> GREATER_EQUAL;
            case GREATER_EQUAL -> LESS_EQUAL;
            case EQUAL, NOT_EQUAL -> this;
            default -> throw new IllegalStateException(this + " cannot be mirrored");
        };
    }
}
