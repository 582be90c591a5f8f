package ast;

/**
 * Operators of {@link ast.expr.BinaryOperator} and {@link ast.expr.UnaryOperator}.
 * Precedence follows C, higher binds tighter.
 */
public enum Opcode {
    // binary
    MUL("*", 13),
    DIV("/", 13),
    REM("%", 13),
    ADD("+", 12),
    SUB("-", 12),
    SHL("<<", 11),
    SHR(">>", 11),
    LT("<", 10),
    GT(">", 10),
    LE("<=", 10),
    GE(">=", 10),
    EQ("==", 9),
    NE("!=", 9),
    AND("&", 8),
    XOR("^", 7),
    OR("|", 6),
    LAND("&&", 5),
    LOR("||", 4),
    ASSIGN("=", 2),

    // unary
    MINUS("-", 15),
    NOT("~", 15),
    LNOT("!", 15);

    private final String symbol;
    private final int precedence;

    Opcode(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isUnary() {
        return this == MINUS || this == NOT || this == LNOT;
    }

    public boolean isComparison() {
        return switch (this) {
            case LT, GT, LE, GE, EQ, NE -> true;
            default -> false;
        };
    }

    public boolean isLogical() {
        return this == LAND || this == LOR;
    }

    /**
     * The comparison that holds exactly when this one does not.
     */
    public Opcode negate() {
        return switch (this) {
            case LT -> GE;
            case GE -> LT;
            case GT -> LE;
            case LE -> GT;
            case EQ -> NE;
            case NE -> EQ;
            default -> throw new IllegalStateException(this + " is not a comparison");
        };
    }
}
