package ast.expr;

import ast.stmt.Stmt;
import ast.type.Type;

/**
 * Expressions are statements too, as in C: an expression in statement
 * position is evaluated for its side effects.
 */
public abstract class Expr extends Stmt {
    protected static final int PRIMARY = 16;

    private final Type type;

    protected Expr(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /**
     * Whether evaluating this expression can change program state: calls and
     * assignments anywhere inside it.
     */
    public abstract boolean hasSideEffects();

    /** C binding strength, used to decide where parentheses are needed. */
    public int precedence() {
        return PRIMARY;
    }

    @Override
    public void printStmt(StringBuilder sb, int indent) {
        print(sb, indent);
        sb.append(';');
    }

    protected static void printOperand(StringBuilder sb, Expr operand, int parent, boolean tight, int indent) {
        int prec = operand.precedence();
        boolean parens = prec < parent || (tight && prec == parent);
        if (parens) {
            sb.append('(');
        }
        operand.print(sb, indent);
        if (parens) {
            sb.append(')');
        }
    }
}
