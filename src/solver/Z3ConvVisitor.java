package solver;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Opcode;
import ast.decl.FieldDecl;
import ast.decl.FunctionDecl;
import ast.decl.RecordDecl;
import ast.decl.VarDecl;
import ast.expr.BinaryOperator;
import ast.expr.CallExpr;
import ast.expr.DeclRefExpr;
import ast.expr.Expr;
import ast.expr.IntegerLiteral;
import ast.expr.UnaryOperator;
import ast.stmt.BreakStmt;
import ast.stmt.CompoundStmt;
import ast.stmt.ContinueStmt;
import ast.stmt.DeclStmt;
import ast.stmt.IfStmt;
import ast.stmt.NullStmt;
import ast.stmt.ReturnStmt;
import ast.stmt.WhileStmt;
import ast.type.IntegerType;
import ast.type.Type;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import exception.DecompileException;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Translates integer expressions of the tree into bit-vector formulas.
 * Variables become bit-vector constants, one per declaration. Calls and
 * assignments become fresh constants, one per node, so nothing is assumed
 * about their value.
 */
public class Z3ConvVisitor implements ASTVisitor<com.microsoft.z3.Expr<?>> {
    private final Context ctx;

    private final Map<VarDecl, BitVecExpr> vars = new IdentityHashMap<>();
    private final Map<ASTNode, BitVecExpr> opaque = new IdentityHashMap<>();

    public Z3ConvVisitor(Context ctx) {
        this.ctx = ctx;
    }

    /** Drop the constants of calls and assignments seen so far. */
    public void clearOpaque() {
        opaque.clear();
    }

    public com.microsoft.z3.Expr<?> toZ3(Expr expr) {
        return expr.accept(this);
    }

    /** C truth value of {@code expr}: nonzero is true. */
    public BoolExpr toBool(Expr expr) {
        return z3BoolCast(toZ3(expr));
    }

    public BoolExpr z3BoolCast(com.microsoft.z3.Expr<?> expr) {
        if (expr instanceof BoolExpr bool) {
            return bool;
        }
        BitVecExpr bv = (BitVecExpr) expr;
        return ctx.mkNot(ctx.mkEq(bv, ctx.mkBV(0, bv.getSortSize())));
    }

    /**
     * Value of {@code expr} converted to {@code target}, extending according
     * to the signedness of the source type or truncating.
     */
    private BitVecExpr toBV(Expr expr, IntegerType target) {
        com.microsoft.z3.Expr<?> z3 = toZ3(expr);
        IntegerType source = integerType(expr);
        BitVecExpr bv;
        if (z3 instanceof BoolExpr bool) {
            // comparisons and logical operators yield an int 0 or 1
            source = IntegerType.getInt();
            bv = (BitVecExpr) ctx.mkITE(bool, ctx.mkBV(1, 32), ctx.mkBV(0, 32));
        } else {
            bv = (BitVecExpr) z3;
        }
        int from = bv.getSortSize();
        int to = target.getBitWidth();
        if (from < to) {
            return source.isSigned() ? ctx.mkSignExt(to - from, bv) : ctx.mkZeroExt(to - from, bv);
        }
        if (from > to) {
            return ctx.mkExtract(to - 1, 0, bv);
        }
        return bv;
    }

    private static IntegerType integerType(Expr expr) {
        Type type = expr.getType();
        if (type instanceof IntegerType integer) {
            return integer;
        }
        throw DecompileException.unSupported("condition operand of type " + type.toC());
    }

    private BitVecExpr fresh(ASTNode node, String prefix, IntegerType type) {
        return opaque.computeIfAbsent(node, n -> {
            BitVecSort sort = ctx.mkBitVecSort(type.getBitWidth());
            return (BitVecExpr) ctx.mkFreshConst(prefix, sort);
        });
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(IntegerLiteral expr) {
        return ctx.mkBV(expr.getValue(), expr.getType().getBitWidth());
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(DeclRefExpr expr) {
        VarDecl decl = expr.getDecl();
        IntegerType type = integerType(expr);
        return vars.computeIfAbsent(decl,
                d -> ctx.mkBVConst(d.getName() + "!" + vars.size(), type.getBitWidth()));
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(BinaryOperator expr) {
        Opcode op = expr.getOpcode();
        Expr lhs = expr.getLHS();
        Expr rhs = expr.getRHS();

        if (op == Opcode.ASSIGN) {
            return fresh(expr, "assign", integerType(expr));
        }
        if (op == Opcode.LAND) {
            return ctx.mkAnd(toBool(lhs), toBool(rhs));
        }
        if (op == Opcode.LOR) {
            return ctx.mkOr(toBool(lhs), toBool(rhs));
        }

        if (op.isComparison()) {
            IntegerType common = IntegerType.common(integerType(lhs), integerType(rhs));
            BitVecExpr l = toBV(lhs, common);
            BitVecExpr r = toBV(rhs, common);
            boolean signed = common.isSigned();
            return switch (op) {
                case EQ -> ctx.mkEq(l, r);
                case NE -> ctx.mkNot(ctx.mkEq(l, r));
                case LT -> signed ? ctx.mkBVSLT(l, r) : ctx.mkBVULT(l, r);
                case LE -> signed ? ctx.mkBVSLE(l, r) : ctx.mkBVULE(l, r);
                case GT -> signed ? ctx.mkBVSGT(l, r) : ctx.mkBVUGT(l, r);
                case GE -> signed ? ctx.mkBVSGE(l, r) : ctx.mkBVUGE(l, r);
                default -> throw new IllegalStateException(op.name());
            };
        }

        IntegerType type = integerType(expr);
        boolean signed = type.isSigned();
        BitVecExpr l = toBV(lhs, type);
        BitVecExpr r = toBV(rhs, type);
        return switch (op) {
            case ADD -> ctx.mkBVAdd(l, r);
            case SUB -> ctx.mkBVSub(l, r);
            case MUL -> ctx.mkBVMul(l, r);
            case DIV -> signed ? ctx.mkBVSDiv(l, r) : ctx.mkBVUDiv(l, r);
            case REM -> signed ? ctx.mkBVSRem(l, r) : ctx.mkBVURem(l, r);
            case SHL -> ctx.mkBVSHL(l, r);
            case SHR -> signed ? ctx.mkBVASHR(l, r) : ctx.mkBVLSHR(l, r);
            case AND -> ctx.mkBVAND(l, r);
            case OR -> ctx.mkBVOR(l, r);
            case XOR -> ctx.mkBVXOR(l, r);
            default -> throw DecompileException.unSupported("operator " + op);
        };
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(UnaryOperator expr) {
        Expr operand = expr.getOperand();
        return switch (expr.getOpcode()) {
            case LNOT -> ctx.mkNot(toBool(operand));
            case MINUS -> ctx.mkBVNeg(toBV(operand, integerType(expr)));
            case NOT -> ctx.mkBVNot(toBV(operand, integerType(expr)));
            default -> throw DecompileException.unSupported("operator " + expr.getOpcode());
        };
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(CallExpr expr) {
        return fresh(expr, expr.getCallee().getName(), integerType(expr));
    }

    /* ── not expressions ────────────────────────────── */

    private com.microsoft.z3.Expr<?> notAnExpression(ASTNode node) {
        throw DecompileException.unSupported(node.getClass().getSimpleName() + " in a condition");
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(CompoundStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(IfStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(WhileStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(BreakStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(ContinueStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(ReturnStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(NullStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(DeclStmt stmt) {
        return notAnExpression(stmt);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(VarDecl decl) {
        return notAnExpression(decl);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(FieldDecl decl) {
        return notAnExpression(decl);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(RecordDecl decl) {
        return notAnExpression(decl);
    }

    @Override
    public com.microsoft.z3.Expr<?> visit(FunctionDecl decl) {
        return notAnExpression(decl);
    }
}
