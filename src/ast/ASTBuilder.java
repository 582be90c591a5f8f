package ast;

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
import ast.stmt.Stmt;
import ast.stmt.WhileStmt;
import ast.type.IntegerType;
import ast.type.Type;
import exception.DecompileException;

import java.util.List;

/**
 * Tree-construction context: every node and identifier the passes create
 * goes through here so it lands in the unit's arena.
 */
public class ASTBuilder {
    private final ASTUnit unit;

    public ASTBuilder(ASTUnit unit) {
        this.unit = unit;
    }

    public ASTUnit getUnit() {
        return unit;
    }

    public Identifier createIdentifier(String name) {
        return unit.getIdentifier(name);
    }

    /* ── statements ─────────────────────────────────── */

    public CompoundStmt createCompoundStmt(List<? extends Stmt> body) {
        return unit.register(new CompoundStmt(body));
    }

    public CompoundStmt createCompoundStmt(Stmt... body) {
        return createCompoundStmt(List.of(body));
    }

    public IfStmt createIf(Expr cond, Stmt then) {
        return createIf(cond, then, null);
    }

    public IfStmt createIf(Expr cond, Stmt then, Stmt otherwise) {
        return unit.register(new IfStmt(cond, then, otherwise));
    }

    public WhileStmt createWhile(Expr cond, Stmt body) {
        return unit.register(new WhileStmt(cond, body));
    }

    public BreakStmt createBreak() {
        return unit.register(new BreakStmt());
    }

    public ContinueStmt createContinue() {
        return unit.register(new ContinueStmt());
    }

    public ReturnStmt createReturn(Expr value) {
        return unit.register(new ReturnStmt(value));
    }

    public NullStmt createNullStmt() {
        return unit.register(new NullStmt());
    }

    public DeclStmt createDeclStmt(VarDecl decl) {
        return unit.register(new DeclStmt(decl));
    }

    /* ── expressions ────────────────────────────────── */

    public IntegerLiteral createIntLit(long value) {
        return createIntLit(IntegerType.getInt(), value);
    }

    public IntegerLiteral createIntLit(IntegerType type, long value) {
        return unit.register(new IntegerLiteral(type, value));
    }

    /** The guard of an unconditional loop, {@code 1U}. */
    public IntegerLiteral createTrue() {
        return createIntLit(IntegerType.getUnsigned(), 1);
    }

    public DeclRefExpr createRef(VarDecl decl) {
        return unit.register(new DeclRefExpr(decl));
    }

    public BinaryOperator createBinaryOp(Opcode opcode, Expr lhs, Expr rhs) {
        return unit.register(new BinaryOperator(opcode, lhs, rhs, resultType(opcode, lhs, rhs)));
    }

    public BinaryOperator createAssign(VarDecl target, Expr value) {
        return createBinaryOp(Opcode.ASSIGN, createRef(target), value);
    }

    public UnaryOperator createUnaryOp(Opcode opcode, Expr operand) {
        Type type = opcode == Opcode.LNOT ? IntegerType.getInt() : promote(operand);
        return unit.register(new UnaryOperator(opcode, operand, type));
    }

    /**
     * Negation for use as a condition: comparisons are inverted, a logical
     * not is stripped, anything else is wrapped in {@code !}. The result has
     * the opposite truth value but not necessarily the same integer value.
     */
    public Expr negateCondition(Expr cond) {
        if (cond instanceof BinaryOperator binop && binop.getOpcode().isComparison()) {
            return createBinaryOp(binop.getOpcode().negate(), binop.getLHS(), binop.getRHS());
        }
        if (cond instanceof UnaryOperator unop && unop.getOpcode() == Opcode.LNOT) {
            return unop.getOperand();
        }
        return createUnaryOp(Opcode.LNOT, cond);
    }

    public CallExpr createCall(String callee, List<? extends Expr> args, Type type) {
        return unit.register(new CallExpr(createIdentifier(callee), args, type));
    }

    /* ── declarations ───────────────────────────────── */

    public VarDecl createVar(String name, Type type) {
        return createVar(name, type, null);
    }

    public VarDecl createVar(String name, Type type, Expr init) {
        return unit.register(new VarDecl(createIdentifier(name), type, init));
    }

    public FieldDecl createField(String name, Type type) {
        return createField(createIdentifier(name), type);
    }

    public FieldDecl createField(Identifier name, Type type) {
        return unit.register(new FieldDecl(name, type));
    }

    /** Creates a record without adding it to the unit. */
    public RecordDecl createRecordDecl(Identifier name, List<FieldDecl> fields) {
        return unit.register(new RecordDecl(name, fields));
    }

    /** Creates a record and appends it to the unit's top level. */
    public RecordDecl addRecord(String name, List<FieldDecl> fields) {
        RecordDecl record = createRecordDecl(createIdentifier(name), fields);
        unit.addDecl(record);
        return record;
    }

    /** Creates a function and appends it to the unit's top level. */
    public FunctionDecl addFunction(String name, Type returnType, List<VarDecl> params, CompoundStmt body) {
        FunctionDecl function = unit.register(
                new FunctionDecl(createIdentifier(name), returnType, params, body));
        unit.addDecl(function);
        return function;
    }

    private static IntegerType promote(Expr expr) {
        if (!(expr.getType() instanceof IntegerType type)) {
            throw DecompileException.unSupported("non-integer operand " + expr.toC());
        }
        return IntegerType.common(type, type);
    }

    private static Type resultType(Opcode opcode, Expr lhs, Expr rhs) {
        if (opcode.isComparison() || opcode.isLogical()) {
            return IntegerType.getInt();
        }
        if (opcode == Opcode.ASSIGN) {
            return lhs.getType();
        }
        if (opcode == Opcode.SHL || opcode == Opcode.SHR) {
            return promote(lhs);
        }
        return IntegerType.common(promote(lhs), promote(rhs));
    }
}
