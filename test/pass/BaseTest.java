package pass;

import ast.ASTBuilder;
import ast.ASTUnit;
import ast.Opcode;
import ast.Provenance;
import ast.decl.FunctionDecl;
import ast.decl.VarDecl;
import ast.expr.Expr;
import ast.stmt.CompoundStmt;
import ast.stmt.IfStmt;
import ast.stmt.Stmt;
import ast.type.IntegerType;
import ast.type.VoidType;
import debuginfo.DebugInfoMap;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;

/**
 * Shared fixture: a fresh unit with two int variables {@code x} and
 * {@code y}, plus shorthands for building small functions.
 */
public abstract class BaseTest {
    protected ASTUnit unit;
    protected ASTBuilder ast;
    protected PassContext context;
    protected VarDecl x;
    protected VarDecl y;

    @BeforeEach
    public void setUpUnit() {
        unit = new ASTUnit(getClass().getSimpleName());
        context = new PassContext(unit, Provenance.empty(), DebugInfoMap.empty(), new StopSignal(), 10_000);
        ast = context.getBuilder();
        x = ast.createVar("x", IntegerType.getInt());
        y = ast.createVar("y", IntegerType.getInt());
    }

    protected Expr lit(long value) {
        return ast.createIntLit(value);
    }

    protected Expr ref(VarDecl var) {
        return ast.createRef(var);
    }

    /** {@code var op value} */
    protected Expr cmp(VarDecl var, Opcode op, long value) {
        return ast.createBinaryOp(op, ref(var), lit(value));
    }

    /** {@code var = value;} */
    protected Stmt set(VarDecl var, long value) {
        return ast.createAssign(var, lit(value));
    }

    /** {@code if (cond) { var = value; }} */
    protected IfStmt ifSet(Expr cond, VarDecl var, long value) {
        return ast.createIf(cond, ast.createCompoundStmt(set(var, value)));
    }

    protected FunctionDecl function(Stmt... body) {
        return ast.addFunction("f", VoidType.getVoid(), List.of(x, y), ast.createCompoundStmt(body));
    }

    protected CompoundStmt body(FunctionDecl function) {
        return unit.getFunction(function.getName()).getBody();
    }
}
