package solver;

import ast.ASTBuilder;
import ast.ASTUnit;
import ast.Opcode;
import ast.decl.VarDecl;
import ast.expr.Expr;
import ast.type.IntegerType;
import com.microsoft.z3.BoolExpr;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConditionSolverTest {
    private ASTBuilder ast;
    private ConditionSolver solver;
    private VarDecl x;
    private VarDecl u;

    @BeforeEach
    public void setUp() {
        ast = new ASTBuilder(new ASTUnit("solver"));
        solver = new ConditionSolver(10_000);
        x = ast.createVar("x", IntegerType.getInt());
        u = ast.createVar("u", IntegerType.getUnsigned());
    }

    @AfterEach
    public void tearDown() {
        solver.close();
    }

    private BoolExpr cond(VarDecl var, Opcode op, long value) {
        Expr lit = ast.createIntLit((IntegerType) var.getType(), value);
        return solver.condition(ast.createBinaryOp(op, ast.createRef(var), lit));
    }

    @Test
    public void testComplementaryComparisonsCoverEverything() {
        BoolExpr any = solver.mkOr(List.of(cond(x, Opcode.GT, 0), cond(x, Opcode.LE, 0)));
        assertTrue(solver.proveValid(any));
    }

    @Test
    public void testGapIsNotValid() {
        BoolExpr any = solver.mkOr(List.of(cond(x, Opcode.GT, 0), cond(x, Opcode.LT, -1)));
        assertFalse(solver.proveValid(any));
    }

    @Test
    public void testDisjointConditions() {
        assertTrue(solver.proveUnsat(solver.mkAnd(cond(x, Opcode.GT, 0), cond(x, Opcode.LT, 0))));
        assertFalse(solver.proveUnsat(solver.mkAnd(cond(x, Opcode.GE, 0), cond(x, Opcode.LE, 0))));
    }

    @Test
    public void testSignedness() {
        // unsigned values are never below zero, signed ones can be
        assertTrue(solver.proveValid(cond(u, Opcode.GE, 0)));
        assertFalse(solver.proveValid(cond(x, Opcode.GE, 0)));
    }

    @Test
    public void testEmptyDisjunctionIsFalse() {
        assertTrue(solver.proveUnsat(solver.mkOr(List.of())));
        assertTrue(solver.proveUnsat(solver.mkAnd(cond(x, Opcode.EQ, 1), solver.mkOr(List.of()))));
    }

    @Test
    public void testIntegerConditionMeansNonZero() {
        BoolExpr plain = solver.condition(ast.createRef(x));
        BoolExpr nonZero = cond(x, Opcode.NE, 0);
        assertTrue(solver.proveUnsat(solver.mkAnd(plain, solver.mkNot(nonZero))));
        assertTrue(solver.proveUnsat(solver.mkAnd(nonZero, solver.mkNot(plain))));
    }

    @Test
    public void testNegatedConditionIsComplement() {
        Expr c = ast.createBinaryOp(Opcode.LT, ast.createRef(x), ast.createIntLit(7));
        BoolExpr both = solver.mkOr(List.of(solver.condition(c), solver.condition(ast.negateCondition(c))));
        assertTrue(solver.proveValid(both));
    }

    @Test
    public void testCallsAreOpaque() {
        Expr lhs = ast.createCall("rand", List.of(), IntegerType.getInt());
        Expr rhs = ast.createCall("rand", List.of(), IntegerType.getInt());
        BoolExpr same = solver.condition(ast.createBinaryOp(Opcode.EQ, lhs, rhs));
        assertFalse(solver.proveValid(same));
        assertFalse(solver.proveUnsat(same));
    }

    @Test
    public void testQueriesAreCounted() {
        solver.proveValid(cond(x, Opcode.EQ, 0));
        solver.proveUnsat(cond(x, Opcode.EQ, 0));
        assertEquals(2, solver.getQueryCount());
        assertEquals(0, solver.getUndecidedCount());
    }

    @Test
    public void testTimeoutIsNotAProof() {
        IntegerType u64 = IntegerType.get(64, false);
        VarDecl p = ast.createVar("p", u64);
        VarDecl q = ast.createVar("q", u64);
        // 1000000007 * 1000000009, factors below 2^32 so the product cannot wrap
        Expr product = ast.createBinaryOp(Opcode.EQ,
                ast.createBinaryOp(Opcode.MUL, ast.createRef(p), ast.createRef(q)),
                ast.createIntLit(u64, 1000000016000000063L));
        Expr bounds = ast.createBinaryOp(Opcode.LAND,
                ast.createBinaryOp(Opcode.LAND,
                        ast.createBinaryOp(Opcode.GT, ast.createRef(p), ast.createIntLit(u64, 1)),
                        ast.createBinaryOp(Opcode.GT, ast.createRef(q), ast.createIntLit(u64, 1))),
                ast.createBinaryOp(Opcode.LAND,
                        ast.createBinaryOp(Opcode.LT, ast.createRef(p), ast.createIntLit(u64, 1L << 32)),
                        ast.createBinaryOp(Opcode.LT, ast.createRef(q), ast.createIntLit(u64, 1L << 32))));

        try (ConditionSolver hasty = new ConditionSolver(1)) {
            BoolExpr factoring = hasty.condition(ast.createBinaryOp(Opcode.LAND, product, bounds));

            assertFalse(hasty.proveUnsat(factoring));
            assertFalse(hasty.proveValid(factoring));
            assertTrue(hasty.getUndecidedCount() > 0);
        }
    }

    @Test
    public void testResetForgetsOpaqueValues() {
        Expr call = ast.createCall("rand", List.of(), IntegerType.getInt());
        Expr test = ast.createBinaryOp(Opcode.EQ, call, ast.createIntLit(0));
        Expr plain = ast.createBinaryOp(Opcode.EQ, ast.createRef(x), ast.createIntLit(0));

        BoolExpr first = solver.condition(test);
        BoolExpr firstPlain = solver.condition(plain);
        assertTrue(solver.proveUnsat(solver.mkAnd(first, solver.mkNot(solver.condition(test)))));

        solver.reset();

        // the call gets a new constant, the variable keeps its own
        assertFalse(solver.proveUnsat(solver.mkAnd(first, solver.mkNot(solver.condition(test)))));
        assertTrue(solver.proveUnsat(solver.mkAnd(firstPlain, solver.mkNot(solver.condition(plain)))));
    }
}
