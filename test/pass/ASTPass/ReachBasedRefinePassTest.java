package pass.ASTPass;

import ast.Opcode;
import ast.decl.FunctionDecl;
import ast.stmt.CompoundStmt;
import ast.stmt.IfStmt;
import ast.stmt.Stmt;
import ast.stmt.WhileStmt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pass.BaseTest;
import pass.PassContext;
import pass.TreeInterpreter;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReachBasedRefinePassTest extends BaseTest {
    private ReachBasedRefinePass pass;

    @BeforeEach
    public void setUp() {
        pass = new ReachBasedRefinePass(context);
    }

    @AfterEach
    public void tearDown() {
        pass.close();
    }

    private long[] outcomes(FunctionDecl function) {
        long[] result = new long[11];
        for (int v = -5; v <= 5; v++) {
            result[v + 5] = new TreeInterpreter().set(x, v).set(y, -100).run(body(function)).get(y);
        }
        return result;
    }

    @Test
    public void testThreeWaySplitIsChained() {
        IfStmt neg = ifSet(cmp(x, Opcode.LT, 0), y, 1);
        IfStmt zero = ifSet(cmp(x, Opcode.EQ, 0), y, 2);
        IfStmt pos = ifSet(cmp(x, Opcode.GT, 0), y, 3);
        FunctionDecl f = function(neg, zero, pos);

        assertTrue(pass.run());

        CompoundStmt body = body(f);
        assertEquals(1, body.size());
        IfStmt head = assertInstanceOf(IfStmt.class, body.get(0));
        assertSame(neg.getCond(), head.getCond());
        assertSame(neg.getThen(), head.getThen());
        IfStmt second = assertInstanceOf(IfStmt.class, head.getElse());
        assertSame(zero.getCond(), second.getCond());
        // the last condition is implied, only its body survives
        assertSame(pos.getThen(), second.getElse());
    }

    @Test
    public void testChainKeepsBehaviour() {
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LT, 0), y, 1),
                ifSet(cmp(x, Opcode.EQ, 0), y, 2),
                ifSet(cmp(x, Opcode.EQ, 1), y, 3),
                ifSet(cmp(x, Opcode.GT, 1), y, 4));
        long[] before = outcomes(f);

        assertTrue(pass.run());

        assertEquals(1, body(f).size());
        assertEquals(Arrays.toString(before), Arrays.toString(outcomes(f)));
    }

    @Test
    public void testTwoBranchesAreLeftAlone() {
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LT, 0), y, 1),
                ifSet(cmp(x, Opcode.GE, 0), y, 2));

        assertFalse(pass.run());
        assertEquals(2, body(f).size());
    }

    @Test
    public void testIncompleteCoverIsLeftAlone() {
        // x == 0 is covered by no branch
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.GT, 0), y, 1),
                ifSet(cmp(x, Opcode.LT, -1), y, 2),
                ifSet(cmp(x, Opcode.EQ, -1), y, 3));

        assertFalse(pass.run());
        assertEquals(3, body(f).size());
    }

    @Test
    public void testOverlappingConditionsAreLeftAlone() {
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LE, 0), y, 1),
                ifSet(cmp(x, Opcode.GE, 0), y, 2),
                ifSet(cmp(x, Opcode.GT, 5), y, 3));

        assertFalse(pass.run());
        assertEquals(3, body(f).size());
    }

    @Test
    public void testElseBranchBreaksTheRun() {
        IfStmt middle = ast.createIf(cmp(x, Opcode.EQ, 0),
                ast.createCompoundStmt(set(y, 2)), ast.createCompoundStmt(set(y, 5)));
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LT, 0), y, 1),
                middle,
                ifSet(cmp(x, Opcode.GT, 0), y, 3));

        assertFalse(pass.run());
        assertEquals(3, body(f).size());
        assertSame(middle, body(f).get(1));
    }

    @Test
    public void testOtherStatementBreaksTheRun() {
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LT, 0), y, 1),
                set(y, 7),
                ifSet(cmp(x, Opcode.EQ, 0), y, 2),
                ifSet(cmp(x, Opcode.GT, 0), y, 3));

        assertFalse(pass.run());
        assertEquals(4, body(f).size());
    }

    @Test
    public void testSurroundingStatementsStay() {
        Stmt before = set(y, 0);
        Stmt after = set(y, 9);
        FunctionDecl f = function(
                before,
                ifSet(cmp(x, Opcode.LT, 0), y, 1),
                ifSet(cmp(x, Opcode.EQ, 0), y, 2),
                ifSet(cmp(x, Opcode.GT, 0), y, 3),
                after);

        assertTrue(pass.run());

        CompoundStmt body = body(f);
        assertEquals(3, body.size());
        assertSame(before, body.get(0));
        assertInstanceOf(IfStmt.class, body.get(1));
        assertSame(after, body.get(2));
    }

    @Test
    public void testBodyWritingLaterConditionIsLeftAlone() {
        // after the first body runs, x == 0 holds and the second branch fires too
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LT, 0), x, 0),
                ifSet(cmp(x, Opcode.EQ, 0), y, 2),
                ifSet(cmp(x, Opcode.GT, 0), y, 3));
        long[] before = outcomes(f);

        pass.run();

        assertEquals(3, body(f).size());
        assertEquals(Arrays.toString(before), Arrays.toString(outcomes(f)));
    }

    @Test
    public void testNestedBlocksAreChained() {
        CompoundStmt inner = ast.createCompoundStmt(
                ifSet(cmp(y, Opcode.LT, 0), x, 1),
                ifSet(cmp(y, Opcode.EQ, 0), x, 2),
                ifSet(cmp(y, Opcode.GT, 0), x, 3));
        FunctionDecl f = function(ast.createWhile(cmp(x, Opcode.NE, 0), inner));

        assertTrue(pass.run());

        WhileStmt loop = assertInstanceOf(WhileStmt.class, body(f).get(0));
        CompoundStmt loopBody = assertInstanceOf(CompoundStmt.class, loop.getBody());
        assertEquals(1, loopBody.size());
    }

    @Test
    public void testSecondRunIsQuiet() {
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LT, 0), y, 1),
                ifSet(cmp(x, Opcode.EQ, 0), y, 2),
                ifSet(cmp(x, Opcode.GT, 0), y, 3));

        assertTrue(pass.run());
        String once = f.toC();
        assertFalse(pass.run());
        assertEquals(once, f.toC());
    }

    @Test
    public void testStoppedPassDoesNothing() {
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.LT, 0), y, 1),
                ifSet(cmp(x, Opcode.EQ, 0), y, 2),
                ifSet(cmp(x, Opcode.GT, 0), y, 3));

        pass.stop();

        assertTrue(pass.stopped());
        assertFalse(pass.run());
        assertEquals(3, body(f).size());
    }

    @Test
    public void testOverlappingIfDoesNotStartNewChain() {
        // the second x == 0 overlaps the first, so neither heads a chain and
        // only two branches remain for the next candidate
        FunctionDecl f = function(
                ifSet(cmp(x, Opcode.EQ, 0), y, 1),
                ifSet(cmp(x, Opcode.EQ, 0), y, 2),
                ifSet(cmp(x, Opcode.EQ, 1), y, 3),
                ifSet(ast.createBinaryOp(Opcode.LAND, cmp(x, Opcode.NE, 0), cmp(x, Opcode.NE, 1)), y, 4));

        assertFalse(pass.run());
        assertEquals(4, body(f).size());
    }

    /** Requests the stop as soon as one block has been chained. */
    private static final class StopAfterFirstChain extends ReachBasedRefinePass {
        StopAfterFirstChain(PassContext context) {
            super(context);
        }

        @Override
        public Boolean visit(CompoundStmt compound) {
            Boolean result = super.visit(compound);
            if (!substitutions.isEmpty()) {
                stop();
            }
            return result;
        }
    }

    private WhileStmt loopOverThreeWaySplit() {
        return ast.createWhile(cmp(x, Opcode.NE, 0), ast.createCompoundStmt(
                ifSet(cmp(y, Opcode.LT, 0), y, 1),
                ifSet(cmp(y, Opcode.EQ, 0), y, 2),
                ifSet(cmp(y, Opcode.GT, 0), y, 3)));
    }

    @Test
    public void testStopDuringWalkKeepsLaterBlocks() {
        WhileStmt first = loopOverThreeWaySplit();
        WhileStmt second = loopOverThreeWaySplit();
        function(first, second);

        try (StopAfterFirstChain stopping = new StopAfterFirstChain(context)) {
            assertTrue(stopping.run());

            assertTrue(stopping.stopped());
            assertEquals(1, ((CompoundStmt) first.getBody()).size());
            assertEquals(3, ((CompoundStmt) second.getBody()).size());

            assertFalse(stopping.run());
            assertEquals(3, ((CompoundStmt) second.getBody()).size());
        }
    }
}
