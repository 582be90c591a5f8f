package ast;

import ast.decl.RecordDecl;
import ast.decl.VarDecl;
import ast.expr.Expr;
import ast.type.IntegerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class ASTBuilderTest {
    private ASTUnit unit;
    private ASTBuilder ast;
    private VarDecl x;
    private VarDecl y;

    @BeforeEach
    public void setUp() {
        unit = new ASTUnit("builder");
        ast = new ASTBuilder(unit);
        x = ast.createVar("x", IntegerType.getInt());
        y = ast.createVar("y", IntegerType.getInt());
    }

    @Test
    public void testNegateComparison() {
        Expr cond = ast.createBinaryOp(Opcode.LT, ast.createRef(x), ast.createIntLit(3));
        assertEquals("x >= 3", ast.negateCondition(cond).toC());
    }

    @Test
    public void testNegateStripsLogicalNot() {
        Expr ref = ast.createRef(x);
        assertSame(ref, ast.negateCondition(ast.createUnaryOp(Opcode.LNOT, ref)));
    }

    @Test
    public void testNegateWrapsOtherConditions() {
        Expr sum = ast.createBinaryOp(Opcode.ADD, ast.createRef(x), ast.createRef(y));
        assertEquals("!x", ast.negateCondition(ast.createRef(x)).toC());
        assertEquals("!(x + y)", ast.negateCondition(sum).toC());
    }

    @Test
    public void testParenthesesFollowPrecedence() {
        Expr sum = ast.createBinaryOp(Opcode.ADD, ast.createRef(x), ast.createIntLit(1));
        assertEquals("(x + 1) * 2", ast.createBinaryOp(Opcode.MUL, sum, ast.createIntLit(2)).toC());

        Expr diff = ast.createBinaryOp(Opcode.SUB, ast.createRef(y), ast.createIntLit(1));
        assertEquals("x - (y - 1)", ast.createBinaryOp(Opcode.SUB, ast.createRef(x), diff).toC());
        assertEquals("y - 1 - x", ast.createBinaryOp(Opcode.SUB, diff, ast.createRef(x)).toC());
    }

    @Test
    public void testArithmeticConversion() {
        Expr mixed = ast.createBinaryOp(Opcode.ADD, ast.createRef(x), ast.createTrue());
        assertSame(IntegerType.getUnsigned(), mixed.getType());

        Expr wide = ast.createBinaryOp(Opcode.ADD, ast.createRef(x), ast.createIntLit(IntegerType.i64, 1));
        assertSame(IntegerType.i64, wide.getType());

        Expr test = ast.createBinaryOp(Opcode.LT, ast.createRef(x), ast.createTrue());
        assertSame(IntegerType.getInt(), test.getType());
    }

    @Test
    public void testIdentifiersAreInterned() {
        assertSame(ast.createIdentifier("len"), unit.getIdentifier("len"));
    }

    @Test
    public void testNodesAreRegistered() {
        int before = unit.getNumNodes();
        ast.createBreak();
        ast.createIntLit(4);
        assertEquals(before + 2, unit.getNumNodes());
    }

    @Test
    public void testRecordPrinting() {
        RecordDecl record = ast.addRecord("S", List.of(
                ast.createField("len", IntegerType.getUnsigned()),
                ast.createField("tag", IntegerType.i8)));

        assertEquals("struct S {\n    unsigned int len;\n    char tag;\n};", record.toC());
        assertSame(record, unit.getRecord("S"));
    }
}
