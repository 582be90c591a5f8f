package ast.expr;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Opcode;
import ast.type.Type;

import exception.DecompileException;

import java.util.Arrays;
import java.util.List;

public class BinaryOperator extends Expr {
    private final Opcode opcode;
    private Expr lhs;
    private Expr rhs;

    public BinaryOperator(Opcode opcode, Expr lhs, Expr rhs, Type type) {
        super(type);
        if (opcode.isUnary()) {
            throw DecompileException.illegalNode("unary opcode " + opcode + " in binary operator");
        }
        this.opcode = opcode;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public Expr getLHS() {
        return lhs;
    }

    public Expr getRHS() {
        return rhs;
    }

    public boolean isAssignment() {
        return opcode == Opcode.ASSIGN;
    }

    @Override
    public boolean hasSideEffects() {
        return isAssignment() || lhs.hasSideEffects() || rhs.hasSideEffects();
    }

    @Override
    public int precedence() {
        return opcode.getPrecedence();
    }

    @Override
    public List<ASTNode> getChildren() {
        return Arrays.asList(lhs, rhs);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        switch (index) {
            case 0 -> lhs = cast(child, Expr.class, "left operand");
            case 1 -> rhs = cast(child, Expr.class, "right operand");
            default -> throw new IndexOutOfBoundsException(index);
        }
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        // assignment is right associative, everything else left associative
        boolean rightAssoc = isAssignment();
        printOperand(sb, lhs, precedence(), rightAssoc, indent);
        sb.append(' ').append(opcode.getSymbol()).append(' ');
        printOperand(sb, rhs, precedence(), !rightAssoc, indent);
    }
}
