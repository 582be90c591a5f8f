package ast.expr;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Opcode;
import ast.type.Type;

import exception.DecompileException;

import java.util.List;

public class UnaryOperator extends Expr {
    private final Opcode opcode;
    private Expr operand;

    public UnaryOperator(Opcode opcode, Expr operand, Type type) {
        super(type);
        if (!opcode.isUnary()) {
            throw DecompileException.illegalNode("binary opcode " + opcode + " in unary operator");
        }
        this.opcode = opcode;
        this.operand = operand;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public boolean hasSideEffects() {
        return operand.hasSideEffects();
    }

    @Override
    public int precedence() {
        return opcode.getPrecedence();
    }

    @Override
    public List<ASTNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        if (index != 0) {
            throw new IndexOutOfBoundsException(index);
        }
        operand = cast(child, Expr.class, "operand");
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append(opcode.getSymbol());
        printOperand(sb, operand, precedence(), false, indent);
    }
}
