package ast.expr;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Opcode;
import ast.type.IntegerType;

import java.util.List;

public class IntegerLiteral extends Expr {
    private final long value;

    public IntegerLiteral(IntegerType type, long value) {
        super(type);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public IntegerType getType() {
        return (IntegerType) super.getType();
    }

    @Override
    public boolean hasSideEffects() {
        return false;
    }

    @Override
    public List<ASTNode> getChildren() {
        return List.of();
    }

    @Override
    public void setChild(int index, ASTNode child) {
        throw new IndexOutOfBoundsException(index);
    }

    @Override
    public int precedence() {
        return value < 0 ? Opcode.MINUS.getPrecedence() : PRIMARY;
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        IntegerType type = getType();
        sb.append(type.isSigned() ? Long.toString(value) : Long.toUnsignedString(value));
        if (!type.isSigned()) {
            sb.append('U');
        }
        if (type.getBitWidth() == 64) {
            sb.append("LL");
        }
    }
}
