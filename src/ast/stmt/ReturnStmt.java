package ast.stmt;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.expr.Expr;

import java.util.Arrays;
import java.util.List;

public class ReturnStmt extends Stmt {
    private Expr value;

    public ReturnStmt(Expr value) {
        this.value = value;
    }

    /** @return the returned expression, or null for a bare return */
    public Expr getValue() {
        return value;
    }

    @Override
    public List<ASTNode> getChildren() {
        return Arrays.asList(value);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        if (index != 0) {
            throw new IndexOutOfBoundsException(index);
        }
        value = child == null ? null : cast(child, Expr.class, "return value");
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("return");
        if (value != null) {
            sb.append(' ');
            value.print(sb, indent);
        }
        sb.append(';');
    }
}
