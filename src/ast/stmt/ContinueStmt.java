package ast.stmt;

import ast.ASTNode;
import ast.ASTVisitor;

import java.util.List;

public class ContinueStmt extends Stmt {

    @Override
    public List<ASTNode> getChildren() {
        return List.of();
    }

    @Override
    public void setChild(int index, ASTNode child) {
        throw new IndexOutOfBoundsException(index);
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("continue;");
    }
}
