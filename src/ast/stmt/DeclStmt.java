package ast.stmt;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.decl.VarDecl;

import java.util.List;

/**
 * Declaration of a local variable in statement position.
 */
public class DeclStmt extends Stmt {
    private VarDecl decl;

    public DeclStmt(VarDecl decl) {
        this.decl = decl;
    }

    public VarDecl getDecl() {
        return decl;
    }

    @Override
    public List<ASTNode> getChildren() {
        return List.of(decl);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        if (index != 0) {
            throw new IndexOutOfBoundsException(index);
        }
        decl = cast(child, VarDecl.class, "declaration");
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        decl.print(sb, indent);
        sb.append(';');
    }
}
