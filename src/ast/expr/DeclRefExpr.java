package ast.expr;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.decl.VarDecl;

import java.util.List;

/**
 * Use of a variable. The referenced declaration is not a child.
 */
public class DeclRefExpr extends Expr {
    private final VarDecl decl;

    public DeclRefExpr(VarDecl decl) {
        super(decl.getType());
        this.decl = decl;
    }

    public VarDecl getDecl() {
        return decl;
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
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append(decl.getName());
    }
}
