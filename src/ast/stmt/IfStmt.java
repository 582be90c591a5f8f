package ast.stmt;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.expr.Expr;

import java.util.Arrays;
import java.util.List;

public class IfStmt extends Stmt {
    private Expr cond;
    private Stmt then;
    private Stmt otherwise;

    public IfStmt(Expr cond, Stmt then, Stmt otherwise) {
        this.cond = cond;
        this.then = then;
        this.otherwise = otherwise;
    }

    public Expr getCond() {
        return cond;
    }

    public Stmt getThen() {
        return then;
    }

    /** @return the else branch, or null */
    public Stmt getElse() {
        return otherwise;
    }

    public boolean hasElse() {
        return otherwise != null;
    }

    @Override
    public List<ASTNode> getChildren() {
        return Arrays.asList(cond, then, otherwise);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        switch (index) {
            case 0 -> cond = cast(child, Expr.class, "if condition");
            case 1 -> then = cast(child, Stmt.class, "if body");
            case 2 -> otherwise = child == null ? null : cast(child, Stmt.class, "else body");
            default -> throw new IndexOutOfBoundsException(index);
        }
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("if (");
        cond.print(sb, indent);
        sb.append(") ");
        then.printStmt(sb, indent);
        if (otherwise != null) {
            sb.append(" else ");
            otherwise.printStmt(sb, indent);
        }
    }
}
