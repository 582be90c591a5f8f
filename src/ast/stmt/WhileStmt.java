package ast.stmt;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.expr.Expr;

import java.util.Arrays;
import java.util.List;

public class WhileStmt extends Stmt {
    private Expr cond;
    private Stmt body;

    public WhileStmt(Expr cond, Stmt body) {
        this.cond = cond;
        this.body = body;
    }

    public Expr getCond() {
        return cond;
    }

    public Stmt getBody() {
        return body;
    }

    @Override
    public List<ASTNode> getChildren() {
        return Arrays.asList(cond, body);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        switch (index) {
            case 0 -> cond = cast(child, Expr.class, "loop condition");
            case 1 -> body = cast(child, Stmt.class, "loop body");
            default -> throw new IndexOutOfBoundsException(index);
        }
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("while (");
        cond.print(sb, indent);
        sb.append(") ");
        body.printStmt(sb, indent);
    }
}
