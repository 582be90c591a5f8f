package ast.stmt;

import ast.ASTNode;
import ast.ASTVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A braced statement sequence.
 */
public class CompoundStmt extends Stmt {
    private final List<Stmt> body;

    public CompoundStmt(List<? extends Stmt> body) {
        this.body = new ArrayList<>(body);
    }

    public List<Stmt> getBody() {
        return Collections.unmodifiableList(body);
    }

    public int size() {
        return body.size();
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    public Stmt get(int index) {
        return body.get(index);
    }

    /**
     * Replace the whole sequence. Used when a substitution drops members.
     */
    public void setBody(List<? extends Stmt> newBody) {
        body.clear();
        body.addAll(newBody);
    }

    @Override
    public List<ASTNode> getChildren() {
        return new ArrayList<>(body);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        body.set(index, cast(child, Stmt.class, "compound member"));
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("{\n");
        for (Stmt stmt : body) {
            indent(sb, indent + 1);
            stmt.printStmt(sb, indent + 1);
            sb.append('\n');
        }
        indent(sb, indent);
        sb.append('}');
    }
}
