package ast.expr;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Identifier;
import ast.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Call of a named function. Always treated as having side effects.
 */
public class CallExpr extends Expr {
    private final Identifier callee;
    private final List<Expr> args;

    public CallExpr(Identifier callee, List<? extends Expr> args, Type type) {
        super(type);
        this.callee = callee;
        this.args = new ArrayList<>(args);
    }

    public Identifier getCallee() {
        return callee;
    }

    public List<Expr> getArgs() {
        return Collections.unmodifiableList(args);
    }

    @Override
    public boolean hasSideEffects() {
        return true;
    }

    @Override
    public List<ASTNode> getChildren() {
        return new ArrayList<>(args);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        args.set(index, cast(child, Expr.class, "call argument"));
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append(callee.getName()).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            args.get(i).print(sb, indent);
        }
        sb.append(')');
    }
}
