package ast.decl;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Identifier;
import ast.expr.Expr;
import ast.type.Type;

import java.util.Arrays;
import java.util.List;

/**
 * Local variable or parameter.
 */
public class VarDecl extends Decl {
    private final Type type;
    private Expr init;

    public VarDecl(Identifier name, Type type, Expr init) {
        super(name);
        this.type = type;
        this.init = init;
    }

    public Type getType() {
        return type;
    }

    public Expr getInit() {
        return init;
    }

    @Override
    public List<ASTNode> getChildren() {
        return Arrays.asList(init);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        if (index != 0) {
            throw new IndexOutOfBoundsException(index);
        }
        init = child == null ? null : cast(child, Expr.class, "initializer");
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append(type.toC()).append(' ').append(getName());
        if (init != null) {
            sb.append(" = ");
            init.print(sb, indent);
        }
    }
}
