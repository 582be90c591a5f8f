package ast.decl;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Identifier;
import ast.stmt.CompoundStmt;
import ast.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FunctionDecl extends Decl {
    private final Type returnType;
    private final List<VarDecl> params;
    private CompoundStmt body;

    public FunctionDecl(Identifier name, Type returnType, List<VarDecl> params, CompoundStmt body) {
        super(name);
        this.returnType = returnType;
        this.params = new ArrayList<>(params);
        this.body = body;
    }

    public Type getReturnType() {
        return returnType;
    }

    public List<VarDecl> getParams() {
        return Collections.unmodifiableList(params);
    }

    public CompoundStmt getBody() {
        return body;
    }

    // slots: params in order, then the body
    @Override
    public List<ASTNode> getChildren() {
        List<ASTNode> children = new ArrayList<>(params);
        children.add(body);
        return children;
    }

    @Override
    public void setChild(int index, ASTNode child) {
        if (index == params.size()) {
            body = cast(child, CompoundStmt.class, "function body");
        } else {
            params.set(index, cast(child, VarDecl.class, "parameter"));
        }
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append(returnType.toC()).append(' ').append(getName()).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            params.get(i).print(sb, indent);
        }
        sb.append(") ");
        body.print(sb, indent);
    }
}
