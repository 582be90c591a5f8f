package ast.decl;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Identifier;
import ast.type.Type;

import java.util.List;

public class FieldDecl extends Decl {
    private final Type type;

    public FieldDecl(Identifier name, Type type) {
        super(name);
        this.type = type;
    }

    public Type getType() {
        return type;
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
        sb.append(type.toC()).append(' ').append(getName()).append(';');
    }
}
