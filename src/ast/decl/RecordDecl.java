package ast.decl;

import ast.ASTNode;
import ast.ASTVisitor;
import ast.Identifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A recovered struct. Field order is the layout order.
 */
public class RecordDecl extends Decl {
    private final List<FieldDecl> fields;

    public RecordDecl(Identifier name, List<FieldDecl> fields) {
        super(name);
        this.fields = new ArrayList<>(fields);
    }

    public List<FieldDecl> getFields() {
        return Collections.unmodifiableList(fields);
    }

    @Override
    public List<ASTNode> getChildren() {
        return new ArrayList<>(fields);
    }

    @Override
    public void setChild(int index, ASTNode child) {
        fields.set(index, cast(child, FieldDecl.class, "record field"));
    }

    @Override
    public <T> T accept(ASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("struct ").append(getName()).append(" {\n");
        for (FieldDecl field : fields) {
            indent(sb, indent + 1);
            field.print(sb, indent + 1);
            sb.append('\n');
        }
        indent(sb, indent);
        sb.append("};");
    }
}
