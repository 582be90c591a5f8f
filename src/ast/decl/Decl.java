package ast.decl;

import ast.ASTNode;
import ast.Identifier;

public abstract class Decl extends ASTNode {
    private final Identifier name;

    protected Decl(Identifier name) {
        this.name = name;
    }

    public Identifier getIdentifier() {
        return name;
    }

    public String getName() {
        return name.getName();
    }
}
