package ast.stmt;

import ast.ASTNode;

public abstract class Stmt extends ASTNode {
    /**
     * Print in statement position. Expressions override this to add the
     * terminating semicolon.
     */
    public void printStmt(StringBuilder sb, int indent) {
        print(sb, indent);
    }
}
