package ast;

import exception.DecompileException;

import java.util.List;

/**
 * Base of every node in the syntax tree. Nodes are owned by an {@link ASTUnit}
 * and compared by identity.
 */
public abstract class ASTNode {
    protected static final String INDENT = "    ";

    /**
     * Child slots in source order. Optional slots that are empty hold null,
     * so slot indices stay stable for {@link #setChild}.
     */
    public abstract List<ASTNode> getChildren();

    /**
     * Relink one child slot. Only substitution application calls this; the
     * passes themselves never edit a node in place.
     */
    public abstract void setChild(int index, ASTNode child);

    public abstract <T> T accept(ASTVisitor<T> visitor);

    /** Append the C spelling of this node, continuation lines indented by {@code indent} levels. */
    public abstract void print(StringBuilder sb, int indent);

    public final String toC() {
        StringBuilder sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }

    protected static void indent(StringBuilder sb, int level) {
        for (int i = 0; i < level; i++) {
            sb.append(INDENT);
        }
    }

    protected static <N extends ASTNode> N cast(ASTNode child, Class<N> cls, String slot) {
        if (!cls.isInstance(child)) {
            throw DecompileException.illegalNode(
                    slot + " expects " + cls.getSimpleName() + " but got "
                            + (child == null ? "null" : child.getClass().getSimpleName()));
        }
        return cls.cast(child);
    }

    @Override
    public String toString() {
        return toC();
    }
}
