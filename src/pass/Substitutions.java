package pass;

import ast.ASTBuilder;
import ast.ASTNode;
import ast.ASTUnit;
import ast.decl.Decl;
import ast.stmt.CompoundStmt;
import ast.stmt.IfStmt;
import ast.stmt.Stmt;
import exception.DecompileException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replacements collected during one traversal, keyed by node identity.
 * Nothing in the tree changes until {@link #apply}, which relinks the parent
 * of every replaced node in a single walk.
 *
 * A null replacement removes the node: it is dropped from a compound
 * statement, an else branch is cleared, and any other statement slot gets an
 * empty block.
 */
public class Substitutions {
    private final Map<ASTNode, ASTNode> replacements = new IdentityHashMap<>();
    private final Set<ASTNode> resolving = Collections.newSetFromMap(new IdentityHashMap<>());
    private final ASTBuilder builder;

    private boolean applied;

    public Substitutions(ASTBuilder builder) {
        this.builder = builder;
    }

    /** Register a replacement; a later call for the same node wins. */
    public void put(ASTNode node, ASTNode replacement) {
        replacements.put(node, replacement);
    }

    public void remove(ASTNode node) {
        replacements.put(node, null);
    }

    public boolean contains(ASTNode node) {
        return replacements.containsKey(node);
    }

    /** @return the registered replacement, which is null for a removal */
    public ASTNode get(ASTNode node) {
        return replacements.get(node);
    }

    public int size() {
        return replacements.size();
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }

    public void clear() {
        replacements.clear();
    }

    /**
     * Relink every registered node in {@code unit}, then forget them.
     * @return whether any node was actually replaced
     */
    public boolean apply(ASTUnit unit) {
        if (replacements.isEmpty()) {
            return false;
        }
        applied = false;
        List<Decl> decls = unit.getDecls();
        for (int i = 0; i < decls.size(); i++) {
            Decl decl = decls.get(i);
            ASTNode resolved = resolve(decl);
            if (resolved == decl) {
                continue;
            }
            if (!(resolved instanceof Decl replacement)) {
                throw DecompileException.illegalSubstitution(
                        "top level declaration " + decl.getName() + " replaced by " + resolved);
            }
            unit.setDecl(i, replacement);
        }
        replacements.clear();
        return applied;
    }

    private ASTNode resolve(ASTNode node) {
        ASTNode current = node;
        if (replacements.containsKey(node)) {
            if (!resolving.add(node)) {
                throw DecompileException.illegalSubstitution("replacement of a node contains the node itself");
            }
            current = replacements.get(node);
            if (current != node) {
                applied = true;
            }
            if (current == null) {
                resolving.remove(node);
                return null;
            }
        }

        if (current instanceof CompoundStmt compound) {
            relinkBody(compound);
        } else {
            relinkChildren(current);
        }
        resolving.remove(node);
        return current;
    }

    private void relinkBody(CompoundStmt compound) {
        List<Stmt> body = new ArrayList<>(compound.size());
        boolean relinked = false;
        for (Stmt stmt : compound.getBody()) {
            ASTNode resolved = resolve(stmt);
            if (resolved != stmt) {
                relinked = true;
            }
            if (resolved == null) {
                continue;
            }
            if (!(resolved instanceof Stmt replacement)) {
                throw DecompileException.illegalSubstitution("statement replaced by " + resolved);
            }
            body.add(replacement);
        }
        if (relinked) {
            compound.setBody(body);
        }
    }

    private void relinkChildren(ASTNode parent) {
        List<ASTNode> children = parent.getChildren();
        for (int i = 0; i < children.size(); i++) {
            ASTNode child = children.get(i);
            if (child == null) {
                continue;
            }
            ASTNode resolved = resolve(child);
            if (resolved == child) {
                continue;
            }
            parent.setChild(i, resolved != null ? resolved : filler(parent, i));
        }
    }

    private ASTNode filler(ASTNode parent, int slot) {
        if (parent instanceof IfStmt && slot == 2) {
            return null;
        }
        return builder.createCompoundStmt(List.of());
    }
}
