package ast;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Read-only link from tree nodes back to the low-level values they were
 * lowered from. Built by the lowering stage; the passes only query it.
 */
public final class Provenance {
    private static final Provenance EMPTY = new Provenance(Map.of());

    private final Map<ASTNode, Object> origins;

    public Provenance(Map<? extends ASTNode, ?> origins) {
        this.origins = Collections.unmodifiableMap(new IdentityHashMap<ASTNode, Object>(origins));
    }

    public static Provenance empty() {
        return EMPTY;
    }

    /** @return the originating value, or null for synthesized nodes */
    public Object get(ASTNode node) {
        return origins.get(node);
    }

    public boolean contains(ASTNode node) {
        return origins.containsKey(node);
    }

    public int size() {
        return origins.size();
    }

    /** Short form for log records. */
    public String describe(ASTNode node) {
        Object origin = origins.get(node);
        return origin == null ? "<synthesized>" : String.valueOf(origin);
    }
}
