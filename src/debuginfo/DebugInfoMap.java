package debuginfo;

import ast.decl.RecordDecl;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Links recovered record declarations to their debug-info composite types.
 * Records without an entry had no debug info in the input.
 */
public final class DebugInfoMap {
    private final Map<RecordDecl, DICompositeType> types;

    public DebugInfoMap(Map<RecordDecl, DICompositeType> types) {
        this.types = Collections.unmodifiableMap(new IdentityHashMap<>(types));
    }

    public static DebugInfoMap empty() {
        return new DebugInfoMap(Map.of());
    }

    /** @return the composite type, or null when the record has no debug info */
    public DICompositeType get(RecordDecl decl) {
        return types.get(decl);
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }
}
