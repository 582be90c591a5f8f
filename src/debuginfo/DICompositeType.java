package debuginfo;

import java.util.List;

/**
 * Struct type as described by the debug info, members in layout order.
 */
public final class DICompositeType {
    private final String name;
    private final List<DIDerivedType> elements;

    public DICompositeType(String name, List<DIDerivedType> elements) {
        this.name = name;
        this.elements = List.copyOf(elements);
    }

    public String getName() {
        return name;
    }

    public List<DIDerivedType> getElements() {
        return elements;
    }

    @Override
    public String toString() {
        return "struct " + name + " " + elements;
    }
}
