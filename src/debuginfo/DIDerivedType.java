package debuginfo;

/**
 * Member of a composite type as described by the debug info.
 */
public final class DIDerivedType {
    private final String name;
    private final long offsetInBits;

    public DIDerivedType(String name, long offsetInBits) {
        this.name = name;
        this.offsetInBits = offsetInBits;
    }

    public DIDerivedType(String name) {
        this(name, -1);
    }

    public String getName() {
        return name;
    }

    /** @return the member offset, or -1 when the producer omitted it */
    public long getOffsetInBits() {
        return offsetInBits;
    }

    @Override
    public String toString() {
        return name;
    }
}
