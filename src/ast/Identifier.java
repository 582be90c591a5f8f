package ast;

/**
 * Interned name. One instance exists per spelling within an {@link ASTUnit}.
 */
public final class Identifier {
    private final String name;

    Identifier(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
