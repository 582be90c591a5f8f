package ast.type;

public abstract class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return this.kind;
    }

    /** spelling of the type in C source */
    public abstract String toC();

    public boolean is(TypeKind k) { return kind == k; }
    public boolean isVoid() { return is(TypeKind.VOID); }
    public boolean isInteger() { return is(TypeKind.INTEGER); }

    @Override public String toString() { return toC(); }
}
