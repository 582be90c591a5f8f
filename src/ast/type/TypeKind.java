package ast.type;

public enum TypeKind {
    VOID,
    INTEGER,
}
