package ast.type;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import exception.DecompileException;

/**
 * Fixed-width integer type. Instances are interned, so identity comparison
 * is equivalent to equals.
 */
public final class IntegerType extends Type {
    private final int bitWidth;
    private final boolean signed;

    private static final Map<Integer, IntegerType> pool
        = new ConcurrentHashMap<>();

    public static final IntegerType i8 = IntegerType.get(8, true);
    public static final IntegerType i32 = IntegerType.get(32, true);
    public static final IntegerType u32 = IntegerType.get(32, false);
    public static final IntegerType i64 = IntegerType.get(64, true);

    private IntegerType(int bitWidth, boolean signed) {
        super(TypeKind.INTEGER);
        this.bitWidth = bitWidth;
        this.signed = signed;
    }

    public static IntegerType get(int bitWidth, boolean signed) {
        switch (bitWidth) {
            case 1, 8, 16, 32, 64 -> { }
            default -> throw DecompileException.unSupported("Integer with bitWidth " + bitWidth);
        }
        return pool.computeIfAbsent(signed ? bitWidth : -bitWidth,
                key -> new IntegerType(bitWidth, signed));
    }

    public static IntegerType getInt() {
        return i32;
    }

    public static IntegerType getUnsigned() {
        return u32;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public boolean isSigned() {
        return signed;
    }

    /**
     * Usual arithmetic conversion of two operand types: the wider type wins,
     * and on equal width an unsigned operand makes the result unsigned.
     * Anything narrower than int is promoted to int first.
     */
    public static IntegerType common(IntegerType a, IntegerType b) {
        IntegerType pa = a.bitWidth < 32 ? i32 : a;
        IntegerType pb = b.bitWidth < 32 ? i32 : b;
        if (pa.bitWidth != pb.bitWidth) {
            return pa.bitWidth > pb.bitWidth ? pa : pb;
        }
        return pa.signed ? pb : pa;
    }

    @Override
    public String toC() {
        return switch (bitWidth) {
            case 1 -> "_Bool";
            case 8 -> signed ? "char" : "unsigned char";
            case 16 -> signed ? "short" : "unsigned short";
            case 32 -> signed ? "int" : "unsigned int";
            default -> signed ? "long long" : "unsigned long long";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerType other)) return false;
        return bitWidth == other.bitWidth && signed == other.signed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bitWidth, signed);
    }
}
