package com.cfort.compiler.ast;

import java.util.Objects;

/**
 * 翻译器支持的 C 类型：Int32、UInt64、定长数组，以及仅用于返回值的 void
 */
public final class CType {

    public enum Kind {
        INT32,
        UINT64,
        ARRAY,
        VOID
    }

    public static final CType INT32 = new CType(Kind.INT32, null, 0);
    public static final CType UINT64 = new CType(Kind.UINT64, null, 0);
    public static final CType VOID = new CType(Kind.VOID, null, 0);

    private final Kind kind;
    private final CType elementType;
    private final int size;

    private CType(Kind kind, CType elementType, int size) {
        this.kind = kind;
        this.elementType = elementType;
        this.size = size;
    }

    public static CType arrayOf(CType elementType, int size) {
        if (elementType.kind == Kind.ARRAY || elementType.kind == Kind.VOID) {
            throw new IllegalArgumentException("Invalid array element type: " + elementType);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Array size must be positive: " + size);
        }
        return new CType(Kind.ARRAY, elementType, size);
    }

    public Kind getKind() {
        return kind;
    }

    /** 数组元素类型，非数组为 null */
    public CType getElementType() {
        return elementType;
    }

    /** 数组长度，非数组为 0 */
    public int getSize() {
        return size;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    public boolean isScalar() {
        return kind == Kind.INT32 || kind == Kind.UINT64;
    }

    public boolean isWide() {
        return kind == Kind.UINT64;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CType)) return false;
        CType other = (CType) o;
        return kind == other.kind && size == other.size
                && Objects.equals(elementType, other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, elementType, size);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INT32: return "int";
            case UINT64: return "unsigned long long";
            case VOID: return "void";
            default: return elementType + "[" + size + "]";
        }
    }
}
