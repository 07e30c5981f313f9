package com.cfort.compiler.ast.expr;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;
    private final boolean wide;

    public Literal(SourceLocation location, Object value, LiteralKind kind, boolean wide) {
        super(location);
        this.value = value;
        this.kind = kind;
        this.wide = wide;
    }

    public static Literal ofInt(SourceLocation location, long value) {
        return new Literal(location, value, LiteralKind.INT,
                value > Integer.MAX_VALUE || value < Integer.MIN_VALUE);
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, value, LiteralKind.STRING, false);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    /** INT 字面量的数值 */
    public long getIntValue() {
        if (kind != LiteralKind.INT) {
            throw new IllegalStateException("Not an integer literal: " + kind);
        }
        return (Long) value;
    }

    /** STRING 字面量的内容（已处理转义） */
    public String getStringValue() {
        if (kind != LiteralKind.STRING) {
            throw new IllegalStateException("Not a string literal: " + kind);
        }
        return (String) value;
    }

    /** 64 位整数字面量（ull 后缀或超出 int 范围） */
    public boolean isWide() {
        return wide;
    }

    public boolean isInteger() {
        return kind == LiteralKind.INT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        STRING,
        /** INT_MAX 哨兵，生成为 huge(0) */
        INT_MAX,
        /** INT_MIN 哨兵，生成为 (-huge(0) - 1) */
        INT_MIN
    }
}
