package com.cfort.compiler.ast.decl;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 整数常量：{@code #define NAME value}
 */
public class ConstantDecl extends AstNode {
    private final String name;
    private final long value;

    public ConstantDecl(SourceLocation location, String name, long value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public long getValue() {
        return value;
    }

    /** 超出 int 范围的常量按 64 位处理 */
    public boolean isWide() {
        return value > Integer.MAX_VALUE || value < Integer.MIN_VALUE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstantDecl(this, context);
    }
}
