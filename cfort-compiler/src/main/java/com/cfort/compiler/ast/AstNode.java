package com.cfort.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点创建后不可变；后续阶段通过 {@link AstTransformer} 按需复制变化的路径。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
