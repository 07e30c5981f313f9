package com.cfort.compiler.ast.expr;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 数组元素访问 {@code a[i]}
 */
public class IndexExpr extends Expression {
    private final Identifier array;
    private final Expression index;

    public IndexExpr(SourceLocation location, Identifier array, Expression index) {
        super(location);
        this.array = array;
        this.index = index;
    }

    public Identifier getArray() {
        return array;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
