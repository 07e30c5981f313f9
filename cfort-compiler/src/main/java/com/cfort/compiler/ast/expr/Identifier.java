package com.cfort.compiler.ast.expr;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 标识符引用
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
