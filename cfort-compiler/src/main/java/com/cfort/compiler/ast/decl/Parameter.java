package com.cfort.compiler.ast.decl;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final CType type;

    public Parameter(SourceLocation location, String name, CType type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public CType getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
