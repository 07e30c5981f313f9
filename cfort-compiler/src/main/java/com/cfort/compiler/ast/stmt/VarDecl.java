package com.cfort.compiler.ast.stmt;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.Expression;

/**
 * 标量变量声明
 */
public class VarDecl extends Statement {
    private final String name;
    private final CType type;
    private final Expression initializer;  // 可选

    public VarDecl(SourceLocation location, String name, CType type, Expression initializer) {
        super(location);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public CType getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
