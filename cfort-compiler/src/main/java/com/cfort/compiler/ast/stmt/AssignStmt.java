package com.cfort.compiler.ast.stmt;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.Expression;

/**
 * 赋值语句 {@code target = value}，target 为变量或数组元素
 */
public class AssignStmt extends Statement {
    private final Expression target;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
