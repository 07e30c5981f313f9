package com.cfort.compiler.ast.stmt;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.cfort.compiler.ast.expr.Expression;

/**
 * 复合赋值 {@code target op= value}；{@code i++} 等自增形式也表示为此节点
 */
public class CompoundAssignStmt extends Statement {
    private final Expression target;
    private final BinaryOp operator;
    private final Expression value;

    public CompoundAssignStmt(SourceLocation location, Expression target, BinaryOp operator, Expression value) {
        super(location);
        if (!operator.isArithmetic()) {
            throw new IllegalArgumentException("Compound assignment requires an arithmetic operator: " + operator);
        }
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompoundAssignStmt(this, context);
    }
}
