package com.cfort.compiler.ast.stmt;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.Expression;

/**
 * C 风格 for 循环。init、condition、update 均可省略。
 */
public class ForStmt extends Statement {
    private final Statement init;        // VarDecl 或 AssignStmt
    private final Expression condition;
    private final Statement update;      // AssignStmt 或 CompoundAssignStmt
    private final Block body;

    public ForStmt(SourceLocation location, Statement init, Expression condition,
                   Statement update, Block body) {
        super(location);
        this.init = init;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public Statement getInit() {
        return init;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getUpdate() {
        return update;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
