package com.cfort.compiler.ast.stmt;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.Expression;

/**
 * If 语句。{@code else if} 表示为只含一个 IfStmt 的 else 块。
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBlock;
    private final Block elseBlock;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBlock, Block elseBlock) {
        super(location);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    /** else 块是否正好是一个 else-if */
    public boolean isElseIf() {
        return elseBlock != null && elseBlock.getStatements().size() == 1
                && elseBlock.getStatements().get(0) instanceof IfStmt;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
