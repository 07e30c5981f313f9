package com.cfort.compiler.ast.expr;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用。printf/scanf 也以此表示，格式串保留为第一个实参。
 */
public class CallExpr extends Expression {
    public static final String PRINTF = "printf";
    public static final String SCANF = "scanf";

    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public boolean isPrintf() {
        return PRINTF.equals(callee);
    }

    public boolean isScanf() {
        return SCANF.equals(callee);
    }

    /** printf/scanf 之外的用户函数调用 */
    public boolean isUserCall() {
        return !isPrintf() && !isScanf();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
