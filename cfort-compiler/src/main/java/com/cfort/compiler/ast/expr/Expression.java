package com.cfort.compiler.ast.expr;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
