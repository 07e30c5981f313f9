package com.cfort.compiler.ast.stmt;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
