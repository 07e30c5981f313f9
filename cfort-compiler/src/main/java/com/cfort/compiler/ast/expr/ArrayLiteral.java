package com.cfort.compiler.ast.expr;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 数组构造值，长度等于目标数组长度（由数组初始化列表补零得到）
 */
public class ArrayLiteral extends Expression {
    private final List<Expression> values;

    public ArrayLiteral(SourceLocation location, List<Expression> values) {
        super(location);
        this.values = Collections.unmodifiableList(values);
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }
}
