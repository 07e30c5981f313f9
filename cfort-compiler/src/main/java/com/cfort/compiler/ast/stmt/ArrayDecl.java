package com.cfort.compiler.ast.stmt;

import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 定长一维数组声明
 */
public class ArrayDecl extends Statement {
    private final String name;
    private final CType type;
    private final List<Expression> initializers;  // null 表示无初始化列表

    public ArrayDecl(SourceLocation location, String name, CType type, List<Expression> initializers) {
        super(location);
        if (!type.isArray()) {
            throw new IllegalArgumentException("ArrayDecl requires an array type: " + type);
        }
        this.name = name;
        this.type = type;
        this.initializers = initializers != null ? Collections.unmodifiableList(initializers) : null;
    }

    public String getName() {
        return name;
    }

    /** 数组类型，含元素类型与长度 */
    public CType getType() {
        return type;
    }

    public CType getElementType() {
        return type.getElementType();
    }

    public int getSize() {
        return type.getSize();
    }

    /** 源码中写出的初始值（可能少于长度），无初始化列表时为 null */
    public List<Expression> getInitializers() {
        return initializers;
    }

    public boolean hasInitializer() {
        return initializers != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayDecl(this, context);
    }
}
