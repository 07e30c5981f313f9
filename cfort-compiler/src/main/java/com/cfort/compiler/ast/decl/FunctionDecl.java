package com.cfort.compiler.ast.decl;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.stmt.Block;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明。body 为 null 时表示原型。
 */
public class FunctionDecl extends AstNode {
    private final String name;
    private final List<Parameter> params;
    private final CType returnType;
    private final Block body;

    public FunctionDecl(SourceLocation location, String name, List<Parameter> params,
                        CType returnType, Block body) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.returnType = returnType;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public CType getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public boolean isPrototype() {
        return body == null;
    }

    public boolean isMain() {
        return "main".equals(name);
    }

    /** 同签名、新函数体的副本 */
    public FunctionDecl withBody(Block newBody) {
        if (newBody == body) return this;
        return new FunctionDecl(location, name, params, returnType, newBody);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
