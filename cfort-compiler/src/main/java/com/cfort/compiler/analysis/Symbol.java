package com.cfort.compiler.analysis;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final CType type;             // 函数为返回类型
    private final String scopeName;       // 所属函数名，全局符号为 null
    private final int blockId;            // 声明所在的 C 块，参数与函数体顶层块同为 0
    private final SourceLocation location;
    private final AstNode declaration;

    public Symbol(String name, SymbolKind kind, CType type, String scopeName, int blockId,
                  SourceLocation location, AstNode declaration) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.scopeName = scopeName;
        this.blockId = blockId;
        this.location = location;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public CType getType() { return type; }
    public String getScopeName() { return scopeName; }
    public int getBlockId() { return blockId; }
    public SourceLocation getLocation() { return location; }
    public AstNode getDeclaration() { return declaration; }

    public boolean isArray() {
        return type.isArray();
    }

    /** 数组长度，非数组为 0 */
    public int getArraySize() {
        return type.getSize();
    }

    @Override
    public String toString() {
        return kind + " " + type + " " + name + (scopeName != null ? " in " + scopeName + "#" + blockId : "");
    }
}
