package com.cfort.compiler.analysis;

import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.decl.FunctionDecl;
import com.cfort.compiler.ast.stmt.Block;

import java.util.Collections;
import java.util.List;

/**
 * 翻译单元中的一个函数：原始声明、绑定得到的符号、当前函数体及各阶段的产物。
 * 不可变，各阶段通过 with* 方法得到新实例。
 */
public final class FunctionUnit {
    private final FunctionDecl declaration;
    private final FunctionScope scope;
    private final Block body;
    private final String resultName;          // void 函数与 main 为 null
    private final List<LocalDecl> declarations;  // 提升之前为 null
    private final boolean normalized;

    public FunctionUnit(FunctionDecl declaration, FunctionScope scope, String resultName) {
        this(declaration, scope, declaration.getBody(), resultName, null, false);
    }

    private FunctionUnit(FunctionDecl declaration, FunctionScope scope, Block body, String resultName,
                         List<LocalDecl> declarations, boolean normalized) {
        this.declaration = declaration;
        this.scope = scope;
        this.body = body;
        this.resultName = resultName;
        this.declarations = declarations != null ? Collections.unmodifiableList(declarations) : null;
        this.normalized = normalized;
    }

    public FunctionDecl getDeclaration() { return declaration; }
    public FunctionScope getScope() { return scope; }
    public Block getBody() { return body; }
    public String getResultName() { return resultName; }
    public boolean isNormalized() { return normalized; }

    public String getName() {
        return declaration.getName();
    }

    public CType getReturnType() {
        return declaration.getReturnType();
    }

    public boolean isMain() {
        return declaration.isMain();
    }

    /** void 函数，生成为 subroutine */
    public boolean isSubroutine() {
        return declaration.getReturnType().isVoid();
    }

    public boolean hasResult() {
        return resultName != null;
    }

    /** 提升后的声明列表（参数在前，按参数顺序；局部变量按首次声明顺序） */
    public List<LocalDecl> getDeclarations() {
        return declarations;
    }

    public boolean isHoisted() {
        return declarations != null;
    }

    /** 控制流规范化之后的副本 */
    public FunctionUnit withNormalizedBody(Block newBody) {
        return new FunctionUnit(declaration, scope, newBody, resultName, declarations, true);
    }

    /** 声明提升之后的副本 */
    public FunctionUnit withHoisted(Block newBody, List<LocalDecl> newDeclarations) {
        return new FunctionUnit(declaration, scope, newBody, resultName, newDeclarations, normalized);
    }
}
