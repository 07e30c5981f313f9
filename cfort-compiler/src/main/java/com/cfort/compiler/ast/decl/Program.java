package com.cfort.compiler.ast.decl;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 程序（AST 根节点）
 */
public class Program extends AstNode {
    private final String fileName;
    private final List<String> includes;
    private final List<ConstantDecl> constants;
    private final List<FunctionDecl> functions;

    public Program(SourceLocation location, String fileName, List<String> includes,
                   List<ConstantDecl> constants, List<FunctionDecl> functions) {
        super(location);
        this.fileName = fileName;
        this.includes = Collections.unmodifiableList(includes);
        this.constants = Collections.unmodifiableList(constants);
        this.functions = Collections.unmodifiableList(functions);
    }

    public String getFileName() {
        return fileName;
    }

    /** {@code #include <...>} 的头文件名，按出现顺序 */
    public List<String> getIncludes() {
        return includes;
    }

    public List<ConstantDecl> getConstants() {
        return constants;
    }

    /** 函数定义与原型，按源码顺序 */
    public List<FunctionDecl> getFunctions() {
        return functions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
