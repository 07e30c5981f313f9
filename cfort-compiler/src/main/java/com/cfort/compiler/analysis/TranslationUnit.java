package com.cfort.compiler.analysis;

import com.cfort.compiler.ast.decl.ConstantDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 绑定、规范化、提升各阶段之间传递的翻译单元
 */
public final class TranslationUnit {
    private final String fileName;
    private final List<String> includes;
    private final List<ConstantDecl> constants;
    private final List<FunctionUnit> functions;   // main 以外的函数定义，按源码顺序
    private final FunctionUnit main;

    public TranslationUnit(String fileName, List<String> includes, List<ConstantDecl> constants,
                           List<FunctionUnit> functions, FunctionUnit main) {
        this.fileName = fileName;
        this.includes = Collections.unmodifiableList(includes);
        this.constants = Collections.unmodifiableList(constants);
        this.functions = Collections.unmodifiableList(functions);
        this.main = main;
    }

    public String getFileName() { return fileName; }
    public List<String> getIncludes() { return includes; }
    public List<ConstantDecl> getConstants() { return constants; }
    public List<FunctionUnit> getFunctions() { return functions; }
    public FunctionUnit getMain() { return main; }

    /** 全部函数，main 在最后 */
    public List<FunctionUnit> getAllFunctions() {
        List<FunctionUnit> all = new ArrayList<FunctionUnit>(functions);
        all.add(main);
        return all;
    }

    /** 按名字查找函数（含 main） */
    public FunctionUnit getFunction(String name) {
        for (FunctionUnit fn : getAllFunctions()) {
            if (fn.getName().equals(name)) {
                return fn;
            }
        }
        return null;
    }

    /**
     * 替换全部函数，参数顺序与 {@link #getAllFunctions()} 一致（main 在最后）
     */
    public TranslationUnit withFunctions(List<FunctionUnit> all) {
        if (all.size() != functions.size() + 1) {
            throw new IllegalArgumentException("Expected " + (functions.size() + 1) + " functions, got " + all.size());
        }
        boolean changed = false;
        List<FunctionUnit> current = getAllFunctions();
        for (int i = 0; i < all.size(); i++) {
            changed |= all.get(i) != current.get(i);
        }
        if (!changed) return this;
        return new TranslationUnit(fileName, includes, constants,
                new ArrayList<FunctionUnit>(all.subList(0, all.size() - 1)), all.get(all.size() - 1));
    }
}
