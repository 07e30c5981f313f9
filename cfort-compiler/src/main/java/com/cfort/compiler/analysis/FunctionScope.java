package com.cfort.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个函数的扁平作用域：函数内所有声明不分块地登记在一起，保留声明顺序与块编号
 */
public final class FunctionScope {
    private final String functionName;
    private final List<Symbol> symbols = new ArrayList<Symbol>();
    private final Map<String, List<Symbol>> byName = new LinkedHashMap<String, List<Symbol>>();

    public FunctionScope(String functionName) {
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }

    /** 注册符号 */
    public void define(Symbol symbol) {
        symbols.add(symbol);
        List<Symbol> same = byName.get(symbol.getName());
        if (same == null) {
            same = new ArrayList<Symbol>(1);
            byName.put(symbol.getName(), same);
        }
        same.add(symbol);
    }

    /** 扁平查找：返回该名字第一次声明的符号 */
    public Symbol lookup(String name) {
        List<Symbol> same = byName.get(name);
        return same == null ? null : same.get(0);
    }

    /** 同名的全部声明，按声明顺序 */
    public List<Symbol> lookupAll(String name) {
        List<Symbol> same = byName.get(name);
        return same == null ? Collections.<Symbol>emptyList() : Collections.unmodifiableList(same);
    }

    /** 全部符号，按声明顺序 */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }
}
