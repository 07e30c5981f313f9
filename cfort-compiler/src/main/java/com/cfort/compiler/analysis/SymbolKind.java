package com.cfort.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    PARAMETER,      // 函数参数
    LOCAL,          // 局部变量或数组
    CONSTANT,       // #define 常量
    FUNCTION        // 函数定义或原型
}
