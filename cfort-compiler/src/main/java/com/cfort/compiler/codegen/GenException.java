package com.cfort.compiler.codegen;

import com.cfort.compiler.TranslationException;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 代码生成错误：前面的阶段没有消除、Fortran 又无法等价表达的构造
 */
public class GenException extends TranslationException {

    public enum Kind {
        UNSUPPORTED_CONSTRUCT
    }

    public GenException(String message, SourceLocation location) {
        super(Stage.GENERATE, Kind.UNSUPPORTED_CONSTRUCT.name(), message, location);
    }
}
