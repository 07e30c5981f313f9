package com.cfort.compiler.lexer;

import com.cfort.compiler.TranslationException;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 词法错误：不支持的字符或字面量
 */
public class LexException extends TranslationException {
    private final String offending;

    public LexException(String message, String offending, SourceLocation location) {
        super(Stage.LEX, "UNRECOGNIZED_INPUT", message, location);
        this.offending = offending;
    }

    /** 触发错误的原始文本 */
    public String getOffending() {
        return offending;
    }
}
