package com.cfort.compiler.analysis;

import com.cfort.compiler.TranslationException;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 符号绑定错误
 */
public class BindException extends TranslationException {

    public enum Kind {
        DUPLICATE_DECLARATION,
        UNRESOLVED_IDENTIFIER,
        TYPE_MISMATCH
    }

    private final Kind bindKind;

    public BindException(Kind kind, String message, SourceLocation location) {
        super(Stage.BIND, kind.name(), message, location);
        this.bindKind = kind;
    }

    public Kind getBindKind() {
        return bindKind;
    }
}
