package com.cfort.compiler.pass;

import com.cfort.compiler.TranslationException;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 声明提升错误
 */
public class HoistException extends TranslationException {

    public enum Kind {
        /** 互不相交的块中同名声明的类型不同 */
        DUPLICATE_INCOMPATIBLE_TYPE,
        /** 引用处词法上看不到对应声明 */
        REFERENCE_OUT_OF_SCOPE
    }

    private final Kind hoistKind;

    public HoistException(Kind kind, String message, SourceLocation location) {
        super(Stage.HOIST, kind.name(), message, location);
        this.hoistKind = kind;
    }

    public Kind getHoistKind() {
        return hoistKind;
    }
}
