package com.cfort.compiler.pass;

import com.cfort.compiler.TranslationException;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 控制流规范化错误
 */
public class NormalizeException extends TranslationException {

    public enum Kind {
        /** 有返回值的函数存在不经 return 的结束路径 */
        MISSING_RETURN
    }

    public NormalizeException(Kind kind, String message, SourceLocation location) {
        super(Stage.NORMALIZE, kind.name(), message, location);
    }
}
