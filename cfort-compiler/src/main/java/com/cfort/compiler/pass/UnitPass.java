package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.TranslationUnit;

/**
 * 作用于整个翻译单元的变换 pass 接口。
 */
public interface UnitPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对翻译单元执行变换，返回新的翻译单元；没有变化时返回原实例。
     */
    TranslationUnit run(TranslationUnit unit);
}
