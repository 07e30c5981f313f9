package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.Symbol;
import com.cfort.compiler.analysis.TranslationUnit;
import com.cfort.compiler.ast.decl.ConstantDecl;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 局部名字不能占用的 Fortran 名字（一律小写比较）
 */
public final class ReservedNames {

    /** 生成代码中会调用的内建函数与模块辅助函数 */
    public static final Set<String> INTRINSICS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "huge", "mod", "modulo", "merge", "int", "real", "achar",
            "bgt", "bge", "blt", "ble", "kind", "abs", "min", "max", "size",
            "ishft", "iand", "ior",
            "u64_str", "u64_div", "u64_mod"
    )));

    private ReservedNames() {
    }

    public static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * 整个程序层面保留的名字：函数名、结果变量名、常量名、内建函数，以及额外的名字（模块名、主程序名）
     */
    public static Set<String> forUnit(TranslationUnit unit, Collection<String> extra) {
        Set<String> reserved = new HashSet<String>(INTRINSICS);
        for (String name : extra) {
            reserved.add(key(name));
        }
        for (ConstantDecl c : unit.getConstants()) {
            reserved.add(key(c.getName()));
        }
        for (FunctionUnit fn : unit.getAllFunctions()) {
            reserved.add(key(fn.getName()));
            if (fn.hasResult()) {
                reserved.add(key(fn.getResultName()));
            }
        }
        return reserved;
    }

    /**
     * 程序中出现过的全部名字，重命名时跳过
     */
    public static Set<String> usedInUnit(TranslationUnit unit) {
        Set<String> used = new HashSet<String>();
        for (FunctionUnit fn : unit.getAllFunctions()) {
            for (Symbol s : fn.getScope().getSymbols()) {
                used.add(key(s.getName()));
            }
        }
        return used;
    }
}
