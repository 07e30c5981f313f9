package com.cfort.compiler.codegen;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 为生成器引入的变量（iostat、临时变量）分配不冲突的名字，比较不区分大小写
 */
public class NameAllocator {
    private final Set<String> taken = new HashSet<String>();

    public NameAllocator(Collection<String> takenNames) {
        for (String name : takenNames) {
            taken.add(name.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * 分配名字：base 可用时返回 base，否则依次尝试 base_2、base_3 ...
     */
    public String allocate(String base) {
        String candidate = base;
        int suffix = 2;
        while (taken.contains(candidate.toLowerCase(Locale.ROOT))) {
            candidate = base + "_" + suffix++;
        }
        taken.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }

    public boolean isTaken(String name) {
        return taken.contains(name.toLowerCase(Locale.ROOT));
    }
}
