package com.cfort.compiler.analysis;

import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;

/**
 * 提升后的声明：Fortran 声明区中的一个名字
 */
public final class LocalDecl {

    public enum Kind {
        PARAMETER,
        LOCAL
    }

    private final String name;
    private final String sourceName;
    private final CType type;
    private final Kind kind;
    private final SourceLocation location;

    public LocalDecl(String name, String sourceName, CType type, Kind kind, SourceLocation location) {
        this.name = name;
        this.sourceName = sourceName;
        this.type = type;
        this.kind = kind;
        this.location = location;
    }

    /** 提升后（可能已重命名）的名字 */
    public String getName() { return name; }

    /** C 源码中的名字 */
    public String getSourceName() { return sourceName; }

    public CType getType() { return type; }
    public Kind getKind() { return kind; }
    public SourceLocation getLocation() { return location; }

    public boolean isParameter() {
        return kind == Kind.PARAMETER;
    }

    public boolean isRenamed() {
        return !name.equals(sourceName);
    }

    @Override
    public String toString() {
        return type + " " + name + (isRenamed() ? " (was " + sourceName + ")" : "");
    }
}
