package com.cfort.compiler;

import com.cfort.compiler.ast.SourceLocation;

/**
 * 翻译失败的基类。
 *
 * <p>每个阶段抛出自己的子类；第一个错误即终止整个翻译，不做恢复。</p>
 */
public abstract class TranslationException extends RuntimeException {

    /**
     * 产生错误的流水线阶段
     */
    public enum Stage {
        LEX("lex"),
        PARSE("parse"),
        BIND("bind"),
        NORMALIZE("normalize"),
        HOIST("hoist"),
        GENERATE("generate");

        private final String displayName;

        Stage(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final Stage stage;
    private final String kind;
    private final SourceLocation location;

    protected TranslationException(Stage stage, String kind, String message, SourceLocation location) {
        super(message);
        this.stage = stage;
        this.kind = kind;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Stage getStage() {
        return stage;
    }

    /** 阶段内的错误分类名，如 UNRESOLVED_IDENTIFIER */
    public String getKind() {
        return kind;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 不带位置前缀的原始消息 */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return location + ": " + stage.getDisplayName() + " error: " + super.getMessage();
    }
}
