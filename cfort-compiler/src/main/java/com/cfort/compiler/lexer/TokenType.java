package com.cfort.compiler.lexer;

/**
 * C 子集词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL(Category.INT_LITERAL),
    STRING_LITERAL(Category.STRING_LITERAL),

    // === 标识符 ===
    IDENTIFIER(Category.IDENTIFIER),

    // === 关键词 - 类型 ===
    KW_INT(Category.KEYWORD),
    KW_UNSIGNED(Category.KEYWORD),
    KW_LONG(Category.KEYWORD),
    KW_VOID(Category.KEYWORD),

    // === 关键词 - 控制流 ===
    KW_IF(Category.KEYWORD),
    KW_ELSE(Category.KEYWORD),
    KW_FOR(Category.KEYWORD),
    KW_WHILE(Category.KEYWORD),
    KW_RETURN(Category.KEYWORD),

    // === 关键词 - 内置 ===
    KW_PRINTF(Category.KEYWORD),
    KW_SCANF(Category.KEYWORD),
    KW_SIZEOF(Category.KEYWORD),
    KW_INT_MAX(Category.KEYWORD),
    KW_INT_MIN(Category.KEYWORD),

    // 保留但不支持的 C 关键词，由 Parser 给出拒绝诊断
    KW_UNSUPPORTED(Category.KEYWORD),

    // === 操作符 - 算术 ===
    PLUS(Category.OPERATOR),        // +
    MINUS(Category.OPERATOR),       // -
    MUL(Category.OPERATOR),         // *
    DIV(Category.OPERATOR),         // /
    MOD(Category.OPERATOR),         // %
    INC(Category.OPERATOR),         // ++
    DEC(Category.OPERATOR),         // --

    // === 操作符 - 比较 ===
    EQ(Category.OPERATOR),          // ==
    NE(Category.OPERATOR),          // !=
    LT(Category.OPERATOR),          // <
    GT(Category.OPERATOR),          // >
    LE(Category.OPERATOR),          // <=
    GE(Category.OPERATOR),          // >=

    // === 操作符 - 逻辑 ===
    AND(Category.OPERATOR),         // &&
    OR(Category.OPERATOR),          // ||
    NOT(Category.OPERATOR),         // !
    AMPERSAND(Category.OPERATOR),   // &（仅用于 scanf 取址）

    // === 操作符 - 赋值 ===
    ASSIGN(Category.OPERATOR),          // =
    PLUS_ASSIGN(Category.OPERATOR),     // +=
    MINUS_ASSIGN(Category.OPERATOR),    // -=
    MUL_ASSIGN(Category.OPERATOR),      // *=
    DIV_ASSIGN(Category.OPERATOR),      // /=
    MOD_ASSIGN(Category.OPERATOR),      // %=

    // === 标点 ===
    LPAREN(Category.PUNCTUATION),
    RPAREN(Category.PUNCTUATION),
    LBRACE(Category.PUNCTUATION),
    RBRACE(Category.PUNCTUATION),
    LBRACKET(Category.PUNCTUATION),
    RBRACKET(Category.PUNCTUATION),
    COMMA(Category.PUNCTUATION),
    SEMICOLON(Category.PUNCTUATION),

    // === 预处理指令（整行） ===
    DIRECTIVE(Category.DIRECTIVE),

    EOF(Category.EOF);

    /**
     * 词法单元大类
     */
    public enum Category {
        IDENTIFIER, INT_LITERAL, STRING_LITERAL, KEYWORD, OPERATOR, PUNCTUATION, DIRECTIVE, EOF
    }

    private final Category category;

    TokenType(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }
}
