package com.cfort.compiler.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * 字面量值：整数为 {@link IntValue}，字符串为转义处理后的 String，其余为 null
     */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, line, column);
    }

    /**
     * 整数字面量的值与宽度
     */
    public static final class IntValue {
        private final long value;
        private final boolean wide;

        public IntValue(long value, boolean wide) {
            this.value = value;
            this.wide = wide;
        }

        public long getValue() {
            return value;
        }

        /** 带 ull 后缀或超出 int 范围 */
        public boolean isWide() {
            return wide;
        }

        @Override
        public String toString() {
            return wide ? value + "ull" : String.valueOf(value);
        }
    }
}
