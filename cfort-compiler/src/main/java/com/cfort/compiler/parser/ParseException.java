package com.cfort.compiler.parser;

import com.cfort.compiler.TranslationException;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.lexer.Token;
import com.cfort.compiler.lexer.TokenType;

/**
 * 解析异常
 */
public class ParseException extends TranslationException {

    public enum Kind {
        /** 语法错误：缺少或多出 token */
        SYNTAX_ERROR,
        /** 语法正确但超出支持的 C 子集 */
        UNSUPPORTED_SYNTAX
    }

    private final Token token;
    private final String expected;

    public ParseException(Kind kind, String message, Token token, String expected, SourceLocation location) {
        super(Stage.PARSE, kind.name(), format(message, token, expected), location);
        this.token = token;
        this.expected = expected;
    }

    private static String format(String message, Token token, String expected) {
        StringBuilder sb = new StringBuilder(message);
        if (token != null) {
            sb.append(" (found ");
            sb.append(token.getType() == TokenType.EOF
                    ? "end of file" : "'" + token.getLexeme() + "'");
            sb.append(')');
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }

    /** 实际遇到的 token */
    public Token getToken() {
        return token;
    }

    /** 期望的内容描述，可能为 null */
    public String getExpected() {
        return expected;
    }
}
