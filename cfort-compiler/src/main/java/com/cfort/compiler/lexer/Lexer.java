package com.cfort.compiler.lexer;

import com.cfort.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * C 子集词法分析器
 *
 * <p>既可以通过 {@link #nextToken()} 惰性读取，也可以用 {@link #scanTokens()} 一次扫描完毕；
 * {@link #reset()} 回到源码开头重新开始。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    // 当前行在此之前只出现过空白（用于识别预处理指令）
    private boolean lineHasOnlyWhitespace = true;

    private static final long INT_MAX = Integer.MAX_VALUE;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 类型
        map.put("int", TokenType.KW_INT);
        map.put("unsigned", TokenType.KW_UNSIGNED);
        map.put("long", TokenType.KW_LONG);
        map.put("void", TokenType.KW_VOID);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("return", TokenType.KW_RETURN);

        // 内置
        map.put("printf", TokenType.KW_PRINTF);
        map.put("scanf", TokenType.KW_SCANF);
        map.put("sizeof", TokenType.KW_SIZEOF);
        map.put("INT_MAX", TokenType.KW_INT_MAX);
        map.put("INT_MIN", TokenType.KW_INT_MIN);

        // 保留但不翻译的 C 关键词
        String[] unsupported = {
                "char", "short", "float", "double", "signed", "struct", "union", "enum",
                "typedef", "const", "static", "extern", "volatile", "register", "auto",
                "switch", "case", "default", "break", "continue", "do", "goto"
        };
        for (String word : unsupported) {
            map.put(word, TokenType.KW_UNSUPPORTED);
        }

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 回到源码开头，之后的 nextToken 重新产出同一序列
     */
    public void reset() {
        tokens.clear();
        start = 0;
        current = 0;
        line = 1;
        column = 1;
        lineHasOnlyWhitespace = true;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，源码结束后始终返回 EOF
     */
    public Token nextToken() {
        while (tokens.isEmpty()) {
            skipWhitespace();
            if (isAtEnd()) {
                return new Token(TokenType.EOF, "", null, line, column, current);
            }
            beginToken();
            scanToken();
        }
        return tokens.remove(0);
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> result = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            result.add(token);
        } while (token.getType() != TokenType.EOF);
        return result;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\f') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    private void beginToken() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private void scanToken() {
        boolean directiveAllowed = lineHasOnlyWhitespace;
        lineHasOnlyWhitespace = false;
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;

            case '#':
                if (!directiveAllowed) {
                    throw error("Preprocessor directive must start a line", "#");
                }
                directive();
                break;

            case '+':
                if (match('+')) addToken(TokenType.INC);
                else if (match('=')) addToken(TokenType.PLUS_ASSIGN);
                else addToken(TokenType.PLUS);
                break;

            case '-':
                if (match('-')) addToken(TokenType.DEC);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                    lineHasOnlyWhitespace = directiveAllowed;
                } else if (match('*')) {
                    blockComment();
                    lineHasOnlyWhitespace = directiveAllowed && line == startLine;
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                if (peek() == '<') throw error("Shift operators are not supported", "<<");
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                if (peek() == '>') throw error("Shift operators are not supported", ">>");
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                addToken(match('&') ? TokenType.AND : TokenType.AMPERSAND);
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    throw error("Bitwise operator '|' is not supported", "|");
                }
                break;

            case '"':
                string();
                break;

            case '\'':
                throw error("Character literals are not supported", "'");

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unrecognized character '" + c + "'", String.valueOf(c));
                }
                break;
        }
    }

    // === 基础方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
        lineHasOnlyWhitespace = true;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void directive() {
        while (peek() != '\n' && !isAtEnd()) {
            if (peek() == '/' && (peekNext() == '/' || peekNext() == '*')) {
                break;
            }
            advance();
        }
        String body = source.substring(start + 1, current).trim();
        addToken(TokenType.DIRECTIVE, body);
    }

    private void string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                throw error("Unterminated string literal", source.substring(start, current));
            }
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string literal", source.substring(start, current));
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) {
            throw error("Unterminated string literal", source.substring(start, current));
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case '\\': return '\\';
            case '"': return '"';
            default:
                throw error("Unsupported escape sequence '\\" + c + "'", "\\" + c);
        }
    }

    private void number() {
        if (source.charAt(start) == '0' && isAlphaNumeric(peek())) {
            char next = Character.toLowerCase(peek());
            if (next == 'x') {
                throw error("Hexadecimal literals are not supported", source.substring(start, current + 1));
            }
            if (isDigit(next)) {
                throw error("Octal literals are not supported", source.substring(start, current + 1));
            }
        }

        while (isDigit(peek())) advance();
        String digits = source.substring(start, current);

        if (peek() == '.') {
            throw error("Floating-point literals are not supported", digits + ".");
        }

        // 整数后缀：u / l / ul / ll / ull（大小写均可，顺序任意）
        int unsignedCount = 0;
        int longCount = 0;
        while (peek() == 'u' || peek() == 'U' || peek() == 'l' || peek() == 'L') {
            char s = advance();
            if (s == 'u' || s == 'U') unsignedCount++;
            else longCount++;
        }
        if (unsignedCount > 1 || longCount > 2 || isAlphaNumeric(peek())) {
            throw error("Invalid integer literal suffix", source.substring(start, current + (isAtEnd() ? 0 : 1)));
        }

        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + digits, digits);
        }
        boolean wide = (unsignedCount == 1 && longCount == 2) || value > INT_MAX;
        addToken(TokenType.INT_LITERAL, new Token.IntValue(value, wide));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') {
                newLine();
            }
        }
        throw error("Unterminated block comment", "/*");
    }

    private LexException error(String message, String offending) {
        SourceLocation location = new SourceLocation(fileName, startLine, startColumn, start,
                Math.max(1, current - start));
        return new LexException(message, offending, location);
    }
}
