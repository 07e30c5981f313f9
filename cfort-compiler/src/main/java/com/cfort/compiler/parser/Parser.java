package com.cfort.compiler.parser;

import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.decl.ConstantDecl;
import com.cfort.compiler.ast.decl.FunctionDecl;
import com.cfort.compiler.ast.decl.Parameter;
import com.cfort.compiler.ast.decl.Program;
import com.cfort.compiler.ast.expr.Expression;
import com.cfort.compiler.ast.stmt.Block;
import com.cfort.compiler.lexer.Lexer;
import com.cfort.compiler.lexer.Token;
import com.cfort.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.cfort.compiler.lexer.TokenType.*;

/**
 * C 子集语法分析器（递归下降，一个 token 前瞻）
 */
public class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private static final Pattern INCLUDE_SYSTEM = Pattern.compile("include\\s*<([^>]+)>\\s*");
    private static final Pattern INCLUDE_LOCAL = Pattern.compile("include\\s*\"([^\"]*)\"\\s*");
    private static final Pattern DEFINE_INT = Pattern.compile(
            "define\\s+([A-Za-z_][A-Za-z0-9_]*)\\s+\\(?\\s*(-?\\s*[0-9]+)\\s*\\)?\\s*");

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲

    // #define 常量，按出现顺序
    final Map<String, Long> constants = new LinkedHashMap<String, Long>();
    // 词法可见的声明及其类型（用于折叠 sizeof 惯用法）
    private final Deque<Map<String, CType>> declarationScopes = new ArrayDeque<Map<String, CType>>();

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = lexer.nextToken();
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = lexer.nextToken();
        }
        return nextToken;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        return current.isOneOf(types);
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, describe(type));
    }

    /**
     * 当前 token 处的语法错误
     */
    ParseException error(String message, String expected) {
        return new ParseException(ParseException.Kind.SYNTAX_ERROR, message, current, expected, location());
    }

    /**
     * 当前 token 处的"超出子集"错误
     */
    ParseException unsupported(String message) {
        return unsupported(message, current);
    }

    ParseException unsupported(String message, Token at) {
        return new ParseException(ParseException.Kind.UNSUPPORTED_SYNTAX, message, at, null, locationOf(at));
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    private static String describe(TokenType type) {
        switch (type) {
            case LPAREN: return "'('";
            case RPAREN: return "')'";
            case LBRACE: return "'{'";
            case RBRACE: return "'}'";
            case LBRACKET: return "'['";
            case RBRACKET: return "']'";
            case SEMICOLON: return "';'";
            case COMMA: return "','";
            case DIV: return "'/'";
            case IDENTIFIER: return "identifier";
            case INT_LITERAL: return "integer literal";
            case STRING_LITERAL: return "string literal";
            default: return type.name();
        }
    }

    // ============ 声明作用域（sizeof 折叠） ============

    void pushScope() {
        declarationScopes.push(new HashMap<String, CType>());
    }

    void popScope() {
        declarationScopes.pop();
    }

    void declare(String name, CType type) {
        declarationScopes.peek().put(name, type);
    }

    /**
     * 查找词法可见的数组类型
     *
     * @return 数组类型；名字不可见或为标量时返回 null
     */
    CType visibleArray(String name) {
        for (Map<String, CType> scope : declarationScopes) {
            CType type = scope.get(name);
            if (type != null) {
                return type.isArray() ? type : null;
            }
        }
        return null;
    }

    // ============ 程序解析 ============

    /**
     * 解析程序
     */
    public Program parse() {
        SourceLocation loc = location();
        List<String> includes = new ArrayList<String>();
        List<ConstantDecl> constantDecls = new ArrayList<ConstantDecl>();
        List<FunctionDecl> functions = new ArrayList<FunctionDecl>();

        while (!isAtEnd()) {
            if (check(DIRECTIVE)) {
                parseDirective(includes, constantDecls);
            } else if (typeParser.isTypeStart()) {
                functions.add(parseFunction());
            } else if (check(KW_UNSUPPORTED)) {
                throw unsupported("Unsupported keyword '" + current.getLexeme() + "'");
            } else {
                throw error("Expected a function definition", "type");
            }
        }

        LOG.log(Level.FINE, "Parsed {0}: {1} function(s), {2} constant(s)",
                new Object[]{fileName, functions.size(), constantDecls.size()});
        return new Program(loc, fileName, includes, constantDecls, functions);
    }

    private void parseDirective(List<String> includes, List<ConstantDecl> constantDecls) {
        Token token = advance();
        String body = (String) token.getLiteral();
        Matcher m = INCLUDE_SYSTEM.matcher(body);
        if (m.matches()) {
            includes.add(m.group(1).trim());
            return;
        }
        if (INCLUDE_LOCAL.matcher(body).matches()) {
            throw unsupported("Local #include files are not supported", token);
        }
        m = DEFINE_INT.matcher(body);
        if (m.matches()) {
            String name = m.group(1);
            long value;
            try {
                value = Long.parseLong(m.group(2).replaceAll("\\s+", ""));
            } catch (NumberFormatException e) {
                throw unsupported("#define value out of range: " + m.group(2), token);
            }
            constants.put(name, value);
            constantDecls.add(new ConstantDecl(locationOf(token), name, value));
            return;
        }
        throw unsupported("Unsupported preprocessor directive '#" + body + "'", token);
    }

    private FunctionDecl parseFunction() {
        SourceLocation loc = location();
        CType returnType = typeParser.parseType();
        Token nameToken = expect(IDENTIFIER, "Expected function name");
        String name = nameToken.getLexeme();

        if (!check(LPAREN)) {
            if (returnType.isVoid()) {
                throw unsupported("Variables cannot have type void", nameToken);
            }
            throw unsupported("Global variables are not supported", nameToken);
        }
        advance();

        List<Parameter> params = parseParameters();
        expect(RPAREN, "Expected ')' after parameters");

        if (match(SEMICOLON)) {
            return new FunctionDecl(loc, name, params, returnType, null);
        }
        for (Parameter p : params) {
            if (p.getName() == null) {
                throw error("Parameter name required in a function definition", "identifier");
            }
        }

        pushScope();
        try {
            for (Parameter p : params) {
                declare(p.getName(), p.getType());
            }
            Block body = stmtParser.parseBlock();
            return new FunctionDecl(loc, name, params, returnType, body);
        } finally {
            popScope();
        }
    }

    private List<Parameter> parseParameters() {
        List<Parameter> params = new ArrayList<Parameter>();
        if (check(RPAREN)) {
            return params;
        }
        if (check(KW_VOID) && checkAhead(RPAREN)) {
            advance();
            return params;
        }
        do {
            SourceLocation loc = location();
            CType type = typeParser.parseType();
            if (type.isVoid()) {
                throw unsupported("Parameters cannot have type void", previous);
            }
            String name = null;
            if (check(IDENTIFIER)) {
                name = advance().getLexeme();
            }
            if (check(LBRACKET)) {
                throw unsupported("Array parameters are not supported");
            }
            params.add(new Parameter(loc, name, type));
        } while (match(COMMA));
        return params;
    }

    // ============ 解析委托 ============

    Expression parseExpression() { return exprParser.parseExpression(); }
}
