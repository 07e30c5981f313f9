package com.cfort.compiler.parser;

import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.cfort.compiler.ast.expr.CallExpr;
import com.cfort.compiler.ast.expr.Expression;
import com.cfort.compiler.ast.expr.Identifier;
import com.cfort.compiler.ast.expr.IndexExpr;
import com.cfort.compiler.ast.expr.Literal;
import com.cfort.compiler.ast.stmt.*;
import com.cfort.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.cfort.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一个语句并追加到 out。声明的多个声明符展开为多个语句，空语句不产生节点。
     */
    void parseStatementInto(List<Statement> out) {
        if (parser.check(LBRACE)) {
            out.add(parseBlock());
            return;
        }
        if (parser.check(KW_IF)) {
            out.add(parseIfStmt());
            return;
        }
        if (parser.check(KW_FOR)) {
            out.add(parseForStmt());
            return;
        }
        if (parser.check(KW_WHILE)) {
            out.add(parseWhileStmt());
            return;
        }
        if (parser.check(KW_RETURN)) {
            out.add(parseReturnStmt());
            return;
        }
        if (parser.match(SEMICOLON)) {
            return;
        }
        if (parser.typeParser.isTypeStart()) {
            out.addAll(parseDeclaration());
            parser.expect(SEMICOLON, "Expected ';' after declaration");
            return;
        }
        if (parser.check(KW_UNSUPPORTED)) {
            throw parser.unsupported("Unsupported keyword '" + parser.current.getLexeme() + "'");
        }
        if (parser.check(DIRECTIVE)) {
            throw parser.unsupported("Preprocessor directives are only supported at file scope");
        }
        if (parser.check(KW_ELSE)) {
            throw parser.error("'else' without a matching 'if'", "statement");
        }
        out.add(parseSimpleStatement());
        parser.expect(SEMICOLON, "Expected ';' after statement");
    }

    /**
     * 解析花括号代码块
     */
    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        parser.pushScope();
        try {
            while (!parser.check(RBRACE) && !parser.isAtEnd()) {
                parseStatementInto(statements);
            }
        } finally {
            parser.popScope();
        }
        parser.expect(RBRACE, "Expected '}'");
        return new Block(loc, statements);
    }

    /**
     * 解析控制语句的主体：花括号块直接返回，单条语句包装为块
     */
    private Block parseBody() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        SourceLocation loc = parser.location();
        if (parser.typeParser.isTypeStart()) {
            throw parser.error("A declaration is not allowed as a statement body", "statement");
        }
        List<Statement> statements = new ArrayList<Statement>(1);
        parser.pushScope();
        try {
            parseStatementInto(statements);
        } finally {
            parser.popScope();
        }
        return new Block(loc, statements);
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '(' after 'if'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");
        Block thenBlock = parseBody();

        Block elseBlock = null;
        if (parser.check(KW_ELSE)) {
            SourceLocation elseLoc = parser.location();
            parser.advance();
            if (parser.check(KW_IF)) {
                Statement elseIf = parseIfStmt();
                elseBlock = new Block(elseLoc, Collections.singletonList(elseIf));
            } else {
                elseBlock = parseBody();
            }
        }
        return new IfStmt(loc, condition, thenBlock, elseBlock);
    }

    private ForStmt parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '(' after 'for'");

        // for-init 声明的作用域覆盖整个循环
        parser.pushScope();
        try {
            Statement init = null;
            if (parser.typeParser.isTypeStart()) {
                List<Statement> decls = parseDeclaration();
                if (decls.size() != 1) {
                    throw parser.unsupported("Only one declaration is supported in a for initializer");
                }
                init = decls.get(0);
            } else if (!parser.check(SEMICOLON)) {
                init = parseSimpleStatement();
                if (init instanceof ExpressionStmt) {
                    throw parser.unsupported("A for initializer must be a declaration or an assignment");
                }
            }
            if (parser.check(COMMA)) {
                throw parser.unsupported("Comma expressions are not supported");
            }
            parser.expect(SEMICOLON, "Expected ';' after for initializer");

            Expression condition = null;
            if (!parser.check(SEMICOLON)) {
                condition = parser.parseExpression();
            }
            parser.expect(SEMICOLON, "Expected ';' after for condition");

            Statement update = null;
            if (!parser.check(RPAREN)) {
                update = parseSimpleStatement();
                if (update instanceof ExpressionStmt) {
                    throw parser.unsupported("A for update must be an assignment or increment");
                }
            }
            if (parser.check(COMMA)) {
                throw parser.unsupported("Comma expressions are not supported");
            }
            parser.expect(RPAREN, "Expected ')' after for clauses");

            Block body = parseBody();
            return new ForStmt(loc, init, condition, update, body);
        } finally {
            parser.popScope();
        }
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");
        Block body = parseBody();
        return new WhileStmt(loc, condition, body);
    }

    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(loc, value);
    }

    // ============ 声明 ============

    /**
     * 解析 {@code type d1 [= e], d2[N] [= {...}], ...}（不含结尾分号）
     */
    private List<Statement> parseDeclaration() {
        CType type = parser.typeParser.parseType();
        if (type.isVoid()) {
            throw parser.unsupported("Variables cannot have type void", parser.previous);
        }
        List<Statement> decls = new ArrayList<Statement>();
        do {
            decls.add(parseDeclarator(type));
        } while (parser.match(COMMA));
        return decls;
    }

    private Statement parseDeclarator(CType type) {
        if (parser.check(MUL)) {
            throw parser.unsupported("Pointers are not supported");
        }
        SourceLocation loc = parser.location();
        Token nameToken = parser.expect(IDENTIFIER, "Expected variable name");
        String name = nameToken.getLexeme();
        if (parser.constants.containsKey(name)) {
            throw parser.unsupported("'" + name + "' is a #define constant and cannot be redeclared", nameToken);
        }

        if (parser.match(LBRACKET)) {
            return parseArrayDeclarator(loc, name, type);
        }

        Expression init = null;
        if (parser.match(ASSIGN)) {
            if (parser.check(LBRACE)) {
                throw parser.unsupported("Brace initializers are only supported for arrays");
            }
            init = parser.parseExpression();
        }
        parser.declare(name, type);
        return new VarDecl(loc, name, type, init);
    }

    private ArrayDecl parseArrayDeclarator(SourceLocation loc, String name, CType elementType) {
        Integer declaredSize = null;
        if (!parser.check(RBRACKET)) {
            declaredSize = parseArraySize();
        }
        parser.expect(RBRACKET, "Expected ']' after array size");
        if (parser.check(LBRACKET)) {
            throw parser.unsupported("Multi-dimensional arrays are not supported");
        }

        List<Expression> inits = null;
        if (parser.match(ASSIGN)) {
            inits = parseInitializerList();
        }

        int size;
        if (declaredSize != null) {
            size = declaredSize;
            if (inits != null && inits.size() > size) {
                throw parser.error("Too many initializers for array '" + name + "' of size " + size, null);
            }
        } else if (inits != null && !inits.isEmpty()) {
            size = inits.size();
        } else {
            throw parser.error("Array '" + name + "' needs a size or a non-empty initializer", "array size");
        }

        CType arrayType = CType.arrayOf(elementType, size);
        parser.declare(name, arrayType);
        return new ArrayDecl(loc, name, arrayType, inits);
    }

    private int parseArraySize() {
        Token token = parser.current;
        long value;
        if (parser.match(INT_LITERAL)) {
            value = ((Token.IntValue) token.getLiteral()).getValue();
        } else if (parser.check(IDENTIFIER) && parser.constants.containsKey(token.getLexeme())) {
            parser.advance();
            value = parser.constants.get(token.getLexeme());
        } else {
            throw parser.unsupported("Array size must be an integer literal or a #define constant");
        }
        if (value <= 0 || value > Integer.MAX_VALUE) {
            throw parser.unsupported("Array size must be positive: " + value, token);
        }
        return (int) value;
    }

    private List<Expression> parseInitializerList() {
        if (!parser.check(LBRACE)) {
            throw parser.unsupported("Arrays must be initialized with a brace list");
        }
        parser.advance();
        List<Expression> values = new ArrayList<Expression>();
        while (!parser.check(RBRACE)) {
            if (parser.check(LBRACE)) {
                throw parser.unsupported("Nested initializer lists are not supported");
            }
            values.add(parser.parseExpression());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after initializer list");
        return values;
    }

    // ============ 简单语句 ============

    /**
     * 赋值、复合赋值、自增自减或函数调用（不含结尾分号）
     */
    private Statement parseSimpleStatement() {
        SourceLocation loc = parser.location();

        if (parser.checkAny(INC, DEC)) {
            BinaryOp op = parser.advance().is(INC) ? BinaryOp.ADD : BinaryOp.SUB;
            Expression target = requireAssignable(parser.exprParser.parseOr());
            return new CompoundAssignStmt(loc, target, op, Literal.ofInt(loc, 1));
        }

        Token start = parser.current;
        Expression expr = parser.exprParser.parseOr();

        if (parser.checkAny(INC, DEC)) {
            BinaryOp op = parser.advance().is(INC) ? BinaryOp.ADD : BinaryOp.SUB;
            return new CompoundAssignStmt(loc, requireAssignable(expr), op, Literal.ofInt(loc, 1));
        }
        if (parser.match(ASSIGN)) {
            Expression target = requireAssignable(expr);
            Expression value = parser.parseExpression();
            return new AssignStmt(loc, target, value);
        }
        if (parser.exprParser.isAssignmentOperator()) {
            BinaryOp op;
            switch (parser.advance().getType()) {
                case PLUS_ASSIGN: op = BinaryOp.ADD; break;
                case MINUS_ASSIGN: op = BinaryOp.SUB; break;
                case MUL_ASSIGN: op = BinaryOp.MUL; break;
                case DIV_ASSIGN: op = BinaryOp.DIV; break;
                default: op = BinaryOp.MOD; break;
            }
            Expression target = requireAssignable(expr);
            Expression value = parser.parseExpression();
            return new CompoundAssignStmt(loc, target, op, value);
        }
        if (!(expr instanceof CallExpr)) {
            throw parser.unsupported("Only assignments and function calls can be used as statements", start);
        }
        return new ExpressionStmt(loc, expr);
    }

    private Expression requireAssignable(Expression target) {
        if (target instanceof Identifier || target instanceof IndexExpr) {
            return target;
        }
        throw new ParseException(ParseException.Kind.SYNTAX_ERROR, "Invalid assignment target",
                parser.previous, "variable or array element", target.getLocation());
    }
}
