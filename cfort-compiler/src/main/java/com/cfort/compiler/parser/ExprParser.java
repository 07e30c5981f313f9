package com.cfort.compiler.parser;

import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.cfort.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.cfort.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.cfort.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：|| &lt; &amp;&amp; &lt; 相等 &lt; 关系 &lt; 加减 &lt; 乘除模 &lt; 一元 &lt; 后缀。
 * 赋值只存在于语句层面。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一个完整表达式；其后紧跟赋值或自增运算符时报错
     */
    Expression parseExpression() {
        Expression expr = parseOr();
        if (isAssignmentOperator()) {
            throw parser.unsupported("Assignment inside an expression is not supported");
        }
        if (parser.checkAny(INC, DEC)) {
            throw parser.unsupported("Increment/decrement inside an expression is not supported");
        }
        return expr;
    }

    boolean isAssignmentOperator() {
        return parser.checkAny(ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, MUL_ASSIGN, DIV_ASSIGN, MOD_ASSIGN);
    }

    /**
     * 逗号分隔的实参列表（不含括号）
     */
    List<Expression> parseExpressionList() {
        List<Expression> exprs = new ArrayList<Expression>();
        if (parser.check(RPAREN)) {
            return exprs;
        }
        do {
            exprs.add(parseExpression());
        } while (parser.match(COMMA));
        return exprs;
    }

    // ============ 二元运算 ============

    Expression parseOr() {
        Expression left = parseAnd();
        while (parser.check(OR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryOp.OR, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (parser.check(AND)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryOp.AND, parseEquality());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (parser.checkAny(EQ, NE)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(EQ) ? BinaryOp.EQ : BinaryOp.NE;
            left = new BinaryExpr(loc, left, op, parseRelational());
        }
        return left;
    }

    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (parser.checkAny(LT, GT, LE, GE)) {
            SourceLocation loc = parser.location();
            Token opToken = parser.advance();
            BinaryOp op;
            switch (opToken.getType()) {
                case LT: op = BinaryOp.LT; break;
                case GT: op = BinaryOp.GT; break;
                case LE: op = BinaryOp.LE; break;
                default: op = BinaryOp.GE; break;
            }
            left = new BinaryExpr(loc, left, op, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            left = new BinaryExpr(loc, left, op, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (parser.checkAny(MUL, DIV, MOD)) {
            SourceLocation loc = parser.location();
            Token opToken = parser.advance();
            BinaryOp op;
            switch (opToken.getType()) {
                case MUL: op = BinaryOp.MUL; break;
                case DIV: op = BinaryOp.DIV; break;
                default: op = BinaryOp.MOD; break;
            }
            left = new BinaryExpr(loc, left, op, parseUnary());
        }
        return left;
    }

    // ============ 一元与后缀 ============

    private Expression parseUnary() {
        SourceLocation loc = parser.location();
        if (parser.match(MINUS)) {
            return new UnaryExpr(loc, UnaryOp.NEG, parseUnary());
        }
        if (parser.match(PLUS)) {
            return parseUnary();
        }
        if (parser.match(NOT)) {
            return new UnaryExpr(loc, UnaryOp.NOT, parseUnary());
        }
        if (parser.match(AMPERSAND)) {
            return new UnaryExpr(loc, UnaryOp.ADDRESS_OF, parseUnary());
        }
        if (parser.check(MUL)) {
            throw parser.unsupported("Pointer dereference is not supported");
        }
        if (parser.checkAny(INC, DEC)) {
            throw parser.unsupported("Increment/decrement inside an expression is not supported");
        }
        if (parser.check(KW_SIZEOF)) {
            return parseSizeofIdiom();
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        while (true) {
            if (parser.check(LBRACKET)) {
                SourceLocation loc = parser.location();
                if (expr instanceof IndexExpr) {
                    throw parser.unsupported("Multi-dimensional arrays are not supported");
                }
                if (!(expr instanceof Identifier)) {
                    throw parser.unsupported("Only named arrays can be indexed");
                }
                parser.advance();
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, (Identifier) expr, index);
            } else if (parser.check(LPAREN)) {
                if (!(expr instanceof Identifier)) {
                    throw parser.unsupported("Only named functions can be called");
                }
                parser.advance();
                List<Expression> args = parseExpressionList();
                parser.expect(RPAREN, "Expected ')' after arguments");
                expr = new CallExpr(expr.getLocation(), ((Identifier) expr).getName(), args);
            } else {
                return expr;
            }
        }
    }

    private Expression parsePrimary() {
        SourceLocation loc = parser.location();
        Token token = parser.current;
        switch (token.getType()) {
            case INT_LITERAL: {
                parser.advance();
                Token.IntValue value = (Token.IntValue) token.getLiteral();
                return new Literal(loc, value.getValue(), Literal.LiteralKind.INT, value.isWide());
            }
            case STRING_LITERAL: {
                // 相邻字符串字面量拼接
                StringBuilder sb = new StringBuilder();
                while (parser.check(STRING_LITERAL)) {
                    sb.append((String) parser.advance().getLiteral());
                }
                return Literal.ofString(loc, sb.toString());
            }
            case KW_INT_MAX:
                parser.advance();
                return new Literal(loc, null, Literal.LiteralKind.INT_MAX, false);
            case KW_INT_MIN:
                parser.advance();
                return new Literal(loc, null, Literal.LiteralKind.INT_MIN, false);
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case KW_PRINTF:
            case KW_SCANF:
                parser.advance();
                if (!parser.check(LPAREN)) {
                    throw parser.error("Expected '(' after " + token.getLexeme(), "'('");
                }
                return new Identifier(loc, token.getLexeme());
            case LPAREN: {
                parser.advance();
                if (parser.typeParser.isTypeStart() || parser.check(KW_UNSUPPORTED)) {
                    throw parser.unsupported("Type casts are not supported");
                }
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')' after expression");
                return inner;
            }
            case KW_UNSUPPORTED:
                throw parser.unsupported("Unsupported keyword '" + token.getLexeme() + "'");
            default:
                throw parser.error("Expected an expression", "expression");
        }
    }

    // ============ sizeof 惯用法 ============

    /**
     * 折叠 {@code sizeof(a) / sizeof(a[k])} 或 {@code sizeof(a) / sizeof(T)} 为数组长度字面量
     */
    private Expression parseSizeofIdiom() {
        Token sizeofToken = parser.current;
        SourceLocation loc = parser.location();
        parser.advance();
        boolean parens = parser.match(LPAREN);
        Token arrayToken = parser.current;
        if (!parser.check(IDENTIFIER)) {
            throw parser.unsupported("sizeof is only supported as sizeof(array) / sizeof(array[0])", sizeofToken);
        }
        parser.advance();
        String arrayName = arrayToken.getLexeme();
        if (parens) {
            parser.expect(RPAREN, "Expected ')' after sizeof operand");
        }
        CType arrayType = parser.visibleArray(arrayName);
        if (arrayType == null) {
            throw parser.unsupported("sizeof operand '" + arrayName + "' is not a visible array", arrayToken);
        }
        if (!parser.check(DIV)) {
            throw parser.unsupported("sizeof is only supported as sizeof(array) / sizeof(array[0])", sizeofToken);
        }
        parser.advance();
        if (!parser.check(KW_SIZEOF)) {
            throw parser.unsupported("sizeof is only supported as sizeof(array) / sizeof(array[0])", sizeofToken);
        }
        parser.advance();
        boolean elementParens = parser.match(LPAREN);
        if (elementParens && parser.typeParser.isTypeStart()) {
            Token typeToken = parser.current;
            CType type = parser.typeParser.parseType();
            if (!type.equals(arrayType.getElementType())) {
                throw parser.unsupported("sizeof divisor must be the element type of '" + arrayName + "'", typeToken);
            }
        } else {
            Token elementToken = parser.current;
            if (!parser.check(IDENTIFIER) || !arrayName.equals(elementToken.getLexeme())) {
                throw parser.unsupported("sizeof divisor must be an element of '" + arrayName + "'", elementToken);
            }
            parser.advance();
            parser.expect(LBRACKET, "Expected '[' in sizeof divisor");
            parser.expect(INT_LITERAL, "Expected a literal index in sizeof divisor");
            parser.expect(RBRACKET, "Expected ']' in sizeof divisor");
        }
        if (elementParens) {
            parser.expect(RPAREN, "Expected ')' after sizeof operand");
        }
        return Literal.ofInt(loc, arrayType.getSize());
    }
}
