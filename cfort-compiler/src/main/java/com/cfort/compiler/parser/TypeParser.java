package com.cfort.compiler.parser;

import com.cfort.compiler.ast.CType;

import static com.cfort.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 *
 * <p>只有 {@code unsigned long long [int]} 映射为 UInt64，其余整数写法均为 Int32。</p>
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 当前 token 是否开始一个类型
     */
    boolean isTypeStart() {
        return parser.checkAny(KW_INT, KW_UNSIGNED, KW_LONG, KW_VOID);
    }

    CType parseType() {
        if (parser.check(KW_UNSUPPORTED)) {
            throw parser.unsupported("Unsupported type keyword '" + parser.current.getLexeme() + "'");
        }
        CType type;
        if (parser.match(KW_VOID)) {
            type = CType.VOID;
        } else if (parser.match(KW_INT)) {
            type = CType.INT32;
        } else if (parser.match(KW_LONG)) {
            parser.match(KW_LONG);
            parser.match(KW_INT);
            type = CType.INT32;
        } else if (parser.match(KW_UNSIGNED)) {
            type = parseUnsignedTail();
        } else {
            throw parser.error("Expected a type", "type");
        }
        if (parser.check(KW_UNSUPPORTED)) {
            throw parser.unsupported("Unsupported type keyword '" + parser.current.getLexeme() + "'");
        }
        if (parser.check(MUL)) {
            throw parser.unsupported("Pointers are not supported");
        }
        return type;
    }

    private CType parseUnsignedTail() {
        if (parser.match(KW_INT)) {
            return CType.INT32;
        }
        if (parser.match(KW_LONG)) {
            boolean longLong = parser.match(KW_LONG);
            parser.match(KW_INT);
            return longLong ? CType.UINT64 : CType.INT32;
        }
        return CType.INT32;
    }
}
