package com.cfort.compiler.codegen;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.decl.ConstantDecl;
import com.cfort.compiler.ast.decl.FunctionDecl;
import com.cfort.compiler.ast.decl.Parameter;
import com.cfort.compiler.ast.decl.Program;
import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.stmt.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把 C 表达式渲染为 Fortran 表达式文本。
 *
 * <p>C 的比较与逻辑运算得到 int，Fortran 得到 logical：需要整数的位置用 {@code merge(1, 0, c)}，
 * 需要条件的位置用 {@code e /= 0}。括号按 Fortran 优先级补齐，不会生成 {@code a * -b}。
 * 64 位无符号的除法与取模交给 {@link UnsignedHelpers}，用到的辅助函数记录在 helpers 中。</p>
 */
final class ExpressionRenderer implements AstVisitor<ExpressionRenderer.Code, Void> {

    // Fortran 运算符优先级，数值越大结合越紧
    static final int OR = 1;
    static final int AND = 2;
    static final int NOT = 3;
    static final int REL = 4;
    static final int ADD = 5;
    static final int MUL = 6;
    static final int ATOM = 9;

    private static final String UINT32_MODULUS = "4294967296_8";

    /**
     * 渲染结果
     */
    static final class Code {
        final String text;
        final int precedence;
        final boolean logical;
        final CType type;
        final Long literal;     // 整数字面量（含取负）的值，其它为 null

        Code(String text, int precedence, boolean logical, CType type, Long literal) {
            this.text = text;
            this.precedence = precedence;
            this.logical = logical;
            this.type = type;
            this.literal = literal;
        }

        static Code atom(String text, CType type) {
            return new Code(text, ATOM, false, type, null);
        }

        static Code condition(String text, int precedence) {
            return new Code(text, precedence, true, CType.INT32, null);
        }
    }

    /**
     * printf 实参中的用户函数调用先求值到临时变量
     */
    interface CallHoister {
        String hoist(String callText, CType type);
    }

    private final Map<String, CType> variables;
    private final Map<String, FunctionUnit> functions;
    private final Set<String> helpers;
    private CallHoister callHoister;

    /**
     * @param variables 当前函数可见的 Fortran 名字及其类型（局部变量、结果变量、常量）
     * @param functions 全部函数，按 C 名字索引
     * @param helpers   收集用到的模块辅助函数名
     */
    ExpressionRenderer(Map<String, CType> variables, Map<String, FunctionUnit> functions, Set<String> helpers) {
        this.variables = variables;
        this.functions = functions;
        this.helpers = helpers;
    }

    void setCallHoister(CallHoister callHoister) {
        this.callHoister = callHoister;
    }

    Code render(Expression expr) {
        return expr.accept(this, null);
    }

    /** 整数上下文 */
    Code integer(Expression expr) {
        return asInt(render(expr));
    }

    /** 整数上下文，并转换到目标种别 */
    String integer(Expression expr, CType target) {
        return toKind(render(expr), target).text;
    }

    /** 条件上下文 */
    Code logical(Expression expr) {
        return asLogical(render(expr));
    }

    // ============ 转换 ============

    static String wrap(Code code, int minPrecedence) {
        return code.precedence >= minPrecedence ? code.text : "(" + code.text + ")";
    }

    static Code asInt(Code code) {
        if (!code.logical) {
            return code;
        }
        return Code.atom("merge(1, 0, " + code.text + ")", CType.INT32);
    }

    static Code asLogical(Code code) {
        if (code.logical) {
            return code;
        }
        if (code.literal != null) {
            return Code.condition(code.literal != 0 ? ".true." : ".false.", ATOM);
        }
        return Code.condition(wrap(code, ADD) + " /= 0", REL);
    }

    static Code toKind(Code code, CType target) {
        code = asInt(code);
        if (target.isWide() && !code.type.isWide()) {
            if (code.literal != null) {
                return new Code(code.text + "_8", code.precedence, false, CType.UINT64, code.literal);
            }
            return Code.atom("int(" + code.text + ", kind=8)", CType.UINT64);
        }
        if (!target.isWide() && code.type.isWide()) {
            return Code.atom("int(" + code.text + ")", CType.INT32);
        }
        return code;
    }

    /**
     * printf %u / %llu：int 按 32 位无符号解释；64 位值转成无符号十进制文本，用 A 输出
     */
    String unsigned(Code code) {
        code = asInt(code);
        if (code.type.isWide()) {
            helpers.add(UnsignedHelpers.TO_STRING);
            return UnsignedHelpers.TO_STRING + "(" + code.text + ")";
        }
        return "modulo(" + toKind(code, CType.UINT64).text + ", " + UINT32_MODULUS + ")";
    }

    static String typeSpec(CType scalar) {
        return scalar.isWide() ? "integer(kind=8)" : "integer";
    }

    // ============ 表达式 ============

    @Override
    public Code visitBinaryExpr(BinaryExpr node, Void ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        switch (op) {
            case AND:
            case OR: {
                int level = op == BinaryExpr.BinaryOp.AND ? AND : OR;
                String keyword = op == BinaryExpr.BinaryOp.AND ? " .and. " : " .or. ";
                Code left = logical(node.getLeft());
                Code right = logical(node.getRight());
                return Code.condition(wrap(left, level) + keyword + wrap(right, level + 1), level);
            }
            case MOD: {
                Code left = integer(node.getLeft());
                Code right = integer(node.getRight());
                CType type = wider(left, right);
                String function = type.isWide() ? helper(UnsignedHelpers.MODULO) : "mod";
                return Code.atom(function + "(" + toKind(left, type).text + ", " + toKind(right, type).text + ")", type);
            }
            case ADD:
            case SUB:
            case MUL:
            case DIV: {
                int level = op == BinaryExpr.BinaryOp.ADD || op == BinaryExpr.BinaryOp.SUB ? ADD : MUL;
                Code left = integer(node.getLeft());
                Code right = integer(node.getRight());
                if (op == BinaryExpr.BinaryOp.DIV && wider(left, right).isWide()) {
                    return Code.atom(helper(UnsignedHelpers.DIVIDE) + "(" + toKind(left, CType.UINT64).text
                            + ", " + toKind(right, CType.UINT64).text + ")", CType.UINT64);
                }
                return new Code(wrap(left, level) + " " + op.toSourceString() + " " + wrap(right, level + 1),
                        level, false, wider(left, right), null);
            }
            default:
                return comparison(node);
        }
    }

    private Code comparison(BinaryExpr node) {
        Code left = integer(node.getLeft());
        Code right = integer(node.getRight());
        BinaryExpr.BinaryOp op = node.getOperator();
        if (wider(left, right).isWide() && op != BinaryExpr.BinaryOp.EQ && op != BinaryExpr.BinaryOp.NE) {
            // 无符号比较
            String intrinsic;
            switch (op) {
                case LT: intrinsic = "blt"; break;
                case LE: intrinsic = "ble"; break;
                case GT: intrinsic = "bgt"; break;
                default: intrinsic = "bge"; break;
            }
            return new Code(intrinsic + "(" + toKind(left, CType.UINT64).text + ", "
                    + toKind(right, CType.UINT64).text + ")", ATOM, true, CType.INT32, null);
        }
        String symbol;
        switch (op) {
            case EQ: symbol = "=="; break;
            case NE: symbol = "/="; break;
            case LT: symbol = "<"; break;
            case LE: symbol = "<="; break;
            case GT: symbol = ">"; break;
            default: symbol = ">="; break;
        }
        return Code.condition(wrap(left, ADD) + " " + symbol + " " + wrap(right, ADD), REL);
    }

    private String helper(String name) {
        helpers.add(name);
        return name;
    }

    private static CType wider(Code left, Code right) {
        return left.type.isWide() || right.type.isWide() ? CType.UINT64 : CType.INT32;
    }

    @Override
    public Code visitUnaryExpr(UnaryExpr node, Void ctx) {
        switch (node.getOperator()) {
            case NOT: {
                Code operand = render(node.getOperand());
                if (operand.logical) {
                    return Code.condition(".not. " + wrap(operand, REL), NOT);
                }
                if (operand.literal != null) {
                    return Code.condition(operand.literal == 0 ? ".true." : ".false.", ATOM);
                }
                return Code.condition(wrap(operand, ADD) + " == 0", REL);
            }
            case NEG: {
                Code operand = integer(node.getOperand());
                if (operand.literal != null && operand.literal > 0) {
                    return new Code("-" + operand.text, ADD, false, operand.type, -operand.literal);
                }
                return new Code("-" + wrap(operand, MUL), ADD, false, operand.type, null);
            }
            default:
                throw new GenException("'&' is only translated inside scanf arguments", node.getLocation());
        }
    }

    @Override
    public Code visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INT_MAX:
                return Code.atom("huge(0)", CType.INT32);
            case INT_MIN:
                return Code.atom("(-huge(0) - 1)", CType.INT32);
            case INT: {
                long value = node.getIntValue();
                CType type = node.isWide() ? CType.UINT64 : CType.INT32;
                String text = Long.toString(value) + (node.isWide() ? "_8" : "");
                return new Code(text, value < 0 ? ADD : ATOM, false, type, value);
            }
            default:
                throw new GenException("String literal outside a printf format or %s argument",
                        node.getLocation());
        }
    }

    @Override
    public Code visitIdentifier(Identifier node, Void ctx) {
        CType type = variables.get(node.getName());
        if (type == null) {
            throw new GenException("No declaration for '" + node.getName() + "'", node.getLocation());
        }
        if (type.isArray()) {
            throw new GenException("Array '" + node.getName() + "' used as a value", node.getLocation());
        }
        return Code.atom(node.getName(), type);
    }

    @Override
    public Code visitIndexExpr(IndexExpr node, Void ctx) {
        String name = node.getArray().getName();
        CType type = variables.get(name);
        if (type == null || !type.isArray()) {
            throw new GenException("'" + name + "' is not an array", node.getLocation());
        }
        return Code.atom(name + "(" + integer(node.getIndex()).text + ")", type.getElementType());
    }

    @Override
    public Code visitCallExpr(CallExpr node, Void ctx) {
        if (!node.isUserCall()) {
            throw new GenException(node.getCallee() + " is only translated as a statement"
                    + (node.isScanf() ? " or a loop/if condition" : ""), node.getLocation());
        }
        FunctionUnit callee = functions.get(node.getCallee());
        if (callee == null) {
            throw new GenException("Call to undefined function '" + node.getCallee() + "'", node.getLocation());
        }
        if (callee.isSubroutine()) {
            throw new GenException("Subroutine '" + node.getCallee() + "' used as a value", node.getLocation());
        }
        String text = callText(callee.getDeclaration(), node.getArgs());
        if (callHoister != null) {
            return Code.atom(callHoister.hoist(text, callee.getReturnType()), callee.getReturnType());
        }
        return Code.atom(text, callee.getReturnType());
    }

    /**
     * {@code f(a, b)}，实参转换到形参的种别
     */
    String callText(FunctionDecl callee, List<Expression> args) {
        // 实参中嵌套的调用不在 I/O 语句里，不需要临时变量
        CallHoister saved = callHoister;
        callHoister = null;
        try {
            StringBuilder sb = new StringBuilder(callee.getName()).append('(');
            List<Parameter> params = callee.getParams();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(integer(args.get(i), params.get(i).getType()));
            }
            return sb.append(')').toString();
        } finally {
            callHoister = saved;
        }
    }

    @Override
    public Code visitArrayLiteral(ArrayLiteral node, Void ctx) {
        throw new GenException("Array initializer outside an array assignment", node.getLocation());
    }

    // ============ 非表达式节点 ============

    @Override
    public Code visitProgram(Program node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitFunctionDecl(FunctionDecl node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitParameter(Parameter node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitConstantDecl(ConstantDecl node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitBlock(Block node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitVarDecl(VarDecl node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitArrayDecl(ArrayDecl node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitAssignStmt(AssignStmt node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitCompoundAssignStmt(CompoundAssignStmt node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitIfStmt(IfStmt node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitForStmt(ForStmt node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitWhileStmt(WhileStmt node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitReturnStmt(ReturnStmt node, Void ctx) {
        throw notExpression(node);
    }

    @Override
    public Code visitExpressionStmt(ExpressionStmt node, Void ctx) {
        throw notExpression(node);
    }

    private static IllegalStateException notExpression(Object node) {
        return new IllegalStateException("Not an expression: " + node.getClass().getSimpleName());
    }
}
