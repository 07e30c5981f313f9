package com.cfort.compiler.codegen;

import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.expr.BinaryExpr;
import com.cfort.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.cfort.compiler.ast.expr.Expression;
import com.cfort.compiler.ast.expr.Identifier;
import com.cfort.compiler.ast.expr.Literal;
import com.cfort.compiler.ast.stmt.AssignStmt;
import com.cfort.compiler.ast.stmt.CompoundAssignStmt;
import com.cfort.compiler.ast.stmt.ForStmt;
import com.cfort.compiler.ast.stmt.Statement;

import java.util.Set;

/**
 * 可翻译为 {@code do i = start, end[, stride]} 的 for 循环。
 *
 * <p>递增循环要求条件为 {@code i < b} 或 {@code i <= b}，递减循环要求 {@code i > b} 或 {@code i >= b}；
 * 步长必须是正整数字面量。严格比较的上界调整为 {@code b - 1} / {@code b + 1}，字面量直接折叠。
 * 循环体不能写循环变量或上界引用的变量，上界中不能有函数调用（Fortran 只在进入循环时求值一次）。</p>
 */
public final class CountedLoop {
    private final String variable;
    private final Expression start;
    private final Expression end;
    private final long stride;

    private CountedLoop(String variable, Expression start, Expression end, long stride) {
        this.variable = variable;
        this.start = start;
        this.end = end;
        this.stride = stride;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    /** 已按严格/非严格比较调整过的闭区间端点 */
    public Expression getEnd() {
        return end;
    }

    /** 带符号步长，递减循环为负 */
    public long getStride() {
        return stride;
    }

    /**
     * 分析 for 循环
     *
     * @throws GenException 不是可计数循环
     */
    public static CountedLoop analyze(ForStmt loop) {
        SourceLocation loc = loop.getLocation();

        Statement init = loop.getInit();
        if (!(init instanceof AssignStmt) || !(((AssignStmt) init).getTarget() instanceof Identifier)) {
            throw reject("the loop variable must be initialised in the for header", loc);
        }
        String var = ((Identifier) ((AssignStmt) init).getTarget()).getName();
        Expression start = ((AssignStmt) init).getValue();

        Expression cond = loop.getCondition();
        if (!(cond instanceof BinaryExpr) || !isVariable(((BinaryExpr) cond).getLeft(), var)) {
            throw reject("the condition must compare '" + var + "' against a bound", loc);
        }
        BinaryOp relation = ((BinaryExpr) cond).getOperator();
        Expression bound = ((BinaryExpr) cond).getRight();

        long step = step(loop.getUpdate(), var, loc);
        boolean ascending = step > 0;
        Expression end;
        switch (relation) {
            case LT:
                requireDirection(ascending, "'<' needs an increasing update", loc);
                end = adjust(bound, -1);
                break;
            case LE:
                requireDirection(ascending, "'<=' needs an increasing update", loc);
                end = bound;
                break;
            case GT:
                requireDirection(!ascending, "'>' needs a decreasing update", loc);
                end = adjust(bound, 1);
                break;
            case GE:
                requireDirection(!ascending, "'>=' needs a decreasing update", loc);
                end = bound;
                break;
            default:
                throw reject("the condition must use <, <=, > or >=", loc);
        }

        if (AssignedNames.containsCall(bound)) {
            throw reject("the bound must not call functions", bound.getLocation());
        }
        Set<String> written = AssignedNames.in(loop.getBody());
        if (written.contains(var)) {
            throw reject("the body assigns the loop variable '" + var + "'", loc);
        }
        for (String name : AssignedNames.referencedBy(bound)) {
            if (written.contains(name)) {
                throw reject("the body assigns '" + name + "', which the bound depends on", loc);
            }
        }
        return new CountedLoop(var, start, end, step);
    }

    private static long step(Statement update, String var, SourceLocation loc) {
        if (update instanceof CompoundAssignStmt) {
            CompoundAssignStmt c = (CompoundAssignStmt) update;
            if (isVariable(c.getTarget(), var)) {
                Long k = positiveLiteral(c.getValue());
                if (k != null && c.getOperator() == BinaryOp.ADD) return k;
                if (k != null && c.getOperator() == BinaryOp.SUB) return -k;
            }
        } else if (update instanceof AssignStmt && isVariable(((AssignStmt) update).getTarget(), var)
                && ((AssignStmt) update).getValue() instanceof BinaryExpr) {
            BinaryExpr value = (BinaryExpr) ((AssignStmt) update).getValue();
            if (value.getOperator() == BinaryOp.ADD) {
                if (isVariable(value.getLeft(), var) && positiveLiteral(value.getRight()) != null) {
                    return positiveLiteral(value.getRight());
                }
                if (isVariable(value.getRight(), var) && positiveLiteral(value.getLeft()) != null) {
                    return positiveLiteral(value.getLeft());
                }
            } else if (value.getOperator() == BinaryOp.SUB
                    && isVariable(value.getLeft(), var) && positiveLiteral(value.getRight()) != null) {
                return -positiveLiteral(value.getRight());
            }
        }
        throw reject("the update must step '" + var + "' by a positive literal", loc);
    }

    private static Expression adjust(Expression bound, long delta) {
        if (bound instanceof Literal && ((Literal) bound).getKind() == Literal.LiteralKind.INT) {
            return Literal.ofInt(bound.getLocation(), ((Literal) bound).getIntValue() + delta);
        }
        BinaryOp op = delta < 0 ? BinaryOp.SUB : BinaryOp.ADD;
        return new BinaryExpr(bound.getLocation(), bound, op, Literal.ofInt(bound.getLocation(), Math.abs(delta)));
    }

    private static Long positiveLiteral(Expression expr) {
        if (expr instanceof Literal && ((Literal) expr).getKind() == Literal.LiteralKind.INT
                && ((Literal) expr).getIntValue() > 0) {
            return ((Literal) expr).getIntValue();
        }
        return null;
    }

    private static boolean isVariable(Expression expr, String var) {
        return expr instanceof Identifier && ((Identifier) expr).getName().equals(var);
    }

    private static void requireDirection(boolean ok, String message, SourceLocation loc) {
        if (!ok) {
            throw reject(message, loc);
        }
    }

    private static GenException reject(String reason, SourceLocation loc) {
        return new GenException("Unsupported for loop: " + reason, loc);
    }
}
