package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.ast.expr.Expression;
import com.cfort.compiler.ast.expr.Identifier;
import com.cfort.compiler.ast.expr.Literal;
import com.cfort.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 保守的"必然退出"分析，以及规范化结果的结构检查。
 */
public final class ReturnAnalysis {

    private ReturnAnalysis() {
    }

    /**
     * 语句是否在所有路径上都不会正常落到下一条语句
     *
     * <ul>
     *   <li>return</li>
     *   <li>两个分支都必然退出的 if</li>
     *   <li>含必然退出语句的块</li>
     *   <li>条件为非零字面量的 while、无条件的 for（子集中没有 break）</li>
     * </ul>
     */
    public static boolean definitelyExits(Statement stmt) {
        if (stmt instanceof ReturnStmt) {
            return true;
        }
        if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            return ifStmt.hasElse()
                    && definitelyExits(ifStmt.getThenBlock())
                    && definitelyExits(ifStmt.getElseBlock());
        }
        if (stmt instanceof Block) {
            for (Statement s : ((Block) stmt).getStatements()) {
                if (definitelyExits(s)) return true;
            }
            return false;
        }
        if (stmt instanceof WhileStmt) {
            return isNonZeroLiteral(((WhileStmt) stmt).getCondition());
        }
        if (stmt instanceof ForStmt) {
            Expression cond = ((ForStmt) stmt).getCondition();
            return cond == null || isNonZeroLiteral(cond);
        }
        return false;
    }

    static boolean isNonZeroLiteral(Expression expr) {
        if (!(expr instanceof Literal)) return false;
        Literal lit = (Literal) expr;
        switch (lit.getKind()) {
            case INT: return lit.getIntValue() != 0;
            case INT_MAX:
            case INT_MIN: return true;
            default: return false;
        }
    }

    /**
     * 检查规范化后的函数体：
     * 退出之后没有语句；有返回值的函数中 return 不带值，且每条退出路径和落出函数体的路径上结果变量都已赋值。
     *
     * @return 违例描述，空列表表示满足不变式
     */
    public static List<String> verify(FunctionUnit fn) {
        Checker checker = new Checker(fn);
        boolean assigned = checker.check(fn.getBody(), false);
        if (fn.hasResult() && !assigned && !definitelyExits(fn.getBody())) {
            checker.violations.add("result '" + fn.getResultName() + "' may be unassigned at the end of the body");
        }
        return checker.violations;
    }

    private static final class Checker {
        final FunctionUnit fn;
        final List<String> violations = new ArrayList<>();

        Checker(FunctionUnit fn) {
            this.fn = fn;
        }

        /**
         * @return 正常落出该块时结果变量是否必然已赋值
         */
        boolean check(Block block, boolean assigned) {
            List<Statement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                Statement stmt = stmts.get(i);
                assigned = checkStmt(stmt, assigned);
                if (definitelyExits(stmt) && i < stmts.size() - 1) {
                    violations.add("statement after exit at " + stmts.get(i + 1).getLocation());
                }
            }
            return assigned;
        }

        private boolean checkStmt(Statement stmt, boolean assigned) {
            if (stmt instanceof AssignStmt) {
                Expression target = ((AssignStmt) stmt).getTarget();
                return assigned || (fn.hasResult() && target instanceof Identifier
                        && ((Identifier) target).getName().equals(fn.getResultName()));
            }
            if (stmt instanceof ReturnStmt) {
                ReturnStmt ret = (ReturnStmt) stmt;
                if (ret.hasValue() && !fn.isMain()) {
                    violations.add("return with a value at " + ret.getLocation());
                }
                if (fn.hasResult() && !assigned) {
                    violations.add("return before result is assigned at " + ret.getLocation());
                }
                return assigned;
            }
            if (stmt instanceof IfStmt) {
                IfStmt ifStmt = (IfStmt) stmt;
                boolean thenAssigned = check(ifStmt.getThenBlock(), assigned);
                boolean elseAssigned = ifStmt.hasElse() ? check(ifStmt.getElseBlock(), assigned) : assigned;
                // 必然退出的分支不会落到后面
                if (definitelyExits(ifStmt.getThenBlock())) return elseAssigned;
                if (ifStmt.hasElse() && definitelyExits(ifStmt.getElseBlock())) return thenAssigned;
                return thenAssigned && elseAssigned;
            }
            if (stmt instanceof Block) {
                return check((Block) stmt, assigned);
            }
            if (stmt instanceof WhileStmt) {
                check(((WhileStmt) stmt).getBody(), assigned);
                return assigned;
            }
            if (stmt instanceof ForStmt) {
                check(((ForStmt) stmt).getBody(), assigned);
                return assigned;
            }
            return assigned;
        }
    }
}
