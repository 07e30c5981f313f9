package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.TranslationUnit;
import com.cfort.compiler.ast.expr.Identifier;
import com.cfort.compiler.ast.expr.Literal;
import com.cfort.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 控制流规范化：把多出口函数体改写为"结果变量赋值 + 显式退出"的形式。
 *
 * <p>有返回值的函数中 {@code return e;} 变为 {@code result = e; return;}，处于尾部位置
 * （函数体最后一条语句，递归穿过末尾 if 的分支）时省略 return。void 函数只保留非尾部的 return；
 * main 中尾部的 {@code return 0;} 被删除，其余 return 保持原样。必然退出之后的语句不可达，直接删除。</p>
 */
public class ControlFlowNormalizer implements UnitPass {
    private static final Logger LOG = Logger.getLogger(ControlFlowNormalizer.class.getName());

    @Override
    public String getName() {
        return "ControlFlowNormalizer";
    }

    @Override
    public TranslationUnit run(TranslationUnit unit) {
        List<FunctionUnit> result = new ArrayList<>();
        for (FunctionUnit fn : unit.getAllFunctions()) {
            result.add(normalize(fn));
        }
        return unit.withFunctions(result);
    }

    /**
     * 规范化单个函数；已规范化的函数原样返回
     */
    public FunctionUnit normalize(FunctionUnit fn) {
        if (fn.isNormalized()) {
            return fn;
        }
        if (fn.hasResult() && !ReturnAnalysis.definitelyExits(fn.getBody())) {
            throw new NormalizeException(NormalizeException.Kind.MISSING_RETURN,
                    "Function '" + fn.getName() + "' can reach the end of its body without returning a value",
                    fn.getDeclaration().getLocation());
        }
        Block body = new Rewriter(fn).rewrite(fn.getBody(), true);
        return fn.withNormalizedBody(body);
    }

    private static final class Rewriter {
        final FunctionUnit fn;

        Rewriter(FunctionUnit fn) {
            this.fn = fn;
        }

        /**
         * @param tail 块的末尾是否就是函数体的末尾
         */
        Block rewrite(Block block, boolean tail) {
            List<Statement> stmts = block.getStatements();
            List<Statement> out = new ArrayList<Statement>(stmts.size() + 1);
            boolean changed = false;

            // 第一条必然退出的语句之后都不可达
            int end = stmts.size();
            for (int i = 0; i < stmts.size(); i++) {
                if (ReturnAnalysis.definitelyExits(stmts.get(i))) {
                    end = i + 1;
                    break;
                }
            }
            if (end < stmts.size()) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Dropping " + (stmts.size() - end) + " unreachable statement(s) in '"
                            + fn.getName() + "' at " + stmts.get(end).getLocation());
                }
                changed = true;
            }

            for (int i = 0; i < end; i++) {
                changed |= rewriteStmt(stmts.get(i), tail && i == end - 1, out);
            }

            if (!changed) {
                return block;
            }
            return new Block(block.getLocation(), out);
        }

        /**
         * 改写一条语句并追加到 out
         *
         * @return 是否有变化
         */
        private boolean rewriteStmt(Statement stmt, boolean tail, List<Statement> out) {
            if (stmt instanceof ReturnStmt) {
                return rewriteReturn((ReturnStmt) stmt, tail, out);
            }
            if (stmt instanceof IfStmt) {
                IfStmt ifStmt = (IfStmt) stmt;
                Block then = rewrite(ifStmt.getThenBlock(), tail);
                Block els = ifStmt.hasElse() ? rewrite(ifStmt.getElseBlock(), tail) : null;
                if (then == ifStmt.getThenBlock() && els == ifStmt.getElseBlock()) {
                    out.add(stmt);
                    return false;
                }
                out.add(new IfStmt(ifStmt.getLocation(), ifStmt.getCondition(), then, els));
                return true;
            }
            if (stmt instanceof Block) {
                Block rewritten = rewrite((Block) stmt, tail);
                out.add(rewritten);
                return rewritten != stmt;
            }
            if (stmt instanceof WhileStmt) {
                WhileStmt loop = (WhileStmt) stmt;
                Block body = rewrite(loop.getBody(), false);
                if (body == loop.getBody()) {
                    out.add(stmt);
                    return false;
                }
                out.add(new WhileStmt(loop.getLocation(), loop.getCondition(), body));
                return true;
            }
            if (stmt instanceof ForStmt) {
                ForStmt loop = (ForStmt) stmt;
                Block body = rewrite(loop.getBody(), false);
                if (body == loop.getBody()) {
                    out.add(stmt);
                    return false;
                }
                out.add(new ForStmt(loop.getLocation(), loop.getInit(), loop.getCondition(),
                        loop.getUpdate(), body));
                return true;
            }
            out.add(stmt);
            return false;
        }

        private boolean rewriteReturn(ReturnStmt ret, boolean tail, List<Statement> out) {
            if (fn.isMain()) {
                if (tail && isZero(ret)) {
                    return true;
                }
                out.add(ret);
                return false;
            }
            if (fn.hasResult()) {
                out.add(new AssignStmt(ret.getLocation(),
                        new Identifier(ret.getLocation(), fn.getResultName()), ret.getValue()));
                if (!tail) {
                    out.add(new ReturnStmt(ret.getLocation(), null));
                }
                return true;
            }
            // void 函数
            if (tail) {
                return true;
            }
            out.add(ret);
            return false;
        }

        private static boolean isZero(ReturnStmt ret) {
            return ret.hasValue() && ret.getValue() instanceof Literal
                    && ((Literal) ret.getValue()).isInteger()
                    && ((Literal) ret.getValue()).getIntValue() == 0;
        }
    }
}
