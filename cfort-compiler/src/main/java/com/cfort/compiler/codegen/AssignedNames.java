package com.cfort.compiler.codegen;

import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.stmt.*;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 收集语句中被写入的变量名：赋值目标、复合赋值目标、scanf 的读入目标。
 * 对数组元素的写入记为数组名。
 */
final class AssignedNames {

    private AssignedNames() {
    }

    static Set<String> in(Statement stmt) {
        Set<String> names = new LinkedHashSet<String>();
        collect(stmt, names);
        return names;
    }

    private static void collect(Statement stmt, Set<String> names) {
        if (stmt == null) {
            return;
        }
        if (stmt instanceof AssignStmt) {
            addTarget(((AssignStmt) stmt).getTarget(), names);
            collectReads(((AssignStmt) stmt).getValue(), names);
        } else if (stmt instanceof CompoundAssignStmt) {
            addTarget(((CompoundAssignStmt) stmt).getTarget(), names);
        } else if (stmt instanceof VarDecl) {
            names.add(((VarDecl) stmt).getName());
        } else if (stmt instanceof ArrayDecl) {
            names.add(((ArrayDecl) stmt).getName());
        } else if (stmt instanceof Block) {
            for (Statement s : ((Block) stmt).getStatements()) {
                collect(s, names);
            }
        } else if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            collectReads(ifStmt.getCondition(), names);
            collect(ifStmt.getThenBlock(), names);
            collect(ifStmt.getElseBlock(), names);
        } else if (stmt instanceof WhileStmt) {
            collectReads(((WhileStmt) stmt).getCondition(), names);
            collect(((WhileStmt) stmt).getBody(), names);
        } else if (stmt instanceof ForStmt) {
            ForStmt loop = (ForStmt) stmt;
            collect(loop.getInit(), names);
            collect(loop.getUpdate(), names);
            collect(loop.getBody(), names);
        } else if (stmt instanceof ExpressionStmt) {
            collectReads(((ExpressionStmt) stmt).getExpression(), names);
        }
    }

    /** 表达式中只有 scanf 会写变量 */
    private static void collectReads(Expression expr, Set<String> names) {
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            for (Expression arg : call.getArgs()) {
                if (call.isScanf() && arg instanceof UnaryExpr) {
                    addTarget(((UnaryExpr) arg).getOperand(), names);
                } else {
                    collectReads(arg, names);
                }
            }
        } else if (expr instanceof BinaryExpr) {
            collectReads(((BinaryExpr) expr).getLeft(), names);
            collectReads(((BinaryExpr) expr).getRight(), names);
        } else if (expr instanceof UnaryExpr) {
            collectReads(((UnaryExpr) expr).getOperand(), names);
        }
    }

    private static void addTarget(Expression target, Set<String> names) {
        if (target instanceof Identifier) {
            names.add(((Identifier) target).getName());
        } else if (target instanceof IndexExpr) {
            names.add(((IndexExpr) target).getArray().getName());
        }
    }

    /**
     * 表达式引用的变量名（数组元素记为数组名）
     */
    static Set<String> referencedBy(Expression expr) {
        Set<String> names = new LinkedHashSet<String>();
        collectReferences(expr, names);
        return names;
    }

    private static void collectReferences(Expression expr, Set<String> names) {
        if (expr instanceof Identifier) {
            names.add(((Identifier) expr).getName());
        } else if (expr instanceof IndexExpr) {
            names.add(((IndexExpr) expr).getArray().getName());
            collectReferences(((IndexExpr) expr).getIndex(), names);
        } else if (expr instanceof BinaryExpr) {
            collectReferences(((BinaryExpr) expr).getLeft(), names);
            collectReferences(((BinaryExpr) expr).getRight(), names);
        } else if (expr instanceof UnaryExpr) {
            collectReferences(((UnaryExpr) expr).getOperand(), names);
        } else if (expr instanceof CallExpr) {
            for (Expression arg : ((CallExpr) expr).getArgs()) {
                collectReferences(arg, names);
            }
        }
    }

    /**
     * 表达式中是否含有函数调用
     */
    static boolean containsCall(Expression expr) {
        if (expr instanceof CallExpr) {
            return true;
        }
        if (expr instanceof BinaryExpr) {
            return containsCall(((BinaryExpr) expr).getLeft()) || containsCall(((BinaryExpr) expr).getRight());
        }
        if (expr instanceof UnaryExpr) {
            return containsCall(((UnaryExpr) expr).getOperand());
        }
        if (expr instanceof IndexExpr) {
            return containsCall(((IndexExpr) expr).getIndex());
        }
        return false;
    }
}
