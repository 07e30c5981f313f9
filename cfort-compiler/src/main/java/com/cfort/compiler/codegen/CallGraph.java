package com.cfort.compiler.codegen;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.TranslationUnit;
import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.stmt.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 函数间的调用关系，用于找出需要标记 recursive 的函数
 */
final class CallGraph {
    private final Map<String, Set<String>> edges = new HashMap<String, Set<String>>();

    CallGraph(TranslationUnit unit) {
        for (FunctionUnit fn : unit.getAllFunctions()) {
            Set<String> callees = new LinkedHashSet<String>();
            collect(fn.getBody(), callees);
            edges.put(fn.getName(), callees);
        }
    }

    Set<String> calleesOf(String function) {
        Set<String> callees = edges.get(function);
        return callees != null ? callees : new HashSet<String>();
    }

    /**
     * 函数是否处在调用环上（含直接递归）
     */
    boolean isRecursive(String function) {
        Set<String> visited = new HashSet<String>();
        Deque<String> work = new ArrayDeque<String>(calleesOf(function));
        while (!work.isEmpty()) {
            String next = work.pop();
            if (next.equals(function)) {
                return true;
            }
            if (visited.add(next)) {
                work.addAll(calleesOf(next));
            }
        }
        return false;
    }

    private static void collect(Statement stmt, Set<String> out) {
        if (stmt == null) {
            return;
        }
        if (stmt instanceof Block) {
            for (Statement s : ((Block) stmt).getStatements()) {
                collect(s, out);
            }
        } else if (stmt instanceof AssignStmt) {
            collect(((AssignStmt) stmt).getTarget(), out);
            collect(((AssignStmt) stmt).getValue(), out);
        } else if (stmt instanceof CompoundAssignStmt) {
            collect(((CompoundAssignStmt) stmt).getTarget(), out);
            collect(((CompoundAssignStmt) stmt).getValue(), out);
        } else if (stmt instanceof VarDecl) {
            collect(((VarDecl) stmt).getInitializer(), out);
        } else if (stmt instanceof ArrayDecl && ((ArrayDecl) stmt).hasInitializer()) {
            for (Expression e : ((ArrayDecl) stmt).getInitializers()) {
                collect(e, out);
            }
        } else if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            collect(ifStmt.getCondition(), out);
            collect(ifStmt.getThenBlock(), out);
            collect(ifStmt.getElseBlock(), out);
        } else if (stmt instanceof WhileStmt) {
            collect(((WhileStmt) stmt).getCondition(), out);
            collect(((WhileStmt) stmt).getBody(), out);
        } else if (stmt instanceof ForStmt) {
            ForStmt loop = (ForStmt) stmt;
            collect(loop.getInit(), out);
            collect(loop.getCondition(), out);
            collect(loop.getUpdate(), out);
            collect(loop.getBody(), out);
        } else if (stmt instanceof ReturnStmt) {
            collect(((ReturnStmt) stmt).getValue(), out);
        } else if (stmt instanceof ExpressionStmt) {
            collect(((ExpressionStmt) stmt).getExpression(), out);
        }
    }

    private static void collect(Expression expr, Set<String> out) {
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            if (call.isUserCall()) {
                out.add(call.getCallee());
            }
            for (Expression arg : call.getArgs()) {
                collect(arg, out);
            }
        } else if (expr instanceof BinaryExpr) {
            collect(((BinaryExpr) expr).getLeft(), out);
            collect(((BinaryExpr) expr).getRight(), out);
        } else if (expr instanceof UnaryExpr) {
            collect(((UnaryExpr) expr).getOperand(), out);
        } else if (expr instanceof IndexExpr) {
            collect(((IndexExpr) expr).getIndex(), out);
        } else if (expr instanceof ArrayLiteral) {
            for (Expression e : ((ArrayLiteral) expr).getValues()) {
                collect(e, out);
            }
        }
    }
}
