package com.cfort.compiler.ast;

import com.cfort.compiler.ast.decl.*;
import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点。
 * 子类覆盖特定 visit 方法实现各阶段的改写。
 */
public class AstTransformer implements AstVisitor<AstNode, Void> {

    /**
     * 变换入口
     */
    public AstNode transform(AstNode node) {
        if (node == null) return null;
        AstNode result = node.accept(this, null);
        return result != null ? result : node;
    }

    // ==================== 辅助方法 ====================

    protected Expression transformExpr(Expression expr) {
        if (expr == null) return null;
        return (Expression) expr.accept(this, null);
    }

    protected Statement transformStmt(Statement stmt) {
        if (stmt == null) return null;
        return (Statement) stmt.accept(this, null);
    }

    protected Block transformBlock(Block block) {
        if (block == null) return null;
        return (Block) block.accept(this, null);
    }

    /**
     * 变换语句列表。visit 方法返回 null 表示删除该语句；列表无变化时返回原列表。
     */
    protected List<Statement> transformStmts(List<Statement> stmts) {
        List<Statement> result = null;
        for (int i = 0; i < stmts.size(); i++) {
            Statement original = stmts.get(i);
            Statement transformed = transformStmt(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(stmts.subList(0, i));
            }
            if (result != null && transformed != null) {
                result.add(transformed);
            }
        }
        return result != null ? result : stmts;
    }

    protected List<Expression> transformExprs(List<Expression> exprs) {
        if (exprs == null) return null;
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression transformed = transformExpr(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(exprs.subList(0, i));
            }
            if (result != null) {
                result.add(transformed);
            }
        }
        return result != null ? result : exprs;
    }

    // ==================== 声明 ====================

    @Override
    public AstNode visitProgram(Program node, Void ctx) {
        List<FunctionDecl> functions = new ArrayList<>();
        boolean changed = false;
        for (FunctionDecl fn : node.getFunctions()) {
            FunctionDecl transformed = (FunctionDecl) fn.accept(this, ctx);
            changed |= transformed != fn;
            functions.add(transformed);
        }
        if (!changed) return node;
        return new Program(node.getLocation(), node.getFileName(), node.getIncludes(),
                node.getConstants(), functions);
    }

    @Override
    public AstNode visitFunctionDecl(FunctionDecl node, Void ctx) {
        return node.withBody(transformBlock(node.getBody()));
    }

    @Override
    public AstNode visitParameter(Parameter node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitConstantDecl(ConstantDecl node, Void ctx) {
        return node;
    }

    // ==================== 语句 ====================

    @Override
    public AstNode visitBlock(Block node, Void ctx) {
        List<Statement> stmts = transformStmts(node.getStatements());
        if (stmts == node.getStatements()) return node;
        return new Block(node.getLocation(), stmts);
    }

    @Override
    public AstNode visitVarDecl(VarDecl node, Void ctx) {
        Expression init = transformExpr(node.getInitializer());
        if (init == node.getInitializer()) return node;
        return new VarDecl(node.getLocation(), node.getName(), node.getType(), init);
    }

    @Override
    public AstNode visitArrayDecl(ArrayDecl node, Void ctx) {
        List<Expression> inits = transformExprs(node.getInitializers());
        if (inits == node.getInitializers()) return node;
        return new ArrayDecl(node.getLocation(), node.getName(), node.getType(), inits);
    }

    @Override
    public AstNode visitAssignStmt(AssignStmt node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        Expression value = transformExpr(node.getValue());
        if (target == node.getTarget() && value == node.getValue()) return node;
        return new AssignStmt(node.getLocation(), target, value);
    }

    @Override
    public AstNode visitCompoundAssignStmt(CompoundAssignStmt node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        Expression value = transformExpr(node.getValue());
        if (target == node.getTarget() && value == node.getValue()) return node;
        return new CompoundAssignStmt(node.getLocation(), target, node.getOperator(), value);
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, Void ctx) {
        Expression cond = transformExpr(node.getCondition());
        Block then = transformBlock(node.getThenBlock());
        Block els = transformBlock(node.getElseBlock());
        if (cond == node.getCondition() && then == node.getThenBlock()
                && els == node.getElseBlock()) return node;
        return new IfStmt(node.getLocation(), cond, then, els);
    }

    @Override
    public AstNode visitForStmt(ForStmt node, Void ctx) {
        Statement init = transformStmt(node.getInit());
        Expression cond = transformExpr(node.getCondition());
        Statement update = transformStmt(node.getUpdate());
        Block body = transformBlock(node.getBody());
        if (init == node.getInit() && cond == node.getCondition()
                && update == node.getUpdate() && body == node.getBody()) return node;
        return new ForStmt(node.getLocation(), init, cond, update, body);
    }

    @Override
    public AstNode visitWhileStmt(WhileStmt node, Void ctx) {
        Expression cond = transformExpr(node.getCondition());
        Block body = transformBlock(node.getBody());
        if (cond == node.getCondition() && body == node.getBody()) return node;
        return new WhileStmt(node.getLocation(), cond, body);
    }

    @Override
    public AstNode visitReturnStmt(ReturnStmt node, Void ctx) {
        Expression value = transformExpr(node.getValue());
        if (value == node.getValue()) return node;
        return new ReturnStmt(node.getLocation(), value);
    }

    @Override
    public AstNode visitExpressionStmt(ExpressionStmt node, Void ctx) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) return node;
        return new ExpressionStmt(node.getLocation(), expr);
    }

    // ==================== 表达式 ====================

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, Void ctx) {
        Expression left = transformExpr(node.getLeft());
        Expression right = transformExpr(node.getRight());
        if (left == node.getLeft() && right == node.getRight()) return node;
        return new BinaryExpr(node.getLocation(), left, node.getOperator(), right);
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, Void ctx) {
        Expression operand = transformExpr(node.getOperand());
        if (operand == node.getOperand()) return node;
        return new UnaryExpr(node.getLocation(), node.getOperator(), operand);
    }

    @Override
    public AstNode visitLiteral(Literal node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitIdentifier(Identifier node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitCallExpr(CallExpr node, Void ctx) {
        List<Expression> args = transformExprs(node.getArgs());
        if (args == node.getArgs()) return node;
        return new CallExpr(node.getLocation(), node.getCallee(), args);
    }

    @Override
    public AstNode visitIndexExpr(IndexExpr node, Void ctx) {
        Expression array = transformExpr(node.getArray());
        Expression index = transformExpr(node.getIndex());
        if (array == node.getArray() && index == node.getIndex()) return node;
        if (!(array instanceof Identifier)) {
            throw new IllegalStateException("Array reference must stay an identifier");
        }
        return new IndexExpr(node.getLocation(), (Identifier) array, index);
    }

    @Override
    public AstNode visitArrayLiteral(ArrayLiteral node, Void ctx) {
        List<Expression> values = transformExprs(node.getValues());
        if (values == node.getValues()) return node;
        return new ArrayLiteral(node.getLocation(), values);
    }
}
