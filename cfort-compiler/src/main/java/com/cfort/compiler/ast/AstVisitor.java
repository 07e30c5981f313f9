package com.cfort.compiler.ast;

import com.cfort.compiler.ast.decl.*;
import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每种节点一个方法，不提供默认实现：新增节点类型时所有访问者都必须处理它。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitFunctionDecl(FunctionDecl node, C ctx);

    R visitParameter(Parameter node, C ctx);

    R visitConstantDecl(ConstantDecl node, C ctx);

    // ============ 语句 ============

    R visitBlock(Block node, C ctx);

    R visitVarDecl(VarDecl node, C ctx);

    R visitArrayDecl(ArrayDecl node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitCompoundAssignStmt(CompoundAssignStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    // ============ 表达式 ============

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitArrayLiteral(ArrayLiteral node, C ctx);
}
