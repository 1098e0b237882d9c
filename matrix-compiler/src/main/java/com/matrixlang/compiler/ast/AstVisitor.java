package com.matrixlang.compiler.ast;

import com.matrixlang.compiler.ast.decl.*;
import com.matrixlang.compiler.ast.expr.*;
import com.matrixlang.compiler.ast.pattern.*;
import com.matrixlang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    default R visitProgram(Program node, C ctx) { return null; }

    // ============ 声明 ============

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitStructField(StructField node, C ctx) { return null; }

    default R visitTypeclassDecl(TypeclassDecl node, C ctx) { return null; }

    default R visitMethodSignature(MethodSignature node, C ctx) { return null; }

    default R visitInstanceDecl(InstanceDecl node, C ctx) { return null; }

    default R visitMethodImpl(MethodImpl node, C ctx) { return null; }

    default R visitModuleDecl(ModuleDecl node, C ctx) { return null; }

    default R visitImportDecl(ImportDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitFieldAccessExpr(FieldAccessExpr node, C ctx) { return null; }

    default R visitLambdaExpr(LambdaExpr node, C ctx) { return null; }

    default R visitLetExpr(LetExpr node, C ctx) { return null; }

    default R visitBlockExpr(BlockExpr node, C ctx) { return null; }

    default R visitIfExpr(IfExpr node, C ctx) { return null; }

    default R visitMatchExpr(MatchExpr node, C ctx) { return null; }

    default R visitMatchArm(MatchArm node, C ctx) { return null; }

    default R visitStructLiteral(StructLiteral node, C ctx) { return null; }

    default R visitFieldInit(FieldInit node, C ctx) { return null; }

    default R visitArrayLiteral(ArrayLiteral node, C ctx) { return null; }

    default R visitMatrixLiteral(MatrixLiteral node, C ctx) { return null; }

    default R visitRangeExpr(RangeExpr node, C ctx) { return null; }

    default R visitComprehensionExpr(ComprehensionExpr node, C ctx) { return null; }

    default R visitComprehensionClause(ComprehensionClause node, C ctx) { return null; }

    default R visitParallelExpr(ParallelExpr node, C ctx) { return null; }

    default R visitSpawnExpr(SpawnExpr node, C ctx) { return null; }

    default R visitWaitExpr(WaitExpr node, C ctx) { return null; }

    // ============ 模式 ============

    default R visitWildcardPattern(WildcardPattern node, C ctx) { return null; }

    default R visitBindingPattern(BindingPattern node, C ctx) { return null; }

    default R visitLiteralPattern(LiteralPattern node, C ctx) { return null; }

    default R visitStructPattern(StructPattern node, C ctx) { return null; }

    default R visitFieldPattern(FieldPattern node, C ctx) { return null; }

    default R visitArrayPattern(ArrayPattern node, C ctx) { return null; }
}
