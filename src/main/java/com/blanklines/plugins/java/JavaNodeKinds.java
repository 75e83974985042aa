package com.blanklines.plugins.java;

import com.blanklines.api.tree.NodeKind;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

/**
 * Maps JavaParser node classes onto {@link NodeKind}.
 */
public final class JavaNodeKinds {

    private JavaNodeKinds() {
    }

    public static NodeKind kindOf(Node node) {
        // Statements
        if (node instanceof BlockStmt) return NodeKind.BLOCK;
        if (node instanceof ExpressionStmt) {
            // Java has no local declaration statement of its own
            return ((ExpressionStmt) node).getExpression() instanceof VariableDeclarationExpr
                    ? NodeKind.LOCAL_VARIABLE_DECLARATION
                    : NodeKind.EXPRESSION_STATEMENT;
        }
        if (node instanceof IfStmt) return NodeKind.IF_STATEMENT;
        if (node instanceof ForStmt) return NodeKind.FOR_STATEMENT;
        if (node instanceof ForEachStmt) return NodeKind.FOR_EACH_STATEMENT;
        if (node instanceof WhileStmt) return NodeKind.WHILE_STATEMENT;
        if (node instanceof DoStmt) return NodeKind.DO_STATEMENT;
        if (node instanceof TryStmt) return NodeKind.TRY_STATEMENT;
        if (node instanceof CatchClause) return NodeKind.CATCH_CLAUSE;
        if (node instanceof SwitchStmt) return NodeKind.SWITCH_STATEMENT;
        if (node instanceof SwitchEntry) return NodeKind.SWITCH_SECTION;
        if (node instanceof ReturnStmt) return NodeKind.RETURN_STATEMENT;
        if (node instanceof ThrowStmt) return NodeKind.THROW_STATEMENT;
        if (node instanceof BreakStmt) return NodeKind.BREAK_STATEMENT;
        if (node instanceof ContinueStmt) return NodeKind.CONTINUE_STATEMENT;
        if (node instanceof SynchronizedStmt) return NodeKind.SYNCHRONIZED_STATEMENT;
        if (node instanceof LabeledStmt) return NodeKind.LABELED_STATEMENT;
        if (node instanceof LocalClassDeclarationStmt) return NodeKind.LOCAL_CLASS_DECLARATION;
        if (node instanceof EmptyStmt) return NodeKind.EMPTY_STATEMENT;

        // Expressions
        if (node instanceof AssignExpr) {
            return ((AssignExpr) node).getOperator() == AssignExpr.Operator.ASSIGN
                    ? NodeKind.SIMPLE_ASSIGNMENT
                    : NodeKind.COMPOUND_ASSIGNMENT;
        }
        if (node instanceof VariableDeclarationExpr) return NodeKind.VARIABLE_DECLARATION;
        if (node instanceof MethodCallExpr) return NodeKind.METHOD_CALL;
        if (node instanceof ObjectCreationExpr) return NodeKind.OBJECT_CREATION;
        if (node instanceof UnaryExpr) return NodeKind.UNARY_EXPRESSION;
        if (node instanceof LambdaExpr) return NodeKind.LAMBDA_EXPRESSION;

        // Declarations
        if (node instanceof MethodDeclaration) return NodeKind.METHOD_DECLARATION;
        if (node instanceof ConstructorDeclaration) return NodeKind.CONSTRUCTOR_DECLARATION;
        if (node instanceof CompactConstructorDeclaration) return NodeKind.COMPACT_CONSTRUCTOR_DECLARATION;
        if (node instanceof InitializerDeclaration) return NodeKind.INITIALIZER_DECLARATION;
        if (node instanceof CompilationUnit) return NodeKind.COMPILATION_UNIT;

        return NodeKind.OTHER;
    }

    /**
     * Whether the node owns an executable body that is checked on its own.
     */
    public static boolean isCodeUnit(Node node) {
        if (node instanceof LambdaExpr) {
            return ((LambdaExpr) node).getBody() instanceof BlockStmt;
        }
        return node instanceof MethodDeclaration
                || node instanceof ConstructorDeclaration
                || node instanceof CompactConstructorDeclaration
                || node instanceof InitializerDeclaration;
    }
}
