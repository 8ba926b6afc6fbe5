// File: src/main/java/com/juanpa/astviz/ast/ASTVisitor.java

package com.juanpa.astviz.ast;

import com.juanpa.astviz.ast.expressions.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type, so adding a node
 * kind forces every traversal (analysis, printing, enumeration) to handle it.
 * The generic type `R` represents the return value type of the `visit` methods.
 */
public interface ASTVisitor<R>
{
	// --- Literals ---
	R visitNumberLiteralExpression(NumberLiteralExpression expression);

	R visitStringLiteralExpression(StringLiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	// --- Operators ---
	R visitBinaryExpression(BinaryExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitAssignmentExpression(AssignmentExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitGroupingExpression(GroupingExpression expression);
}
