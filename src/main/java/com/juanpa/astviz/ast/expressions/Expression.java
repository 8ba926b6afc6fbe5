// File: src/main/java/com/juanpa/astviz/ast/expressions/Expression.java

package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTNode;
import com.juanpa.astviz.lexer.Token;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions compare structurally: two trees are equal when they have the same
 * shape, operators, names and values, regardless of where their tokens appeared.
 */
public interface Expression extends ASTNode
{
	/**
	 * Returns the first token that constitutes this expression.
	 * Useful for error reporting to pinpoint the location of a semantic problem.
	 *
	 * @return The first Token of this expression.
	 */
	Token getFirstToken();
}
