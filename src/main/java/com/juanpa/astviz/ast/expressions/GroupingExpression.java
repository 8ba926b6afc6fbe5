// File: src/main/java/com/juanpa/astviz/ast/expressions/GroupingExpression.java

package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenType;

/**
 * AST node representing a grouped expression, enclosed in parentheses (e.g., `(a + b)`).
 * Evaluates exactly like its inner expression; it is kept so traces and
 * visualizations can show the explicit grouping.
 */
public class GroupingExpression implements Expression
{
	private final Expression expression; // The inner expression being grouped
	private final Token leftParen;      // The opening parenthesis token

	/**
	 * Constructs a new GroupingExpression.
	 *
	 * @param leftParen  The opening parenthesis token.
	 * @param expression The inner expression enclosed by the parentheses.
	 */
	public GroupingExpression(Token leftParen, Expression expression)
	{
		if (leftParen.getType() != TokenType.LEFT_PAREN)
		{
			throw new IllegalArgumentException("Token for GroupingExpression must be TokenType.LEFT_PAREN.");
		}
		this.leftParen = leftParen;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "Grouping";
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen; // The opening parenthesis is the first token of the grouping expression
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		return expression.equals(((GroupingExpression) o).expression);
	}

	@Override
	public int hashCode()
	{
		return 31 * expression.hashCode() + 7;
	}

	@Override
	public String toString()
	{
		return "Grouping(" + expression + ")";
	}
}
