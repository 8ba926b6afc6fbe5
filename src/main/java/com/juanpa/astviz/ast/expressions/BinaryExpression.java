// File: src/main/java/com/juanpa/astviz/ast/expressions/BinaryExpression.java

package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;

import java.util.Objects;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, c && d).
 * It has a left operand, an operator token, and a right operand.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator; // The binary operator token (e.g., PLUS, EQUAL_EQUAL)
	private final Expression right;

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	/**
	 * The operator's spelling, e.g. "+" or "&&".
	 */
	public String getOperatorSymbol()
	{
		return operator.getLexeme();
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "BinaryOp";
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken(); // The first token of a binary expression is its left operand's first token
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		BinaryExpression that = (BinaryExpression) o;
		return operator.getType() == that.operator.getType()
				&& left.equals(that.left)
				&& right.equals(that.right);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(operator.getType(), left, right);
	}

	@Override
	public String toString()
	{
		return "BinaryOp(" + getOperatorSymbol() + ", " + left + ", " + right + ")";
	}
}
