package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;

import java.util.Objects;

/**
 * AST node representing a prefix unary operation (-x, !x).
 * It has an operator token and a single operand expression.
 */
public class UnaryExpression implements Expression
{
	private final Token operator; // The unary operator token (BANG or MINUS)
	private final Expression operand;

	public UnaryExpression(Token operator, Expression operand)
	{
		this.operator = operator;
		this.operand = operand;
	}

	public Token getOperator()
	{
		return operator;
	}

	public String getOperatorSymbol()
	{
		return operator.getLexeme();
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "UnaryOp";
	}

	@Override
	public Token getFirstToken()
	{
		return operator; // The first token of a unary expression is its operator
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		UnaryExpression that = (UnaryExpression) o;
		return operator.getType() == that.operator.getType() && operand.equals(that.operand);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(operator.getType(), operand);
	}

	@Override
	public String toString()
	{
		return "UnaryOp(" + getOperatorSymbol() + ", " + operand + ")";
	}
}
