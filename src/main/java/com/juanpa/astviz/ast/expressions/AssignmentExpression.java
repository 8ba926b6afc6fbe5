// File: src/main/java/com/juanpa/astviz/ast/expressions/AssignmentExpression.java

package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenType;

import java.util.Objects;

/**
 * AST node representing an assignment to a named variable (e.g., x = 10).
 * The target is always a bare identifier; the parser rejects anything else.
 */
public class AssignmentExpression implements Expression
{
	private final Token target; // The IDENTIFIER token on the left-hand side
	private final Expression value;  // The right-hand side expression

	/**
	 * Constructor for AssignmentExpression.
	 *
	 * @param target The identifier token being assigned to.
	 * @param value  The expression whose value is being assigned.
	 */
	public AssignmentExpression(Token target, Expression value)
	{
		if (target.getType() != TokenType.IDENTIFIER)
		{
			throw new IllegalArgumentException("Invalid token type for assignment target: " + target.getType());
		}
		this.target = target;
		this.value = value;
	}

	public String getTarget()
	{
		return target.getLexeme();
	}

	public Token getTargetToken()
	{
		return target;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "Assignment";
	}

	@Override
	public Token getFirstToken()
	{
		return target;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		AssignmentExpression that = (AssignmentExpression) o;
		return getTarget().equals(that.getTarget()) && value.equals(that.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getTarget(), value);
	}

	@Override
	public String toString()
	{
		return "Assignment(\"" + getTarget() + "\", " + value + ")";
	}
}
