// File: src/main/java/com/juanpa/astviz/ast/expressions/IdentifierExpression.java

package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenType;

/**
 * AST node representing a reference to a named value.
 */
public class IdentifierExpression implements Expression
{
	private final Token name; // The IDENTIFIER token

	public IdentifierExpression(Token name)
	{
		if (name.getType() != TokenType.IDENTIFIER)
		{
			throw new IllegalArgumentException("Token for IdentifierExpression must be an IDENTIFIER.");
		}
		this.name = name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "Identifier";
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		return getName().equals(((IdentifierExpression) o).getName());
	}

	@Override
	public int hashCode()
	{
		return getName().hashCode();
	}

	@Override
	public String toString()
	{
		return "Identifier(" + getName() + ")";
	}
}
