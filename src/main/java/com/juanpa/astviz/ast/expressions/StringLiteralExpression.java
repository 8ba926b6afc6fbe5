package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenType;

/**
 * AST node representing a string literal. Holds the value after escape resolution.
 */
public class StringLiteralExpression implements Expression
{
	private final String value;
	private final Token literalToken;

	public StringLiteralExpression(Token literalToken)
	{
		if (literalToken.getType() != TokenType.STRING)
		{
			throw new IllegalArgumentException("Token for StringLiteralExpression must be a STRING.");
		}
		this.literalToken = literalToken;
		this.value = (String) literalToken.getLiteral();
	}

	public String getValue()
	{
		return value;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitStringLiteralExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "StringLiteral";
	}

	@Override
	public Token getFirstToken()
	{
		return literalToken;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		return value.equals(((StringLiteralExpression) o).value);
	}

	@Override
	public int hashCode()
	{
		return value.hashCode();
	}

	@Override
	public String toString()
	{
		return "StringLiteral(\"" + value + "\")";
	}
}
