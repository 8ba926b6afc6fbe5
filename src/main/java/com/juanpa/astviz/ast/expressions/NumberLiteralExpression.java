package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenType;

/**
 * AST node representing a numeric literal (e.g., 42, 3.14, 2.3e-4).
 * The value is always held as a double; the raw text is kept for display.
 */
public class NumberLiteralExpression implements Expression
{
	private final double value;
	private final Token literalToken;

	public NumberLiteralExpression(Token literalToken)
	{
		if (literalToken.getType() != TokenType.NUMBER)
		{
			throw new IllegalArgumentException("Token for NumberLiteralExpression must be a NUMBER.");
		}
		this.literalToken = literalToken;
		this.value = (Double) literalToken.getLiteral();
	}

	public double getValue()
	{
		return value;
	}

	/**
	 * The number exactly as written in the source.
	 */
	public String getRawText()
	{
		return literalToken.getLexeme();
	}

	/**
	 * True when the literal was written with a decimal point or an exponent.
	 */
	public boolean isFloat()
	{
		String raw = getRawText();
		return raw.indexOf('.') >= 0 || raw.indexOf('e') >= 0 || raw.indexOf('E') >= 0;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNumberLiteralExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "NumberLiteral";
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
		return Double.compare(value, ((NumberLiteralExpression) o).value) == 0;
	}

	@Override
	public int hashCode()
	{
		return Double.hashCode(value);
	}

	@Override
	public String toString()
	{
		return "NumberLiteral(" + getRawText() + ")";
	}
}
