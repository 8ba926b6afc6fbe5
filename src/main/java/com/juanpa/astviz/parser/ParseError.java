package com.juanpa.astviz.parser;

import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenType;

/**
 * Thrown by the {@link ExpressionParser} at the first token it cannot fit into the grammar.
 * Parsing stops there; no partial tree is returned.
 * <p>
 * Running out of tokens has its own kind so callers can tell "unexpected end of input"
 * apart from "expected ')' but found ...".
 */
public class ParseError extends RuntimeException
{
	public enum Kind
	{
		UNEXPECTED_TOKEN,
		UNEXPECTED_END_OF_INPUT,
		INVALID_ASSIGNMENT_TARGET,
		DANGLING_SEPARATOR
	}

	private final Kind kind;
	private final String expected; // What the grammar wanted at this point, e.g. "')'" or "expression"
	private final Token found;

	public ParseError(Kind kind, String expected, Token found)
	{
		super(buildMessage(kind, expected, found));
		this.kind = kind;
		this.expected = expected;
		this.found = found;
	}

	/**
	 * Creates the error for a token that does not fit, choosing the end-of-input kind
	 * when the parser has run out of tokens.
	 */
	static ParseError unexpected(Token found, String expected)
	{
		Kind kind = found.getType() == TokenType.END_OF_INPUT ? Kind.UNEXPECTED_END_OF_INPUT : Kind.UNEXPECTED_TOKEN;
		return new ParseError(kind, expected, found);
	}

	private static String buildMessage(Kind kind, String expected, Token found)
	{
		switch (kind)
		{
			case UNEXPECTED_END_OF_INPUT:
				return "Unexpected end of input, expected " + expected + ".";
			case INVALID_ASSIGNMENT_TARGET:
				return "Invalid assignment target at position " + found.getPosition() + ": expected " + expected
						+ " before '=' but found " + found.describe() + ".";
			case DANGLING_SEPARATOR:
				return "Dangling ',' in argument list: expected " + expected + " but found "
						+ found.describe() + " at position " + found.getPosition() + ".";
			default:
				return "Expected " + expected + " but found " + found.describe() + " at position " + found.getPosition() + ".";
		}
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getExpected()
	{
		return expected;
	}

	public Token getFound()
	{
		return found;
	}

	public int getPosition()
	{
		return found.getPosition();
	}

	public int getLine()
	{
		return found.getLine();
	}

	public int getColumn()
	{
		return found.getColumn();
	}
}
