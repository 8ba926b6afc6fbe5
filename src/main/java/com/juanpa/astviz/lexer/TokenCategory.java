package com.juanpa.astviz.lexer;

/**
 * Coarse classification of tokens, as shown to consumers of the token stream.
 * Every {@link TokenType} belongs to exactly one category.
 */
public enum TokenCategory
{
	NUMBER("Number"),
	STRING("String"),
	IDENTIFIER("Identifier"),
	OPERATOR("Operator"),
	PUNCTUATION("Punctuation"),
	END_OF_INPUT("EndOfInput");

	private final String displayName;

	TokenCategory(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}
}
