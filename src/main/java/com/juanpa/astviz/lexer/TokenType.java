// File: src/main/java/com/juanpa/astviz/lexer/TokenType.java

package com.juanpa.astviz.lexer;

/**
 * Defines the types of tokens recognized by the {@link Lexer}.
 * Each type carries the category it is reported under and, for fixed tokens, its symbol.
 */
public enum TokenType
{
	// --- Literals ---
	NUMBER(TokenCategory.NUMBER, null),
	STRING(TokenCategory.STRING, null),
	IDENTIFIER(TokenCategory.IDENTIFIER, null),

	// --- Operators ---
	ASSIGN(TokenCategory.OPERATOR, "="),
	PLUS(TokenCategory.OPERATOR, "+"),
	MINUS(TokenCategory.OPERATOR, "-"),
	STAR(TokenCategory.OPERATOR, "*"),
	SLASH(TokenCategory.OPERATOR, "/"),
	EQUAL_EQUAL(TokenCategory.OPERATOR, "=="),
	BANG_EQUAL(TokenCategory.OPERATOR, "!="),
	LESS(TokenCategory.OPERATOR, "<"),
	GREATER(TokenCategory.OPERATOR, ">"),
	LESS_EQUAL(TokenCategory.OPERATOR, "<="),
	GREATER_EQUAL(TokenCategory.OPERATOR, ">="),
	AMPERSAND_AMPERSAND(TokenCategory.OPERATOR, "&&"),
	PIPE_PIPE(TokenCategory.OPERATOR, "||"),
	BANG(TokenCategory.OPERATOR, "!"),

	// --- Punctuation & Delimiters ---
	LEFT_PAREN(TokenCategory.PUNCTUATION, "("),
	RIGHT_PAREN(TokenCategory.PUNCTUATION, ")"),
	LEFT_BRACKET(TokenCategory.PUNCTUATION, "["),
	RIGHT_BRACKET(TokenCategory.PUNCTUATION, "]"),
	LEFT_BRACE(TokenCategory.PUNCTUATION, "{"),
	RIGHT_BRACE(TokenCategory.PUNCTUATION, "}"),
	COMMA(TokenCategory.PUNCTUATION, ","),
	SEMICOLON(TokenCategory.PUNCTUATION, ";"),

	// --- Special Tokens ---
	END_OF_INPUT(TokenCategory.END_OF_INPUT, null);

	private final TokenCategory category;
	private final String symbol; // Fixed spelling, null for literals and identifiers

	TokenType(TokenCategory category, String symbol)
	{
		this.category = category;
		this.symbol = symbol;
	}

	public TokenCategory getCategory()
	{
		return category;
	}

	public String getSymbol()
	{
		return symbol;
	}

	/**
	 * Describes this token type the way error messages quote it, e.g. {@code ')'} or {@code identifier}.
	 */
	public String describe()
	{
		if (symbol != null)
		{
			return "'" + symbol + "'";
		}
		switch (this)
		{
			case NUMBER:
				return "number";
			case STRING:
				return "string";
			case IDENTIFIER:
				return "identifier";
			default:
				return "end of input";
		}
	}
}
