package com.juanpa.astviz.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, NUMBER, PLUS)
	private final String lexeme;     // The raw text of the token, quotes included for strings
	private final Object literal;    // Double for numbers, the unescaped String for strings, null otherwise
	private final int position;      // Zero-based character offset where the token begins
	private final int line;
	private final int column;

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type     The TokenType of this token.
	 * @param lexeme   The raw string value of the token from the source code.
	 * @param literal  The parsed literal value for literal tokens. Null for non-literal tokens.
	 * @param position The zero-based offset of the first character of the token.
	 * @param line     The line number where this token begins (1-based).
	 * @param column   The column number where this token begins (1-based).
	 */
	public Token(TokenType type, String lexeme, Object literal, int position, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.position = position;
		this.line = line;
		this.column = column;
	}

	// --- Getters for Token properties ---

	public TokenType getType()
	{
		return type;
	}

	public TokenCategory getCategory()
	{
		return type.getCategory();
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getPosition()
	{
		return position;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Offset just past the last character of this token.
	 */
	public int getEndPosition()
	{
		return position + lexeme.length();
	}

	/**
	 * Describes this token for error messages: the quoted lexeme, or "end of input".
	 */
	public String describe()
	{
		if (type == TokenType.END_OF_INPUT)
		{
			return "end of input";
		}
		return "'" + lexeme + "'";
	}

	/**
	 * Provides a string representation of the Token, useful for debugging.
	 * Format: "TokenType 'lexeme' [literal] @position"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " @" + position;
	}

	/**
	 * Compares type, lexeme, and literal. Positions are not included as
	 * tokens from different positions are still "the same" token.
	 */
	@Override
	public boolean equals(Object o)
	{
		if(this == o)
			return true;
		if(o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;

		if(type != token.type)
			return false;
		if(!lexeme.equals(token.lexeme))
			return false;
		return Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
