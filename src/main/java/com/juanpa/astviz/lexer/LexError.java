package com.juanpa.astviz.lexer;

/**
 * Thrown by the {@link Lexer} on the first character sequence it cannot turn into a token.
 * Lexing stops there; no partial token list is returned.
 */
public class LexError extends RuntimeException
{
	public enum Kind
	{
		UNRECOGNIZED_CHARACTER,
		UNTERMINATED_STRING,
		MALFORMED_EXPONENT,
		INVALID_NUMBER
	}

	private final Kind kind;
	private final int position;
	private final int line;
	private final int column;
	private final String offendingText; // The character or partial lexeme at fault

	public LexError(Kind kind, String message, String offendingText, int position, int line, int column)
	{
		super(message);
		this.kind = kind;
		this.offendingText = offendingText;
		this.position = position;
		this.line = line;
		this.column = column;
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getOffendingText()
	{
		return offendingText;
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
}
