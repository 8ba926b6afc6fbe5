package com.juanpa.astviz.util;

/**
 * One reported error.
 *
 * @param stage    The stage that rejected the input.
 * @param line     1-based line, or 0 when the error has no location.
 * @param column   1-based column, or 0 when the error has no location.
 * @param position Zero-based character offset, or -1 when the error has no location.
 * @param message  The user-facing message.
 */
public record Diagnostic(Stage stage, int line, int column, int position, String message)
{
	public enum Stage
	{
		INPUT,
		LEXER,
		PARSER
	}

	public static Diagnostic unlocated(Stage stage, String message)
	{
		return new Diagnostic(stage, 0, 0, -1, message);
	}

	public boolean hasLocation()
	{
		return position >= 0;
	}

	/**
	 * "[Error] Line x, Column y: message", or "[Error] message" without a location.
	 */
	public String format()
	{
		if (!hasLocation())
		{
			return "[Error] " + message;
		}
		return "[Error] Line " + line + ", Column " + column + ": " + message;
	}
}
