// File: src/main/java/com/juanpa/astviz/lexer/Lexer.java

package com.juanpa.astviz.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw source text and converts it into a list of Tokens.
 * This class identifies numbers, strings, identifiers, operators, and punctuation.
 * <p>
 * A Lexer instance scans its source once; create a new instance for every input.
 */
public class Lexer
{
	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;
	private boolean scanned = false;

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source;
	}

	/**
	 * Scans the entire source and returns its tokens, without the end-of-input marker.
	 * Empty or all-whitespace input yields an empty list.
	 *
	 * @return An unmodifiable list of tokens in source order.
	 * @throws LexError on the first unrecognized character, unterminated string or malformed number.
	 */
	public List<Token> tokenize()
	{
		List<Token> all = scanTokens();
		return Collections.unmodifiableList(all.subList(0, all.size() - 1));
	}

	/**
	 * Scans the entire source and returns its tokens followed by an END_OF_INPUT token.
	 * This is the form the parser consumes.
	 *
	 * @throws LexError on the first lexical error.
	 */
	public List<Token> scanTokens()
	{
		if (!scanned)
		{
			while (!isAtEnd())
			{
				start = current; // Mark the beginning of the current token

				// Save the starting position of the token before scanning it
				startLine = line;
				startColumn = column;

				scanToken(); // Scan and add the next token
			}

			tokens.add(new Token(TokenType.END_OF_INPUT, "", null, current, line, column));
			scanned = true;
		}
		return Collections.unmodifiableList(tokens);
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = advance(); // Get and consume the current character

		switch (c)
		{
			// --- Single-character tokens ---
			case '(':
				addToken(TokenType.LEFT_PAREN);
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case '{':
				addToken(TokenType.LEFT_BRACE);
				break;
			case '}':
				addToken(TokenType.RIGHT_BRACE);
				break;
			case '[':
				addToken(TokenType.LEFT_BRACKET);
				break;
			case ']':
				addToken(TokenType.RIGHT_BRACKET);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '+':
				addToken(TokenType.PLUS);
				break;
			case '-':
				addToken(TokenType.MINUS);
				break;
			case '*':
				addToken(TokenType.STAR);
				break;
			case '/':
				addToken(TokenType.SLASH);
				break;

			// --- Operators that can be single or double characters ---
			case '=':
				addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
				break;
			case '!':
				addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
				break;
			case '<':
				addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
				break;
			case '>':
				addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
				break;

			// --- Operators that only exist doubled ---
			case '&':
				if (!match('&'))
				{
					throw unexpectedCharacter(c);
				}
				addToken(TokenType.AMPERSAND_AMPERSAND);
				break;
			case '|':
				if (!match('|'))
				{
					throw unexpectedCharacter(c);
				}
				addToken(TokenType.PIPE_PIPE);
				break;

			// --- Literals ---
			case '"':
				scanStringLiteral();
				break;

			// --- Whitespace ---
			case ' ':
			case '\r':
			case '\t':
			case '\n':
				// Ignore whitespace; advance() keeps line and column up to date.
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isIdentifierStart(c))
				{
					scanIdentifier();
				}
				else
				{
					throw unexpectedCharacter(c);
				}
				break;
		}
	}

	/**
	 * Consumes the current character and returns it, also updates line/column.
	 *
	 * @return The consumed character.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	/**
	 * Adds a token to the list of tokens.
	 *
	 * @param type    The TokenType of the token.
	 * @param literal The literal value of the token (for numbers and strings).
	 */
	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, start, startLine, startColumn));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	/**
	 * Checks if the current character matches the expected character.
	 * If it matches, consumes it.
	 *
	 * @param expected The expected character.
	 * @return True if the character matched and was consumed, false otherwise.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd())
		{
			return false;
		}
		if (source.charAt(current) != expected)
		{
			return false;
		}

		advance();
		return true;
	}

	/**
	 * Looks at the current character without consuming it.
	 *
	 * @return The current character, or '\0' if at the end of the source.
	 */
	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierPart(char c)
	{
		return isIdentifierStart(c) || isDigit(c);
	}

	/**
	 * Scans a number literal: digits, an optional decimal point with optional digits,
	 * and an optional exponent with optional sign and at least one digit.
	 */
	private void scanNumber()
	{
		while (isDigit(peek()))
		{
			advance();
		}

		if (peek() == '.')
		{
			advance(); // Consume the '.'
			while (isDigit(peek()))
			{
				advance();
			}
		}

		if (peek() == 'e' || peek() == 'E')
		{
			advance(); // Consume the exponent marker
			if (peek() == '+' || peek() == '-')
			{
				advance();
			}
			if (!isDigit(peek()))
			{
				String text = source.substring(start, current);
				throw error(LexError.Kind.MALFORMED_EXPONENT,
						"Malformed exponent in numeric literal '" + text + "': expected a digit after the exponent marker.", text);
			}
			while (isDigit(peek()))
			{
				advance();
			}
		}

		// A letter glued to the number (12abc) is not a separate identifier
		if (isIdentifierPart(peek()))
		{
			while (isIdentifierPart(peek()))
			{
				advance();
			}
			String text = source.substring(start, current);
			throw error(LexError.Kind.INVALID_NUMBER, "Invalid numeric literal '" + text + "'.", text);
		}

		String numberStr = source.substring(start, current);
		addToken(TokenType.NUMBER, Double.parseDouble(numberStr));
	}

	/**
	 * Scans a string literal enclosed in double quotes, resolving escape sequences.
	 */
	private void scanStringLiteral()
	{
		StringBuilder value = new StringBuilder();
		while (peek() != '"' && !isAtEnd())
		{
			char c = advance();
			if (c == '\\')
			{
				if (isAtEnd())
				{
					break; // Reported as unterminated below
				}
				char escapeChar = advance();
				switch (escapeChar)
				{
					case 'n':
						value.append('\n');
						break;
					case 't':
						value.append('\t');
						break;
					case '"':
						value.append('"');
						break;
					case '\\':
						value.append('\\');
						break;
					default:
						// Unknown escapes keep the escaped character as-is
						value.append(escapeChar);
						break;
				}
			}
			else
			{
				value.append(c);
			}
		}

		if (isAtEnd())
		{
			throw new LexError(LexError.Kind.UNTERMINATED_STRING,
					"Unterminated string literal starting at position " + start + ".",
					source.substring(start), start, startLine, startColumn);
		}

		advance(); // Consume the closing '"'
		addToken(TokenType.STRING, value.toString());
	}

	/**
	 * Scans an identifier: an ASCII letter or underscore followed by letters, digits or underscores.
	 */
	private void scanIdentifier()
	{
		while (isIdentifierPart(peek()))
		{
			advance();
		}
		addToken(TokenType.IDENTIFIER);
	}

	private LexError unexpectedCharacter(char c)
	{
		return error(LexError.Kind.UNRECOGNIZED_CHARACTER,
				"Unexpected character '" + c + "' at position " + start + ".", String.valueOf(c));
	}

	private LexError error(LexError.Kind kind, String message, String offendingText)
	{
		return new LexError(kind, message, offendingText, start, startLine, startColumn);
	}
}
