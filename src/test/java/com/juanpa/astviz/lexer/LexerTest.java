package com.juanpa.astviz.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest
{
	private static List<TokenType> types(String source)
	{
		return new Lexer(source).tokenize().stream().map(Token::getType).collect(Collectors.toList());
	}

	@Test
	void emptyAndBlankInputProduceNoTokens()
	{
		assertTrue(new Lexer("").tokenize().isEmpty());
		assertTrue(new Lexer("  \t\r\n ").tokenize().isEmpty());
	}

	@Test
	void scanTokensEndsWithEndOfInput()
	{
		List<Token> tokens = new Lexer("a").scanTokens();
		assertEquals(2, tokens.size());
		assertEquals(TokenType.END_OF_INPUT, tokens.get(1).getType());
		assertEquals(1, tokens.get(1).getPosition());
	}

	@Test
	void assignmentOfStringLiteral()
	{
		List<Token> tokens = new Lexer("id2 = \"Mi nombre es Levi\"").tokenize();

		assertEquals(3, tokens.size());
		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		assertEquals("id2", tokens.get(0).getLexeme());
		assertEquals(0, tokens.get(0).getPosition());

		assertEquals(TokenType.ASSIGN, tokens.get(1).getType());
		assertEquals(4, tokens.get(1).getPosition());

		Token string = tokens.get(2);
		assertEquals(TokenType.STRING, string.getType());
		assertEquals(TokenCategory.STRING, string.getCategory());
		assertEquals("Mi nombre es Levi", string.getLiteral());
		assertEquals("\"Mi nombre es Levi\"", string.getLexeme());
		assertEquals(6, string.getPosition());
	}

	@Test
	void numberForms()
	{
		List<Token> tokens = new Lexer("12 3.5 1e5 2.3e-4 4. 7E+2").tokenize();
		assertEquals(6, tokens.size());
		assertEquals(12.0, tokens.get(0).getLiteral());
		assertEquals(3.5, tokens.get(1).getLiteral());
		assertEquals(1e5, tokens.get(2).getLiteral());
		assertEquals(2.3e-4, tokens.get(3).getLiteral());
		assertEquals(4.0, tokens.get(4).getLiteral());
		assertEquals("4.", tokens.get(4).getLexeme());
		assertEquals(700.0, tokens.get(5).getLiteral());
		tokens.forEach(t -> assertEquals(TokenCategory.NUMBER, t.getCategory()));
	}

	@Test
	void operatorsUseMaximalMunch()
	{
		assertEquals(List.of(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
						TokenType.AMPERSAND_AMPERSAND, TokenType.PIPE_PIPE, TokenType.ASSIGN, TokenType.BANG,
						TokenType.LESS, TokenType.GREATER),
				types("== != <= >= && || = ! < >"));
		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LESS_EQUAL, TokenType.MINUS, TokenType.NUMBER), types("a<=-1"));
	}

	@Test
	void punctuationIsOneTokenEach()
	{
		assertEquals(List.of(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACKET, TokenType.RIGHT_BRACKET,
						TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE, TokenType.COMMA, TokenType.SEMICOLON),
				types("()[]{},;"));
	}

	@Test
	void identifiersAllowUnderscoresAndDigits()
	{
		List<Token> tokens = new Lexer("_tmp x_1 abc9").tokenize();
		assertEquals(List.of("_tmp", "x_1", "abc9"), tokens.stream().map(Token::getLexeme).collect(Collectors.toList()));
		tokens.forEach(t -> assertEquals(TokenType.IDENTIFIER, t.getType()));
	}

	@Test
	void stringEscapes()
	{
		Token token = new Lexer("\"a\\\"b\\\\c\\nd\\te\\qf\"").tokenize().get(0);
		assertEquals("a\"b\\c\nd\te" + "qf", token.getLiteral());
	}

	@Test
	void tracksLinesAndColumns()
	{
		List<Token> tokens = new Lexer("a = 1;\n  b").tokenize();
		Token b = tokens.get(4);
		assertEquals("b", b.getLexeme());
		assertEquals(2, b.getLine());
		assertEquals(3, b.getColumn());
		assertEquals(9, b.getPosition());
	}

	@Test
	void unrecognizedCharacter()
	{
		LexError error = assertThrows(LexError.class, () -> new Lexer("a @ b").tokenize());
		assertEquals(LexError.Kind.UNRECOGNIZED_CHARACTER, error.getKind());
		assertEquals(2, error.getPosition());
		assertEquals("@", error.getOffendingText());
		assertEquals("Unexpected character '@' at position 2.", error.getMessage());
	}

	@Test
	void loneAmpersandOrPipeIsUnrecognized()
	{
		assertEquals(LexError.Kind.UNRECOGNIZED_CHARACTER, assertThrows(LexError.class, () -> new Lexer("a & b").tokenize()).getKind());
		assertEquals(LexError.Kind.UNRECOGNIZED_CHARACTER, assertThrows(LexError.class, () -> new Lexer("a | b").tokenize()).getKind());
	}

	@Test
	void unterminatedStringIsReportedAtTheOpeningQuote()
	{
		LexError error = assertThrows(LexError.class, () -> new Lexer("x = \"abc").tokenize());
		assertEquals(LexError.Kind.UNTERMINATED_STRING, error.getKind());
		assertEquals(4, error.getPosition());

		LexError trailingBackslash = assertThrows(LexError.class, () -> new Lexer("\"abc\\").tokenize());
		assertEquals(LexError.Kind.UNTERMINATED_STRING, trailingBackslash.getKind());
		assertEquals(0, trailingBackslash.getPosition());
	}

	@Test
	void exponentWithoutDigits()
	{
		assertEquals(LexError.Kind.MALFORMED_EXPONENT, assertThrows(LexError.class, () -> new Lexer("1e").tokenize()).getKind());
		assertEquals(LexError.Kind.MALFORMED_EXPONENT, assertThrows(LexError.class, () -> new Lexer("2.5E+ 1").tokenize()).getKind());
	}

	@Test
	void letterGluedToNumber()
	{
		LexError error = assertThrows(LexError.class, () -> new Lexer("x = 12abc").tokenize());
		assertEquals(LexError.Kind.INVALID_NUMBER, error.getKind());
		assertEquals("12abc", error.getOffendingText());
		assertEquals(4, error.getPosition());
	}

	@Test
	void tokenEqualityIgnoresPosition()
	{
		Token first = new Lexer("x").tokenize().get(0);
		Token second = new Lexer("   x").tokenize().get(0);
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertNotEquals(first.getPosition(), second.getPosition());
	}
}
