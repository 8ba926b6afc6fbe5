package com.juanpa.astviz.service;

import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.lexer.Lexer;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.parser.ExpressionParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InputGuardTest
{
	private final InputGuard guard = new InputGuard(20, 4);

	@Test
	void sourceLengthLimit()
	{
		assertDoesNotThrow(() -> guard.checkSource("a".repeat(20)));
		InputRejectedException e = assertThrows(InputRejectedException.class, () -> guard.checkSource("a".repeat(21)));
		assertEquals(-1, e.getPosition());
	}

	@Test
	void parenthesesCount()
	{
		assertDoesNotThrow(() -> guard.checkNesting(new Lexer("((((x))))").scanTokens()));
		InputRejectedException e = assertThrows(InputRejectedException.class,
				() -> guard.checkNesting(new Lexer("(((((x)))))").scanTokens()));
		assertEquals(4, e.getPosition());
	}

	@Test
	void prefixRunsAddToParentheses()
	{
		assertThrows(InputRejectedException.class, () -> guard.checkNesting(new Lexer("((-!-x))").scanTokens()));
		assertDoesNotThrow(() -> guard.checkNesting(new Lexer("((-x)) + ((!y))").scanTokens()));
	}

	@Test
	void closingParenthesisEndsTheRun()
	{
		assertDoesNotThrow(() -> guard.checkNesting(new Lexer("(- -1) - (- -1) - (- -1)").scanTokens()));
	}

	@Test
	void minusIsPrefixOnlyWhereAnOperandIsExpected()
	{
		List<Token> tokens = new Lexer("-a - -b, (-c)").tokenize();
		assertTrue(InputGuard.isPrefixOperator(tokens.get(0), null));
		assertFalse(InputGuard.isPrefixOperator(tokens.get(2), tokens.get(1)));
		assertTrue(InputGuard.isPrefixOperator(tokens.get(3), tokens.get(2)));
		assertTrue(InputGuard.isPrefixOperator(tokens.get(7), tokens.get(6)));
	}

	@Test
	void assignmentsAddToNestingWithinAStatement()
	{
		assertDoesNotThrow(() -> guard.checkNesting(new Lexer("a=b=c=d=1").scanTokens()));
		assertThrows(InputRejectedException.class, () -> guard.checkNesting(new Lexer("a=b=c=d=e=1").scanTokens()));
		assertDoesNotThrow(() -> guard.checkNesting(new Lexer("a=1;b=2;c=3;d=4;e=5").scanTokens()));
	}

	@Test
	void depthCountsEveryLevelOfTheTree()
	{
		assertDoesNotThrow(() -> guard.checkDepth(program("1+2+3+4")));
		InputRejectedException e = assertThrows(InputRejectedException.class, () -> guard.checkDepth(program("1+2+3+4+5")));
		assertTrue(e.getMessage().contains("5 levels deep"));
		assertTrue(e.getMessage().contains("limit of 4"));
	}

	@Test
	void depthIsMeasuredPerStatement()
	{
		assertDoesNotThrow(() -> guard.checkDepth(program("1+2+3+4; f(1+2, -(x))")));
		InputRejectedException e = assertThrows(InputRejectedException.class,
				() -> guard.checkDepth(program("1; f(g(h(-x)))")));
		assertTrue(e.getMessage().startsWith("Statement 2 "));
	}

	private static Program program(String source)
	{
		return new ExpressionParser(new Lexer(source).scanTokens()).parseProgram();
	}
}
