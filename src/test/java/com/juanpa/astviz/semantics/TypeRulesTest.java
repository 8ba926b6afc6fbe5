package com.juanpa.astviz.semantics;

import com.juanpa.astviz.lexer.TokenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class TypeRulesTest
{
	@ParameterizedTest
	@EnumSource(value = TokenType.class, names = {"PLUS", "MINUS", "STAR", "SLASH", "LESS", "GREATER", "LESS_EQUAL",
			"GREATER_EQUAL", "EQUAL_EQUAL", "BANG_EQUAL", "AMPERSAND_AMPERSAND", "PIPE_PIPE"})
	void numbersWorkWithEveryOperator(TokenType operator)
	{
		TypeRules.Outcome outcome = TypeRules.checkBinary(operator, DataType.NUMBER, DataType.NUMBER);
		assertTrue(outcome.valid());
		assertEquals(DataType.NUMBER, outcome.resultType());
		assertNull(outcome.errorMessage());
	}

	@Test
	void stringOperators()
	{
		assertEquals(DataType.STRING, TypeRules.checkBinary(TokenType.PLUS, DataType.STRING, DataType.STRING).resultType());
		assertEquals(DataType.NUMBER, TypeRules.checkBinary(TokenType.EQUAL_EQUAL, DataType.STRING, DataType.STRING).resultType());
		assertEquals(DataType.NUMBER, TypeRules.checkBinary(TokenType.BANG_EQUAL, DataType.STRING, DataType.STRING).resultType());
		assertFalse(TypeRules.checkBinary(TokenType.LESS, DataType.STRING, DataType.STRING).valid());
		assertFalse(TypeRules.checkBinary(TokenType.PIPE_PIPE, DataType.STRING, DataType.STRING).valid());
	}

	@ParameterizedTest
	@EnumSource(value = TokenType.class, names = {"PLUS", "MINUS", "EQUAL_EQUAL", "AMPERSAND_AMPERSAND"})
	void mixingIsNeverValid(TokenType operator)
	{
		TypeRules.Outcome forward = TypeRules.checkBinary(operator, DataType.STRING, DataType.NUMBER);
		TypeRules.Outcome backward = TypeRules.checkBinary(operator, DataType.NUMBER, DataType.STRING);
		assertFalse(forward.valid());
		assertFalse(backward.valid());
		assertEquals(DataType.UNKNOWN, forward.resultType());
		assertEquals(DataType.UNKNOWN, backward.resultType());
	}

	@Test
	void unknownOperandFailsTheCheck()
	{
		TypeRules.Outcome outcome = TypeRules.checkBinary(TokenType.PLUS, DataType.UNKNOWN, DataType.STRING);
		assertFalse(outcome.valid());
		assertEquals("String", outcome.expectedType());
		assertEquals("Unknown and String", outcome.actualType());
		assertEquals(DataType.UNKNOWN, outcome.resultType());
	}

	@Test
	void expectedTypeFollowsTheLeftOperand()
	{
		assertEquals("String", TypeRules.checkBinary(TokenType.PLUS, DataType.STRING, DataType.NUMBER).expectedType());
		assertEquals("Number", TypeRules.checkBinary(TokenType.PLUS, DataType.NUMBER, DataType.STRING).expectedType());
		assertEquals("Number", TypeRules.checkBinary(TokenType.STAR, DataType.STRING, DataType.NUMBER).expectedType());
	}

	@Test
	void unaryOperators()
	{
		assertTrue(TypeRules.checkUnary(TokenType.MINUS, DataType.NUMBER).valid());
		assertTrue(TypeRules.checkUnary(TokenType.BANG, DataType.NUMBER).valid());
		assertFalse(TypeRules.checkUnary(TokenType.MINUS, DataType.STRING).valid());
		assertEquals(DataType.UNKNOWN, TypeRules.checkUnary(TokenType.BANG, DataType.UNKNOWN).resultType());
	}

	@Test
	void rejectsNonOperators()
	{
		assertThrows(IllegalArgumentException.class, () -> TypeRules.checkBinary(TokenType.ASSIGN, DataType.NUMBER, DataType.NUMBER));
		assertThrows(IllegalArgumentException.class, () -> TypeRules.checkUnary(TokenType.PLUS, DataType.NUMBER));
	}
}
