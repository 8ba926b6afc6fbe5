package com.juanpa.astviz.semantics;

import com.juanpa.astviz.lexer.TokenType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Typing of the operators.
 * <ul>
 *     <li>Number with Number is valid for every binary operator and gives Number.</li>
 *     <li>String with String is valid for '+' (giving String) and for '==' and '!=' (giving Number).</li>
 *     <li>'&amp;&amp;' and '||' need Number on both sides.</li>
 *     <li>Number mixed with String is never valid.</li>
 *     <li>An Unknown operand makes the check invalid.</li>
 * </ul>
 * An invalid check always gives Unknown so the failure is visible to the enclosing expression.
 */
public final class TypeRules
{
	private static final Set<TokenType> BINARY_OPERATORS = EnumSet.of(
			TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH,
			TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
			TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
			TokenType.AMPERSAND_AMPERSAND, TokenType.PIPE_PIPE);

	private static final Set<TokenType> STRING_OPERATORS = EnumSet.of(
			TokenType.PLUS, TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL);

	private TypeRules()
	{
	}

	/**
	 * The outcome of typing one operator application.
	 *
	 * @param valid        Whether the operand types are accepted.
	 * @param resultType   The type of the whole expression; Unknown when invalid.
	 * @param expectedType The operand type the operator asked for.
	 * @param actualType   The operand types that were found.
	 * @param errorMessage Why the check failed, or null when valid.
	 */
	public record Outcome(boolean valid, DataType resultType, String expectedType, String actualType, String errorMessage)
	{
	}

	/**
	 * Types a binary operator applied to operands of the given types.
	 *
	 * @throws IllegalArgumentException if the operator is not a binary operator.
	 */
	public static Outcome checkBinary(TokenType operator, DataType left, DataType right)
	{
		if (!BINARY_OPERATORS.contains(operator))
		{
			throw new IllegalArgumentException("Not a binary operator: " + operator);
		}

		String symbol = operator.getSymbol();
		String expected = expectedOperandType(operator, left, right).getName();
		String actual = describeOperands(left, right);

		if (!left.isKnown() || !right.isKnown())
		{
			return invalid(expected, actual, "Cannot check '" + symbol + "': operand of type Unknown ("
					+ describeOperands(left, right) + ").");
		}

		if (left != right)
		{
			return invalid(expected, actual, "Type mismatch: cannot apply '" + symbol + "' to "
					+ left.getName() + " and " + right.getName() + ".");
		}

		if (left == DataType.STRING)
		{
			if (!STRING_OPERATORS.contains(operator))
			{
				return invalid(expected, actual, "Operator '" + symbol + "' is not defined for String operands.");
			}
			DataType result = operator == TokenType.PLUS ? DataType.STRING : DataType.NUMBER;
			return new Outcome(true, result, expected, actual, null);
		}

		return new Outcome(true, DataType.NUMBER, expected, actual, null);
	}

	/**
	 * Types a prefix operator; both '-' and '!' need a Number operand.
	 */
	public static Outcome checkUnary(TokenType operator, DataType operand)
	{
		if (operator != TokenType.MINUS && operator != TokenType.BANG)
		{
			throw new IllegalArgumentException("Not a unary operator: " + operator);
		}
		String expected = DataType.NUMBER.getName();
		if (operand == DataType.NUMBER)
		{
			return new Outcome(true, DataType.NUMBER, expected, operand.getName(), null);
		}
		return invalid(expected, operand.getName(), "Unary '" + operator.getSymbol() + "' requires a Number operand but found "
				+ operand.getName() + ".");
	}

	private static Outcome invalid(String expected, String actual, String message)
	{
		return new Outcome(false, DataType.UNKNOWN, expected, actual, message);
	}

	/**
	 * Operators that accept Strings expect whatever a known String side suggests; all others expect Number.
	 */
	private static DataType expectedOperandType(TokenType operator, DataType left, DataType right)
	{
		if (STRING_OPERATORS.contains(operator))
		{
			if (left == DataType.STRING || (!left.isKnown() && right == DataType.STRING))
			{
				return DataType.STRING;
			}
		}
		return DataType.NUMBER;
	}

	private static String describeOperands(DataType left, DataType right)
	{
		if (left == right)
		{
			return left.getName();
		}
		return left.getName() + " and " + right.getName();
	}
}
