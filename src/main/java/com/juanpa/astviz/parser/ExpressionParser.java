// File: src/main/java/com/juanpa/astviz/parser/ExpressionParser.java

package com.juanpa.astviz.parser;

import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.ast.expressions.*;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenType;
import com.juanpa.astviz.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ExpressionParser is responsible for performing syntactic analysis.
 * It takes a list of tokens from the lexer and builds an Abstract Syntax Tree (AST).
 * This parser uses a recursive-descent approach with one method per precedence level,
 * from loosest to tightest:
 * <pre>
 * assignment     -> IDENTIFIER "=" assignment | or
 * or             -> and ( "||" and )*
 * and            -> equality ( "&amp;&amp;" equality )*
 * equality       -> comparison ( ( "==" | "!=" ) comparison )*
 * comparison     -> additive ( ( "&lt;" | "&gt;" | "&lt;=" | "&gt;=" ) additive )*
 * additive       -> multiplicative ( ( "+" | "-" ) multiplicative )*
 * multiplicative -> unary ( ( "*" | "/" ) unary )*
 * unary          -> ( "-" | "!" ) unary | primary
 * primary        -> NUMBER | STRING | IDENTIFIER ( "(" arguments? ")" )? | "(" assignment ")"
 * </pre>
 * Every decision is made on the current token alone; there is no backtracking and no
 * error recovery. The first error is thrown as a {@link ParseError}.
 */
public class ExpressionParser
{
	private final List<Token> tokens; // The list of tokens from the lexer, END_OF_INPUT last
	private int current = 0; // Current position in the token list

	/**
	 * Constructs an ExpressionParser.
	 *
	 * @param tokens The list of tokens produced by the lexer, with or without the END_OF_INPUT marker.
	 */
	public ExpressionParser(List<Token> tokens)
	{
		this.tokens = withEndMarker(tokens);
	}

	/**
	 * Parses exactly one expression, optionally followed by a ';'.
	 *
	 * @return The root of the expression tree.
	 * @throws ParseError if the tokens do not form a single expression.
	 */
	public Expression parse()
	{
		current = 0;
		Expression expression = expression();
		match(TokenType.SEMICOLON);
		if (!isAtEnd())
		{
			throw ParseError.unexpected(peek(), "end of input");
		}
		return expression;
	}

	/**
	 * Parses a sequence of expressions separated by ';'. Empty statements are skipped,
	 * so leading, trailing and repeated separators are allowed.
	 *
	 * @return The parsed Program, possibly with no statements.
	 * @throws ParseError on the first syntax error.
	 */
	public Program parseProgram()
	{
		current = 0;
		List<Expression> statements = new ArrayList<>();
		while (!isAtEnd())
		{
			if (match(TokenType.SEMICOLON))
			{
				continue;
			}
			statements.add(expression());
			if (!isAtEnd() && !check(TokenType.SEMICOLON))
			{
				throw ParseError.unexpected(peek(), "';' or end of input");
			}
		}
		Debug.log("Parsed program with %d statement(s)", statements.size());
		return new Program(statements);
	}

	private Expression expression()
	{
		return assignment();
	}

	/**
	 * Parses an assignment. The target is checked before the right-hand side is parsed,
	 * so an invalid target is reported even when the value is also malformed.
	 */
	private Expression assignment()
	{
		Expression expr = or();

		if (match(TokenType.ASSIGN))
		{
			if (!(expr instanceof IdentifierExpression))
			{
				throw new ParseError(ParseError.Kind.INVALID_ASSIGNMENT_TARGET, "an identifier", expr.getFirstToken());
			}
			Token target = ((IdentifierExpression) expr).getNameToken();
			Debug.log("Assignment to '%s'", target.getLexeme());
			Debug.indent();
			Expression value = assignment(); // Right-associative
			Debug.dedent();
			return new AssignmentExpression(target, value);
		}
		return expr;
	}

	private Expression or()
	{
		Expression expr = and();

		while (match(TokenType.PIPE_PIPE))
		{
			Token operator = previous();
			Expression right = and();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression and()
	{
		Expression expr = equality();

		while (match(TokenType.AMPERSAND_AMPERSAND))
		{
			Token operator = previous();
			Expression right = equality();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression equality()
	{
		Expression expr = comparison();

		while (match(TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL))
		{
			Token operator = previous();
			Expression right = comparison();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Relational operators are left-associative: a &lt; b &lt; c parses as (a &lt; b) &lt; c.
	 */
	private Expression comparison()
	{
		Expression expr = additive();

		while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL))
		{
			Token operator = previous();
			Expression right = additive();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression additive()
	{
		Expression expr = multiplicative();

		while (match(TokenType.MINUS, TokenType.PLUS))
		{
			Token operator = previous();
			Expression right = multiplicative();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression multiplicative()
	{
		Expression expr = unary();

		while (match(TokenType.SLASH, TokenType.STAR))
		{
			Token operator = previous();
			Expression right = unary();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Parses prefix unary expressions (e.g., `-x`, `!ok`, `- -x`).
	 * A '-' reaching this level is unary; binary minus is consumed by additive().
	 *
	 * @return A UnaryExpression AST node or a higher precedence expression.
	 */
	private Expression unary()
	{
		if (match(TokenType.BANG, TokenType.MINUS))
		{
			Token operator = previous();
			Expression operand = unary();
			return new UnaryExpression(operator, operand);
		}
		return primary();
	}

	/**
	 * Parses the most basic expressions: literals, identifiers, calls and parenthesized expressions.
	 *
	 * @return The parsed primary Expression AST node.
	 */
	private Expression primary()
	{
		if (match(TokenType.NUMBER))
		{
			return new NumberLiteralExpression(previous());
		}

		if (match(TokenType.STRING))
		{
			return new StringLiteralExpression(previous());
		}

		if (match(TokenType.IDENTIFIER))
		{
			Token name = previous();
			if (match(TokenType.LEFT_PAREN))
			{
				return finishCall(name);
			}
			return new IdentifierExpression(name);
		}

		if (match(TokenType.LEFT_PAREN))
		{
			Token leftParen = previous();
			Expression expr = expression();
			consume(TokenType.RIGHT_PAREN, "')' after expression");
			return new GroupingExpression(leftParen, expr);
		}

		throw ParseError.unexpected(peek(), "expression");
	}

	/**
	 * Parses the argument list of a call whose name and '(' have been consumed.
	 */
	private Expression finishCall(Token name)
	{
		Debug.log("Call to '%s'", name.getLexeme());
		Debug.indent();
		List<Expression> arguments = new ArrayList<>();
		if (!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				if (check(TokenType.RIGHT_PAREN))
				{
					throw new ParseError(ParseError.Kind.DANGLING_SEPARATOR, "an argument after ','", peek());
				}
				arguments.add(expression());
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "',' or ')' after argument");
		Debug.dedent();
		return new CallExpression(name, arguments);
	}

	/**
	 * Consumes the current token if its type matches any of the given types.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type, otherwise throws.
	 *
	 * @param type     The expected TokenType.
	 * @param expected Description of what was expected, used in the error message.
	 * @return The consumed Token.
	 * @throws ParseError if the current token's type does not match the expected type.
	 */
	private Token consume(TokenType type, String expected)
	{
		if (check(type))
		{
			return advance();
		}
		throw ParseError.unexpected(peek(), expected);
	}

	private boolean check(TokenType type)
	{
		if (isAtEnd())
		{
			return false;
		}
		return peek().getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.END_OF_INPUT;
	}

	/**
	 * Returns the token list terminated by exactly one END_OF_INPUT token.
	 * Tokens after an END_OF_INPUT are ignored; a missing marker is placed just past the last token.
	 */
	private static List<Token> withEndMarker(List<Token> tokens)
	{
		List<Token> result = new ArrayList<>(tokens.size() + 1);
		for (Token token : tokens)
		{
			result.add(token);
			if (token.getType() == TokenType.END_OF_INPUT)
			{
				return Collections.unmodifiableList(result);
			}
		}

		if (result.isEmpty())
		{
			result.add(new Token(TokenType.END_OF_INPUT, "", null, 0, 1, 1));
		}
		else
		{
			Token last = result.get(result.size() - 1);
			result.add(new Token(TokenType.END_OF_INPUT, "", null, last.getEndPosition(), last.getLine(),
					last.getColumn() + last.getLexeme().length()));
		}
		return Collections.unmodifiableList(result);
	}
}
