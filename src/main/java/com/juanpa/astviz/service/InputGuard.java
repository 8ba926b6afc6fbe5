package com.juanpa.astviz.service;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.ast.expressions.*;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.lexer.TokenCategory;
import com.juanpa.astviz.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rejects inputs large or deep enough to exhaust the recursive stages.
 * <p>
 * Before parsing, {@link #checkNesting} bounds the parser's own recursion: open parentheses,
 * the current run of prefix operators and the '=' signs of the statement.
 * After parsing, {@link #checkDepth} bounds the tree walks by measuring the depth of every statement,
 * which also catches long left-deep operator chains the parser builds in a loop.
 */
public class InputGuard
{
	private final int maxSourceLength;
	private final int maxNestingDepth;

	public InputGuard(int maxSourceLength, int maxNestingDepth)
	{
		this.maxSourceLength = maxSourceLength;
		this.maxNestingDepth = maxNestingDepth;
	}

	/**
	 * @throws InputRejectedException if the source is longer than the limit.
	 */
	public void checkSource(String source)
	{
		if (source.length() > maxSourceLength)
		{
			throw new InputRejectedException("Input is " + source.length() + " characters long, more than the limit of "
					+ maxSourceLength + ".", -1);
		}
	}

	/**
	 * @throws InputRejectedException at the first token that nests deeper than the limit.
	 */
	public void checkNesting(List<Token> tokens)
	{
		int parens = 0;
		int prefixRun = 0;
		int assignments = 0; // Per statement; each '=' is one level of right recursion
		Token previous = null;
		for (Token token : tokens)
		{
			TokenType type = token.getType();
			if (type == TokenType.SEMICOLON)
			{
				assignments = 0;
				prefixRun = 0;
			}
			else if (type == TokenType.ASSIGN)
			{
				assignments++;
				prefixRun = 0;
			}
			else if (type == TokenType.LEFT_PAREN)
			{
				parens++;
			}
			else if (type == TokenType.RIGHT_PAREN)
			{
				parens = Math.max(0, parens - 1);
				prefixRun = 0;
			}
			else if (isPrefixOperator(token, previous))
			{
				prefixRun++;
			}
			else
			{
				prefixRun = 0;
			}

			int depth = parens + prefixRun + assignments;
			if (depth > maxNestingDepth)
			{
				throw new InputRejectedException("Input nests deeper than the limit of " + maxNestingDepth
						+ " levels at position " + token.getPosition() + ".", token.getPosition());
			}
			previous = token;
		}
	}

	/**
	 * Measures each statement without recursion, so a tree of any depth can be checked safely.
	 * A lone literal has depth 1.
	 *
	 * @throws InputRejectedException if a statement is deeper than the limit.
	 */
	public void checkDepth(Program program)
	{
		ChildCollector childCollector = new ChildCollector();
		List<Expression> statements = program.getStatements();
		for (int i = 0; i < statements.size(); i++)
		{
			int depth = measureDepth(statements.get(i), childCollector);
			if (depth > maxNestingDepth)
			{
				throw new InputRejectedException("Statement " + (i + 1) + " is " + depth
						+ " levels deep, more than the limit of " + maxNestingDepth + ".", -1);
			}
		}
	}

	private static int measureDepth(Expression root, ChildCollector childCollector)
	{
		Deque<Expression> pending = new ArrayDeque<>();
		Deque<Integer> depths = new ArrayDeque<>();
		pending.push(root);
		depths.push(1);
		int deepest = 0;
		while (!pending.isEmpty())
		{
			Expression node = pending.pop();
			int depth = depths.pop();
			deepest = Math.max(deepest, depth);
			for (Expression child : node.accept(childCollector))
			{
				pending.push(child);
				depths.push(depth + 1);
			}
		}
		return deepest;
	}

	/**
	 * Lists the direct children of a node.
	 */
	private static class ChildCollector implements ASTVisitor<List<Expression>>
	{
		@Override
		public List<Expression> visitNumberLiteralExpression(NumberLiteralExpression expression)
		{
			return List.of();
		}

		@Override
		public List<Expression> visitStringLiteralExpression(StringLiteralExpression expression)
		{
			return List.of();
		}

		@Override
		public List<Expression> visitIdentifierExpression(IdentifierExpression expression)
		{
			return List.of();
		}

		@Override
		public List<Expression> visitBinaryExpression(BinaryExpression expression)
		{
			return List.of(expression.getLeft(), expression.getRight());
		}

		@Override
		public List<Expression> visitUnaryExpression(UnaryExpression expression)
		{
			return List.of(expression.getOperand());
		}

		@Override
		public List<Expression> visitAssignmentExpression(AssignmentExpression expression)
		{
			return List.of(expression.getValue());
		}

		@Override
		public List<Expression> visitCallExpression(CallExpression expression)
		{
			return expression.getArguments();
		}

		@Override
		public List<Expression> visitGroupingExpression(GroupingExpression expression)
		{
			return List.of(expression.getExpression());
		}
	}

	/**
	 * '!' is always prefix; '-' is prefix at the start or after an operator, '(', ',' or ';'.
	 */
	static boolean isPrefixOperator(Token token, Token previous)
	{
		if (token.getType() == TokenType.BANG)
		{
			return true;
		}
		if (token.getType() != TokenType.MINUS)
		{
			return false;
		}
		return previous == null
				|| previous.getCategory() == TokenCategory.OPERATOR
				|| previous.getType() == TokenType.LEFT_PAREN
				|| previous.getType() == TokenType.COMMA
				|| previous.getType() == TokenType.SEMICOLON;
	}
}
