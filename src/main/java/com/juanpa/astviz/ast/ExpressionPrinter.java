package com.juanpa.astviz.ast;

import com.juanpa.astviz.ast.expressions.*;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders an expression tree back to source text in a canonical layout.
 * No parentheses are added beyond the tree's own grouping nodes, so parsing the
 * output of a parsed tree gives back an equal tree.
 * <p>
 * A {@link #memoizing()} printer remembers the text of every node it has printed, by identity,
 * and reuses it when that node is printed again as part of a larger tree.
 */
public class ExpressionPrinter implements ASTVisitor<String>
{
	private final Map<Expression, String> printed; // null unless memoizing

	public ExpressionPrinter()
	{
		this(null);
	}

	private ExpressionPrinter(Map<Expression, String> printed)
	{
		this.printed = printed;
	}

	public static ExpressionPrinter memoizing()
	{
		return new ExpressionPrinter(new IdentityHashMap<>());
	}

	public String print(Expression expression)
	{
		if (printed == null)
		{
			return expression.accept(this);
		}
		String text = printed.get(expression);
		if (text == null)
		{
			text = expression.accept(this);
			printed.put(expression, text);
		}
		return text;
	}

	/**
	 * Renders every statement of a program, separated by "; ".
	 */
	public String print(Program program)
	{
		StringJoiner joiner = new StringJoiner("; ");
		for (Expression statement : program.getStatements())
		{
			joiner.add(print(statement));
		}
		return joiner.toString();
	}

	@Override
	public String visitNumberLiteralExpression(NumberLiteralExpression expression)
	{
		return expression.getRawText();
	}

	@Override
	public String visitStringLiteralExpression(StringLiteralExpression expression)
	{
		return quote(expression.getValue());
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return expression.getName();
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		return print(expression.getLeft()) + " " + expression.getOperatorSymbol() + " " + print(expression.getRight());
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		return expression.getOperatorSymbol() + print(expression.getOperand());
	}

	@Override
	public String visitAssignmentExpression(AssignmentExpression expression)
	{
		return expression.getTarget() + " = " + print(expression.getValue());
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		List<Expression> arguments = expression.getArguments();
		StringJoiner joiner = new StringJoiner(", ", expression.getName() + "(", ")");
		for (Expression argument : arguments)
		{
			joiner.add(print(argument));
		}
		return joiner.toString();
	}

	@Override
	public String visitGroupingExpression(GroupingExpression expression)
	{
		return "(" + print(expression.getExpression()) + ")";
	}

	/**
	 * Wraps a string value in double quotes, escaping the characters the lexer unescapes.
	 */
	static String quote(String value)
	{
		StringBuilder sb = new StringBuilder(value.length() + 2);
		sb.append('"');
		for (int i = 0; i < value.length(); i++)
		{
			char c = value.charAt(i);
			switch (c)
			{
				case '"':
					sb.append("\\\"");
					break;
				case '\\':
					sb.append("\\\\");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\t':
					sb.append("\\t");
					break;
				default:
					sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
