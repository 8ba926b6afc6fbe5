package com.juanpa.astviz.ast;

import com.juanpa.astviz.ast.expressions.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root of a parsed source: an ordered list of top-level expressions separated by ';'.
 * A source holding a single expression is a one-statement program.
 */
public class Program
{
	private final List<Expression> statements;

	public Program(List<Expression> statements)
	{
		this.statements = new ArrayList<>(statements);
	}

	public List<Expression> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		return statements.equals(((Program) o).statements);
	}

	@Override
	public int hashCode()
	{
		return statements.hashCode();
	}

	@Override
	public String toString()
	{
		return "Program" + statements;
	}
}
