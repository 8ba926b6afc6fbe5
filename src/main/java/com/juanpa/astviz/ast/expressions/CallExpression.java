// File: src/main/java/com/juanpa/astviz/ast/expressions/CallExpression.java

package com.juanpa.astviz.ast.expressions;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AST node representing a call of a named function with a list of argument expressions.
 */
public class CallExpression implements Expression
{
	private final Token name;        // The IDENTIFIER token naming the function
	private final List<Expression> arguments;

	public CallExpression(Token name, List<Expression> arguments)
	{
		this.name = name;
		this.arguments = new ArrayList<>(arguments);
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String getNodeType()
	{
		return "FunctionCall";
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		CallExpression that = (CallExpression) o;
		return getName().equals(that.getName()) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getName(), arguments);
	}

	@Override
	public String toString()
	{
		return "FunctionCall(\"" + getName() + "\", " + arguments + ")";
	}
}
