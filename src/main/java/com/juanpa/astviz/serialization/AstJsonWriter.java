package com.juanpa.astviz.serialization;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.ast.expressions.*;

/**
 * Converts a tree to a Jackson tree, one object per node, tagged with its node type:
 * {@code {"type":"BinaryOp","operator":"+","left":{...},"right":{...}}}.
 */
public class AstJsonWriter implements ASTVisitor<ObjectNode>
{
	private final JsonNodeFactory factory;

	public AstJsonWriter()
	{
		this(JsonNodeFactory.instance);
	}

	public AstJsonWriter(JsonNodeFactory factory)
	{
		this.factory = factory;
	}

	public ObjectNode write(Program program)
	{
		ObjectNode node = factory.objectNode();
		node.put("type", "Program");
		ArrayNode statements = node.putArray("statements");
		for (Expression statement : program.getStatements())
		{
			statements.add(statement.accept(this));
		}
		return node;
	}

	public ObjectNode write(Expression expression)
	{
		return expression.accept(this);
	}

	private ObjectNode node(Expression expression)
	{
		ObjectNode node = factory.objectNode();
		node.put("type", expression.getNodeType());
		return node;
	}

	@Override
	public ObjectNode visitNumberLiteralExpression(NumberLiteralExpression expression)
	{
		ObjectNode node = node(expression);
		node.put("value", expression.getValue());
		node.put("raw", expression.getRawText());
		return node;
	}

	@Override
	public ObjectNode visitStringLiteralExpression(StringLiteralExpression expression)
	{
		return node(expression).put("value", expression.getValue());
	}

	@Override
	public ObjectNode visitIdentifierExpression(IdentifierExpression expression)
	{
		return node(expression).put("name", expression.getName());
	}

	@Override
	public ObjectNode visitBinaryExpression(BinaryExpression expression)
	{
		ObjectNode node = node(expression);
		node.put("operator", expression.getOperatorSymbol());
		node.set("left", expression.getLeft().accept(this));
		node.set("right", expression.getRight().accept(this));
		return node;
	}

	@Override
	public ObjectNode visitUnaryExpression(UnaryExpression expression)
	{
		ObjectNode node = node(expression);
		node.put("operator", expression.getOperatorSymbol());
		node.set("operand", expression.getOperand().accept(this));
		return node;
	}

	@Override
	public ObjectNode visitAssignmentExpression(AssignmentExpression expression)
	{
		ObjectNode node = node(expression);
		node.put("target", expression.getTarget());
		node.set("value", expression.getValue().accept(this));
		return node;
	}

	@Override
	public ObjectNode visitCallExpression(CallExpression expression)
	{
		ObjectNode node = node(expression);
		node.put("name", expression.getName());
		ArrayNode arguments = node.putArray("arguments");
		for (Expression argument : expression.getArguments())
		{
			arguments.add(argument.accept(this));
		}
		return node;
	}

	@Override
	public ObjectNode visitGroupingExpression(GroupingExpression expression)
	{
		ObjectNode node = node(expression);
		node.set("expression", expression.getExpression().accept(this));
		return node;
	}
}
