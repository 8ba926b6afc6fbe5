package com.juanpa.astviz.visualization;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.ast.ExpressionPrinter;
import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.ast.expressions.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a tree into a {@link TreeGraph}. Ids are "node_&lt;n&gt;" assigned in pre-order from 0,
 * so the same tree always yields the same graph. The statements of a program form a forest
 * whose ids continue from one statement to the next.
 * <p>
 * Not thread-safe; each {@code enumerate} call starts over.
 */
public class TreeEnumerator implements ASTVisitor<String>
{
	private final ExpressionPrinter printer = new ExpressionPrinter();

	private List<TreeGraph.Node> nodes;
	private List<TreeGraph.Edge> edges;
	private int nextId;

	public TreeGraph enumerate(Expression expression)
	{
		begin();
		expression.accept(this);
		return new TreeGraph(nodes, edges);
	}

	public TreeGraph enumerate(Program program)
	{
		begin();
		for (Expression statement : program.getStatements())
		{
			statement.accept(this);
		}
		return new TreeGraph(nodes, edges);
	}

	private void begin()
	{
		nodes = new ArrayList<>();
		edges = new ArrayList<>();
		nextId = 0;
	}

	private String addNode(NodeStyle style, String detail)
	{
		String id = "node_" + nextId++;
		nodes.add(new TreeGraph.Node(id, style.label(detail), style.getNodeType(), style.getColor()));
		return id;
	}

	/**
	 * Emits the edge to a child, then the child's subtree. The child is numbered next in pre-order.
	 */
	private void addChild(String parentId, Expression child, String label)
	{
		edges.add(new TreeGraph.Edge(parentId, "node_" + nextId, label));
		child.accept(this);
	}

	@Override
	public String visitNumberLiteralExpression(NumberLiteralExpression expression)
	{
		return addNode(NodeStyle.NUMBER_LITERAL, expression.getRawText() + (expression.isFloat() ? " (float)" : " (int)"));
	}

	@Override
	public String visitStringLiteralExpression(StringLiteralExpression expression)
	{
		return addNode(NodeStyle.STRING_LITERAL, printer.print(expression));
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return addNode(NodeStyle.IDENTIFIER, expression.getName());
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		String id = addNode(NodeStyle.BINARY_OP, expression.getOperatorSymbol());
		addChild(id, expression.getLeft(), "left");
		addChild(id, expression.getRight(), "right");
		return id;
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		String id = addNode(NodeStyle.UNARY_OP, expression.getOperatorSymbol());
		addChild(id, expression.getOperand(), "operand");
		return id;
	}

	@Override
	public String visitAssignmentExpression(AssignmentExpression expression)
	{
		String id = addNode(NodeStyle.ASSIGNMENT, expression.getTarget() + " =");
		addChild(id, expression.getValue(), "value");
		return id;
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		String id = addNode(NodeStyle.FUNCTION_CALL, expression.getName());
		List<Expression> arguments = expression.getArguments();
		for (int i = 0; i < arguments.size(); i++)
		{
			addChild(id, arguments.get(i), "arg" + i);
		}
		return id;
	}

	@Override
	public String visitGroupingExpression(GroupingExpression expression)
	{
		String id = addNode(NodeStyle.GROUPING, "( )");
		addChild(id, expression.getExpression(), "expr");
		return id;
	}
}
