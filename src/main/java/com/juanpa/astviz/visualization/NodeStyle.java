package com.juanpa.astviz.visualization;

/**
 * Display heading and fill color per node type.
 */
public enum NodeStyle
{
	NUMBER_LITERAL("NumberLiteral", "Number", "lightgreen"),
	STRING_LITERAL("StringLiteral", "String", "lightyellow"),
	IDENTIFIER("Identifier", "Identifier", "lightcyan"),
	BINARY_OP("BinaryOp", "BinaryOp", "lightcoral"),
	UNARY_OP("UnaryOp", "UnaryOp", "lightpink"),
	ASSIGNMENT("Assignment", "Assignment", "orange"),
	FUNCTION_CALL("FunctionCall", "FunctionCall", "lightsteelblue"),
	GROUPING("Grouping", "Grouping", "lavender");

	private final String nodeType;
	private final String heading;
	private final String color;

	NodeStyle(String nodeType, String heading, String color)
	{
		this.nodeType = nodeType;
		this.heading = heading;
		this.color = color;
	}

	public String getNodeType()
	{
		return nodeType;
	}

	public String getHeading()
	{
		return heading;
	}

	public String getColor()
	{
		return color;
	}

	/**
	 * A two-line label: the heading, then the node-specific detail.
	 */
	public String label(String detail)
	{
		return heading + "\n" + detail;
	}
}
