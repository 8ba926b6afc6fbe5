package com.juanpa.astviz.visualization;

import java.util.List;

/**
 * A syntax tree flattened into nodes and parent-to-child edges, ready for a renderer.
 *
 * @param nodes Nodes in pre-order.
 * @param edges Edges in the order their child nodes were reached.
 */
public record TreeGraph(List<Node> nodes, List<Edge> edges)
{
	public TreeGraph
	{
		nodes = List.copyOf(nodes);
		edges = List.copyOf(edges);
	}

	public record Node(String id, String label, String nodeType, String color)
	{
	}

	/**
	 * @param label The child's role: left, right, operand, value, expr or arg&lt;i&gt;.
	 */
	public record Edge(String from, String to, String label)
	{
	}

	public boolean isEmpty()
	{
		return nodes.isEmpty();
	}
}
