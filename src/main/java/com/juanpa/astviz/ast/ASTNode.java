package com.juanpa.astviz.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes own their children outright and hold no reference back to their parent.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 * This is part of the Visitor design pattern, allowing operations to be
	 * performed on the AST nodes without modifying the node classes themselves.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);

	/**
	 * Name of this node's kind as shown in traces and visualizations (e.g. "BinaryOp").
	 */
	String getNodeType();
}
