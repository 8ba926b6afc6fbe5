package com.juanpa.astviz.semantics;

/**
 * One entry of the analysis trace. Exactly one step is recorded per visited node,
 * in post-order, numbered from 1.
 *
 * @param stepNumber  1-based position in the trace.
 * @param description Human-readable account of what the analyzer did.
 * @param nodeType    The node type name (e.g., "BinaryOp").
 * @param action      One of literal, lookup, group, unary, type_check, assign, call.
 * @param symbolAdded "name:Type" when this step added or replaced a symbol, else null.
 * @param typeCheck   The check performed at this step, else null.
 * @param error       The problem found at this step, else null.
 */
public record SemanticStep(int stepNumber, String description, String nodeType, String action,
						   String symbolAdded, TypeCheck typeCheck, String error)
{
	public boolean hasError()
	{
		return error != null || (typeCheck != null && !typeCheck.valid());
	}
}
