package com.juanpa.astviz.semantics;

import java.util.List;

/**
 * Everything one analysis run produced. The lists are immutable copies, so two runs over
 * equal trees produce equal results.
 *
 * @param steps       The trace, in the order the steps were taken.
 * @param symbolTable The symbol table entries in declaration order.
 * @param typeChecks  Every check performed, in order.
 */
public record AnalysisResult(List<SemanticStep> steps, List<Symbol> symbolTable, List<TypeCheck> typeChecks)
{
	public AnalysisResult
	{
		steps = List.copyOf(steps);
		symbolTable = List.copyOf(symbolTable);
		typeChecks = List.copyOf(typeChecks);
	}

	/**
	 * True when no step recorded an error and every check passed.
	 */
	public boolean isClean()
	{
		return steps.stream().noneMatch(SemanticStep::hasError);
	}
}
