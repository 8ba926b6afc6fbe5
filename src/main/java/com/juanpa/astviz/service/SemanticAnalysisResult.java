package com.juanpa.astviz.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.juanpa.astviz.semantics.AnalysisResult;
import com.juanpa.astviz.semantics.SemanticStep;
import com.juanpa.astviz.semantics.Symbol;
import com.juanpa.astviz.semantics.TypeCheck;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of semantic analysis, flattened for clients. {@code analysis} keeps the
 * analyzer's own result for callers in the same process.
 */
@JsonPropertyOrder({"steps", "symbol_table", "type_checks", "success", "error"})
public record SemanticAnalysisResult(boolean success,
									 List<StepInfo> steps,
									 List<SymbolInfo> symbolTable,
									 List<TypeCheckInfo> typeChecks,
									 String error,
									 @JsonIgnore AnalysisResult analysis)
{
	/**
	 * A trace step; {@code typeCheck} is the one-line summary of the step's check, if any.
	 */
	public record StepInfo(int stepNumber, String description, String nodeType, String action,
						   String symbolAdded, String typeCheck, String error)
	{
		static StepInfo of(SemanticStep step)
		{
			return new StepInfo(step.stepNumber(), step.description(), step.nodeType(), step.action(),
					step.symbolAdded(), summarize(step.typeCheck()), step.error());
		}

		private static String summarize(TypeCheck check)
		{
			if (check == null)
			{
				return null;
			}
			return check.expression() + ": expected " + check.expectedType() + ", found " + check.actualType()
					+ (check.valid() ? " (valid)" : " (invalid)");
		}
	}

	public record SymbolInfo(String name, String symbolType, String dataType, String scope, int line)
	{
		static SymbolInfo of(Symbol symbol)
		{
			return new SymbolInfo(symbol.getName(), symbol.getKind().getDisplayName(), symbol.getType().getName(),
					symbol.getScope(), symbol.getDeclarationLine());
		}
	}

	public record TypeCheckInfo(String expression, String expectedType, String actualType,
								@JsonProperty("is_valid") boolean valid, String errorMessage)
	{
		static TypeCheckInfo of(TypeCheck check)
		{
			return new TypeCheckInfo(check.expression(), check.expectedType(), check.actualType(), check.valid(),
					check.errorMessage());
		}
	}

	public static SemanticAnalysisResult success(AnalysisResult analysis)
	{
		return new SemanticAnalysisResult(true,
				analysis.steps().stream().map(StepInfo::of).collect(Collectors.toList()),
				analysis.symbolTable().stream().map(SymbolInfo::of).collect(Collectors.toList()),
				analysis.typeChecks().stream().map(TypeCheckInfo::of).collect(Collectors.toList()),
				null,
				analysis);
	}

	public static SemanticAnalysisResult error(String error)
	{
		return new SemanticAnalysisResult(false, List.of(), List.of(), List.of(), error, null);
	}
}
