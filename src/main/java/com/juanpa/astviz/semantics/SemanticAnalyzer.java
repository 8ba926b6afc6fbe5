// File: src/main/java/com/juanpa/astviz/semantics/SemanticAnalyzer.java

package com.juanpa.astviz.semantics;

import com.juanpa.astviz.ast.ASTVisitor;
import com.juanpa.astviz.ast.ExpressionPrinter;
import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.ast.expressions.*;
import com.juanpa.astviz.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Performs semantic analysis as a single post-order walk over the tree.
 * Every node is typed after its children, and every node visited adds exactly one
 * {@link SemanticStep} to the trace. Assignments declare variables, calls declare functions,
 * and binary operators and assignments record a {@link TypeCheck}.
 * <p>
 * Semantic problems never throw: they are recorded on the step or the check, and the offending
 * expression is typed {@link DataType#UNKNOWN}.
 * <p>
 * Each {@code analyze} call starts from an empty symbol table. An instance may be reused
 * sequentially but must not be shared between threads.
 */
public class SemanticAnalyzer implements ASTVisitor<DataType>
{
	public static final String DEFAULT_SCOPE = "global";
	public static final String UNDEFINED_IDENTIFIER = "undefined identifier";

	private final String scopeName;

	private ExpressionPrinter printer;

	private SymbolTable symbolTable;
	private List<SemanticStep> steps;
	private List<TypeCheck> typeChecks;

	public SemanticAnalyzer()
	{
		this(DEFAULT_SCOPE);
	}

	/**
	 * @param scopeName The name recorded as the scope of every symbol.
	 */
	public SemanticAnalyzer(String scopeName)
	{
		this.scopeName = scopeName;
	}

	/**
	 * Analyzes a single expression.
	 */
	public AnalysisResult analyze(Expression expression)
	{
		begin();
		try
		{
			expression.accept(this);
			return finish();
		}
		finally
		{
			Debug.reset();
		}
	}

	/**
	 * Analyzes the statements of a program in order against one shared symbol table,
	 * so a later statement sees the variables an earlier one assigned.
	 */
	public AnalysisResult analyze(Program program)
	{
		begin();
		try
		{
			for (Expression statement : program.getStatements())
			{
				Debug.log("Statement: %s", printer.print(statement));
				Debug.indent();
				statement.accept(this);
				Debug.dedent();
			}
			return finish();
		}
		finally
		{
			Debug.reset();
		}
	}

	private void begin()
	{
		// Children are printed before their parents, so each subtree is rendered once
		printer = ExpressionPrinter.memoizing();
		symbolTable = new SymbolTable(scopeName);
		steps = new ArrayList<>();
		typeChecks = new ArrayList<>();
	}

	private AnalysisResult finish()
	{
		AnalysisResult result = new AnalysisResult(steps, symbolTable.getSymbols(), typeChecks);
		Debug.log("Analysis finished: %d step(s), %d symbol(s), %d check(s)", steps.size(), symbolTable.size(), typeChecks.size());
		return result;
	}

	private void addStep(Expression node, String action, String description, String symbolAdded, TypeCheck typeCheck, String error)
	{
		SemanticStep step = new SemanticStep(steps.size() + 1, description, node.getNodeType(), action, symbolAdded, typeCheck, error);
		steps.add(step);
		Debug.log("[%d] %s: %s%s", step.stepNumber(), action, description, error != null ? " (error: " + error + ")" : "");
	}

	// --- Leaves ---

	@Override
	public DataType visitNumberLiteralExpression(NumberLiteralExpression expression)
	{
		addStep(expression, "literal", "Number literal " + expression.getRawText() + " has type Number", null, null, null);
		return DataType.NUMBER;
	}

	@Override
	public DataType visitStringLiteralExpression(StringLiteralExpression expression)
	{
		addStep(expression, "literal", "String literal " + printer.print(expression) + " has type String", null, null, null);
		return DataType.STRING;
	}

	@Override
	public DataType visitIdentifierExpression(IdentifierExpression expression)
	{
		String name = expression.getName();
		Symbol symbol = symbolTable.resolve(name);
		if (symbol == null)
		{
			addStep(expression, "lookup", "Looked up '" + name + "': not found in scope '" + scopeName + "'",
					null, null, UNDEFINED_IDENTIFIER);
			return DataType.UNKNOWN;
		}

		addStep(expression, "lookup", "Resolved '" + name + "' as " + symbol.getKind().getDisplayName()
				+ " of type " + symbol.getType().getName() + " (declared on line " + symbol.getDeclarationLine() + ")", null, null, null);
		return symbol.getType();
	}

	// --- Composites ---

	@Override
	public DataType visitGroupingExpression(GroupingExpression expression)
	{
		DataType inner = expression.getExpression().accept(this);
		addStep(expression, "group", "Parenthesized expression has type " + inner.getName(), null, null, null);
		return inner;
	}

	@Override
	public DataType visitUnaryExpression(UnaryExpression expression)
	{
		DataType operand = expression.getOperand().accept(this);
		TypeRules.Outcome outcome = TypeRules.checkUnary(expression.getOperator().getType(), operand);
		String description = "Unary '" + expression.getOperatorSymbol() + "' applied to " + operand.getName()
				+ (outcome.valid() ? ", result Number" : "");
		addStep(expression, "unary", description, null, null, outcome.errorMessage());
		return outcome.resultType();
	}

	@Override
	public DataType visitBinaryExpression(BinaryExpression expression)
	{
		DataType left = expression.getLeft().accept(this);
		DataType right = expression.getRight().accept(this);

		TypeRules.Outcome outcome = TypeRules.checkBinary(expression.getOperator().getType(), left, right);
		TypeCheck check = new TypeCheck(printer.print(expression), outcome.expectedType(), outcome.actualType(),
				outcome.valid(), outcome.errorMessage());
		typeChecks.add(check);

		String description = "Checked " + left.getName() + " " + expression.getOperatorSymbol() + " " + right.getName()
				+ (outcome.valid() ? ": result " + outcome.resultType().getName() : ": invalid");
		addStep(expression, "type_check", description, null, check, null);
		return outcome.resultType();
	}

	@Override
	public DataType visitAssignmentExpression(AssignmentExpression expression)
	{
		DataType valueType = expression.getValue().accept(this);
		String target = expression.getTarget();

		Symbol previous = symbolTable.resolve(target);
		DataType expected = previous instanceof VariableSymbol ? previous.getType() : valueType;
		boolean valid = valueType.isKnown();
		String errorMessage = valid ? null : "Cannot infer a type for '" + target + "' from a value of type Unknown.";
		TypeCheck check = new TypeCheck(printer.print(expression), expected.getName(), valueType.getName(), valid, errorMessage);
		typeChecks.add(check);

		VariableSymbol symbol = new VariableSymbol(target, valueType, scopeName, expression.getTargetToken());
		symbolTable.define(symbol);

		addStep(expression, "assign", describeAssignment(target, previous, valueType), symbol.describe(), check, null);
		return valueType;
	}

	private static String describeAssignment(String target, Symbol previous, DataType valueType)
	{
		if (previous == null)
		{
			return "Declared variable '" + target + "' with type " + valueType.getName();
		}
		if (!(previous instanceof VariableSymbol))
		{
			return "Redeclared function '" + target + "' as a variable of type " + valueType.getName();
		}
		if (previous.getType() != valueType)
		{
			return "Reassigned '" + target + "': type changed from " + previous.getType().getName() + " to " + valueType.getName();
		}
		return "Reassigned '" + target + "' with type " + valueType.getName();
	}

	@Override
	public DataType visitCallExpression(CallExpression expression)
	{
		Debug.log("Call '%s': analyzing %d argument(s)", expression.getName(), expression.getArguments().size());
		Debug.indent();
		for (Expression argument : expression.getArguments())
		{
			argument.accept(this);
		}
		Debug.dedent();

		String name = expression.getName();
		int arity = expression.getArguments().size();
		String symbolAdded = null;
		String description;
		if (symbolTable.resolve(name) instanceof FunctionSymbol)
		{
			description = "Call to known function '" + name + "' with " + arity + " argument(s); return type Unknown";
		}
		else
		{
			FunctionSymbol function = new FunctionSymbol(name, scopeName, expression.getNameToken(), arity);
			symbolTable.define(function);
			symbolAdded = function.describe();
			description = "Registered function '" + name + "' from call with " + arity + " argument(s); return type Unknown";
		}
		addStep(expression, "call", description, symbolAdded, null, null);
		return DataType.UNKNOWN;
	}
}
