// File: src/main/java/com/juanpa/astviz/semantics/VariableSymbol.java

package com.juanpa.astviz.semantics;

import com.juanpa.astviz.lexer.Token;

/**
 * Represents a variable introduced by an assignment.
 * Its type is the type of the value most recently assigned to it.
 */
public class VariableSymbol extends Symbol
{
	/**
	 * Constructs a VariableSymbol.
	 *
	 * @param name             The name of the variable.
	 * @param type             The type of the assigned value.
	 * @param scope            The scope the variable is declared in.
	 * @param declarationToken The assignment target token.
	 */
	public VariableSymbol(String name, DataType type, String scope, Token declarationToken)
	{
		super(name, type, scope, declarationToken);
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.VARIABLE;
	}

	@Override
	public String describe()
	{
		return getName() + ":" + getType().getName();
	}
}
