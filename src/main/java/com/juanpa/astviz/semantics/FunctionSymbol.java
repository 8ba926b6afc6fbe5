// File: src/main/java/com/juanpa/astviz/semantics/FunctionSymbol.java

package com.juanpa.astviz.semantics;

import com.juanpa.astviz.lexer.Token;

/**
 * Represents a function known only from being called. Nothing is known about
 * its signature, so its return type is always {@link DataType#UNKNOWN}.
 */
public class FunctionSymbol extends Symbol
{
	private final int arity; // Argument count at the first call seen

	/**
	 * Constructs a FunctionSymbol.
	 *
	 * @param name             The function name.
	 * @param scope            The scope the call appeared in.
	 * @param declarationToken The name token of the first call.
	 * @param arity            The number of arguments at that call.
	 */
	public FunctionSymbol(String name, String scope, Token declarationToken, int arity)
	{
		super(name, DataType.UNKNOWN, scope, declarationToken);
		this.arity = arity;
	}

	public int getArity()
	{
		return arity;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.FUNCTION;
	}

	@Override
	public String describe()
	{
		return getName() + ":" + SymbolKind.FUNCTION.getDisplayName();
	}

	@Override
	public boolean equals(Object o)
	{
		return super.equals(o) && arity == ((FunctionSymbol) o).arity;
	}

	@Override
	public int hashCode()
	{
		return 31 * super.hashCode() + arity;
	}
}
