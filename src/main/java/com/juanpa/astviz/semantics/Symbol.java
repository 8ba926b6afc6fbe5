// File: src/main/java/com/juanpa/astviz/semantics/Symbol.java

package com.juanpa.astviz.semantics;

import com.juanpa.astviz.lexer.Token;

import java.util.Objects;

/**
 * Abstract base class for all symbols in the symbol table.
 * A symbol represents a named entity the program introduced (a variable or a called function).
 * Symbols are immutable; a redeclaration replaces the entry in the table.
 */
public abstract class Symbol
{
	private final String name;
	private final DataType type;
	private final String scope;
	private final Token declarationToken; // The token where this symbol was declared

	/**
	 * Constructor for a Symbol.
	 *
	 * @param name             The name of the symbol.
	 * @param type             The type of the symbol.
	 * @param scope            The name of the scope the symbol lives in.
	 * @param declarationToken The token representing the declaration of this symbol.
	 */
	protected Symbol(String name, DataType type, String scope, Token declarationToken)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		this.scope = Objects.requireNonNull(scope, "scope");
		this.declarationToken = Objects.requireNonNull(declarationToken, "declarationToken");
	}

	public String getName()
	{
		return name;
	}

	public DataType getType()
	{
		return type;
	}

	public String getScope()
	{
		return scope;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	/**
	 * The 1-based source line of the declaring token.
	 */
	public int getDeclarationLine()
	{
		return declarationToken.getLine();
	}

	public abstract SymbolKind getKind();

	/**
	 * The "name:Type" form recorded in the trace when this symbol is added.
	 */
	public abstract String describe();

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		Symbol symbol = (Symbol) o;
		return name.equals(symbol.name) && type == symbol.type && scope.equals(symbol.scope)
				&& getDeclarationLine() == symbol.getDeclarationLine();
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getKind(), name, type, scope, getDeclarationLine());
	}

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "{" + "name='" + name + '\'' + ", type=" + type + ", scope=" + scope + ", line=" + getDeclarationLine() + '}';
	}
}
