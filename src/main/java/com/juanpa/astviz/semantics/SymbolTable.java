package com.juanpa.astviz.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single flat scope mapping names to their Symbol objects.
 * Entries keep the order in which names were first declared; redefining a name
 * replaces its entry without moving it.
 */
public class SymbolTable
{
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();
	private final String scopeName; // e.g., "global"

	public SymbolTable(String scopeName)
	{
		this.scopeName = scopeName;
	}

	/**
	 * Defines a symbol, replacing any existing entry with the same name.
	 *
	 * @param symbol The symbol to define.
	 * @return The symbol previously bound to the name, or null if the name is new.
	 */
	public Symbol define(Symbol symbol)
	{
		return symbols.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a symbol by name.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found Symbol, or null if not found.
	 */
	public Symbol resolve(String name)
	{
		return symbols.get(name);
	}

	public boolean contains(String name)
	{
		return symbols.containsKey(name);
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public int size()
	{
		return symbols.size();
	}

	/**
	 * A snapshot of the entries in declaration order.
	 */
	public List<Symbol> getSymbols()
	{
		return Collections.unmodifiableList(new ArrayList<>(symbols.values()));
	}

	@Override
	public String toString()
	{
		return "SymbolTable{" + "scope='" + scopeName + '\'' + ", symbols=" + symbols.values() + '}';
	}
}
