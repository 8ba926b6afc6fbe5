package com.juanpa.astviz.semantics;

/**
 * The types the analyzer assigns to expressions.
 * UNKNOWN marks an undefined name, a call result or the result of a failed check,
 * and makes every check it reaches invalid.
 */
public enum DataType
{
	NUMBER("Number"),
	STRING("String"),
	UNKNOWN("Unknown");

	private final String displayName;

	DataType(String displayName)
	{
		this.displayName = displayName;
	}

	/**
	 * The name shown in trace descriptions and symbol table entries.
	 */
	public String getName()
	{
		return displayName;
	}

	public boolean isKnown()
	{
		return this != UNKNOWN;
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
