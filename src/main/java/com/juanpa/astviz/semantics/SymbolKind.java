package com.juanpa.astviz.semantics;

public enum SymbolKind
{
	VARIABLE("Variable"),
	FUNCTION("Function");

	private final String displayName;

	SymbolKind(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}
}
