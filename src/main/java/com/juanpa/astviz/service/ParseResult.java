package com.juanpa.astviz.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.juanpa.astviz.ast.Program;

/**
 * The outcome of parsing. {@code ast} is null on failure.
 */
@JsonPropertyOrder({"ast", "success", "error"})
public record ParseResult(boolean success, Program ast, String error)
{
	public static ParseResult success(Program ast)
	{
		return new ParseResult(true, ast, null);
	}

	public static ParseResult error(String error)
	{
		return new ParseResult(false, null, error);
	}
}
