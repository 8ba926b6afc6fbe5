package com.juanpa.astviz.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.juanpa.astviz.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

@JsonPropertyOrder({"tokens", "success", "error"})
public record TokenizeResult(boolean success, List<TokenInfo> tokens, String error)
{
	/**
	 * One token as reported to clients: its category name, source text and location.
	 */
	public record TokenInfo(String tokenType, String rawValue, int position, int line, int column)
	{
		static TokenInfo of(Token token)
		{
			return new TokenInfo(token.getCategory().getDisplayName(), token.getLexeme(), token.getPosition(),
					token.getLine(), token.getColumn());
		}
	}

	public static TokenizeResult success(List<Token> tokens)
	{
		return new TokenizeResult(true, tokens.stream().map(TokenInfo::of).collect(Collectors.toList()), null);
	}

	public static TokenizeResult error(String error)
	{
		return new TokenizeResult(false, List.of(), error);
	}
}
