package com.juanpa.astviz.semantics;

/**
 * The record of one binary or assignment check.
 *
 * @param expression   The checked expression rendered as source text.
 * @param expectedType The type the operation asked for.
 * @param actualType   The type(s) found.
 * @param valid        Whether the check passed.
 * @param errorMessage The failure reason, or null when valid.
 */
public record TypeCheck(String expression, String expectedType, String actualType, boolean valid, String errorMessage)
{
}
