package com.juanpa.astviz.service;

/**
 * Thrown by {@link InputGuard} when a source exceeds the configured limits.
 */
public class InputRejectedException extends RuntimeException
{
	private final int position;

	public InputRejectedException(String message, int position)
	{
		super(message);
		this.position = position;
	}

	/**
	 * The offset where the limit was crossed, or -1 when the whole input is at fault.
	 */
	public int getPosition()
	{
		return position;
	}
}
