package com.juanpa.astviz.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indented trace logging for the recursive stages (parser, analyzer).
 * Output goes to the "astviz.debug" logger at DEBUG level, so it is switched on and off
 * through the logging configuration.
 */
public final class Debug
{
	private static final Logger LOGGER = LoggerFactory.getLogger("astviz.debug");

	// Per thread, so concurrent pipelines do not mix their indentation.
	private static final ThreadLocal<Integer> INDENT_LEVEL = ThreadLocal.withInitial(() -> 0);

	private Debug()
	{
	}

	public static boolean isEnabled()
	{
		return LOGGER.isDebugEnabled();
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Found var: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (LOGGER.isDebugEnabled())
		{
			String indent = "  ".repeat(INDENT_LEVEL.get());
			LOGGER.debug(indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public static void indent()
	{
		if (LOGGER.isDebugEnabled())
		{
			INDENT_LEVEL.set(INDENT_LEVEL.get() + 1);
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public static void dedent()
	{
		if (LOGGER.isDebugEnabled())
		{
			INDENT_LEVEL.set(Math.max(0, INDENT_LEVEL.get() - 1));
		}
	}

	/**
	 * Drops the indentation of the current thread, e.g. after a stage aborted mid-recursion.
	 */
	public static void reset()
	{
		INDENT_LEVEL.remove();
	}
}
