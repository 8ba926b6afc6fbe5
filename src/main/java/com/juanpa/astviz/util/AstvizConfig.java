package com.juanpa.astviz.util;

import java.util.Properties;

/**
 * Holds configuration settings for astviz, loaded from properties.
 * Provides sensible defaults if settings are not specified.
 */
public class AstvizConfig
{
	public static final String MAX_SOURCE_LENGTH = "astviz.limits.max-source-length";
	public static final String MAX_NESTING_DEPTH = "astviz.limits.max-nesting-depth";
	public static final String PRETTY_JSON = "astviz.output.pretty-json";
	public static final String SCOPE_NAME = "astviz.analysis.scope-name";

	private final int maxSourceLength;
	private final int maxNestingDepth;
	private final boolean prettyJson;
	private final String scopeName;

	/**
	 * @throws IllegalArgumentException if a numeric setting is not a positive integer.
	 */
	public AstvizConfig(Properties props)
	{
		this.maxSourceLength = positiveInt(props, MAX_SOURCE_LENGTH, 100_000);
		this.maxNestingDepth = positiveInt(props, MAX_NESTING_DEPTH, 256);
		this.prettyJson = Boolean.parseBoolean(props.getProperty(PRETTY_JSON, "true").trim());
		String scope = props.getProperty(SCOPE_NAME, "global").trim();
		this.scopeName = scope.isEmpty() ? "global" : scope;
	}

	/**
	 * The configuration with every setting at its default.
	 */
	public static AstvizConfig defaults()
	{
		return new AstvizConfig(new Properties());
	}

	private static int positiveInt(Properties props, String key, int defaultValue)
	{
		String raw = props.getProperty(key);
		if (raw == null || raw.isBlank())
		{
			return defaultValue;
		}
		try
		{
			int value = Integer.parseInt(raw.trim());
			if (value <= 0)
			{
				throw new IllegalArgumentException("Setting '" + key + "' must be positive but was " + value + ".");
			}
			return value;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Setting '" + key + "' is not an integer: '" + raw + "'.", e);
		}
	}

	public int getMaxSourceLength()
	{
		return maxSourceLength;
	}

	public int getMaxNestingDepth()
	{
		return maxNestingDepth;
	}

	public boolean isPrettyJson()
	{
		return prettyJson;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	@Override
	public String toString()
	{
		return "AstvizConfig{" + "maxSourceLength=" + maxSourceLength + ", maxNestingDepth=" + maxNestingDepth
				+ ", prettyJson=" + prettyJson + ", scopeName='" + scopeName + '\'' + '}';
	}
}
