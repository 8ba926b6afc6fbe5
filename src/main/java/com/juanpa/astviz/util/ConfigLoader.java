package com.juanpa.astviz.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Builds an {@link AstvizConfig} from three layers, each overriding the one before:
 * the bundled {@code astviz.properties}, the user file {@code ~/.config/astviz/astviz.conf}
 * and {@code astviz.*} system properties.
 */
public class ConfigLoader
{
	private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

	static final String DEFAULTS_RESOURCE = "astviz.properties";
	private static final String PREFIX = "astviz.";

	private final Path userConfigPath;
	private final Properties systemProperties;

	public ConfigLoader()
	{
		this(Paths.get(System.getProperty("user.home"), ".config", "astviz", "astviz.conf"), System.getProperties());
	}

	/**
	 * @param userConfigPath   The user configuration file; it need not exist.
	 * @param systemProperties The properties scanned for {@code astviz.*} overrides.
	 */
	public ConfigLoader(Path userConfigPath, Properties systemProperties)
	{
		this.userConfigPath = userConfigPath;
		this.systemProperties = systemProperties;
	}

	public AstvizConfig load()
	{
		Properties props = new Properties();
		loadDefaults(props);
		loadUserFile(props);

		for (String name : systemProperties.stringPropertyNames())
		{
			if (name.startsWith(PREFIX))
			{
				props.setProperty(name, systemProperties.getProperty(name));
			}
		}

		AstvizConfig config = new AstvizConfig(props);
		logger.debug("Loaded configuration: {}", config);
		return config;
	}

	private void loadDefaults(Properties props)
	{
		try (InputStream input = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if (input == null)
			{
				logger.debug("No bundled {} found, using built-in defaults", DEFAULTS_RESOURCE);
				return;
			}
			props.load(input);
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("Could not read bundled " + DEFAULTS_RESOURCE, e);
		}
	}

	private void loadUserFile(Properties props)
	{
		if (userConfigPath == null || !Files.exists(userConfigPath))
		{
			return;
		}
		try (InputStream input = Files.newInputStream(userConfigPath))
		{
			props.load(input);
			logger.info("Loaded configuration from: {}", userConfigPath);
		}
		catch (IOException e)
		{
			logger.warn("Could not read config file at {}. Using default settings.", userConfigPath, e);
		}
	}
}
