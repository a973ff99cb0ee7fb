package com.glitchtrip;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves {@link AppConfig} as JSON. Missing or broken files fall back
 * to defaults so a bad settings file never blocks startup.
 */
public class ConfigManager
{

	private static final Logger LOG = LoggerFactory.getLogger(ConfigManager.class);
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	private final Path configFile;

	public ConfigManager(Path configFile)
	{
		this.configFile = configFile;
	}

	public static ConfigManager forUserHome()
	{
		return new ConfigManager(Path.of(System.getProperty("user.home"), ".glitchtrip", "config.json"));
	}

	public Path configFile()
	{
		return configFile;
	}

	public AppConfig load()
	{
		if (!Files.exists(configFile))
		{
			LOG.info("No config file at {}, writing defaults", configFile);
			AppConfig defaults = new AppConfig();
			save(defaults);
			return defaults;
		}
		try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8))
		{
			AppConfig config = GSON.fromJson(reader, AppConfig.class);
			if (config == null)
			{
				config = new AppConfig();
			}
			config.normalize();
			LOG.info("Config loaded from {}", configFile);
			return config;
		}
		catch (IOException | JsonParseException e)
		{
			LOG.error("Failed to load config file {}, using defaults", configFile, e);
			return new AppConfig();
		}
	}

	/**
	 * @return false if the file could not be written
	 */
	public boolean save(AppConfig config)
	{
		try
		{
			Path parent = configFile.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			try (Writer writer = Files.newBufferedWriter(configFile, StandardCharsets.UTF_8))
			{
				GSON.toJson(config, writer);
			}
			return true;
		}
		catch (IOException e)
		{
			LOG.error("Failed to save config file {}", configFile, e);
			return false;
		}
	}
}
