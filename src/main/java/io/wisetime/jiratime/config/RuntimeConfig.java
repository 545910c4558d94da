/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up configuration values. System properties take precedence over environment variables, which take precedence
 * over the JSON config file.
 *
 * @author jiratime
 */
public class RuntimeConfig {

  private static final Logger log = LoggerFactory.getLogger(RuntimeConfig.class);

  private final Properties systemProperties;
  private final Map<String, String> environment;
  private final Map<String, String> fileValues;

  @VisibleForTesting
  RuntimeConfig(final Properties systemProperties,
                final Map<String, String> environment,
                final Map<String, String> fileValues) {
    this.systemProperties = systemProperties;
    this.environment = environment;
    this.fileValues = fileValues;
  }

  /**
   * Loads the JSON config file and layers system properties and environment variables on top of it.
   */
  public static RuntimeConfig load(final Path configFile) {
    return new RuntimeConfig(System.getProperties(), System.getenv(), readConfigFile(configFile));
  }

  public Optional<String> getString(final ConfigKey key) {
    final String fromProperty = systemProperties.getProperty(key.getConfigKey());
    if (StringUtils.isNotBlank(fromProperty)) {
      return Optional.of(fromProperty.trim());
    }
    final String fromEnvironment = environment.get(key.getConfigKey());
    if (StringUtils.isNotBlank(fromEnvironment)) {
      return Optional.of(fromEnvironment.trim());
    }
    return Optional.ofNullable(StringUtils.trimToNull(fileValues.get(key.getFileKey())));
  }

  public Optional<Integer> getInt(final ConfigKey key) {
    return getString(key).map(value -> {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new ConfigurationException(
            String.format("Invalid value for %s: %s is not a number", key.getFileKey(), value), e);
      }
    });
  }

  @VisibleForTesting
  static Map<String, String> readConfigFile(final Path configFile) {
    final JsonElement root;
    try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
      root = JsonParser.parseReader(reader);
    } catch (IOException | JsonParseException e) {
      throw new ConfigurationException("Failed to load config: " + e.getMessage(), e);
    }
    if (!root.isJsonObject()) {
      throw new ConfigurationException("Failed to load config: " + configFile + " does not contain a JSON object");
    }

    final ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
    for (Map.Entry<String, JsonElement> entry : ((JsonObject) root).entrySet()) {
      // File keys are case insensitive: "Baseurl" and "baseurl" are the same entry
      if (entry.getValue().isJsonPrimitive()) {
        values.put(entry.getKey().toLowerCase(), entry.getValue().getAsString());
      } else {
        log.warn("Ignoring non scalar config entry {}", entry.getKey());
      }
    }
    log.debug("Loaded config file {}", configFile);
    return values.buildKeepingLast();
  }
}
