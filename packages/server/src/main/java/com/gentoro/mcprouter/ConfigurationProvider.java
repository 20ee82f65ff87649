package com.gentoro.mcprouter;

import com.gentoro.mcprouter.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration. Without an explicit location the bundled {@code
 * application.yaml} is used; otherwise the location is a {@code classpath:} resource, a {@code
 * file:} URI or a plain path.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final YAMLConfiguration config;
  private final String location;

  public ConfigurationProvider(String location) {
    this.location = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    this.config = load(this.location);
  }

  private static YAMLConfiguration load(String location) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = open(location);
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
      log.debug("Loaded configuration from {}", location);
      return yaml;
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to load configuration from " + location, e);
    }
  }

  private static InputStream open(String location) throws Exception {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      InputStream in =
          Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + resource);
      }
      return in;
    }
    Path path = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return Files.newInputStream(path);
  }

  public Configuration config() {
    return config;
  }

  public String location() {
    return location;
  }
}
