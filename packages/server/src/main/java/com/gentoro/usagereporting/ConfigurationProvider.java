package com.gentoro.usagereporting;

import com.gentoro.usagereporting.exception.ConfigException;
import com.gentoro.usagereporting.logging.LoggingService;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;
import org.apache.commons.configuration2.io.FileHandler;
import org.slf4j.Logger;

/**
 * Loads the YAML file holding the {@code usageReporting} and {@code logging} sections.
 *
 * <p>A location is either {@code classpath:<resource>}, a {@code file:} URI or a plain path. A
 * blank location reads {@code classpath:usage-reporting.yaml}; when that resource is absent the
 * configuration is empty and every option keeps its default. An explicit location that does not
 * exist is an error.
 *
 * <p>{@code ${env:NAME}} placeholders resolve against the process environment, then against a
 * {@code .env.local} file in the working directory.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "usage-reporting.yaml";
  static final String CLASSPATH_PREFIX = "classpath:";
  static final Path DEFAULT_DOTENV = Path.of(".env.local");

  private final YAMLConfiguration configuration;

  public ConfigurationProvider(String location) {
    this(location, System::getenv, DEFAULT_DOTENV);
  }

  ConfigurationProvider(String location, UnaryOperator<String> environment, Path dotEnv) {
    boolean explicit = location != null && !location.isBlank();
    String effective = explicit ? location.trim() : CLASSPATH_PREFIX + DEFAULT_RESOURCE;
    this.configuration = new YAMLConfiguration();
    configuration.getInterpolator().registerLookup("env", new EnvLookup(environment, dotEnv));

    URL url = resolve(effective);
    if (url == null) {
      if (explicit) {
        throw new ConfigException("Configuration not found: " + effective);
      }
      log.debug("No {} on the classpath; using default options", DEFAULT_RESOURCE);
      return;
    }
    log.info("Loading usage reporting configuration from {}", url);
    try {
      FileHandler handler = new FileHandler(configuration);
      handler.setEncoding(StandardCharsets.UTF_8.name());
      handler.load(url);
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to read YAML configuration: " + effective, e);
    }
  }

  public Configuration config() {
    return configuration;
  }

  /** The URL of the location, or null when nothing exists there. */
  static URL resolve(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      if (resource.startsWith("/")) resource = resource.substring(1);
      ClassLoader loader = Thread.currentThread().getContextClassLoader();
      if (loader == null) loader = ConfigurationProvider.class.getClassLoader();
      return loader.getResource(resource);
    }
    Path path =
        location.regionMatches(true, 0, "file:", 0, 5)
            ? Path.of(URI.create(location))
            : Path.of(location);
    if (!Files.isRegularFile(path)) return null;
    try {
      return path.toUri().toURL();
    } catch (MalformedURLException e) {
      throw new ConfigException("Invalid configuration location: " + location, e);
    }
  }

  /** Environment lookup with a lazily read {@code .env.local} fallback. */
  static final class EnvLookup implements Lookup {
    private static final Pattern ASSIGNMENT =
        Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_.]*)\\s*=\\s*(.*)$");

    private final UnaryOperator<String> environment;
    private final Path dotEnv;
    private volatile Map<String, String> dotEnvValues;

    EnvLookup(UnaryOperator<String> environment, Path dotEnv) {
      this.environment = environment;
      this.dotEnv = dotEnv;
    }

    @Override
    public Object lookup(String name) {
      String value = environment.apply(name);
      if (value != null && !value.isEmpty()) return value;
      return dotEnvValues().get(name);
    }

    private Map<String, String> dotEnvValues() {
      Map<String, String> values = dotEnvValues;
      if (values == null) {
        synchronized (this) {
          if (dotEnvValues == null) {
            dotEnvValues = readDotEnv();
          }
          values = dotEnvValues;
        }
      }
      return values;
    }

    private Map<String, String> readDotEnv() {
      Map<String, String> values = new HashMap<>();
      if (dotEnv == null || !Files.isRegularFile(dotEnv)) return values;
      List<String> lines;
      try {
        lines = Files.readAllLines(dotEnv, StandardCharsets.UTF_8);
      } catch (IOException e) {
        log.warn("Ignoring unreadable {}: {}", dotEnv.toAbsolutePath(), e.getMessage());
        return values;
      }
      for (String raw : lines) {
        String line = raw.trim();
        if (line.isEmpty() || line.startsWith("#")) continue;
        Matcher m = ASSIGNMENT.matcher(line);
        if (m.matches()) {
          values.put(m.group(1), unquote(m.group(2).trim()));
        }
      }
      log.debug("Read {} entries from {}", values.size(), dotEnv.toAbsolutePath());
      return values;
    }

    private static String unquote(String value) {
      if (value.length() >= 2) {
        char first = value.charAt(0);
        if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
          return value.substring(1, value.length() - 1);
        }
      }
      return value;
    }
  }
}
