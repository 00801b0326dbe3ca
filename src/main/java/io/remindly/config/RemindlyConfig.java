package io.remindly.config;

import io.remindly.RemindException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for phrase resolution.
 *
 * <p>{@link #load()} reads {@code remindly.properties} from the classpath, then applies JVM
 * system properties with the same keys, then environment variables:
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Key</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>remindly.timezone</td><td>REMINDLY_TIMEZONE</td><td>Asia/Tokyo</td></tr>
 *   <tr><td>remindly.default-hour</td><td>REMINDLY_DEFAULT_HOUR</td><td>9</td></tr>
 *   <tr><td>remindly.fallback.enabled</td><td>REMINDLY_FALLBACK_ENABLED</td><td>true</td></tr>
 * </table>
 *
 * @param timezone the zone every timestamp is computed in
 * @param defaultHour the hour used when a phrase names a day but no time
 * @param fallbackEnabled whether unresolved phrases go to the fallback delegate
 */
public record RemindlyConfig(ZoneId timezone, int defaultHour, boolean fallbackEnabled) {
  private static final Logger log = LoggerFactory.getLogger(RemindlyConfig.class);

  public static final String RESOURCE = "remindly.properties";
  public static final String TIMEZONE_KEY = "remindly.timezone";
  public static final String DEFAULT_HOUR_KEY = "remindly.default-hour";
  public static final String FALLBACK_KEY = "remindly.fallback.enabled";

  public RemindlyConfig {
    if (timezone == null) {
      throw new IllegalArgumentException("timezone is required");
    }
    if (defaultHour < 0 || defaultHour > 23) {
      throw new IllegalArgumentException("default hour out of range: " + defaultHour);
    }
  }

  /**
   * Returns the built-in settings: Asia/Tokyo, 09:00, fallback on.
   *
   * @return the defaults
   */
  public static RemindlyConfig defaults() {
    return new RemindlyConfig(ZoneId.of("Asia/Tokyo"), 9, true);
  }

  /**
   * Loads the settings from the classpath resource, system properties and the environment.
   *
   * @return the settings
   * @throws RemindException if the resource cannot be read or a value is invalid
   */
  public static RemindlyConfig load() throws RemindException {
    Properties props = new Properties();
    try (InputStream in = RemindlyConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
      } else {
        log.debug("{} not found on the classpath, using defaults", RESOURCE);
      }
    } catch (IOException e) {
      throw RemindException.config("cannot read " + RESOURCE, RESOURCE, e);
    }
    for (String key : new String[] {TIMEZONE_KEY, DEFAULT_HOUR_KEY, FALLBACK_KEY}) {
      String value = System.getProperty(key);
      if (value != null) {
        props.setProperty(key, value);
      }
    }
    return from(props, System.getenv());
  }

  /**
   * Builds the settings from properties, overridden by environment variables.
   *
   * @param props the properties
   * @param env the environment
   * @return the settings
   * @throws RemindException if a value is invalid
   */
  public static RemindlyConfig from(Properties props, Map<String, String> env)
      throws RemindException {
    RemindlyConfig defaults = defaults();
    String zone = setting(props, env, TIMEZONE_KEY, defaults.timezone().getId());
    String hour = setting(props, env, DEFAULT_HOUR_KEY, String.valueOf(defaults.defaultHour()));
    String fallback =
        setting(props, env, FALLBACK_KEY, String.valueOf(defaults.fallbackEnabled()));

    ZoneId zoneId;
    try {
      zoneId = ZoneId.of(zone);
    } catch (DateTimeException e) {
      throw RemindException.config("unknown timezone", zone, e);
    }

    int defaultHour;
    try {
      defaultHour = Integer.parseInt(hour);
    } catch (NumberFormatException e) {
      throw RemindException.config("default hour is not a number", hour, e);
    }
    if (defaultHour < 0 || defaultHour > 23) {
      throw RemindException.config("default hour must be 0-23", hour, null);
    }

    if (!fallback.equalsIgnoreCase("true") && !fallback.equalsIgnoreCase("false")) {
      throw RemindException.config("fallback flag must be true or false", fallback, null);
    }

    RemindlyConfig config =
        new RemindlyConfig(zoneId, defaultHour, Boolean.parseBoolean(fallback));
    log.debug("loaded {}", config);
    return config;
  }

  /**
   * Returns the default time of day.
   *
   * @return the default hour on the hour
   */
  public LocalTime defaultTime() {
    return LocalTime.of(defaultHour, 0);
  }

  private static String setting(
      Properties props, Map<String, String> env, String key, String fallback) {
    String envValue = env.get(envName(key));
    if (envValue != null && !envValue.isBlank()) {
      return envValue.trim();
    }
    String value = props.getProperty(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  // remindly.fallback.enabled -> REMINDLY_FALLBACK_ENABLED
  private static String envName(String key) {
    return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }
}
