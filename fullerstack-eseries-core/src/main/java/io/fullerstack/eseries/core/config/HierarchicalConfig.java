package io.fullerstack.eseries.core.config;

import java.util.*;

/**
 * Hierarchical configuration using ResourceBundle.
 *
 * <p>Supports fallback chain:
 * <ol>
 *   <li>collector_{profile}.properties (deployment profile, e.g. "lab")</li>
 *   <li>collector.properties (defaults)</li>
 * </ol>
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # collector.properties (defaults)
 * collector.interval-seconds=60
 * collector.pool-size=8
 *
 * # collector_lab.properties (profile override)
 * collector.interval-seconds=300
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig config = HierarchicalConfig.forProfile("lab");
 * int interval = config.getInt("collector.interval-seconds");
 * // → 300 (from collector_lab.properties)
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <p>System properties take precedence over all property files:
 * <pre>
 * java -Deseries.api.password=secret -jar collector.jar
 * </pre>
 */
public class HierarchicalConfig {

  static final String BASE_NAME = "collector";

  private static final ResourceBundle.Control NO_LOCALE_FALLBACK =
    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

  private final ResourceBundle bundle;
  private final String context;  // For debugging/logging

  private HierarchicalConfig(ResourceBundle bundle, String context) {
    this.bundle = bundle;
    this.context = context;
  }

  /**
   * Get default configuration (collector.properties).
   *
   * @return Default configuration
   * @throws ConfigurationException if collector.properties is not on the classpath
   */
  public static HierarchicalConfig global() {
    return load(BASE_NAME, Locale.ROOT, "global");
  }

  /**
   * Get profile-specific configuration.
   *
   * <p>Fallback chain:
   * <ol>
   *   <li>collector_{profile}.properties</li>
   *   <li>collector.properties (defaults)</li>
   * </ol>
   *
   * @param profile Profile name (e.g., "lab", "production")
   * @return Profile-specific configuration
   */
  public static HierarchicalConfig forProfile(String profile) {
    Objects.requireNonNull(profile, "profile cannot be null");
    if (profile.isBlank()) {
      throw new IllegalArgumentException("profile cannot be blank");
    }

    // The locale's language carries the profile name: collector_lab.properties
    return load(BASE_NAME, new Locale(profile), "profile:" + profile);
  }

  /**
   * Load a configuration from an arbitrary bundle base name (used by tests).
   */
  static HierarchicalConfig load(String baseName, Locale locale, String context) {
    try {
      ResourceBundle bundle = ResourceBundle.getBundle(baseName, locale, NO_LOCALE_FALLBACK);
      return new HierarchicalConfig(bundle, context);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("Configuration bundle '" + baseName + "' not found", e);
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get string value.
   *
   * <p>Checks system properties first, then ResourceBundle.
   *
   * @param key Property key
   * @return Property value, trimmed
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp.trim();
    }

    try {
      return bundle.getString(key).trim();
    } catch (MissingResourceException e) {
      throw new ConfigurationException(
        "Missing config key '" + key + "' in context: " + context, e
      );
    }
  }

  /**
   * Get string value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value or default
   */
  public String getString(String key, String defaultValue) {
    if (!contains(key)) {
      return defaultValue;
    }
    return getString(key);
  }

  /**
   * Get comma-separated list value. Blank entries are dropped.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return List of trimmed entries
   */
  public List<String> getList(String key, List<String> defaultValue) {
    String value = getString(key, null);
    if (value == null) {
      return defaultValue;
    }
    List<String> entries = new ArrayList<>();
    for (String entry : value.split(",")) {
      if (!entry.isBlank()) {
        entries.add(entry.trim());
      }
    }
    return entries;
  }

  /**
   * Get int value.
   *
   * @param key Property key
   * @return Property value as int
   * @throws ConfigurationException if key not found or invalid format
   */
  public int getInt(String key) {
    String value = getString(key);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid int value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get int value with default.
   *
   * <p>Unlike a missing key, a present but malformed value is an error.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as int or default
   * @throws ConfigurationException if the value is present but invalid
   */
  public int getInt(String key, int defaultValue) {
    return contains(key) ? getInt(key) : defaultValue;
  }

  /**
   * Get long value.
   *
   * @param key Property key
   * @return Property value as long
   * @throws ConfigurationException if key not found or invalid format
   */
  public long getLong(String key) {
    String value = getString(key);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid long value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get long value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as long or default
   * @throws ConfigurationException if the value is present but invalid
   */
  public long getLong(String key, long defaultValue) {
    return contains(key) ? getLong(key) : defaultValue;
  }

  /**
   * Get boolean value.
   *
   * @param key Property key
   * @return Property value as boolean
   * @throws ConfigurationException if key not found or not "true"/"false"
   */
  public boolean getBoolean(String key) {
    String value = getString(key);
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new ConfigurationException("Invalid boolean value for key '" + key + "': " + value);
  }

  /**
   * Get boolean value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    return contains(key) ? getBoolean(key) : defaultValue;
  }

  /**
   * Check if key exists in configuration.
   *
   * @param key Property key
   * @return true if key exists
   */
  public boolean contains(String key) {
    if (System.getProperty(key) != null) {
      return true;
    }
    return bundle.containsKey(key);
  }

  /**
   * Get all keys in this configuration level.
   *
   * @return Set of all keys
   */
  public Set<String> keys() {
    return bundle.keySet();
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "profile:lab")
   */
  public String context() {
    return context;
  }

  @Override
  public String toString() {
    return "HierarchicalConfig[context=" + context + "]";
  }
}
