package com.parceltrack.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration record for the database backing the parcel store.
 *
 * <p>Values are read from the environment by {@link #fromEnvironment(Map)}:
 *
 * <ul>
 *   <li>{@code DB_URL} - JDBC URL (required)
 *   <li>{@code DB_USER} / {@code DB_PASSWORD} - credentials
 *   <li>{@code DB_POOL_SIZE} - maximum pool size, default 10
 *   <li>{@code DB_QUERY_TIMEOUT_SECONDS} - per-statement timeout, default 0 (none)
 * </ul>
 *
 * @param jdbcUrl The JDBC URL of the database
 * @param username The database user
 * @param password The database password
 * @param maximumPoolSize The maximum number of pooled connections
 * @param queryTimeout The default timeout applied to every statement; zero for none
 */
public record DatabaseConfig(
    String jdbcUrl,
    String username,
    String password,
    int maximumPoolSize,
    Duration queryTimeout
) {
  public static final int DEFAULT_POOL_SIZE = 10;

  public DatabaseConfig {
    if (Strings.isNullOrEmpty(jdbcUrl)) {
      throw new IllegalArgumentException("DB_URL must be set");
    }
    if (maximumPoolSize < 1) {
      throw new IllegalArgumentException("Pool size must be positive, got " + maximumPoolSize);
    }
    if (queryTimeout == null || queryTimeout.isNegative()) {
      throw new IllegalArgumentException("Query timeout must be zero or positive");
    }
  }

  /**
   * Reads the configuration from the given environment map, typically {@code System.getenv()}.
   *
   * @throws IllegalArgumentException if DB_URL is missing or a numeric value does not parse
   */
  public static DatabaseConfig fromEnvironment(Map<String, String> env) {
    return new DatabaseConfig(
        env.get("DB_URL"),
        env.get("DB_USER"),
        env.get("DB_PASSWORD"),
        parseInt(env, "DB_POOL_SIZE", DEFAULT_POOL_SIZE),
        Duration.ofSeconds(parseInt(env, "DB_QUERY_TIMEOUT_SECONDS", 0)));
  }

  private static int parseInt(Map<String, String> env, String key, int defaultValue) {
    String raw = env.get(key);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " is not a number: " + raw, e);
    }
  }

  /**
   * Returns a string representation of this object without the password, safe to log.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("jdbcUrl", jdbcUrl())
        .add("username", username())
        .add("maximumPoolSize", maximumPoolSize())
        .add("queryTimeout", queryTimeout())
        .toString();
  }
}
