package com.rowbase.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Connection settings for the database backing the repositories.
 *
 * <p>Read from the environment by {@link #fromEnvironment()}:
 *
 * <ul>
 *   <li>{@code DB_URL} - JDBC URL, required
 *   <li>{@code DB_USER}, {@code DB_PASSWORD} - credentials
 *   <li>{@code DB_POOL_SIZE} - maximum pool size, default 10
 *   <li>{@code DB_POOL_NAME} - pool name shown in logs, default {@code RowbasePool}
 * </ul>
 *
 * @param jdbcUrl The JDBC URL of the database
 * @param username The database user
 * @param password The database password
 * @param maximumPoolSize Maximum number of pooled connections
 * @param poolName Name of the connection pool
 */
public record DbConfig(
    String jdbcUrl,
    String username,
    String password,
    int maximumPoolSize,
    String poolName
) {

  public static final int DEFAULT_POOL_SIZE = 10;
  public static final String DEFAULT_POOL_NAME = "RowbasePool";

  /** Reads the configuration from the process environment. */
  public static DbConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from the given variables.
   *
   * @throws IllegalStateException if DB_URL is missing or DB_POOL_SIZE is not a positive number
   */
  public static DbConfig fromEnvironment(Map<String, String> env) {
    String url = env.get("DB_URL");
    if (Strings.isNullOrEmpty(url)) {
      throw new IllegalStateException("DB_URL is not set");
    }
    return new DbConfig(
        url,
        env.get("DB_USER"),
        env.get("DB_PASSWORD"),
        parsePoolSize(env.get("DB_POOL_SIZE")),
        MoreObjects.firstNonNull(Strings.emptyToNull(env.get("DB_POOL_NAME")), DEFAULT_POOL_NAME));
  }

  private static int parsePoolSize(String value) {
    if (Strings.isNullOrEmpty(value)) {
      return DEFAULT_POOL_SIZE;
    }
    int size;
    try {
      size = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("DB_POOL_SIZE is not a number: " + value, e);
    }
    if (size <= 0) {
      throw new IllegalStateException("DB_POOL_SIZE must be positive: " + value);
    }
    return size;
  }

  /** Builds the HikariCP configuration for these settings. */
  public HikariConfig toHikariConfig() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(jdbcUrl);
    config.setUsername(username);
    config.setPassword(password);
    config.setMaximumPoolSize(maximumPoolSize);
    config.setMinimumIdle(Math.min(2, maximumPoolSize));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName(poolName);
    return config;
  }

  /** Opens a connection pool for these settings. The caller closes it. */
  public HikariDataSource createDataSource() {
    Logger.info("Opening connection pool: {}", toSecureString());
    return new HikariDataSource(toHikariConfig());
  }

  /** Returns a string representation of this object without the password, safe for logs. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("jdbcUrl", jdbcUrl())
        .add("username", username())
        .add("maximumPoolSize", maximumPoolSize())
        .add("poolName", poolName())
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
