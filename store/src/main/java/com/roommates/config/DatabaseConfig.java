package com.roommates.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.roommates.common.status.Status;
import com.roommates.common.status.StatusOr;
import java.util.Map;
import java.util.Properties;
import javax.annotation.Nonnull;

/**
 * Connection settings for the Roommates database.
 *
 * <p>This record is the explicit replacement for a process-wide connection string: it is read once,
 * handed to {@link DataSources#create(DatabaseConfig)}, and the resulting data source is passed to
 * the store.
 *
 * @param jdbcUrl The JDBC URL of the database (e.g., "jdbc:postgresql://localhost:5432/roommates")
 * @param username The database user
 * @param password The database password
 */
public record DatabaseConfig(String jdbcUrl, String username, String password) {

  public static final String ENV_URL = "DB_URL";
  public static final String ENV_USER = "DB_USER";
  public static final String ENV_PASSWORD = "DB_PASSWORD";

  public static final String PROPERTY_URL = "db.url";
  public static final String PROPERTY_USER = "db.user";
  public static final String PROPERTY_PASSWORD = "db.password";

  /** Reads the configuration from the process environment. */
  @Nonnull
  public static StatusOr<DatabaseConfig> fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from {@code DB_URL}, {@code DB_USER} and {@code DB_PASSWORD}.
   *
   * @param env the environment to read, usually {@link System#getenv()}
   * @return StatusOr containing the configuration, or INVALID_ARGUMENT when the URL is missing
   */
  @Nonnull
  public static StatusOr<DatabaseConfig> fromEnvironment(Map<String, String> env) {
    return create(env.get(ENV_URL), env.get(ENV_USER), env.get(ENV_PASSWORD), ENV_URL);
  }

  /**
   * Reads the configuration from {@code db.url}, {@code db.user} and {@code db.password}.
   *
   * @param properties the properties to read
   * @return StatusOr containing the configuration, or INVALID_ARGUMENT when the URL is missing
   */
  @Nonnull
  public static StatusOr<DatabaseConfig> fromProperties(Properties properties) {
    return create(
        properties.getProperty(PROPERTY_URL),
        properties.getProperty(PROPERTY_USER),
        properties.getProperty(PROPERTY_PASSWORD),
        PROPERTY_URL);
  }

  private static StatusOr<DatabaseConfig> create(
      String url, String user, String password, String urlKey) {
    if (Strings.isNullOrEmpty(url)) {
      return StatusOr.ofStatus(Status.invalidArgument(urlKey + " is not set"));
    }
    return StatusOr.ofValue(new DatabaseConfig(url, user, password));
  }

  /**
   * Returns a string representation of this object without the password, safe to log.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("jdbcUrl", jdbcUrl())
        .add("username", username())
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
