package com.roommates.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.tinylog.Logger;

/**
 * Builds the connection provider used by {@link com.roommates.RoomStore}.
 *
 * <p>The pool runs with HikariCP's default sizing and timeouts; only the connection settings and a
 * pool name are applied.
 */
public final class DataSources {

  static final String POOL_NAME = "RoommatesPool";

  private DataSources() {
    // Utility class
  }

  /**
   * Creates a HikariCP data source for the given database. The caller owns the returned data
   * source and must close it.
   *
   * @param dbConfig the connection settings
   * @return A configured HikariDataSource for database connections
   */
  public static HikariDataSource create(DatabaseConfig dbConfig) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(dbConfig.jdbcUrl());
    config.setUsername(dbConfig.username());
    config.setPassword(dbConfig.password());
    config.setAutoCommit(true);
    config.setPoolName(POOL_NAME);

    Logger.info("Initializing database connection pool with {}", dbConfig.toSecureString());
    return new HikariDataSource(config);
  }
}
