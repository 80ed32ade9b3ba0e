package com.roommates.config;

import static org.junit.jupiter.api.Assertions.*;

import com.roommates.common.status.StatusCode;
import com.roommates.common.status.StatusOr;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests for loading DatabaseConfig. */
public class DatabaseConfigTest {

  @Test
  void testFromEnvironment() {
    StatusOr<DatabaseConfig> config =
        DatabaseConfig.fromEnvironment(
            Map.of(
                "DB_URL", "jdbc:postgresql://localhost:5432/roommates",
                "DB_USER", "roommates",
                "DB_PASSWORD", "secret"));

    assertTrue(config.isOk());
    assertEquals(
        new DatabaseConfig("jdbc:postgresql://localhost:5432/roommates", "roommates", "secret"),
        config.getValue());
  }

  @Test
  void testFromEnvironment_MissingUrl() {
    StatusOr<DatabaseConfig> config = DatabaseConfig.fromEnvironment(Map.of("DB_USER", "x"));

    assertTrue(config.isNotOk());
    assertEquals(StatusCode.INVALID_ARGUMENT, config.getStatus().getCode());
    assertEquals("DB_URL is not set", config.getStatus().getMessage());
  }

  @Test
  void testFromProperties() {
    Properties properties = new Properties();
    properties.setProperty("db.url", "jdbc:postgresql://db:5432/roommates");
    properties.setProperty("db.user", "app");

    StatusOr<DatabaseConfig> config = DatabaseConfig.fromProperties(properties);

    assertTrue(config.isOk());
    assertEquals("jdbc:postgresql://db:5432/roommates", config.getValue().jdbcUrl());
    assertEquals("app", config.getValue().username());
    assertNull(config.getValue().password());
  }

  @Test
  void testFromProperties_EmptyUrl() {
    Properties properties = new Properties();
    properties.setProperty("db.url", "");

    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        DatabaseConfig.fromProperties(properties).getStatus().getCode());
  }

  @Test
  void testToStringOmitsPassword() {
    DatabaseConfig config = new DatabaseConfig("jdbc:postgresql://db/roommates", "app", "hunter2");

    assertFalse(config.toString().contains("hunter2"));
    assertFalse(config.toSecureString().contains("hunter2"));
    assertTrue(config.toSecureString().contains("jdbc:postgresql://db/roommates"));
  }
}
