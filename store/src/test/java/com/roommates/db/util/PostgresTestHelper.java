package com.roommates.db.util;

import com.google.common.io.Resources;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Helper class for setting up PostgreSQL test containers initialized with the Roommates schema.
 */
public class PostgresTestHelper {

  private static final String SCHEMA_SQL_PATH = "/db/01-schema.sql";

  /**
   * Creates a PostgreSQL container. The schema is applied after start by {@link
   * #initializeSchema(Connection)}.
   *
   * @param databaseName The name to use for the test database
   * @return A configured PostgreSQLContainer ready to start
   */
  public static PostgreSQLContainer<?> createPostgresContainer(String databaseName) {
    return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
        .withDatabaseName(databaseName)
        .withUsername("roommates")
        .withPassword("roommates");
  }

  /**
   * Creates a JDBC connection to the PostgreSQL container.
   *
   * @throws SQLException If connection fails
   */
  public static Connection createConnection(PostgreSQLContainer<?> container) throws SQLException {
    return DriverManager.getConnection(
        container.getJdbcUrl(), container.getUsername(), container.getPassword());
  }

  /**
   * Runs the schema script from the classpath against the given connection.
   *
   * @throws RuntimeException If the schema file cannot be found or executed
   */
  public static void initializeSchema(Connection connection) {
    URL schemaUrl = PostgresTestHelper.class.getResource(SCHEMA_SQL_PATH);
    if (schemaUrl == null) {
      throw new RuntimeException("Schema file not found: " + SCHEMA_SQL_PATH);
    }
    try (var stmt = connection.createStatement()) {
      stmt.execute(Resources.toString(schemaUrl, StandardCharsets.UTF_8));
    } catch (IOException | SQLException e) {
      throw new RuntimeException("Failed to initialize database schema", e);
    }
  }

  /**
   * Empties both tables and restarts their id sequences so every test sees ids starting at 1.
   */
  public static void resetTables(Connection connection) throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute("TRUNCATE TABLE Roommate, Room RESTART IDENTITY");
    }
  }

  /**
   * Adds a roommate living in the given room, so that the room can no longer be deleted.
   */
  public static void insertRoommate(Connection connection, int roomId) throws SQLException {
    String sql = """
        INSERT INTO Roommate (FirstName, LastName, RentPortion, MoveInDate, RoomId)
        VALUES ('Test', 'Roommate', 25, CURRENT_DATE, ?)
        """;
    try (var stmt = connection.prepareStatement(sql)) {
      stmt.setInt(1, roomId);
      stmt.executeUpdate();
    }
  }

  /** Counts the rows of the Room table without going through the code under test. */
  public static int countRooms(Connection connection) throws SQLException {
    try (var stmt = connection.createStatement();
        var rs = stmt.executeQuery("SELECT COUNT(*) FROM Room")) {
      rs.next();
      return rs.getInt(1);
    }
  }

  /**
   * Starts a PostgreSQL container, creates a connection, and initializes the schema.
   *
   * @param databaseName The name to use for the test database
   * @return A PostgresContext containing the container and connection
   * @throws SQLException If database connection fails
   */
  public static PostgresContext setupPostgres(String databaseName) throws SQLException {
    PostgreSQLContainer<?> container = createPostgresContainer(databaseName);
    container.start();

    Connection connection = createConnection(container);
    initializeSchema(connection);

    return new PostgresContext(container, connection);
  }

  /**
   * Holds the PostgreSQL container and a connection to it.
   */
  public static class PostgresContext {
    private final PostgreSQLContainer<?> container;
    private final Connection connection;

    public PostgresContext(PostgreSQLContainer<?> container, Connection connection) {
      this.container = container;
      this.connection = connection;
    }

    public PostgreSQLContainer<?> getContainer() {
      return container;
    }

    public Connection getConnection() {
      return connection;
    }

    /**
     * Closes the connection and stops the container. Call this from test tearDown methods.
     */
    public void close() {
      try {
        if (connection != null && !connection.isClosed()) {
          connection.close();
        }
      } catch (SQLException e) {
        // Log but continue with cleanup
        System.err.println("Error closing connection: " + e.getMessage());
      }

      if (container != null && container.isRunning()) {
        container.stop();
      }
    }
  }
}
